package brook.lang;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Flat variable store for one program run. There are no nested scopes:
 * assignment creates or overwrites, lookup reads, nothing is ever removed.
 */
public final class Environment {

    private final Map<String, Value> values = new LinkedHashMap<>();

    public void assign(String name, Value value) {
        values.put(name, value);
    }

    public Optional<Value> lookup(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}

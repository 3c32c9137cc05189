package brook.lang;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import lombok.NonNull;

/**
 * Runtime value. All variants are immutable; array "mutators" return a new
 * array.
 */
public sealed interface Value {

    /** Name of the variant as it appears in error messages. */
    String typeName();

    /** Text as written by {@code print}. */
    String render();

    record Number(long value) implements Value {
        @Override
        public String typeName() {
            return "number";
        }

        @Override
        public String render() {
            return Long.toString(value);
        }
    }

    record Text(@NonNull String value) implements Value {
        @Override
        public String typeName() {
            return "text";
        }

        @Override
        public String render() {
            return value;
        }
    }

    record Bool(boolean value) implements Value {
        @Override
        public String typeName() {
            return "boolean";
        }

        @Override
        public String render() {
            return Boolean.toString(value);
        }
    }

    record Array(List<Value> elements) implements Value {
        public Array {
            elements = List.copyOf(elements);
        }

        public int size() {
            return elements.size();
        }

        public boolean isEmpty() {
            return elements.isEmpty();
        }

        public Value get(int index) {
            return elements.get(index);
        }

        public Array append(Value value) {
            var copy = new ArrayList<>(elements);
            copy.add(value);
            return new Array(copy);
        }

        public Array withoutLast() {
            return new Array(elements.subList(0, elements.size() - 1));
        }

        @Override
        public String typeName() {
            return "array";
        }

        @Override
        public String render() {
            return elements.stream()
                .map(Value::render)
                .collect(Collectors.joining(", ", "[", "]"));
        }
    }

    static Number of(long value) {
        return new Number(value);
    }

    static Text of(String value) {
        return new Text(value);
    }

    static Bool of(boolean value) {
        return new Bool(value);
    }

    static Array of(List<Value> elements) {
        return new Array(elements);
    }
}

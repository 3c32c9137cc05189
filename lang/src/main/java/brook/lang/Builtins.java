package brook.lang;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;

/**
 * Fixed library of functions callable from scripts. Every function checks
 * its argument count and argument types before doing any work.
 */
@Slf4j
final class Builtins {

    @FunctionalInterface
    interface Builtin {
        Value call(Call call);
    }

    private final Map<String, Builtin> functions = new HashMap<>();

    Builtins() {
        functions.put("join", this::join);
        functions.put("split", this::split);
        functions.put("count", this::count);
        functions.put("length", this::length);
        functions.put("uppercase", this::uppercase);
        functions.put("lowercase", this::lowercase);
        functions.put("trim", this::trim);
        functions.put("replace", this::replace);
        functions.put("push", this::push);
        functions.put("pop", this::pop);
        functions.put("first", this::first);
        functions.put("last", this::last);
        functions.put("read_file", this::readFile);
        functions.put("write_file", this::writeFile);
    }

    Value invoke(Token name, List<Value> arguments) {
        var function = functions.get(name.lexeme());
        if (function == null) {
            throw new EvalError(name, "Unknown function: " + name.lexeme());
        }
        return function.call(new Call(name, arguments));
    }

    //// strings and arrays ////

    private Value join(Call call) {
        if (call.arity() < 2) {
            throw call.error("expected at least 2 arguments, got " + call.arity());
        }
        var separator = call.text(0);
        if (call.arity() == 2) {
            var items = call.array(1);
            return Value.of(items.elements().stream()
                .map(Value::render)
                .collect(Collectors.joining(separator)));
        }

        var parts = new ArrayList<String>();
        for (int i = 1; i < call.arity(); i++) {
            parts.add(call.text(i));
        }
        return Value.of(String.join(separator, parts));
    }

    private Value split(Call call) {
        call.expectArity(2);
        var text = call.text(0);
        var separator = call.text(1);

        if (separator.isEmpty()) {
            return Value.of(text.codePoints()
                .<Value>mapToObj(cp -> Value.of(new String(Character.toChars(cp))))
                .collect(Collectors.toList()));
        }
        return Value.of(Arrays.stream(text.split(Pattern.quote(separator), -1))
            .<Value>map(Value::of)
            .collect(Collectors.toList()));
    }

    private Value count(Call call) {
        call.expectArity(2);
        if (call.argument(0) instanceof Value.Array items) {
            var needle = call.argument(1);
            return Value.of(items.elements().stream().filter(needle::equals).count());
        }
        if (!(call.argument(0) instanceof Value.Text)) {
            throw call.typeError(0, "text or array");
        }

        var text = call.text(0);
        var needle = call.text(1);
        if (needle.isEmpty()) {
            throw call.error("argument 2 must not be empty");
        }
        long occurrences = 0;
        int from = text.indexOf(needle);
        while (from >= 0) {
            occurrences++;
            from = text.indexOf(needle, from + needle.length());
        }
        return Value.of(occurrences);
    }

    private Value length(Call call) {
        call.expectArity(1);
        var argument = call.argument(0);
        if (argument instanceof Value.Array items) {
            return Value.of(items.size());
        }
        if (argument instanceof Value.Text text) {
            var value = text.value();
            return Value.of(value.codePointCount(0, value.length()));
        }
        throw call.typeError(0, "text or array");
    }

    private Value uppercase(Call call) {
        call.expectArity(1);
        return Value.of(call.text(0).toUpperCase(Locale.ROOT));
    }

    private Value lowercase(Call call) {
        call.expectArity(1);
        return Value.of(call.text(0).toLowerCase(Locale.ROOT));
    }

    private Value trim(Call call) {
        call.expectArity(1);
        return Value.of(call.text(0).strip());
    }

    private Value replace(Call call) {
        call.expectArity(3);
        var text = call.text(0);
        var from = call.text(1);
        var to = call.text(2);
        if (from.isEmpty()) {
            throw call.error("argument 2 must not be empty");
        }
        return Value.of(text.replace(from, to));
    }

    //// arrays ////

    private Value push(Call call) {
        call.expectArity(2);
        return call.array(0).append(call.argument(1));
    }

    private Value pop(Call call) {
        call.expectArity(1);
        return call.nonEmptyArray(0).withoutLast();
    }

    private Value first(Call call) {
        call.expectArity(1);
        return call.nonEmptyArray(0).get(0);
    }

    private Value last(Call call) {
        call.expectArity(1);
        var items = call.nonEmptyArray(0);
        return items.get(items.size() - 1);
    }

    //// files ////

    private Value readFile(Call call) {
        call.expectArity(1);
        var path = call.text(0);
        try {
            var content = Files.readString(call.path(0), StandardCharsets.UTF_8);
            log.debug("read_file {}: {} chars", path, content.length());
            return Value.of(content);
        } catch (IOException ex) {
            throw call.ioError(path, ex);
        }
    }

    private Value writeFile(Call call) {
        call.expectArity(2);
        var path = call.text(0);
        var content = call.text(1);
        try {
            Files.writeString(call.path(0), content, StandardCharsets.UTF_8);
            log.debug("write_file {}: {} chars", path, content.length());
            return Value.of(true);
        } catch (IOException ex) {
            throw call.ioError(path, ex);
        }
    }

    /**
     * Arguments of one invocation, plus the token naming the function so
     * that failures point at the call site.
     */
    record Call(Token name, List<Value> arguments) {

        int arity() {
            return arguments.size();
        }

        Value argument(int index) {
            return arguments.get(index);
        }

        void expectArity(int expected) {
            if (arity() != expected) {
                var noun = expected == 1 ? " argument" : " arguments";
                throw error("expected " + expected + noun + ", got " + arity());
            }
        }

        String text(int index) {
            if (argument(index) instanceof Value.Text text) {
                return text.value();
            }
            throw typeError(index, "text");
        }

        Value.Array array(int index) {
            if (argument(index) instanceof Value.Array array) {
                return array;
            }
            throw typeError(index, "array");
        }

        Value.Array nonEmptyArray(int index) {
            var array = array(index);
            if (array.isEmpty()) {
                throw error("argument " + (index + 1) + " must not be an empty array");
            }
            return array;
        }

        Path path(int index) {
            var path = text(index);
            try {
                return Path.of(path);
            } catch (InvalidPathException ex) {
                throw new EvalError(name, name.lexeme() + ": invalid path '" + path + "': " + ex.getReason(), ex);
            }
        }

        EvalError typeError(int index, String expected) {
            return error("argument " + (index + 1) + " must be " + expected + ", got " + argument(index).typeName());
        }

        EvalError ioError(String path, IOException ex) {
            String reason;
            if (ex instanceof NoSuchFileException) {
                reason = "file not found";
            } else if (ex instanceof AccessDeniedException) {
                reason = "permission denied";
            } else {
                reason = ex.toString();
            }
            return new EvalError(name, name.lexeme() + ": " + reason + ": " + path, ex);
        }

        EvalError error(String message) {
            return new EvalError(name, name.lexeme() + ": " + message);
        }
    }
}

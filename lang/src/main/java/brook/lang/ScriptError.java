package brook.lang;

import lombok.Getter;

/**
 * Base of the three pipeline failures. Each carries the source position
 * where the problem was found.
 */
@Getter
public abstract class ScriptError extends RuntimeException {
    private final int line;
    private final int column;

    ScriptError(int line, int column, String message) {
        super(message);
        this.line = line;
        this.column = column;
    }

    ScriptError(int line, int column, String message, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.column = column;
    }

    /** Short name of the stage that raised the error, used when reporting. */
    public abstract String stage();
}

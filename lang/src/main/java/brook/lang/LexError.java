package brook.lang;

/** Malformed token stream. */
public class LexError extends ScriptError {

    LexError(int line, int column, String message) {
        super(line, column, message);
    }

    @Override
    public String stage() {
        return "scanner";
    }
}

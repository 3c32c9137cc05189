package brook.lang;

import lombok.Getter;

/** Well-formed program that violates runtime semantics. */
public class EvalError extends ScriptError {
    @Getter
    private final Token token;

    EvalError(Token token, String message) {
        super(token.line(), token.column(), message);
        this.token = token;
    }

    EvalError(Token token, String message, Throwable cause) {
        super(token.line(), token.column(), message, cause);
        this.token = token;
    }

    @Override
    public String stage() {
        return "interpreter";
    }
}

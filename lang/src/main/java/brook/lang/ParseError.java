package brook.lang;

import lombok.Getter;

/** Token sequence that violates the grammar. */
public class ParseError extends ScriptError {
    @Getter
    private final Token token;

    ParseError(Token token, String message) {
        super(token.line(), token.column(), message);
        this.token = token;
    }

    @Override
    public String stage() {
        return "parser";
    }
}

package brook.lang;

import static brook.lang.Token.Type.*;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Two-token window over a {@link Scanner}. Tokens are pulled only when the
 * parser looks at them, so a lexical error surfaces exactly where parsing
 * reaches the bad input.
 */
@RequiredArgsConstructor
final class TokenStream {

    private final @NonNull Scanner scanner;

    // null until pulled; next is only ever pulled after current
    private Token current = null;
    private Token next = null;
    private Token previous = null;

    public Token previous() {
        return previous != null ? previous : peek();
    }

    public boolean isAtEnd() {
        return peek().type() == EOF;
    }

    public Token peek() {
        if (current == null) {
            current = scanner.nextToken();
        }
        return current;
    }

    public Token peekNext() {
        if (isAtEnd()) {
            return peek();
        }
        if (next == null) {
            next = scanner.nextToken();
        }
        return next;
    }

    public Token advance() {
        previous = peek();
        if (!isAtEnd()) {
            current = next;
            next = null;
        }
        return previous;
    }
}

package brook.lang;

import static java.util.Map.entry;
import static brook.lang.Token.Type.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Pull-based lexer. Every call to {@link #nextToken()} scans just enough of
 * the source to produce one token; once the input is exhausted it keeps
 * returning {@code EOF}.
 */
@RequiredArgsConstructor
final class Scanner {

    private static final Map<String, Token.Type> keywords = Map.ofEntries(
        entry("print", PRINT),
        entry("true", TRUE),
        entry("false", FALSE),
        entry("if", IF),
        entry("else", ELSE),
        entry("elseif", ELSEIF),
        entry("while", WHILE),
        entry("for", FOR),
        entry("join", JOIN),
        entry("split", SPLIT),
        entry("count", COUNT),
        entry("length", LENGTH),
        entry("uppercase", UPPERCASE),
        entry("lowercase", LOWERCASE),
        entry("trim", TRIM),
        entry("replace", REPLACE),
        entry("push", PUSH),
        entry("pop", POP),
        entry("first", FIRST),
        entry("last", LAST),
        entry("read_file", READ_FILE),
        entry("write_file", WRITE_FILE));

    private final @NonNull String source;

    private int start = 0;
    private int current = 0;
    private int lineStart = 0;
    private int line = 1;

    private int tokenLine = 1;
    private int tokenColumn = 1;

    Token nextToken() {
        while (!isAtEnd()) {
            start = current;
            tokenLine = line;
            tokenColumn = getColumn();
            var token = scanToken();
            if (token != null) {
                return token;
            }
        }

        start = current; // report the correct EOF column
        tokenLine = line;
        tokenColumn = getColumn();
        return makeToken(EOF);
    }

    /**
     * Drains the remaining input, including the final {@code EOF}.
     */
    List<Token> getTokens() {
        var tokens = new ArrayList<Token>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != EOF);
        return tokens;
    }

    private int getColumn() {
        return 1 + start - lineStart;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    /**
     * Scans one lexeme starting at {@code start}. Returns {@code null} for
     * whitespace and comments.
     */
    private Token scanToken() {
        var c = advance();
        switch (c) {
        case '&':
            if (match('&')) {
                return makeToken(AMPERSAND_AMPERSAND);
            }
            throw error("Expect '&&', found a single '&'.");
        case '|':
            if (match('|')) {
                return makeToken(PIPE_PIPE);
            }
            throw error("Expect '||', found a single '|'.");
        case '(':
            return makeToken(PAREN_LEFT);
        case ')':
            return makeToken(PAREN_RIGHT);
        case '{':
            return makeToken(BRACE_LEFT);
        case '}':
            return makeToken(BRACE_RIGHT);
        case '[':
            return makeToken(BRACKET_LEFT);
        case ']':
            return makeToken(BRACKET_RIGHT);
        case ',':
            return makeToken(COMMA);
        case ';':
            return makeToken(SEMICOLON);
        case '-':
            return makeToken(MINUS);
        case '+':
            return makeToken(PLUS);
        case '*':
            return makeToken(STAR);
        case '!':
            return makeToken(match('=') ? BANG_EQUAL : BANG);
        case '=':
            return makeToken(match('=') ? EQUAL_EQUAL : EQUAL);
        case '<':
            return makeToken(match('=') ? LESS_EQUAL : LESS);
        case '>':
            return makeToken(match('=') ? GREATER_EQUAL : GREATER);
        case '/':
            if (match('/')) {
                while (peek() != '\n' && !isAtEnd()) {
                    advance();
                }
                return null;
            }
            return makeToken(SLASH);

        case '\n':
            newline();
            return null;

        case '"':
            return string();

        default:
            if (isDigit(c)) {
                return integer();
            } else if (isAlpha(c)) {
                return identifier();
            } else if (Character.isWhitespace(c)) {
                return null;
            }
            throw error("Unexpected character: '" + c + "'");
        }
    }

    private static boolean isAlpha(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private Token identifier() {
        while (isAlpha(peek())) {
            advance();
        }
        var text = source.substring(start, current);
        return makeToken(keywords.getOrDefault(text, IDENTIFIER));
    }

    private Token integer() {
        while (isDigit(peek())) {
            advance();
        }
        var text = source.substring(start, current);
        try {
            Long.parseLong(text);
        } catch (NumberFormatException ex) {
            throw error("Integer literal out of range: " + text);
        }
        return makeToken(INTEGER);
    }

    private Token string() {
        while (peek() != '"' && !isAtEnd()) {
            if (advance() == '\n') {
                newline();
            }
        }
        if (isAtEnd()) {
            throw error("Unterminated string.");
        }
        advance(); // closing quote
        return makeToken(STRING);
    }

    private void newline() {
        line++;
        lineStart = current;
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd()) {
            return false;
        }
        if (source.charAt(current) != expected) {
            return false;
        }

        current++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) {
            return '\0';
        }
        return source.charAt(current);
    }

    private Token makeToken(Token.Type type) {
        var text = source.substring(start, current);
        return new Token(type, text, tokenLine, tokenColumn);
    }

    private LexError error(String msg) {
        return new LexError(tokenLine, tokenColumn, msg);
    }
}

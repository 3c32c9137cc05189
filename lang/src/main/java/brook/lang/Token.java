package brook.lang;

import lombok.NonNull;

record Token(
    @NonNull Type type,
    @NonNull String lexeme,
    int line,
    int column) {

    @Override
    public String toString() {
        return "(Token " + type + " \"" + lexeme + "\" " + line + ":" + column + ")";
    }

    String describe() {
        return type == Type.EOF ? "end of input" : "'" + lexeme + "'";
    }

    enum Type {
        BRACE_LEFT,
        BRACE_RIGHT,
        BRACKET_LEFT,
        BRACKET_RIGHT,
        COMMA,
        PAREN_LEFT,
        PAREN_RIGHT,
        SEMICOLON,

        // operators
        AMPERSAND_AMPERSAND,
        BANG,
        BANG_EQUAL,
        EQUAL,
        EQUAL_EQUAL,
        GREATER,
        GREATER_EQUAL,
        LESS,
        LESS_EQUAL,
        MINUS,
        PIPE_PIPE,
        PLUS,
        SLASH,
        STAR,

        // literals
        IDENTIFIER,
        INTEGER,
        STRING,

        // keywords
        ELSE,
        ELSEIF,
        FALSE,
        FOR,
        IF,
        PRINT,
        TRUE,
        WHILE,

        // built-in functions
        COUNT,
        FIRST,
        JOIN,
        LAST,
        LENGTH,
        LOWERCASE,
        POP,
        PUSH,
        READ_FILE,
        REPLACE,
        SPLIT,
        TRIM,
        UPPERCASE,
        WRITE_FILE,

        // end-of-file
        EOF;
    }
}

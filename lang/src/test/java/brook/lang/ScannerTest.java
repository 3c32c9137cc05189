package brook.lang;

import static brook.lang.Token.Type.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

class ScannerTest {

    private static List<Token.Type> types(String source) {
        return new Scanner(source).getTokens().stream()
            .map(Token::type)
            .collect(Collectors.toList());
    }

    private static List<String> lexemes(String source) {
        return new Scanner(source).getTokens().stream()
            .map(Token::lexeme)
            .collect(Collectors.toList());
    }

    @Test
    void operatorsUseOneCharacterLookahead() {
        assertEquals(
            List.of(EQUAL_EQUAL, BANG_EQUAL, LESS_EQUAL, GREATER_EQUAL, AMPERSAND_AMPERSAND, PIPE_PIPE,
                EQUAL, BANG, LESS, GREATER, EOF),
            types("== != <= >= && || = ! < >"));
        assertEquals(List.of(IDENTIFIER, EQUAL_EQUAL, BANG, IDENTIFIER, EOF), types("a==!b"));
    }

    @Test
    void punctuation() {
        assertEquals(
            List.of(PAREN_LEFT, PAREN_RIGHT, BRACKET_LEFT, BRACKET_RIGHT, BRACE_LEFT, BRACE_RIGHT,
                COMMA, SEMICOLON, PLUS, MINUS, STAR, SLASH, EOF),
            types("()[]{},;+-*/"));
    }

    @Test
    void keywordsAndBuiltinsAreReserved() {
        assertEquals(
            List.of(PRINT, TRUE, FALSE, IF, ELSE, ELSEIF, WHILE, FOR, EOF),
            types("print true false if else elseif while for"));
        assertEquals(
            List.of(JOIN, SPLIT, COUNT, LENGTH, UPPERCASE, LOWERCASE, TRIM, REPLACE,
                PUSH, POP, FIRST, LAST, READ_FILE, WRITE_FILE, EOF),
            types("join split count length uppercase lowercase trim replace push pop first last read_file write_file"));
    }

    @Test
    void identifiersAreRunsOfLetters() {
        assertEquals(List.of(IDENTIFIER, INTEGER, EOF), types("x1"));
        assertEquals(List.of("total_count", "café", ""), lexemes("total_count café"));
        assertEquals(List.of(IDENTIFIER, EOF), types("printer"));
    }

    @Test
    void integersAreSixtyFourBit() {
        assertEquals(List.of("9223372036854775807", ""), lexemes("9223372036854775807"));

        var error = assertThrows(LexError.class, () -> types("9223372036854775808"));
        assertEquals("Integer literal out of range: 9223372036854775808", error.getMessage());
    }

    @Test
    void stringsKeepTheirQuotesAndHaveNoEscapes() {
        assertEquals(List.of("\"a b\\n\"", ";", ""), lexemes("\"a b\\n\";"));
    }

    @Test
    void unterminatedString() {
        var error = assertThrows(LexError.class, () -> types("print \"abc;"));
        assertEquals("Unterminated string.", error.getMessage());
        assertEquals(1, error.getLine());
        assertEquals(7, error.getColumn());
    }

    @Test
    void singleAmpersandOrPipe() {
        assertThrows(LexError.class, () -> types("a & b"));
        var error = assertThrows(LexError.class, () -> types("a | b"));
        assertEquals("Expect '||', found a single '|'.", error.getMessage());
    }

    @Test
    void unexpectedCharacter() {
        var error = assertThrows(LexError.class, () -> types("x = 1;\n  y = $;"));
        assertEquals("Unexpected character: '$'", error.getMessage());
        assertEquals(2, error.getLine());
        assertEquals(7, error.getColumn());
    }

    @Test
    void commentsRunToEndOfLine() {
        assertEquals(
            List.of(PRINT, INTEGER, SEMICOLON, PRINT, INTEGER, SEMICOLON, EOF),
            types("print 1; // print 3; \" &\nprint 2; // trailing"));
        assertEquals(List.of(INTEGER, SLASH, INTEGER, EOF), types("1/2"));
    }

    @Test
    void tracksLinesAndColumns() {
        var tokens = new Scanner("x = 1;\n  print x;").getTokens();
        assertEquals(new Token(PRINT, "print", 2, 3), tokens.get(4));
        assertEquals(new Token(IDENTIFIER, "x", 2, 9), tokens.get(5));
    }

    @Test
    void multiLineStringReportsItsStart() {
        var tokens = new Scanner("s = \"a\nb\"; t").getTokens();
        assertEquals(new Token(STRING, "\"a\nb\"", 1, 5), tokens.get(2));
        assertEquals(new Token(IDENTIFIER, "t", 2, 5), tokens.get(4));
    }

    @Test
    void endOfInputRepeats() {
        var scanner = new Scanner("  ");
        assertEquals(EOF, scanner.nextToken().type());
        assertEquals(EOF, scanner.nextToken().type());
    }
}

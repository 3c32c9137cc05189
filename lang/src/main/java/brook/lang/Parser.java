package brook.lang;

import static brook.lang.Token.Type.*;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Recursive-descent parser. The first grammar violation aborts the parse
 * with a {@link ParseError}; lexical errors from the underlying scanner pass
 * through unchanged.
 */
@RequiredArgsConstructor
final class Parser {

    private static final Token.Type[] BUILTINS = {
        COUNT, FIRST, JOIN, LAST, LENGTH, LOWERCASE, POP,
        PUSH, READ_FILE, REPLACE, SPLIT, TRIM, UPPERCASE, WRITE_FILE
    };

    /** Deepest nesting of expressions and blocks a program may use. */
    static final int MAX_DEPTH = 200;

    private final @NonNull TokenStream tokens;
    private int depth = 0;

    public Ast.Program parse() {
        return program();
    }

    //// grammar rules ////

    /**
     * <pre>
     * program     :: statement* EOF
     * </pre>
     */
    private Ast.Program program() {
        var statements = new ArrayList<Ast.Stmt>();
        while (!isAtEnd()) {
            statements.add(statement());
        }
        return new Ast.Program(statements);
    }

    /**
     * <pre>
     *  statement   :: printStmt | ifStmt | whileStmt | forStmt | simple ";"
     * </pre>
     */
    private Ast.Stmt statement() {
        if (match(PRINT)) {
            return printStatement();
        }
        if (match(IF)) {
            return ifStatement();
        }
        if (match(WHILE)) {
            return whileStatement();
        }
        if (match(FOR)) {
            return forStatement();
        }

        var stmt = simple();
        consume(SEMICOLON, stmt instanceof Ast.Assign
            ? "Expect ';' after assignment."
            : "Expect ';' after expression.");
        return stmt;
    }

    /**
     * <pre>
     *  simple      :: ( ID "=" expression ) | expression
     * </pre>
     */
    private Ast.Stmt simple() {
        if (check(IDENTIFIER) && peekNext().type() == EQUAL) {
            var name = advance();
            advance(); // EQUAL
            return new Ast.Assign(name, expression());
        }
        return new Ast.Expression(expression());
    }

    /**
     * <pre>
     *  printStmt   :: "print" expression ";"
     * </pre>
     */
    private Ast.Stmt printStatement() {
        var keyword = previous();
        var value = expression();
        consume(SEMICOLON, "Expect ';' after value.");
        return new Ast.Print(keyword, value);
    }

    /**
     * <pre>
     *  ifStmt      :: "if" expression block ( "elseif" expression block )* ( "else" block )?
     * </pre>
     */
    private Ast.Stmt ifStatement() {
        var keyword = previous();
        var condition = expression();
        var thenBranch = block("if body");

        var elseIfs = new ArrayList<Ast.ElseIf>();
        while (match(ELSEIF)) {
            var elseIfKeyword = previous();
            var elseIfCondition = expression();
            elseIfs.add(new Ast.ElseIf(elseIfKeyword, elseIfCondition, block("elseif body")));
        }

        List<Ast.Stmt> elseBranch = null;
        if (match(ELSE)) {
            elseBranch = block("else body");
        }
        return new Ast.If(keyword, condition, thenBranch, elseIfs, elseBranch);
    }

    /**
     * <pre>
     *  whileStmt   :: "while" expression block
     * </pre>
     */
    private Ast.Stmt whileStatement() {
        var keyword = previous();
        var condition = expression();
        return new Ast.While(keyword, condition, block("while body"));
    }

    /**
     * <pre>
     *  forStmt     :: "for" ( clauses | "(" clauses ")" ) block
     *  clauses     :: simple ";" expression ";" simple
     * </pre>
     */
    private Ast.Stmt forStatement() {
        var keyword = previous();
        var parenthesized = match(PAREN_LEFT);

        var initializer = simple();
        consume(SEMICOLON, "Expect ';' after loop initializer.");
        var condition = expression();
        consume(SEMICOLON, "Expect ';' after loop condition.");
        var update = simple();

        if (parenthesized) {
            consume(PAREN_RIGHT, "Expect ')' after for clauses.");
        }
        return new Ast.For(keyword, initializer, condition, update, block("for body"));
    }

    /**
     * <pre>
     *  block       :: "{" statement* "}"
     * </pre>
     */
    private List<Ast.Stmt> block(String context) {
        var brace = consume(BRACE_LEFT, "Expect '{' before " + context + ".");
        enter(brace);
        try {
            var statements = new ArrayList<Ast.Stmt>();
            while (!check(BRACE_RIGHT) && !isAtEnd()) {
                statements.add(statement());
            }
            consume(BRACE_RIGHT, "Expect '}' after " + context + ".");
            return statements;
        } finally {
            depth--;
        }
    }

    /**
     * <pre>
     *  expression  :: or
     * </pre>
     */
    private Ast.Expr expression() {
        enter(peek());
        try {
            return or();
        } finally {
            depth--;
        }
    }

    /**
     * <pre>
     *  or          :: and ( "||" and )*
     * </pre>
     */
    private Ast.Expr or() {
        return binary(this::and, Ast.LogicalOp::new, PIPE_PIPE);
    }

    /**
     * <pre>
     *  and         :: equality ( "&&" equality )*
     * </pre>
     */
    private Ast.Expr and() {
        return binary(this::equality, Ast.LogicalOp::new, AMPERSAND_AMPERSAND);
    }

    /**
     * <pre>
     *  equality    :: relational ( ( "==" | "!=" ) relational )*
     * </pre>
     */
    private Ast.Expr equality() {
        return binary(this::relational, Ast.Comparison::new, EQUAL_EQUAL, BANG_EQUAL);
    }

    /**
     * <pre>
     *  relational  :: additive ( ( "<" | ">" | "<=" | ">=" ) additive )*
     * </pre>
     */
    private Ast.Expr relational() {
        return binary(this::additive, Ast.Comparison::new, LESS, GREATER, LESS_EQUAL, GREATER_EQUAL);
    }

    /**
     * <pre>
     *  additive    :: term ( ( "+" | "-" ) term )*
     * </pre>
     */
    private Ast.Expr additive() {
        return binary(this::term, Ast.BinaryOp::new, PLUS, MINUS);
    }

    /**
     * <pre>
     *  term        :: unary ( ( "*" | "/" ) unary )*
     * </pre>
     */
    private Ast.Expr term() {
        return binary(this::unary, Ast.BinaryOp::new, STAR, SLASH);
    }

    /**
     * <pre>
     *  unary       :: ( "!" unary ) | postfix
     * </pre>
     */
    private Ast.Expr unary() {
        if (match(BANG)) {
            var operator = previous();
            enter(operator);
            try {
                return new Ast.Not(operator, unary());
            } finally {
                depth--;
            }
        }
        return postfix();
    }

    /**
     * <pre>
     *  postfix     :: primary ( "[" expression "]" )*
     * </pre>
     */
    private Ast.Expr postfix() {
        var expr = primary();
        int chained = 0;
        try {
            while (match(BRACKET_LEFT)) {
                var bracket = previous();
                chained++;
                enter(bracket);
                var index = expression();
                consume(BRACKET_RIGHT, "Expect ']' after index.");
                expr = new Ast.IndexAccess(expr, bracket, index);
            }
            return expr;
        } finally {
            depth -= chained;
        }
    }

    /**
     * <pre>
     *  primary     :: INTEGER | STRING | "true" | "false"
     *              | ( BUILTIN "(" arguments ")" )
     *              | ( ID ( "(" arguments ")" )? )
     *              | ( "(" expression ")" )
     *              | ( "[" sequence "]" )
     * </pre>
     */
    private Ast.Expr primary() {
        if (match(FALSE)) {
            return new Ast.BooleanLiteral(false, previous());
        }
        if (match(TRUE)) {
            return new Ast.BooleanLiteral(true, previous());
        }
        if (match(STRING)) {
            var lexeme = previous().lexeme();
            var string = lexeme.substring(1, lexeme.length() - 1); // strip quotes
            return new Ast.StringLiteral(string, previous());
        }
        if (match(INTEGER)) {
            var value = Long.parseLong(previous().lexeme());
            return new Ast.NumberLiteral(value, previous());
        }
        if (match(BUILTINS)) {
            var name = previous();
            consume(PAREN_LEFT, "Expect '(' after built-in '" + name.lexeme() + "'.");
            return call(name);
        }
        if (match(IDENTIFIER)) {
            var name = previous();
            if (match(PAREN_LEFT)) {
                return call(name);
            }
            return new Ast.Identifier(name);
        }
        if (match(PAREN_LEFT)) {
            var expression = expression();
            consume(PAREN_RIGHT, "Expect ')' after expression.");
            return expression;
        }
        if (match(BRACKET_LEFT)) {
            var bracket = previous();
            var elements = sequence();
            consume(BRACKET_RIGHT, "Expect ']' after array elements.");
            return new Ast.ArrayLiteral(bracket, elements);
        }
        throw error(peek(), "Expect expression.");
    }

    /**
     * <pre>
     *  arguments   :: ( expression ( "," expression )* )? ")"
     * </pre>
     */
    private Ast.Expr call(Token name) {
        var arguments = new ArrayList<Ast.Expr>();
        if (!check(PAREN_RIGHT)) {
            do {
                arguments.add(expression());
            } while (match(COMMA));
        }
        consume(PAREN_RIGHT, "Expect ')' after arguments.");
        return new Ast.FunctionCall(name, arguments);
    }

    /**
     * <pre>
     *  sequence    :: ( expression ( "," expression )* ","? )?
     * </pre>
     */
    private List<Ast.Expr> sequence() {
        var elements = new ArrayList<Ast.Expr>();
        if (check(BRACKET_RIGHT)) {
            return elements;
        }

        do {
            elements.add(expression());
        } while (match(COMMA) && !check(BRACKET_RIGHT));

        return elements;
    }

    //// utility methods ////

    @FunctionalInterface
    private interface BinaryNode {
        Ast.Expr build(Ast.Expr left, Token operator, Ast.Expr right);
    }

    /**
     * One left-associative precedence level. Every operator in a chain adds
     * a level to the tree, so it counts towards the nesting limit.
     */
    private Ast.Expr binary(Supplier<Ast.Expr> operand, BinaryNode node, Token.Type... operators) {
        var expr = operand.get();
        int chained = 0;
        try {
            while (match(operators)) {
                var operator = previous();
                chained++;
                enter(operator);
                expr = node.build(expr, operator, operand.get());
            }
            return expr;
        } finally {
            depth -= chained;
        }
    }

    private void enter(Token token) {
        if (++depth > MAX_DEPTH) {
            throw new ParseError(token, "Nesting too deep.");
        }
    }

    private Token consume(Token.Type type, String message) {
        if (check(type)) {
            return advance();
        }

        throw error(peek(), message);
    }

    private ParseError error(Token token, String message) {
        return new ParseError(token, message + " Found " + token.describe() + ".");
    }

    private boolean match(Token.Type... types) {
        for (var type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }

        return false;
    }

    private boolean check(Token.Type type) {
        return !isAtEnd() && peek().type() == type;
    }

    private Token advance() {
        return tokens.advance();
    }

    private boolean isAtEnd() {
        return tokens.isAtEnd();
    }

    private Token peek() {
        return tokens.peek();
    }

    private Token peekNext() {
        return tokens.peekNext();
    }

    private Token previous() {
        return tokens.previous();
    }
}

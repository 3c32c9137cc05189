package brook.lang;

import java.util.List;

/**
 * Syntax tree. Nodes are immutable and keep the token they were parsed from
 * so that evaluation errors can point back into the source.
 */
sealed interface Ast {

    record Program(List<Stmt> statements) implements Ast {
        public Program {
            statements = List.copyOf(statements);
        }
    }

    sealed interface Stmt extends Ast {}

    sealed interface Expr extends Ast {}

    //// statements ////

    record Assign(Token name, Expr value) implements Stmt {}

    record Print(Token keyword, Expr value) implements Stmt {}

    record Expression(Expr expression) implements Stmt {}

    /**
     * {@code elseBranch} is {@code null} when there is no {@code else}.
     */
    record If(Token keyword, Expr condition, List<Stmt> thenBranch, List<ElseIf> elseIfs, List<Stmt> elseBranch)
            implements Stmt {
        public If {
            thenBranch = List.copyOf(thenBranch);
            elseIfs = List.copyOf(elseIfs);
            elseBranch = elseBranch != null ? List.copyOf(elseBranch) : null;
        }
    }

    record ElseIf(Token keyword, Expr condition, List<Stmt> body) {
        public ElseIf {
            body = List.copyOf(body);
        }
    }

    record While(Token keyword, Expr condition, List<Stmt> body) implements Stmt {
        public While {
            body = List.copyOf(body);
        }
    }

    record For(Token keyword, Stmt initializer, Expr condition, Stmt update, List<Stmt> body) implements Stmt {
        public For {
            body = List.copyOf(body);
        }
    }

    //// expressions ////

    record NumberLiteral(long value, Token token) implements Expr {}

    record StringLiteral(String value, Token token) implements Expr {}

    record BooleanLiteral(boolean value, Token token) implements Expr {}

    record Identifier(Token name) implements Expr {}

    record BinaryOp(Expr left, Token operator, Expr right) implements Expr {}

    record Comparison(Expr left, Token operator, Expr right) implements Expr {}

    record LogicalOp(Expr left, Token operator, Expr right) implements Expr {}

    record Not(Token operator, Expr operand) implements Expr {}

    record ArrayLiteral(Token bracket, List<Expr> elements) implements Expr {
        public ArrayLiteral {
            elements = List.copyOf(elements);
        }
    }

    record IndexAccess(Expr array, Token bracket, Expr index) implements Expr {}

    record FunctionCall(Token name, List<Expr> arguments) implements Expr {
        public FunctionCall {
            arguments = List.copyOf(arguments);
        }
    }
}

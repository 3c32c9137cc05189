package brook.lang;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Tree-walking evaluator. Holds no variable state of its own: every call
 * receives the {@link Environment} of the run it belongs to.
 */
@RequiredArgsConstructor
final class Interpreter {

    private final @NonNull PrintStream out;
    private final @NonNull Builtins builtins;

    Interpreter(PrintStream out) {
        this(out, new Builtins());
    }

    public Optional<Value> interpret(Ast.Program program, Environment environment) {
        return execute(program.statements(), environment);
    }

    /**
     * Interprets any node. Expressions always produce a value; statements may
     * produce none.
     */
    public Optional<Value> evaluate(Ast node, Environment environment) {
        if (node instanceof Ast.Program program) {
            return interpret(program, environment);
        }
        if (node instanceof Ast.Stmt stmt) {
            return execute(stmt, environment);
        }
        if (node instanceof Ast.Expr expr) {
            return Optional.of(evaluateExpr(expr, environment));
        }

        var astClazz = node != null ? node.getClass() : null;
        throw new IllegalArgumentException("unsupported syntax tree: " + astClazz);
    }

    //// statements ////

    private Optional<Value> execute(List<Ast.Stmt> statements, Environment environment) {
        Optional<Value> result = Optional.empty();
        for (var stmt : statements) {
            result = execute(stmt, environment);
        }
        return result;
    }

    /**
     * Runs one statement. Nesting in the tree is bounded by the parser, but
     * values built at run time (an array wrapped in itself in a loop) can
     * still be too deep to print or compare.
     */
    private Optional<Value> execute(Ast.Stmt stmt, Environment environment) {
        try {
            return executeStmt(stmt, environment);
        } catch (StackOverflowError ex) {
            throw new EvalError(position(stmt), "Value nested too deeply.", ex);
        }
    }

    private Optional<Value> executeStmt(Ast.Stmt stmt, Environment environment) {
        if (stmt instanceof Ast.Assign assign) {
            return Optional.of(executeAssignStmt(assign, environment));
        }

        if (stmt instanceof Ast.Print print) {
            executePrintStmt(print, environment);
            return Optional.empty();
        }

        if (stmt instanceof Ast.Expression expression) {
            return Optional.of(evaluateExpr(expression.expression(), environment));
        }

        if (stmt instanceof Ast.If ifStmt) {
            return executeIfStmt(ifStmt, environment);
        }

        if (stmt instanceof Ast.While whileStmt) {
            return executeWhileStmt(whileStmt, environment);
        }

        if (stmt instanceof Ast.For forStmt) {
            return executeForStmt(forStmt, environment);
        }

        throw new IllegalArgumentException("unsupported statement: " + stmt);
    }

    private Value executeAssignStmt(Ast.Assign assign, Environment environment) {
        var value = evaluateExpr(assign.value(), environment);
        environment.assign(assign.name().lexeme(), value);
        return value;
    }

    private void executePrintStmt(Ast.Print print, Environment environment) {
        var value = evaluateExpr(print.value(), environment);
        out.println(value.render());
    }

    private Optional<Value> executeIfStmt(Ast.If ifStmt, Environment environment) {
        if (isTrue(ifStmt.keyword(), ifStmt.condition(), environment)) {
            return execute(ifStmt.thenBranch(), environment);
        }
        for (var elseIf : ifStmt.elseIfs()) {
            if (isTrue(elseIf.keyword(), elseIf.condition(), environment)) {
                return execute(elseIf.body(), environment);
            }
        }
        if (ifStmt.elseBranch() != null) {
            return execute(ifStmt.elseBranch(), environment);
        }
        return Optional.empty();
    }

    private Optional<Value> executeWhileStmt(Ast.While whileStmt, Environment environment) {
        Optional<Value> result = Optional.empty();
        while (isTrue(whileStmt.keyword(), whileStmt.condition(), environment)) {
            result = execute(whileStmt.body(), environment);
        }
        return result;
    }

    private Optional<Value> executeForStmt(Ast.For forStmt, Environment environment) {
        Optional<Value> result = Optional.empty();
        execute(forStmt.initializer(), environment);
        while (isTrue(forStmt.keyword(), forStmt.condition(), environment)) {
            result = execute(forStmt.body(), environment);
            execute(forStmt.update(), environment);
        }
        return result;
    }

    //// expressions ////

    private Value evaluateExpr(Ast.Expr node, Environment environment) {
        if (node instanceof Ast.NumberLiteral literal) {
            return Value.of(literal.value());
        }

        if (node instanceof Ast.StringLiteral literal) {
            return Value.of(literal.value());
        }

        if (node instanceof Ast.BooleanLiteral literal) {
            return Value.of(literal.value());
        }

        if (node instanceof Ast.Identifier identifier) {
            return evaluateIdentifierExpr(identifier, environment);
        }

        if (node instanceof Ast.BinaryOp binary) {
            return evaluateBinaryExpr(binary, environment);
        }

        if (node instanceof Ast.Comparison comparison) {
            return evaluateComparisonExpr(comparison, environment);
        }

        if (node instanceof Ast.LogicalOp logical) {
            return evaluateLogicalExpr(logical, environment);
        }

        if (node instanceof Ast.Not not) {
            var operand = evaluateExpr(not.operand(), environment);
            return Value.of(!asBoolean(not.operator(), operand, "Operand of '!'"));
        }

        if (node instanceof Ast.ArrayLiteral array) {
            return evaluateArrayExpr(array, environment);
        }

        if (node instanceof Ast.IndexAccess access) {
            return evaluateIndexExpr(access, environment);
        }

        if (node instanceof Ast.FunctionCall call) {
            return evaluateCallExpr(call, environment);
        }

        throw new IllegalArgumentException("unsupported expression: " + node);
    }

    private Value evaluateIdentifierExpr(Ast.Identifier identifier, Environment environment) {
        var name = identifier.name();
        return environment.lookup(name.lexeme())
            .orElseThrow(() -> new EvalError(name, "Undefined variable '" + name.lexeme() + "'."));
    }

    private Value evaluateBinaryExpr(Ast.BinaryOp binary, Environment environment) {
        var left = evaluateExpr(binary.left(), environment);
        var right = evaluateExpr(binary.right(), environment);
        var operator = binary.operator();
        checkNumberOperands(operator, left, right);

        long a = ((Value.Number) left).value();
        long b = ((Value.Number) right).value();
        try {
            switch (operator.type()) {
            case PLUS:
                return Value.of(Math.addExact(a, b));
            case MINUS:
                return Value.of(Math.subtractExact(a, b));
            case STAR:
                return Value.of(Math.multiplyExact(a, b));
            case SLASH:
                if (b == 0) {
                    throw new EvalError(operator, "Division by zero.");
                }
                if (a == Long.MIN_VALUE && b == -1) {
                    throw new ArithmeticException("long overflow");
                }
                return Value.of(a / b);
            default:
                throw new IllegalArgumentException("unsupported arithmetic operator: " + operator);
            }
        } catch (ArithmeticException ex) {
            throw new EvalError(operator, "Integer overflow in '" + operator.lexeme() + "'.", ex);
        }
    }

    private Value evaluateComparisonExpr(Ast.Comparison comparison, Environment environment) {
        var left = evaluateExpr(comparison.left(), environment);
        var right = evaluateExpr(comparison.right(), environment);
        var operator = comparison.operator();

        if (left instanceof Value.Number a && right instanceof Value.Number b) {
            switch (operator.type()) {
            case EQUAL_EQUAL:
                return Value.of(a.value() == b.value());
            case BANG_EQUAL:
                return Value.of(a.value() != b.value());
            case LESS:
                return Value.of(a.value() < b.value());
            case LESS_EQUAL:
                return Value.of(a.value() <= b.value());
            case GREATER:
                return Value.of(a.value() > b.value());
            case GREATER_EQUAL:
                return Value.of(a.value() >= b.value());
            default:
                throw new IllegalArgumentException("unsupported comparison operator: " + operator);
            }
        }

        var sameKind = (left instanceof Value.Text && right instanceof Value.Text)
            || (left instanceof Value.Bool && right instanceof Value.Bool);
        if (!sameKind) {
            throw new EvalError(operator, "Cannot compare " + left.typeName() + " with " + right.typeName()
                + " using '" + operator.lexeme() + "'.");
        }

        switch (operator.type()) {
        case EQUAL_EQUAL:
            return Value.of(left.equals(right));
        case BANG_EQUAL:
            return Value.of(!left.equals(right));
        default:
            throw new EvalError(operator, "Operator '" + operator.lexeme() + "' is not defined for "
                + left.typeName() + " operands.");
        }
    }

    private Value evaluateLogicalExpr(Ast.LogicalOp logical, Environment environment) {
        var operator = logical.operator();
        var description = "Operand of '" + operator.lexeme() + "'";

        var left = asBoolean(operator, evaluateExpr(logical.left(), environment), description);
        switch (operator.type()) {
        case PIPE_PIPE:
            if (left) {
                return Value.of(true);
            }
            break;
        case AMPERSAND_AMPERSAND:
            if (!left) {
                return Value.of(false);
            }
            break;
        default:
            throw new IllegalArgumentException("unsupported logical operator: " + operator);
        }

        var right = evaluateExpr(logical.right(), environment);
        return Value.of(asBoolean(operator, right, description));
    }

    private Value evaluateArrayExpr(Ast.ArrayLiteral array, Environment environment) {
        var elements = new ArrayList<Value>();
        for (var element : array.elements()) {
            elements.add(evaluateExpr(element, environment));
        }
        return Value.of(elements);
    }

    private Value evaluateIndexExpr(Ast.IndexAccess access, Environment environment) {
        var target = evaluateExpr(access.array(), environment);
        var index = evaluateExpr(access.index(), environment);
        var bracket = access.bracket();

        if (!(target instanceof Value.Array array)) {
            throw new EvalError(bracket, "Only arrays can be indexed, got " + target.typeName() + ".");
        }
        if (!(index instanceof Value.Number position)) {
            throw new EvalError(bracket, "Array index must be a number, got " + index.typeName() + ".");
        }
        if (array.isEmpty()) {
            throw new EvalError(bracket, "Cannot index an empty array.");
        }
        if (position.value() < 0 || position.value() >= array.size()) {
            throw new EvalError(bracket, "Index " + position.value() + " out of bounds for array of length "
                + array.size() + ".");
        }
        return array.get((int) position.value());
    }

    private Value evaluateCallExpr(Ast.FunctionCall call, Environment environment) {
        var arguments = new ArrayList<Value>();
        for (var argument : call.arguments()) {
            arguments.add(evaluateExpr(argument, environment));
        }
        return builtins.invoke(call.name(), arguments);
    }

    // **** UTILITIES ****

    private static Token position(Ast.Stmt stmt) {
        if (stmt instanceof Ast.Assign assign) {
            return assign.name();
        }
        if (stmt instanceof Ast.Print print) {
            return print.keyword();
        }
        if (stmt instanceof Ast.If ifStmt) {
            return ifStmt.keyword();
        }
        if (stmt instanceof Ast.While whileStmt) {
            return whileStmt.keyword();
        }
        if (stmt instanceof Ast.For forStmt) {
            return forStmt.keyword();
        }
        return position(((Ast.Expression) stmt).expression());
    }

    private static Token position(Ast.Expr expr) {
        if (expr instanceof Ast.NumberLiteral literal) {
            return literal.token();
        }
        if (expr instanceof Ast.StringLiteral literal) {
            return literal.token();
        }
        if (expr instanceof Ast.BooleanLiteral literal) {
            return literal.token();
        }
        if (expr instanceof Ast.Identifier identifier) {
            return identifier.name();
        }
        if (expr instanceof Ast.BinaryOp op) {
            return op.operator();
        }
        if (expr instanceof Ast.Comparison op) {
            return op.operator();
        }
        if (expr instanceof Ast.LogicalOp op) {
            return op.operator();
        }
        if (expr instanceof Ast.Not not) {
            return not.operator();
        }
        if (expr instanceof Ast.ArrayLiteral array) {
            return array.bracket();
        }
        if (expr instanceof Ast.IndexAccess access) {
            return access.bracket();
        }
        return ((Ast.FunctionCall) expr).name();
    }

    private boolean isTrue(Token keyword, Ast.Expr condition, Environment environment) {
        var value = evaluateExpr(condition, environment);
        return asBoolean(keyword, value, "Condition of '" + keyword.lexeme() + "'");
    }

    private boolean asBoolean(Token token, Value value, String description) {
        if (value instanceof Value.Bool bool) {
            return bool.value();
        }
        throw new EvalError(token, description + " must be a boolean, got " + value.typeName() + ".");
    }

    private void checkNumberOperands(Token operator, Value... operands) {
        for (var operand : operands) {
            if (!(operand instanceof Value.Number)) {
                throw new EvalError(operator, "Operands of '" + operator.lexeme() + "' must be numbers, got "
                    + operand.typeName() + ".");
            }
        }
    }
}

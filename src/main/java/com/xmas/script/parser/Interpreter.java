package com.xmas.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.xmas.script.parser.Expr.ArrayLiteral;
import com.xmas.script.parser.Expr.Binary;
import com.xmas.script.parser.Expr.Block;
import com.xmas.script.parser.Expr.Builtin;
import com.xmas.script.parser.Expr.Call;
import com.xmas.script.parser.Expr.ExprInterface;
import com.xmas.script.parser.Expr.For;
import com.xmas.script.parser.Expr.If;
import com.xmas.script.parser.Expr.Index;
import com.xmas.script.parser.Expr.IndexComponent;
import com.xmas.script.parser.Expr.InputRef;
import com.xmas.script.parser.Expr.Literal;
import com.xmas.script.parser.Expr.Logical;
import com.xmas.script.parser.Expr.MethodCall;
import com.xmas.script.parser.Expr.Pipe;
import com.xmas.script.parser.Expr.Range;
import com.xmas.script.parser.Expr.ReturnValueRef;
import com.xmas.script.parser.Expr.Unary;
import com.xmas.script.parser.Expr.Variable;
import com.xmas.script.parser.Statement.Assign;
import com.xmas.script.parser.Statement.AssignOp;
import com.xmas.script.parser.Statement.ExprStmt;
import com.xmas.script.parser.Statement.FunctionStmt;
import com.xmas.script.parser.Statement.Return;
import com.xmas.script.parser.Statement.Stmt;

/**
 * Tree-walking evaluator. One instance runs one program against one
 * {@link Environment}; every fault surfaces as an {@link XmasRuntimeException}.
 */
public class Interpreter implements Expr.ExprVisitor<Value>, Statement.StmtVisitor {

    /** Variable that holds the left operand of {@code |>} while the right side runs. */
    public static final String PIPE_TEMP = "__pipe_temp__";

    final Environment env = new Environment();
    private TraceListener trace = TraceListener.NONE;
    private int depth = 0;

    public Interpreter() {}

    public void setTraceListener(TraceListener listener) {
        this.trace = listener == null ? TraceListener.NONE : listener;
    }

    public Environment getEnvironment() {
        return env;
    }

    /**
     * Loads the {@code input} grid: one row per line, one single-character
     * string per cell. A trailing newline does not add an empty row, and a
     * trailing carriage return on each line is dropped.
     */
    public void setInput(String text) {
        List<List<Value>> grid = new ArrayList<>();
        if (text != null && !text.isEmpty()) {
            String[] lines = text.split("\n", -1);
            int count = text.endsWith("\n") ? lines.length - 1 : lines.length;
            for (int i = 0; i < count; i++) {
                String line = lines[i];
                if (line.endsWith("\r")) line = line.substring(0, line.length() - 1);
                List<Value> row = new ArrayList<>();
                line.codePoints().forEach(cp -> row.add(Value.string(new String(Character.toChars(cp)))));
                grid.add(row);
            }
        }
        env.setInput(Value.matrix(grid));
    }

    /**
     * Runs the program. The result is the value of {@code _} if it was ever
     * set, else the value of the last bare expression, else an empty array.
     */
    public Value interpret(List<Stmt> program) {
        Value last = Value.emptyArray();
        for (Stmt stmt : program) {
            if (stmt instanceof ExprStmt) {
                last = evaluate(((ExprStmt) stmt).expression);
            } else {
                execute(stmt);
            }
        }
        Value returned = env.getReturnValue();
        return returned != null ? returned : last;
    }

    Value evaluate(ExprInterface expr) {
        return expr.accept(this);
    }

    void execute(Stmt stmt) {
        stmt.accept(this);
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public void visitAssignStmt(Assign stmt) {
        String name = stmt.name.lexeme;
        Value value = evaluate(stmt.value);
        trace.onAssign(depth, name, env.get(name), value);
        env.assign(name, value);
    }

    @Override
    public void visitAssignOpStmt(AssignOp stmt) {
        String name = stmt.name.lexeme;
        TokenType op = stmt.operator.type;

        if (stmt.targetsReturn()) {
            String slot = stmt.name.type == TokenType.UNDERSCORE ? null : name.substring(1);
            Value current;
            if (slot != null) {
                // a named slot that was never set starts from the unnamed one
                current = env.getNamedReturn(slot);
                if (current == null) current = env.getReturnValue();
                if (current == null) throw new XmasRuntimeException("No return value set for _" + slot);
            } else {
                current = env.getReturnValue();
                if (current == null) throw new XmasRuntimeException("No return value set");
            }

            Value right = evaluate(stmt.value);
            Value updated = applyOperator(arithmeticOf(op), current, right);
            Value previous = slot != null ? env.getNamedReturn(slot) : env.getReturnValue();
            trace.onCompoundAssign(depth, name, op, previous, updated);

            if (slot != null) env.setNamedReturn(slot, updated);
            else env.setReturnValue(updated);
            return;
        }

        Value current = env.get(name);
        if (current == null) throw new XmasRuntimeException("Undefined variable: " + name);
        Value right = evaluate(stmt.value);
        Value updated = applyOperator(arithmeticOf(op), current, right);
        trace.onCompoundAssign(depth, name, op, env.get(name), updated);
        env.assign(name, updated);
    }

    @Override
    public void visitReturnStmt(Return stmt) {
        Value value = evaluate(stmt.value);
        env.setReturnValue(value);
        if (stmt.name != null) env.setNamedReturn(stmt.name, value);
    }

    @Override
    public void visitFunctionStmt(FunctionStmt stmt) {
        env.defineFunction(new UserFunction(stmt.name.lexeme, stmt.params, stmt.body));
    }

    @Override
    public void visitExprStmt(ExprStmt stmt) {
        evaluate(stmt.expression);
    }

    private static TokenType arithmeticOf(TokenType compound) {
        switch (compound) {
            case PLUS_EQUAL: return TokenType.PLUS;
            case MINUS_EQUAL: return TokenType.MINUS;
            case STAR_EQUAL: return TokenType.STAR;
            case SLASH_EQUAL: return TokenType.SLASH;
            case PERCENT_EQUAL: return TokenType.PERCENT;
            default: throw new XmasRuntimeException("Unknown compound operator: " + compound);
        }
    }

    // -------------------------
    // Leaves and collections
    // -------------------------

    @Override
    public Value visitLiteralExpr(Literal expr) {
        Object v = expr.value;
        if (v instanceof Long) return Value.number((Long) v);
        if (v instanceof Boolean) return Value.bool((Boolean) v);
        return Value.string((String) v);
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        String name = expr.name.lexeme;
        if (Statement.isNamedReturn(name)) {
            Value value = env.getNamedReturn(name.substring(1));
            if (value == null) throw new XmasRuntimeException("Undefined named return: " + name);
            return value;
        }
        Value value = env.get(name);
        if (value == null) throw new XmasRuntimeException("Undefined variable: " + name);
        return value;
    }

    @Override
    public Value visitInputExpr(InputRef expr) {
        return env.getInput();
    }

    @Override
    public Value visitReturnValueExpr(ReturnValueRef expr) {
        Value value = env.getReturnValue();
        if (value == null) throw new XmasRuntimeException("No return value set");
        return value;
    }

    @Override
    public Value visitArrayLiteralExpr(ArrayLiteral expr) {
        List<Value> values = new ArrayList<>(expr.elements.size());
        for (ExprInterface element : expr.elements) values.add(evaluate(element));
        return Value.array(values);
    }

    @Override
    public Value visitRangeExpr(Range expr) {
        Value startValue = evaluate(expr.start);
        Value endValue = evaluate(expr.end);
        if (startValue.type != Value.Type.NUMBER) throw new XmasRuntimeException("Range start must be a number");
        if (endValue.type != Value.Type.NUMBER) throw new XmasRuntimeException("Range end must be a number");

        long start = startValue.asNumber();
        long end = endValue.asNumber();
        List<Value> values = new ArrayList<>();
        if (start <= end) {
            for (long i = start; i <= end; i++) {
                values.add(Value.number(i));
                if (i == Long.MAX_VALUE) break;
            }
        } else {
            for (long i = start; i >= end; i--) {
                values.add(Value.number(i));
                if (i == Long.MIN_VALUE) break;
            }
        }
        return Value.array(values);
    }

    // -------------------------
    // Operators
    // -------------------------

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value value = evaluate(expr.right);
        if (expr.operator.type == TokenType.BANG) {
            return Value.bool(!value.isTruthy());
        }
        return toNumber(value);
    }

    /** The {@code ~} conversion. */
    private static Value toNumber(Value value) {
        switch (value.type) {
            case STRING:
                return parseNumber(value.asString());
            case ARRAY: {
                StringBuilder sb = new StringBuilder();
                for (Value item : value.asArray()) {
                    if (item.type != Value.Type.STRING) {
                        throw new XmasRuntimeException("Cannot convert non-string array element to number");
                    }
                    sb.append(item.asString());
                }
                return parseNumber(sb.toString());
            }
            case NUMBER:
                return value;
            case BOOL:
                return Value.number(value.asBool() ? 1 : 0);
            default:
                throw new XmasRuntimeException("Cannot convert to number");
        }
    }

    private static Value parseNumber(String text) {
        try {
            return Value.number(Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw new XmasRuntimeException("Cannot convert '" + text + "' to number");
        }
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Value left = evaluate(expr.left);
        Value right = evaluate(expr.right);
        return applyOperator(expr.operator.type, left, right);
    }

    @Override
    public Value visitLogicalExpr(Logical expr) {
        Value left = evaluate(expr.left);
        Value right = evaluate(expr.right);
        if (expr.operator.type == TokenType.AND_AND) {
            return left.isTruthy() ? right : left;
        }
        return left.isTruthy() ? left : right;
    }

    /**
     * Arithmetic and comparison. {@code + - * /} accept a boolean paired with a
     * number (as 0/1); {@code %} and the ordering comparisons take numbers only;
     * {@code ==} compares structurally without any coercion.
     */
    static Value applyOperator(TokenType op, Value left, Value right) {
        switch (op) {
            case PLUS: {
                long[] n = numericPair(left, right);
                if (n != null) return Value.number(n[0] + n[1]);
                if (left.type == Value.Type.STRING && right.type == Value.Type.STRING) {
                    return Value.string(left.asString() + right.asString());
                }
                if (left.type == Value.Type.ARRAY && right.type == Value.Type.ARRAY) {
                    List<Value> joined = new ArrayList<>(left.asArray());
                    joined.addAll(right.asArray());
                    return Value.array(joined);
                }
                throw invalidOperands("+", left, right);
            }
            case MINUS: {
                long[] n = numericPair(left, right);
                if (n == null) throw invalidOperands("-", left, right);
                return Value.number(n[0] - n[1]);
            }
            case STAR: {
                long[] n = numericPair(left, right);
                if (n == null) throw invalidOperands("*", left, right);
                return Value.number(n[0] * n[1]);
            }
            case SLASH: {
                long[] n = numericPair(left, right);
                if (n == null) throw invalidOperands("/", left, right);
                if (n[1] == 0) throw new XmasRuntimeException("Division by zero");
                return Value.number(n[0] / n[1]);
            }
            case PERCENT: {
                if (left.type != Value.Type.NUMBER || right.type != Value.Type.NUMBER) {
                    throw invalidOperands("%", left, right);
                }
                if (right.asNumber() == 0) throw new XmasRuntimeException("Modulo by zero");
                return Value.number(left.asNumber() % right.asNumber());
            }
            case LESS: {
                long[] n = numbers("<", left, right);
                return Value.bool(n[0] < n[1]);
            }
            case GREATER: {
                long[] n = numbers(">", left, right);
                return Value.bool(n[0] > n[1]);
            }
            case LESS_EQUAL: {
                long[] n = numbers("<=", left, right);
                return Value.bool(n[0] <= n[1]);
            }
            case GREATER_EQUAL: {
                long[] n = numbers(">=", left, right);
                return Value.bool(n[0] >= n[1]);
            }
            case EQUAL_EQUAL:
                return Value.bool(left.equals(right));
            default:
                throw new XmasRuntimeException("Unknown operator: " + op);
        }
    }

    /** Two numbers, or one number and one boolean; null for anything else. */
    private static long[] numericPair(Value left, Value right) {
        boolean leftNumber = left.type == Value.Type.NUMBER;
        boolean rightNumber = right.type == Value.Type.NUMBER;
        if (leftNumber && rightNumber) {
            return new long[] { left.asNumber(), right.asNumber() };
        }
        if (leftNumber && right.type == Value.Type.BOOL) {
            return new long[] { left.asNumber(), right.asBool() ? 1 : 0 };
        }
        if (left.type == Value.Type.BOOL && rightNumber) {
            return new long[] { left.asBool() ? 1 : 0, right.asNumber() };
        }
        return null;
    }

    private static long[] numbers(String op, Value left, Value right) {
        if (left.type != Value.Type.NUMBER || right.type != Value.Type.NUMBER) {
            throw invalidOperands(op, left, right);
        }
        return new long[] { left.asNumber(), right.asNumber() };
    }

    private static XmasRuntimeException invalidOperands(String op, Value left, Value right) {
        return new XmasRuntimeException("Invalid operands for " + op + ": left is "
                + left.toDebugString() + ", right is " + right.toDebugString());
    }

    @Override
    public Value visitPipeExpr(Pipe expr) {
        Value left = evaluate(expr.left);
        Environment.Shadow shadow = env.shadow(PIPE_TEMP, left);
        try {
            return evaluate(expr.right);
        } finally {
            env.restore(shadow);
        }
    }

    // -------------------------
    // Calls
    // -------------------------

    @Override
    public Value visitCallExpr(Call expr) {
        String name = expr.callee.lexeme;
        UserFunction function = env.getFunction(name);
        if (function == null) throw new XmasRuntimeException("Undefined function: " + name);
        return function.call(this, expr.arguments);
    }

    @Override
    public Value visitMethodCallExpr(MethodCall expr) {
        Value object = evaluate(expr.object);
        String method = expr.method.lexeme;
        if (!"rows".equals(method)) {
            throw new XmasRuntimeException("Unknown method: " + method);
        }
        if (!expr.arguments.isEmpty()) {
            throw new XmasRuntimeException("rows() method takes no arguments");
        }
        if (object.type != Value.Type.MATRIX) {
            throw new XmasRuntimeException("rows() method only works on 2D arrays");
        }
        List<Value> rows = new ArrayList<>();
        for (List<Value> row : object.asMatrix()) rows.add(Value.array(row));
        return Value.array(rows);
    }

    @Override
    public Value visitBuiltinExpr(Builtin expr) {
        String name = expr.name.lexeme;
        List<ExprInterface> args = expr.arguments;

        switch (expr.name.type) {
            case LEN: {
                requireArgs(name, args, 1);
                Value value = evaluate(args.get(0));
                switch (value.type) {
                    case ARRAY:
                        return Value.number(value.asArray().size());
                    case MATRIX: {
                        List<List<Value>> rows = value.asMatrix();
                        List<Value> dims = new ArrayList<>(2);
                        dims.add(Value.number(rows.size()));
                        dims.add(Value.number(rows.isEmpty() ? 0 : rows.get(0).size()));
                        return Value.array(dims);
                    }
                    case STRING: {
                        String s = value.asString();
                        return Value.number(s.codePointCount(0, s.length()));
                    }
                    default:
                        throw new XmasRuntimeException("len requires array or string");
                }
            }
            case MAX:
            case MIN: {
                requireArgs(name, args, 2);
                Value a = evaluate(args.get(0));
                Value b = evaluate(args.get(1));
                if (a.type != Value.Type.NUMBER || b.type != Value.Type.NUMBER) {
                    throw new XmasRuntimeException(name + " requires 2 numbers");
                }
                return expr.name.type == TokenType.MAX
                        ? Value.number(Math.max(a.asNumber(), b.asNumber()))
                        : Value.number(Math.min(a.asNumber(), b.asNumber()));
            }
            case FLOOR:
            case CEIL: {
                // numbers are integers, so both are the identity
                requireArgs(name, args, 1);
                Value value = evaluate(args.get(0));
                if (value.type != Value.Type.NUMBER) {
                    throw new XmasRuntimeException(name + " requires a number");
                }
                return value;
            }
            default:
                throw new XmasRuntimeException("Unknown builtin function: " + name);
        }
    }

    private static void requireArgs(String name, List<ExprInterface> args, int count) {
        if (args.size() != count) {
            throw new XmasRuntimeException(name + " requires " + count
                    + (count == 1 ? " argument" : " arguments"));
        }
    }

    // -------------------------
    // Control forms
    // -------------------------

    @Override
    public Value visitIfExpr(If expr) {
        boolean truthy = evaluate(expr.condition).isTruthy();
        trace.onCondition(depth, expr.condition, truthy);

        depth++;
        try {
            if (truthy) return evaluate(expr.thenBranch);
            if (expr.elseBranch != null) return evaluate(expr.elseBranch);
            return Value.emptyArray();
        } finally {
            depth--;
        }
    }

    /**
     * Without an initial value the loop runs for its side effects and yields an
     * empty array. With one, {@code _} is seeded with it and carried across
     * iterations, and its final value is the result.
     */
    @Override
    public Value visitForExpr(For expr) {
        Value iterable = evaluate(expr.iterable);
        if (iterable.type == Value.Type.MATRIX) throw new XmasRuntimeException("for loop requires 1D array");
        if (iterable.type != Value.Type.ARRAY) throw new XmasRuntimeException("for loop requires array");

        Value initial = expr.initial != null ? evaluate(expr.initial) : null;
        String variable = expr.variable.lexeme;

        Environment.ReturnScope saved = env.openReturnScope(initial);
        try {
            for (Value element : iterable.asArray()) {
                trace.onIteration(depth, variable, element);
                Environment.Shadow shadow = env.shadow(variable, element);
                depth++;
                try {
                    runLoopBody(expr.body);
                } finally {
                    depth--;
                    env.restore(shadow);
                }
            }

            if (initial == null) return Value.emptyArray();
            Value accumulated = env.getReturnValue();
            return accumulated != null ? accumulated : initial;
        } finally {
            env.closeReturnScope(saved);
        }
    }

    // a literal block runs in the loop's return scope so that _ accumulates
    private void runLoopBody(ExprInterface body) {
        if (body instanceof Block) {
            for (Stmt stmt : ((Block) body).statements) execute(stmt);
        } else {
            evaluate(body);
        }
    }

    @Override
    public Value visitBlockExpr(Block expr) {
        Environment.ReturnScope saved = env.openReturnScope(null);
        try {
            for (Stmt stmt : expr.statements) execute(stmt);
            Value returned = env.getReturnValue();
            return returned != null ? returned : Value.emptyArray();
        } finally {
            env.closeReturnScope(saved);
        }
    }

    // -------------------------
    // Indexing
    // -------------------------

    /**
     * Applies the components left to right. On a 2D array, a range followed by
     * a single index is column access: the column is taken from each row in the
     * range that is long enough.
     */
    @Override
    public Value visitIndexExpr(Index expr) {
        Value current = evaluate(expr.target);
        List<IndexComponent> components = expr.components;

        int i = 0;
        while (i < components.size()) {
            IndexComponent component = components.get(i);

            boolean columnAccess = current.type == Value.Type.MATRIX
                    && component.range
                    && i + 1 < components.size()
                    && !components.get(i + 1).range;

            if (columnAccess) {
                int column = toIndex(evaluate(components.get(i + 1).start));
                List<List<Value>> rows = current.asMatrix();
                int[] bounds = sliceBounds(component, rows.size());
                List<Value> cells = new ArrayList<>();
                for (List<Value> row : rows.subList(bounds[0], bounds[1])) {
                    if (column < row.size()) cells.add(row.get(column));
                }
                current = Value.array(cells);
                i += 2;
                continue;
            }

            if (component.range) {
                current = slice(current, component);
            } else {
                current = indexValue(current, toIndex(evaluate(component.start)));
            }
            i++;
        }
        return current;
    }

    private Value indexValue(Value value, int index) {
        switch (value.type) {
            case ARRAY: {
                List<Value> items = value.asArray();
                if (index >= items.size()) {
                    throw new XmasRuntimeException("Index " + index + " out of bounds (array length: " + items.size() + ")");
                }
                return items.get(index);
            }
            case MATRIX: {
                List<List<Value>> rows = value.asMatrix();
                if (index >= rows.size()) throw new XmasRuntimeException("Index " + index + " out of bounds");
                return Value.array(rows.get(index));
            }
            case STRING: {
                int[] codePoints = value.asString().codePoints().toArray();
                if (index >= codePoints.length) throw new XmasRuntimeException("Index " + index + " out of bounds");
                return Value.string(new String(codePoints, index, 1));
            }
            default:
                throw new XmasRuntimeException("Cannot index non-array value: " + value.toDebugString());
        }
    }

    /** Range bounds are clamped to the length and never fail; start past end gives an empty slice. */
    private Value slice(Value value, IndexComponent range) {
        switch (value.type) {
            case ARRAY: {
                List<Value> items = value.asArray();
                int[] b = sliceBounds(range, items.size());
                return Value.array(items.subList(b[0], b[1]));
            }
            case MATRIX: {
                List<List<Value>> rows = value.asMatrix();
                int[] b = sliceBounds(range, rows.size());
                return Value.matrix(rows.subList(b[0], b[1]));
            }
            case STRING: {
                int[] codePoints = value.asString().codePoints().toArray();
                int[] b = sliceBounds(range, codePoints.length);
                return Value.string(new String(codePoints, b[0], b[1] - b[0]));
            }
            default:
                throw new XmasRuntimeException("Cannot slice non-array value");
        }
    }

    private int[] sliceBounds(IndexComponent range, int length) {
        int start = range.start == null ? 0 : toIndex(evaluate(range.start));
        int end = range.end == null ? length : toIndex(evaluate(range.end));
        end = Math.min(end, length);
        start = Math.min(start, end);
        return new int[] { start, end };
    }

    private static int toIndex(Value value) {
        if (value.type != Value.Type.NUMBER) throw new XmasRuntimeException("Array index must be a number");
        long n = value.asNumber();
        if (n < 0) throw new XmasRuntimeException("Array index must be non-negative integer");
        return (int) Math.min(n, Integer.MAX_VALUE);
    }
}

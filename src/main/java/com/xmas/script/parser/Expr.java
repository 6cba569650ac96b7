package com.xmas.script.parser;

import java.util.List;

import com.xmas.script.parser.Statement.Stmt;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitVariableExpr(Variable expr);
        R visitInputExpr(InputRef expr);
        R visitReturnValueExpr(ReturnValueRef expr);
        R visitArrayLiteralExpr(ArrayLiteral expr);
        R visitRangeExpr(Range expr);
        R visitUnaryExpr(Unary expr);
        R visitBinaryExpr(Binary expr);
        R visitLogicalExpr(Logical expr);
        R visitPipeExpr(Pipe expr);
        R visitCallExpr(Call expr);
        R visitIndexExpr(Index expr);
        R visitIfExpr(If expr);
        R visitForExpr(For expr);
        R visitBuiltinExpr(Builtin expr);
        R visitMethodCallExpr(MethodCall expr);
        R visitBlockExpr(Block expr);
    }

    // -------------------------
    // Leaves
    // -------------------------

    /** Number (Long), boolean (Boolean) or string (String) literal. */
    public static final class Literal implements ExprInterface {
        public final Object value;

        public Literal(Object value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    /** Variable read. Names of the form {@code _name} read the named return slot instead. */
    public static final class Variable implements ExprInterface {
        public final Token name;

        public Variable(Token name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    public static final class InputRef implements ExprInterface {
        public final Token keyword;

        public InputRef(Token keyword) {
            this.keyword = keyword;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitInputExpr(this);
        }
    }

    /** The bare {@code _} read. */
    public static final class ReturnValueRef implements ExprInterface {
        public final Token token;

        public ReturnValueRef(Token token) {
            this.token = token;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitReturnValueExpr(this);
        }
    }

    // -------------------------
    // Collections
    // -------------------------

    public static final class ArrayLiteral implements ExprInterface {
        public final List<ExprInterface> elements;

        public ArrayLiteral(List<ExprInterface> elements) {
            this.elements = elements;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitArrayLiteralExpr(this);
        }
    }

    /** Inclusive {@code [start..end]}; counts down when start > end. */
    public static final class Range implements ExprInterface {
        public final ExprInterface start;
        public final ExprInterface end;

        public Range(ExprInterface start, ExprInterface end) {
            this.start = start;
            this.end = end;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitRangeExpr(this);
        }
    }

    // -------------------------
    // Operators
    // -------------------------

    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    /** Arithmetic and comparison operators. */
    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    /** {@code &&} and {@code ||}. Both sides are always evaluated; the result is one of the operands. */
    public static final class Logical implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Logical(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }
    }

    public static final class Pipe implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Pipe(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitPipeExpr(this);
        }
    }

    // -------------------------
    // Calls and access
    // -------------------------

    public static final class Call implements ExprInterface {
        public final Token callee;
        public final List<ExprInterface> arguments;

        public Call(Token callee, List<ExprInterface> arguments) {
            this.callee = callee;
            this.arguments = arguments;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }

    /** One comma-separated entry inside an index bracket group. */
    public static final class IndexComponent {
        public final boolean range;
        /** The index for a single component, the (optional) start for a range. */
        public final ExprInterface start;
        public final ExprInterface end;

        private IndexComponent(boolean range, ExprInterface start, ExprInterface end) {
            this.range = range;
            this.start = start;
            this.end = end;
        }

        public static IndexComponent single(ExprInterface index) {
            return new IndexComponent(false, index, null);
        }

        public static IndexComponent slice(ExprInterface start, ExprInterface end) {
            return new IndexComponent(true, start, end);
        }
    }

    /** {@code target[a, b..c, ..]}: one bracket group, applied left to right. */
    public static final class Index implements ExprInterface {
        public final ExprInterface target;
        public final Token bracket;
        public final List<IndexComponent> components;

        public Index(ExprInterface target, Token bracket, List<IndexComponent> components) {
            this.target = target;
            this.bracket = bracket;
            this.components = components;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIndexExpr(this);
        }
    }

    public static final class MethodCall implements ExprInterface {
        public final ExprInterface object;
        public final Token method;
        public final List<ExprInterface> arguments;

        public MethodCall(ExprInterface object, Token method, List<ExprInterface> arguments) {
            this.object = object;
            this.method = method;
            this.arguments = arguments;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMethodCallExpr(this);
        }
    }

    // -------------------------
    // Builtin forms
    // -------------------------

    public static final class If implements ExprInterface {
        public final Token keyword;
        public final ExprInterface condition;
        public final ExprInterface thenBranch;
        /** Null when the else branch is omitted. */
        public final ExprInterface elseBranch;

        public If(Token keyword, ExprInterface condition, ExprInterface thenBranch, ExprInterface elseBranch) {
            this.keyword = keyword;
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIfExpr(this);
        }
    }

    public static final class For implements ExprInterface {
        public final Token keyword;
        public final Token variable;
        public final ExprInterface iterable;
        public final ExprInterface body;
        /** Null when no initial value is given; the loop then yields an empty array. */
        public final ExprInterface initial;

        public For(Token keyword, Token variable, ExprInterface iterable, ExprInterface body, ExprInterface initial) {
            this.keyword = keyword;
            this.variable = variable;
            this.iterable = iterable;
            this.body = body;
            this.initial = initial;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitForExpr(this);
        }
    }

    /** len, max, min, floor, ceil. */
    public static final class Builtin implements ExprInterface {
        public final Token name;
        public final List<ExprInterface> arguments;

        public Builtin(Token name, List<ExprInterface> arguments) {
            this.name = name;
            this.arguments = arguments;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBuiltinExpr(this);
        }
    }

    public static final class Block implements ExprInterface {
        public final List<Stmt> statements;

        public Block(List<Stmt> statements) {
            this.statements = statements;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBlockExpr(this);
        }
    }
}

package com.xmas.script.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);
    }

    public interface StmtVisitor {
        void visitAssignStmt(Assign stmt);
        void visitAssignOpStmt(AssignOp stmt);
        void visitReturnStmt(Return stmt);
        void visitFunctionStmt(FunctionStmt stmt);
        void visitExprStmt(ExprStmt stmt);
    }

    /** {@code name = value} */
    public static final class Assign implements Stmt {
        public final Token name;
        public final Expr.ExprInterface value;

        Assign(Token name, Expr.ExprInterface value) {
            this.name = name;
            this.value = value;
        }

        public void accept(StmtVisitor visitor) { visitor.visitAssignStmt(this); }
    }

    /**
     * {@code name op= value}. The target may be an ordinary variable, the bare
     * {@code _}, or a named return {@code _name}.
     */
    public static final class AssignOp implements Stmt {
        public final Token name;
        public final Token operator;
        public final Expr.ExprInterface value;

        AssignOp(Token name, Token operator, Expr.ExprInterface value) {
            this.name = name;
            this.operator = operator;
            this.value = value;
        }

        public boolean targetsReturn() {
            return name.type == TokenType.UNDERSCORE || isNamedReturn(name.lexeme);
        }

        public void accept(StmtVisitor visitor) { visitor.visitAssignOpStmt(this); }
    }

    /** {@code _ = value} or {@code _name = value}. */
    public static final class Return implements Stmt {
        public final Token target;
        /** Slot name without the leading underscore, null for the bare {@code _}. */
        public final String name;
        public final Expr.ExprInterface value;

        Return(Token target, String name, Expr.ExprInterface value) {
            this.target = target;
            this.name = name;
            this.value = value;
        }

        public void accept(StmtVisitor visitor) { visitor.visitReturnStmt(this); }
    }

    /** {@code name(a, b) = body} */
    public static final class FunctionStmt implements Stmt {
        public final Token name;
        public final List<Token> params;
        public final Expr.ExprInterface body;

        FunctionStmt(Token name, List<Token> params, Expr.ExprInterface body) {
            this.name = name;
            this.params = params;
            this.body = body;
        }

        public void accept(StmtVisitor visitor) { visitor.visitFunctionStmt(this); }
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;

        ExprStmt(Expr.ExprInterface expression) { this.expression = expression; }

        public void accept(StmtVisitor visitor) { visitor.visitExprStmt(this); }
    }

    /** {@code _name}: an underscore followed by at least one more character. */
    static boolean isNamedReturn(String lexeme) {
        return lexeme.length() > 1 && lexeme.charAt(0) == '_';
    }
}

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

/**
 * Renders an expression back to source-like text for trace output. Binary
 * expressions are always parenthesised and block bodies are elided.
 */
public class ExprPrinter implements Expr.ExprVisitor<String> {

    public String print(ExprInterface expr) {
        return expr.accept(this);
    }

    @Override
    public String visitLiteralExpr(Literal expr) {
        if (expr.value instanceof String) return "\"" + expr.value + "\"";
        return String.valueOf(expr.value);
    }

    @Override
    public String visitVariableExpr(Variable expr) {
        return expr.name.lexeme;
    }

    @Override
    public String visitInputExpr(InputRef expr) {
        return "input";
    }

    @Override
    public String visitReturnValueExpr(ReturnValueRef expr) {
        return "_";
    }

    @Override
    public String visitArrayLiteralExpr(ArrayLiteral expr) {
        return "[" + joined(expr.elements) + "]";
    }

    @Override
    public String visitRangeExpr(Range expr) {
        return "[" + print(expr.start) + ".." + print(expr.end) + "]";
    }

    @Override
    public String visitUnaryExpr(Unary expr) {
        return expr.operator.lexeme + print(expr.right);
    }

    @Override
    public String visitBinaryExpr(Binary expr) {
        return "(" + print(expr.left) + " " + expr.operator.lexeme + " " + print(expr.right) + ")";
    }

    @Override
    public String visitLogicalExpr(Logical expr) {
        return "(" + print(expr.left) + " " + expr.operator.lexeme + " " + print(expr.right) + ")";
    }

    @Override
    public String visitPipeExpr(Pipe expr) {
        return print(expr.left) + " |> " + print(expr.right);
    }

    @Override
    public String visitCallExpr(Call expr) {
        return expr.callee.lexeme + "(" + joined(expr.arguments) + ")";
    }

    @Override
    public String visitIndexExpr(Index expr) {
        StringBuilder sb = new StringBuilder(print(expr.target));
        for (IndexComponent component : expr.components) {
            sb.append('[');
            if (component.range) {
                if (component.start != null) sb.append(print(component.start));
                sb.append("..");
                if (component.end != null) sb.append(print(component.end));
            } else {
                sb.append(print(component.start));
            }
            sb.append(']');
        }
        return sb.toString();
    }

    @Override
    public String visitIfExpr(If expr) {
        List<ExprInterface> args = new ArrayList<>();
        args.add(expr.condition);
        args.add(expr.thenBranch);
        if (expr.elseBranch != null) args.add(expr.elseBranch);
        return "if(" + joined(args) + ")";
    }

    @Override
    public String visitForExpr(For expr) {
        String text = "for(" + expr.variable.lexeme + " of " + print(expr.iterable) + ", " + print(expr.body);
        if (expr.initial != null) text += ", " + print(expr.initial);
        return text + ")";
    }

    @Override
    public String visitBuiltinExpr(Builtin expr) {
        return expr.name.lexeme + "(" + joined(expr.arguments) + ")";
    }

    @Override
    public String visitMethodCallExpr(MethodCall expr) {
        return print(expr.object) + "." + expr.method.lexeme + "(" + joined(expr.arguments) + ")";
    }

    @Override
    public String visitBlockExpr(Block expr) {
        return "{ ... }";
    }

    private String joined(List<ExprInterface> exprs) {
        List<String> parts = new ArrayList<>(exprs.size());
        for (ExprInterface e : exprs) parts.add(print(e));
        return String.join(", ", parts);
    }
}

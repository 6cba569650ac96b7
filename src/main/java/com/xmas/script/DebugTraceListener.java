package com.xmas.script;

import com.xmas.debug.Debug;
import com.xmas.script.parser.Expr;
import com.xmas.script.parser.ExprPrinter;
import com.xmas.script.parser.TokenType;
import com.xmas.script.parser.TraceListener;
import com.xmas.script.parser.Value;

/**
 * Turns interpreter trace events into DEBUG records on the {@code xmas.trace}
 * tag, indented two spaces per nesting level:
 *
 * <pre>
 * x: undefined → 5
 * for n: 1
 *   _ +=: 0 → 1
 * if (x &gt; 3): true
 * </pre>
 */
public class DebugTraceListener implements TraceListener {

    public static final String TAG = "xmas.trace";

    private final ExprPrinter printer = new ExprPrinter();

    @Override
    public void onAssign(int depth, String name, Value previous, Value current) {
        emit(depth, name + ": " + render(previous) + " → " + render(current));
    }

    @Override
    public void onCompoundAssign(int depth, String name, TokenType operator, Value previous, Value current) {
        emit(depth, name + " " + operatorText(operator) + ": " + render(previous) + " → " + render(current));
    }

    @Override
    public void onCondition(int depth, Expr.ExprInterface condition, boolean result) {
        emit(depth, "if " + printer.print(condition) + ": " + result);
    }

    @Override
    public void onIteration(int depth, String variable, Value element) {
        emit(depth, "for " + variable + ": " + render(element));
    }

    private static void emit(int depth, String line) {
        Debug debug = Debug.get();
        if (!debug.isEnabled()) return;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < depth; i++) sb.append("  ");
        debug.d(TAG, sb.append(line).toString());
    }

    private static String render(Value value) {
        return value == null ? "undefined" : value.toDebugString();
    }

    private static String operatorText(TokenType operator) {
        switch (operator) {
            case PLUS_EQUAL: return "+=";
            case MINUS_EQUAL: return "-=";
            case STAR_EQUAL: return "*=";
            case SLASH_EQUAL: return "/=";
            case PERCENT_EQUAL: return "%=";
            default: return "?=";
        }
    }
}

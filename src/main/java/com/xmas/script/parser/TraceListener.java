package com.xmas.script.parser;

/**
 * Observer for the interpreter's debug trace. Every callback gets the current
 * nesting depth, which grows by one inside an {@code if} branch and inside a
 * {@code for} body. {@code previous} is null when the target had no value.
 */
public interface TraceListener {

    TraceListener NONE = new TraceListener() {};

    default void onAssign(int depth, String name, Value previous, Value current) {}

    default void onCompoundAssign(int depth, String name, TokenType operator, Value previous, Value current) {}

    default void onCondition(int depth, Expr.ExprInterface condition, boolean result) {}

    default void onIteration(int depth, String variable, Value element) {}
}

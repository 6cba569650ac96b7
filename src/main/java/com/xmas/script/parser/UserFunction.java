package com.xmas.script.parser;

import java.util.ArrayList;
import java.util.List;

public class UserFunction {
    final String name;
    final List<Token> params;
    final Expr.ExprInterface body;

    UserFunction(String name, List<Token> params, Expr.ExprInterface body) {
        this.name = name;
        this.params = params;
        this.body = body;
    }

    /**
     * Arguments are evaluated in the caller's state before any parameter is
     * bound. Parameters then overwrite same-named globals for the duration of
     * the call, and the return slots start empty.
     *
     * @return the value left in {@code _} by the body, or the body's own value
     *         if it never set {@code _}
     */
    Value call(Interpreter interpreter, List<Expr.ExprInterface> arguments) {
        if (arguments.size() != params.size()) {
            throw new XmasRuntimeException("Function " + name + " expects " + params.size()
                    + " arguments, got " + arguments.size());
        }

        List<Value> values = new ArrayList<>(arguments.size());
        for (Expr.ExprInterface argument : arguments) {
            values.add(interpreter.evaluate(argument));
        }

        List<String> names = new ArrayList<>(params.size());
        for (Token param : params) names.add(param.lexeme);

        Environment env = interpreter.env;
        Environment.Shadow shadow = env.shadow(names, values);
        Environment.ReturnScope saved = env.openReturnScope(null);
        try {
            Value result = interpreter.evaluate(body);
            Value returned = env.getReturnValue();
            return returned != null ? returned : result;
        } finally {
            env.closeReturnScope(saved);
            env.restore(shadow);
        }
    }
}

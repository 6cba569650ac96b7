package com.xmas.script;

import java.util.Map;

import com.xmas.script.parser.Value;

/** Final value of a run plus the global variables as they stood when it ended. */
public final class RunResult {
    private final Value value;
    private final Map<String, Value> variables;

    RunResult(Value value, Map<String, Value> variables) {
        this.value = value;
        this.variables = variables;
    }

    public Value getValue() {
        return value;
    }

    /** Immutable, in definition order. */
    public Map<String, Value> getVariables() {
        return variables;
    }

    public Value getVariable(String name) {
        return variables.get(name);
    }
}

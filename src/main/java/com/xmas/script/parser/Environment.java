package com.xmas.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Global state of one interpreter run: a single flat variable map, the function
 * table, the input grid and the return slots.
 *
 * <p>There is no lexical nesting. Function parameters, loop variables and the
 * pipe temporary are overlaid on the global map with {@link #shadow} and put back
 * with {@link #restore}. Blocks, calls and loops scope only the return slots, via
 * {@link #openReturnScope} / {@link #closeReturnScope}.
 */
public class Environment {

    private final Map<String, Value> variables = new LinkedHashMap<>();
    private final Map<String, UserFunction> functions = new HashMap<>();
    private Value input = Value.matrix(Collections.<List<Value>>emptyList());

    // null while unset
    private Value returnValue;
    private Map<String, Value> namedReturns = new HashMap<>();

    // -------------------------
    // Variables
    // -------------------------

    /** @return the value, or null if the variable is not defined */
    public Value get(String name) {
        return variables.get(name);
    }

    public void assign(String name, Value value) {
        variables.put(name, value);
    }

    /** Immutable copy of the global variables, in definition order. */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    /** Previous values of the names a {@link #shadow} call overwrote. */
    public static final class Shadow {
        private final List<String> names = new ArrayList<>();
        private final List<Value> previous = new ArrayList<>();

        private Shadow() {}
    }

    public Shadow shadow(String name, Value value) {
        return shadow(Collections.singletonList(name), Collections.singletonList(value));
    }

    public Shadow shadow(List<String> names, List<Value> values) {
        Shadow shadow = new Shadow();
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            shadow.names.add(name);
            shadow.previous.add(variables.get(name));
            variables.put(name, values.get(i));
        }
        return shadow;
    }

    /** Undoes a {@link #shadow}: prior values come back, names that had none are removed. */
    public void restore(Shadow shadow) {
        for (int i = shadow.names.size() - 1; i >= 0; i--) {
            String name = shadow.names.get(i);
            Value old = shadow.previous.get(i);
            if (old == null) variables.remove(name);
            else variables.put(name, old);
        }
    }

    // -------------------------
    // Functions
    // -------------------------

    public void defineFunction(UserFunction function) {
        functions.put(function.name, function);
    }

    public UserFunction getFunction(String name) {
        return functions.get(name);
    }

    // -------------------------
    // Input grid
    // -------------------------

    public Value getInput() {
        return input;
    }

    public void setInput(Value grid) {
        this.input = grid;
    }

    // -------------------------
    // Return slots
    // -------------------------

    public Value getReturnValue() {
        return returnValue;
    }

    public void setReturnValue(Value value) {
        this.returnValue = value;
    }

    public Value getNamedReturn(String name) {
        return namedReturns.get(name);
    }

    public void setNamedReturn(String name, Value value) {
        namedReturns.put(name, value);
    }

    /** Saved return slots of the enclosing scope. */
    public static final class ReturnScope {
        private final Value returnValue;
        private final Map<String, Value> namedReturns;

        private ReturnScope(Value returnValue, Map<String, Value> namedReturns) {
            this.returnValue = returnValue;
            this.namedReturns = namedReturns;
        }
    }

    /**
     * Saves both return slots, then starts a fresh scope whose unnamed slot holds
     * {@code seed} (null for unset) and whose named slots are empty.
     */
    public ReturnScope openReturnScope(Value seed) {
        ReturnScope saved = new ReturnScope(returnValue, namedReturns);
        returnValue = seed;
        namedReturns = new HashMap<>();
        return saved;
    }

    public void closeReturnScope(ReturnScope saved) {
        returnValue = saved.returnValue;
        namedReturns = saved.namedReturns;
    }
}

package com.xmas.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Runtime value. Instances are immutable, so sharing one between variables has
 * the same observable effect as copying it.
 *
 * <p>Equality is structural and exact on the variant: {@code number(1)} is not
 * equal to {@code bool(true)} even though arithmetic treats them alike.
 */
public class Value {
    public enum Type { NUMBER, BOOL, STRING, ARRAY, MATRIX }

    private static final Value EMPTY_ARRAY = new Value(Type.ARRAY, Collections.<Value>emptyList());

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value number(long n) { return new Value(Type.NUMBER, n); }
    public static Value bool(boolean b) { return new Value(Type.BOOL, b); }
    public static Value string(String s) { return new Value(Type.STRING, Objects.requireNonNull(s)); }

    public static Value array(List<Value> a) {
        return new Value(Type.ARRAY, Collections.unmodifiableList(new ArrayList<>(a)));
    }

    public static Value matrix(List<List<Value>> m) {
        List<List<Value>> rows = new ArrayList<>(m.size());
        for (List<Value> row : m) {
            rows.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        return new Value(Type.MATRIX, Collections.unmodifiableList(rows));
    }

    public static Value emptyArray() { return EMPTY_ARRAY; }

    public Type getType() { return type; }

    public long asNumber() {
        if (type != Type.NUMBER) throw new XmasRuntimeException("Expected number, got " + type);
        return (Long) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new XmasRuntimeException("Expected bool, got " + type);
        return (Boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new XmasRuntimeException("Expected string, got " + type);
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asArray() {
        if (type != Type.ARRAY) throw new XmasRuntimeException("Expected array, got " + type);
        return (List<Value>) value;
    }

    @SuppressWarnings("unchecked")
    public List<List<Value>> asMatrix() {
        if (type != Type.MATRIX) throw new XmasRuntimeException("Expected matrix, got " + type);
        return (List<List<Value>>) value;
    }

    public boolean isEmptyArray() {
        return type == Type.ARRAY && asArray().isEmpty();
    }

    /** Nonzero number, true, non-empty string or non-empty array. */
    public boolean isTruthy() {
        switch (type) {
            case NUMBER: return asNumber() != 0;
            case BOOL: return asBool();
            case STRING: return !asString().isEmpty();
            case ARRAY: return !asArray().isEmpty();
            case MATRIX: return !asMatrix().isEmpty();
            default: return false;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        return type == other.type && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + value.hashCode();
    }

    /**
     * Display form: numbers in decimal, strings verbatim, arrays as
     * {@code [a, b]} (recursively).
     */
    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
            case BOOL:
                return String.valueOf(value);
            case STRING:
                return asString();
            case ARRAY:
                return join(asArray(), false);
            case MATRIX: {
                List<String> rows = new ArrayList<>();
                for (List<Value> row : asMatrix()) rows.add(join(row, false));
                return "[" + String.join(", ", rows) + "]";
            }
            default:
                return String.valueOf(value);
        }
    }

    /**
     * Trace form: strings are quoted, and a non-empty array holding only
     * one-character strings is shown as a single quoted string.
     */
    public String toDebugString() {
        switch (type) {
            case STRING:
                return "\"" + asString() + "\"";
            case ARRAY: {
                List<Value> items = asArray();
                String chars = charRun(items);
                if (chars != null) return "\"" + chars + "\"";
                return join(items, true);
            }
            case MATRIX: {
                List<String> rows = new ArrayList<>();
                for (List<Value> row : asMatrix()) rows.add(join(row, true));
                return "[" + String.join(", ", rows) + "]";
            }
            default:
                return toString();
        }
    }

    private static String charRun(List<Value> items) {
        if (items.isEmpty()) return null;
        StringBuilder sb = new StringBuilder();
        for (Value v : items) {
            if (v.type != Type.STRING || v.asString().codePointCount(0, v.asString().length()) != 1) {
                return null;
            }
            sb.append(v.asString());
        }
        return sb.toString();
    }

    private static String join(List<Value> items, boolean debug) {
        List<String> parts = new ArrayList<>(items.size());
        for (Value v : items) parts.add(debug ? v.toDebugString() : v.toString());
        return "[" + String.join(", ", parts) + "]";
    }
}

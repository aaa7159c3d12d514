package com.rlang.script.parser;

import java.math.BigDecimal;

public class Value {
    public enum Type { NUMBER, STRING, BOOL, NIL, FUNC }

    private static final Value NIL = new Value(Type.NIL, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value string(String s) {
        if (s == null) throw new IllegalArgumentException("string value must not be null");
        return new Value(Type.STRING, s);
    }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value nil() { return NIL; }
    public static Value function(Callable fn) {
        if (fn == null) throw new IllegalArgumentException("function value must not be null");
        return new Value(Type.FUNC, fn);
    }

    public Type getType() { return type; }

    public boolean isNil() { return type == Type.NIL; }

    public double asNumber() {
        if (type != Type.NUMBER) throw new IllegalStateException("Expected number, got " + type);
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected bool, got " + type);
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected string, got " + type);
        return (String) value;
    }

    public Callable asFunction() {
        if (type != Type.FUNC) throw new IllegalStateException("Expected function, got " + type);
        return (Callable) value;
    }

    /** Text written by {@code print}: strings unquoted, integral numbers without a fraction. */
    public String display() {
        switch (type) {
            case NUMBER: return formatNumber(asNumber());
            case STRING: return asString();
            case BOOL:   return Boolean.toString(asBool());
            case FUNC:   return asFunction().toString();
            default:     return "nil";
        }
    }

    static String formatNumber(double d) {
        if (Double.isNaN(d)) return "NaN";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == Math.rint(d) && Math.abs(d) < 1e15) return Long.toString((long) d);
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    /** Debug form; strings are quoted so they can be told apart from other values. */
    @Override
    public String toString() {
        if (type == Type.STRING) return '"' + asString() + '"';
        return display();
    }
}

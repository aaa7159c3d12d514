package com.rlang.script.parser;

import java.util.List;

import com.rlang.script.RlangScript.BuiltinFunction;

/** Host-provided function exposed to scripts as a FUNC value. */
public final class NativeFunction implements Callable {
    private final String name;
    private final int arity;
    private final BuiltinFunction fn;

    public NativeFunction(String name, int arity, BuiltinFunction fn) {
        if (arity < 0) throw new IllegalArgumentException("arity must be >= 0: " + arity);
        this.name = name;
        this.arity = arity;
        this.fn = fn;
    }

    @Override
    public int arity() { return arity; }

    @Override
    public String name() { return name; }

    @Override
    public Value call(Interpreter interpreter, List<Value> args) {
        Value out = fn.call(args);
        return (out == null) ? Value.nil() : out;
    }

    @Override
    public String toString() {
        return "<native fn " + name + ">";
    }
}

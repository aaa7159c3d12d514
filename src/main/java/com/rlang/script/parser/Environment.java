package com.rlang.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One scope: a mutable name to value mapping plus an optional enclosing scope.
 *
 * Environments are shared by reference. The interpreter's current scope,
 * every function value that captured it and every child scope may point at
 * the same instance, and a write through any of them is seen by all.
 * An environment lives as long as its longest holder.
 */
public class Environment {

    public final Environment parent;

    private final Map<String, Value> values = new LinkedHashMap<>();

    /** Root scope. Only the engine creates these, one per run. */
    public Environment() {
        this.parent = null;
    }

    private Environment(Environment parent) {
        this.parent = parent;
    }

    public static Environment childOf(Environment parent) {
        if (parent == null) throw new IllegalArgumentException("parent must not be null");
        return new Environment(parent);
    }

    // -------------------------
    // Vars API
    // -------------------------

    /** Binds in this scope only. Redefinition overwrites. */
    public void define(String name, Value value) {
        requireValue(name, value);
        values.put(name, value);
    }

    public Value get(String name) {
        Environment owner = resolve(name);
        if (owner == null) throw EvalError.undefinedVariable(name);
        return owner.values.get(name);
    }

    /** Overwrites the nearest existing binding; never creates one. */
    public void assign(String name, Value value) {
        requireValue(name, value);
        Environment owner = resolve(name);
        if (owner == null) throw EvalError.undefinedVariable(name);
        owner.values.put(name, value);
    }

    public boolean exists(String name) {
        return resolve(name) != null;
    }

    public boolean existsInCurrentScope(String name) {
        return values.containsKey(name);
    }

    private static void requireValue(String name, Value value) {
        if (value == null) throw new IllegalArgumentException("value for '" + name + "' must not be null; use Value.nil()");
    }

    // -------------------------
    // Resolution
    // -------------------------

    /** Nearest scope, starting from this one, that binds {@code name}; null if none does. */
    public Environment resolve(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.values.containsKey(name)) return e;
        }
        return null;
    }

    /** Hops from this scope to the one binding {@code name}, or -1. */
    public int distanceTo(String name) {
        int hops = 0;
        for (Environment e = this; e != null; e = e.parent) {
            if (e.values.containsKey(name)) return hops;
            hops++;
        }
        return -1;
    }

    // -------------------------
    // Introspection
    // -------------------------

    /** Number of enclosing scopes; 0 for a root. */
    public int depth() {
        int d = 0;
        for (Environment e = parent; e != null; e = e.parent) d++;
        return d;
    }

    public Environment root() {
        Environment e = this;
        while (e.parent != null) e = e.parent;
        return e;
    }

    /** Read-only live view of this scope's own bindings, in definition order. */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(values);
    }
}

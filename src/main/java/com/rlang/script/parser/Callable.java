package com.rlang.script.parser;

import java.util.List;

/** Payload of a FUNC value. */
public interface Callable {
    /** Number of arguments the function takes. */
    int arity();

    String name();

    Value call(Interpreter interpreter, List<Value> args);
}

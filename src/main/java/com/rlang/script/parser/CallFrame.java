package com.rlang.script.parser;

/** One active call: the callee's name and the line of the call site. */
public class CallFrame {
    private final String functionName;
    private final int line;

    CallFrame(String functionName, int line) {
        this.functionName = functionName;
        this.line = line;
    }

    public String functionName() { return functionName; }

    public int line() { return line; }

    @Override
    public String toString() {
        return functionName + " (line " + line + ")";
    }
}

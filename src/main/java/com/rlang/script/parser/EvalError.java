package com.rlang.script.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Fatal evaluation error. Aborts the current run; the host process carries on.
 */
public class EvalError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public enum Kind {
        UNDEFINED_VARIABLE,
        NOT_CALLABLE,
        ARITY_MISMATCH,
        TYPE_MISMATCH,
        CALL_DEPTH_EXCEEDED
    }

    private final Kind kind;
    private final List<String> details;
    private int line;
    private final List<CallFrame> callTrace = new ArrayList<>();

    private EvalError(Kind kind, List<String> details, String message) {
        super(message);
        this.kind = kind;
        this.details = List.copyOf(details);
    }

    public static EvalError undefinedVariable(String name) {
        return new EvalError(Kind.UNDEFINED_VARIABLE, List.of(name), "Undefined variable '" + name + "'");
    }

    public static EvalError notCallable(Value value) {
        return new EvalError(Kind.NOT_CALLABLE, List.of(value.getType().name()),
                "Can only call functions, got " + value.getType() + " " + value);
    }

    public static EvalError arityMismatch(String fnName, int expected, int got) {
        return new EvalError(Kind.ARITY_MISMATCH, List.of(String.valueOf(expected), String.valueOf(got)),
                fnName + "() expects " + expected + " arguments, got " + got);
    }

    public static EvalError typeMismatch(String operator, Value... operands) {
        List<String> kinds = Arrays.stream(operands)
                .map(v -> v.getType().name())
                .collect(Collectors.toList());
        return new EvalError(Kind.TYPE_MISMATCH, prepend(operator, kinds),
                "Operator '" + operator + "' not supported for " + String.join(", ", kinds));
    }

    public static EvalError callDepthExceeded(int limit) {
        return new EvalError(Kind.CALL_DEPTH_EXCEEDED, List.of(String.valueOf(limit)),
                "Max call depth exceeded (" + limit + ")");
    }

    private static List<String> prepend(String head, List<String> tail) {
        List<String> out = new ArrayList<>(tail.size() + 1);
        out.add(head);
        out.addAll(tail);
        return out;
    }

    public Kind kind() { return kind; }

    /**
     * Kind-specific data: the name for UNDEFINED_VARIABLE, the value type for
     * NOT_CALLABLE, expected/got for ARITY_MISMATCH, operator then operand
     * types for TYPE_MISMATCH, the limit for CALL_DEPTH_EXCEEDED.
     */
    public List<String> details() { return details; }

    /** Source line, or 0 when unknown (hand-built ASTs). */
    public int line() { return line; }

    /** Records the innermost known line; later calls do not override it. */
    EvalError atLine(int line) {
        if (this.line == 0) this.line = line;
        return this;
    }

    /** Calls active when the error was raised, innermost first. Empty at top level. */
    public List<CallFrame> callTrace() { return Collections.unmodifiableList(callTrace); }

    EvalError unwindingThrough(CallFrame frame) {
        callTrace.add(frame);
        return this;
    }

    @Override
    public String getMessage() {
        String msg = super.getMessage();
        return (line > 0) ? "[line " + line + "] " + msg : msg;
    }
}

package com.rlang.script.parser;

/** Outcome of a run: either success or the first evaluation error. */
public class RunResult {
    private static final RunResult OK = new RunResult(null);

    private final EvalError error;

    private RunResult(EvalError error) {
        this.error = error;
    }

    public static RunResult ok() { return OK; }

    public static RunResult failed(EvalError error) {
        if (error == null) throw new IllegalArgumentException("error must not be null");
        return new RunResult(error);
    }

    public boolean isOk() { return error == null; }

    /** The error that stopped the run, or null. */
    public EvalError error() { return error; }

    /** Rethrows the error, if any. */
    public void orThrow() {
        if (error != null) throw error;
    }

    @Override
    public String toString() {
        return isOk() ? "RunResult[ok]" : "RunResult[" + error.kind() + ": " + error.getMessage() + "]";
    }
}

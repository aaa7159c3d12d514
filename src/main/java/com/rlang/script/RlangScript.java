package com.rlang.script;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.rlang.debug.Debug;
import com.rlang.script.parser.Environment;
import com.rlang.script.parser.Interpreter;
import com.rlang.script.parser.Lexer;
import com.rlang.script.parser.NativeFunction;
import com.rlang.script.parser.OutputSink;
import com.rlang.script.parser.Parser;
import com.rlang.script.parser.RunResult;
import com.rlang.script.parser.Statement.Stmt;
import com.rlang.script.parser.Token;
import com.rlang.script.parser.Value;

/**
 * rlang engine.
 *
 * - Lox-like syntax (var / fn / print / if / else / while / for / and / or)
 * - Types: number (double), string, bool, nil, function
 * - Functions are first-class and close over the scope they were defined in
 * - Built-ins: clock(), plus anything registered via registerFunction
 *
 * Each run owns its environment tree; nothing is shared between runs unless
 * the host passes the same global Environment in again (REPL style).
 */
public class RlangScript {
    private static final String TAG = "rlang.engine";

    /** Functional interface for built-in functions. */
    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    private final Map<String, NativeFunction> natives = new LinkedHashMap<>();
    private int maxCallDepth = Interpreter.DEFAULT_MAX_DEPTH;
    private OutputSink output = System.out::println;

    public RlangScript() {
        registerCoreBuiltins();
    }

    private void registerCoreBuiltins() {
        registerFunction("clock", 0, args -> Value.number(System.currentTimeMillis() / 1000.0));
    }

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("max call depth must be >= 1: " + depth);
        this.maxCallDepth = depth;
    }

    public void setOutput(OutputSink output) {
        this.output = (output == null) ? System.out::println : output;
    }

    public void registerFunction(String name, int arity, BuiltinFunction fn) {
        if (name == null || name.trim().isEmpty()) throw new IllegalArgumentException("name must not be empty");
        if (fn == null) throw new IllegalArgumentException("fn must not be null");
        natives.put(name, new NativeFunction(name, arity, fn));
    }

    /** Root scope with the built-ins bound. A new one per independent program. */
    public Environment createGlobalEnvironment() {
        Environment globals = new Environment();
        for (NativeFunction fn : natives.values()) {
            globals.define(fn.name(), Value.function(fn));
        }
        return globals;
    }

    /** Lex and parse; throws {@link com.rlang.script.parser.ParseError}. */
    public List<Stmt> parse(String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        List<Token> tokens = new Lexer(source).tokenize();
        return new Parser(tokens).parse();
    }

    /** Runs {@code source} in a fresh global Environment. */
    public RunResult run(String source) {
        return run(source, createGlobalEnvironment());
    }

    /** Runs {@code source} in {@code globals}; bindings it makes stay there. */
    public RunResult run(String source, Environment globals) {
        return run(parse(source), globals);
    }

    public RunResult run(List<Stmt> program, Environment globals) {
        Debug.get().d(TAG, "run: " + program.size() + " statements");
        RunResult result = new Interpreter(output, maxCallDepth).run(program, globals);
        if (!result.isOk()) {
            Debug.get().w(TAG, "evaluation error " + result.error().kind() + ": " + result.error().getMessage());
        }
        return result;
    }
}

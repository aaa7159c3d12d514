package com.rlang.script.parser;

import java.util.List;

import com.rlang.script.parser.Interpreter.ReturnSignal;
import com.rlang.script.parser.Statement.Stmt;

/**
 * A script-defined function: the definition's parameters and body, shared
 * read-only with the AST, paired with the Environment that was current when
 * the definition was evaluated.
 */
public final class UserFunction implements Callable {
    static final String ANONYMOUS = "anonymous";

    private final String name;
    final List<Token> params;
    final List<Stmt> body;
    final Environment closure;

    UserFunction(String name, List<Token> params, List<Stmt> body, Environment closure) {
        this.name = name;
        this.params = params;
        this.body = body;
        this.closure = closure;
    }

    @Override
    public int arity() { return params.size(); }

    @Override
    public String name() { return name; }

    public Environment closure() { return closure; }

    @Override
    public Value call(Interpreter interpreter, List<Value> args) {
        // New call frame is a child of the closure (lexical scoping),
        // not a child of the caller's environment.
        Environment frame = Environment.childOf(closure);
        for (int i = 0; i < params.size(); i++) {
            frame.define(params.get(i).lexeme, args.get(i));
        }

        try {
            interpreter.executeBody(body, frame);
        } catch (ReturnSignal rs) {
            return rs.value;
        }
        return Value.nil();
    }

    @Override
    public String toString() {
        return "<fn " + name + ">";
    }
}

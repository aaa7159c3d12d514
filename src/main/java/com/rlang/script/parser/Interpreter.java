package com.rlang.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.rlang.debug.Debug;
import com.rlang.script.parser.Expr.Assign;
import com.rlang.script.parser.Expr.Binary;
import com.rlang.script.parser.Expr.Call;
import com.rlang.script.parser.Expr.ExprVisitor;
import com.rlang.script.parser.Expr.Grouping;
import com.rlang.script.parser.Expr.Literal;
import com.rlang.script.parser.Expr.Logical;
import com.rlang.script.parser.Expr.Unary;
import com.rlang.script.parser.Expr.Variable;
import com.rlang.script.parser.Statement.Block;
import com.rlang.script.parser.Statement.ExprStmt;
import com.rlang.script.parser.Statement.FunctionStmt;
import com.rlang.script.parser.Statement.If;
import com.rlang.script.parser.Statement.PrintStmt;
import com.rlang.script.parser.Statement.ReturnStmt;
import com.rlang.script.parser.Statement.Stmt;
import com.rlang.script.parser.Statement.StmtVisitor;
import com.rlang.script.parser.Statement.VarStmt;
import com.rlang.script.parser.Statement.While;

/**
 * Tree-walking evaluator. Holds only the current Environment and the active
 * call frames; one instance serves one thread of evaluation.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor {
    private static final String TAG = "rlang.interpreter";

    public static final int DEFAULT_MAX_DEPTH = 256;

    Environment env;
    private final OutputSink output;
    private final Deque<CallFrame> callStack = new ArrayDeque<CallFrame>();
    private final int maxDepth;

    public Interpreter(OutputSink output, int maxDepth) {
        if (output == null) throw new IllegalArgumentException("output must not be null");
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1: " + maxDepth);
        this.output = output;
        this.maxDepth = maxDepth;
    }

    public Interpreter(OutputSink output) {
        this(output, DEFAULT_MAX_DEPTH);
    }

    /**
     * Executes {@code program} in {@code globals} until it completes or the first
     * evaluation error. A top-level {@code return} ends the run normally.
     */
    public RunResult run(List<Stmt> program, Environment globals) {
        if (globals == null) throw new IllegalArgumentException("globals must not be null");
        Environment previous = env;
        env = globals;
        try {
            for (Stmt stmt : program) stmt.accept(this);
            return RunResult.ok();
        } catch (ReturnSignal rs) {
            return RunResult.ok();
        } catch (EvalError e) {
            Debug.get().d(TAG, "run aborted: " + e.getMessage());
            return RunResult.failed(e);
        } finally {
            env = previous;
        }
    }

    /** Runs {@code body} with {@code scope} as the current Environment, restoring the caller's afterwards. */
    void executeBody(List<Stmt> body, Environment scope) {
        Environment previous = env;
        env = scope;
        try {
            for (Stmt s : body) s.accept(this);
        } finally {
            env = previous;
        }
    }

    // -------------------------
    // Statements
    // -------------------------

    public void visitExprStmt(ExprStmt stmt) { eval(stmt.expression); }

    public void visitPrintStmt(PrintStmt stmt) {
        Value value = eval(stmt.expression);
        output.println(stringify(value));
    }

    public void visitVarStmt(VarStmt stmt) {
        Value value = (stmt.initializer == null) ? Value.nil() : eval(stmt.initializer);
        env.define(stmt.name.lexeme, value);
    }

    public void visitBlockStmt(Block stmt) {
        executeBody(stmt.statements, Environment.childOf(env));
    }

    public void visitIfStmt(If stmt) {
        Value cond = eval(stmt.condition);
        if (isTruthy(cond)) stmt.thenBranch.accept(this);
        else if (stmt.elseBranch != null) stmt.elseBranch.accept(this);
    }

    public void visitWhileStmt(While stmt) {
        while (isTruthy(eval(stmt.condition))) {
            stmt.body.accept(this);
        }
    }

    public void visitFunctionStmt(FunctionStmt stmt) {
        // Captures the scope active right now, then binds itself there so the body can recurse.
        String name = stmt.name.lexeme;
        env.define(name, Value.function(new UserFunction(name, stmt.params, stmt.body, env)));
    }

    public void visitReturnStmt(ReturnStmt stmt) {
        throw new ReturnSignal(stmt.value == null ? Value.nil() : eval(stmt.value));
    }

    // -------------------------
    // Expressions
    // -------------------------

    public Value eval(Expr.ExprInterface expr) { return expr.accept(this); }

    public Value visitLiteralExpr(Literal expr) {
        if (expr.value == null) return Value.nil();
        if (expr.value instanceof Boolean) return Value.bool((Boolean) expr.value);
        if (expr.value instanceof Double) return Value.number((Double) expr.value);
        if (expr.value instanceof Number) return Value.number(((Number) expr.value).doubleValue());
        if (expr.value instanceof String) return Value.string((String) expr.value);
        throw new IllegalArgumentException("Unsupported literal value: " + expr.value);
    }

    public Value visitVariableExpr(Variable expr) {
        try {
            return env.get(expr.name.lexeme);
        } catch (EvalError e) {
            throw e.atLine(expr.name.line);
        }
    }

    public Value visitAssignExpr(Assign expr) {
        Value value = eval(expr.value);
        try {
            env.assign(expr.name.lexeme, value);
        } catch (EvalError e) {
            throw e.atLine(expr.name.line);
        }
        return value;
    }

    public Value visitGroupingExpr(Grouping expr) {
        return eval(expr.expression);
    }

    public Value visitFunctionExpr(Expr.Function expr) {
        return Value.function(new UserFunction(UserFunction.ANONYMOUS, expr.params, expr.body, env));
    }

    public Value visitLogicalExpr(Logical expr) {
        Value left = eval(expr.left);
        if (expr.operator.type == TokenType.OR) {
            if (isTruthy(left, expr.operator)) return left;
        } else {
            if (!isTruthy(left, expr.operator)) return left;
        }
        return eval(expr.right);
    }

    public Value visitUnaryExpr(Unary expr) {
        Value right = eval(expr.right);
        switch (expr.operator.type) {
            case BANG:
                return Value.bool(!isTruthy(right, expr.operator));
            case MINUS:
                if (right.getType() != Value.Type.NUMBER) {
                    throw EvalError.typeMismatch(expr.operator.lexeme, right).atLine(expr.operator.line);
                }
                return Value.number(-right.asNumber());
            default:
                throw new IllegalStateException("Unsupported unary operator: " + expr.operator.type);
        }
    }

    public Value visitBinaryExpr(Binary expr) {
        Value left = eval(expr.left);
        Value right = eval(expr.right);
        Token op = expr.operator;

        switch (op.type) {
            case PLUS:
                if (left.getType() == Value.Type.NUMBER && right.getType() == Value.Type.NUMBER) {
                    return Value.number(left.asNumber() + right.asNumber());
                }
                // string + string, string + number
                if (left.getType() == Value.Type.STRING
                        && (right.getType() == Value.Type.STRING || right.getType() == Value.Type.NUMBER)) {
                    return Value.string(left.asString() + right.display());
                }
                throw EvalError.typeMismatch(op.lexeme, left, right).atLine(op.line);
            case MINUS:
                requireNumber(left, right, op);
                return Value.number(left.asNumber() - right.asNumber());
            case STAR:
                requireNumber(left, right, op);
                return Value.number(left.asNumber() * right.asNumber());
            case SLASH:
                requireNumber(left, right, op);
                return Value.number(left.asNumber() / right.asNumber());
            case PERCENT:
                requireNumber(left, right, op);
                return Value.number(left.asNumber() % right.asNumber());

            case GREATER:
            case GREATER_EQUAL:
            case LESS:
            case LESS_EQUAL:
                return Value.bool(compare(left, right, op));

            case EQUAL_EQUAL: return Value.bool(isEqual(left, right));
            case BANG_EQUAL:  return Value.bool(!isEqual(left, right));

            default:
                throw new IllegalStateException("Unsupported binary operator: " + op.type);
        }
    }

    public Value visitCallExpr(Call expr) {
        Value callee = eval(expr.callee);
        int line = expr.paren.line;

        if (callee.getType() != Value.Type.FUNC) {
            throw EvalError.notCallable(callee).atLine(line);
        }
        Callable fn = callee.asFunction();
        if (expr.arguments.size() != fn.arity()) {
            throw EvalError.arityMismatch(fn.name(), fn.arity(), expr.arguments.size()).atLine(line);
        }

        // Arguments are evaluated in the caller's scope, left to right.
        List<Value> args = new ArrayList<Value>(expr.arguments.size());
        for (Expr.ExprInterface a : expr.arguments) args.add(eval(a));

        if (callStack.size() >= maxDepth) throw EvalError.callDepthExceeded(maxDepth).atLine(line);

        CallFrame frame = new CallFrame(fn.name(), line);
        callStack.push(frame);
        Debug.get().t(TAG, "call " + frame + " depth=" + callStack.size());
        try {
            return fn.call(this, args);
        } catch (EvalError e) {
            throw e.unwindingThrough(frame);
        } finally {
            callStack.pop();
        }
    }

    // -------------------------
    // Helpers
    // -------------------------

    /** Truthiness for conditions. A function is not a condition. */
    public boolean isTruthy(Value v) {
        switch (v.getType()) {
            case NIL: return false;
            case BOOL: return v.asBool();
            case NUMBER: return v.asNumber() != 0.0;
            case STRING: return !v.asString().isEmpty();
            default: throw EvalError.typeMismatch("condition", v);
        }
    }

    private boolean isTruthy(Value v, Token at) {
        try {
            return isTruthy(v);
        } catch (EvalError e) {
            throw e.atLine(at.line);
        }
    }

    public boolean isEqual(Value a, Value b) {
        if (a.getType() != b.getType()) return false;
        switch (a.getType()) {
            case NIL: return true;
            case NUMBER: return a.asNumber() == b.asNumber();
            case BOOL: return a.asBool() == b.asBool();
            case STRING: return a.asString().equals(b.asString());
            case FUNC: return a.asFunction() == b.asFunction();
            default: return false;
        }
    }

    public void requireNumber(Value a, Value b, Token op) {
        if (a.getType() != Value.Type.NUMBER || b.getType() != Value.Type.NUMBER) {
            throw EvalError.typeMismatch(op.lexeme, a, b).atLine(op.line);
        }
    }

    private boolean compare(Value a, Value b, Token op) {
        if (a.getType() == Value.Type.NUMBER && b.getType() == Value.Type.NUMBER) {
            double x = a.asNumber();
            double y = b.asNumber();
            switch (op.type) {
                case GREATER: return x > y;
                case GREATER_EQUAL: return x >= y;
                case LESS: return x < y;
                default: return x <= y;
            }
        }
        if (a.getType() == Value.Type.STRING && b.getType() == Value.Type.STRING) {
            int c = a.asString().compareTo(b.asString());
            switch (op.type) {
                case GREATER: return c > 0;
                case GREATER_EQUAL: return c >= 0;
                case LESS: return c < 0;
                default: return c <= 0;
            }
        }
        throw EvalError.typeMismatch(op.lexeme, a, b).atLine(op.line);
    }

    public String stringify(Value v) {
        return v.display();
    }

    public static final class ReturnSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;
        final Value value;
        ReturnSignal(Value value) { super(null, null, false, false); this.value = value; }
    }
}

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.rlang.script.RlangScript;
import com.rlang.script.parser.Environment;
import com.rlang.script.parser.EvalError;
import com.rlang.script.parser.Expr;
import com.rlang.script.parser.Interpreter;
import com.rlang.script.parser.RunResult;
import com.rlang.script.parser.Statement;
import com.rlang.script.parser.Statement.Stmt;
import com.rlang.script.parser.Token;
import com.rlang.script.parser.TokenType;
import com.rlang.script.parser.UserFunction;
import com.rlang.script.parser.Value;

/**
 * Drives the interpreter with hand-built trees, the way a host that has its
 * own front end would.
 */
public class InterpreterAstTest {

    private final List<String> out = new ArrayList<>();

    private static Expr.ExprInterface num(double d) { return new Expr.Literal(d); }
    private static Expr.ExprInterface var(String name) { return new Expr.Variable(Token.identifier(name)); }
    private static Expr.ExprInterface call(String name) {
        return new Expr.Call(var(name), Token.of(TokenType.RIGHT_PAREN, ")"), List.of());
    }

    /** fn make_counter() { var i = 0; fn count() { i = i + 1; return i; } return count; } */
    private static Stmt makeCounter() {
        Expr.ExprInterface inc = new Expr.Binary(var("i"), Token.of(TokenType.PLUS, "+"), num(1));
        Stmt count = new Statement.FunctionStmt(Token.identifier("count"), List.of(), List.of(
                new Statement.ExprStmt(new Expr.Assign(Token.identifier("i"), inc)),
                new Statement.ReturnStmt(Token.of(TokenType.RETURN, "return"), var("i"))));
        return new Statement.FunctionStmt(Token.identifier("make_counter"), List.of(), List.of(
                new Statement.VarStmt(Token.identifier("i"), num(0)),
                count,
                new Statement.ReturnStmt(Token.of(TokenType.RETURN, "return"), var("count"))));
    }

    @Test
    void handBuiltCounters_keepIndependentState() {
        Environment globals = new RlangScript().createGlobalEnvironment();
        List<Stmt> program = List.of(
                makeCounter(),
                new Statement.VarStmt(Token.identifier("c1"), call("make_counter")),
                new Statement.VarStmt(Token.identifier("c2"), call("make_counter")),
                new Statement.PrintStmt(call("c1")),
                new Statement.PrintStmt(call("c2")),
                new Statement.PrintStmt(call("c1")),
                new Statement.PrintStmt(call("c2")));

        RunResult rr = new Interpreter(out::add).run(program, globals);

        assertTrue(rr.isOk(), rr::toString);
        assertEquals(List.of("1", "1", "2", "2"), out);
    }

    @Test
    void closureEnvironment_isTheDefiningCallFrame() {
        Environment globals = new Environment();
        List<Stmt> program = List.of(
                makeCounter(),
                new Statement.VarStmt(Token.identifier("c1"), call("make_counter")),
                new Statement.VarStmt(Token.identifier("c2"), call("make_counter")),
                new Statement.ExprStmt(call("c1")));

        assertTrue(new Interpreter(out::add).run(program, globals).isOk());

        UserFunction c1 = (UserFunction) globals.get("c1").asFunction();
        UserFunction c2 = (UserFunction) globals.get("c2").asFunction();
        UserFunction maker = (UserFunction) globals.get("make_counter").asFunction();

        assertNotSame(c1.closure(), c2.closure(), "each call must get its own frame");
        assertSame(globals, maker.closure());
        assertSame(globals, c1.closure().parent, "frames are parented to the callee's closure");
        assertEquals(1.0, c1.closure().get("i").asNumber());
        assertEquals(0.0, c2.closure().get("i").asNumber());
        assertTrue(c1.closure().existsInCurrentScope("count"));
    }

    @Test
    void topLevelReturn_endsTheRunNormally() {
        List<Stmt> program = List.of(
                new Statement.PrintStmt(num(1)),
                new Statement.ReturnStmt(Token.of(TokenType.RETURN, "return"), null),
                new Statement.PrintStmt(num(2)));

        RunResult rr = new Interpreter(out::add).run(program, new Environment());

        assertTrue(rr.isOk());
        assertEquals(List.of("1"), out);
    }

    @Test
    void functionWithoutReturn_yieldsNil() {
        List<Stmt> program = List.of(
                new Statement.FunctionStmt(Token.identifier("noop"), List.of(), List.of()),
                new Statement.PrintStmt(call("noop")));

        assertTrue(new Interpreter(out::add).run(program, new Environment()).isOk());
        assertEquals(List.of("nil"), out);
    }

    @Test
    void bindingsStayInTheGivenGlobals() {
        Environment globals = new Environment();
        Interpreter interpreter = new Interpreter(out::add);

        interpreter.run(List.of(new Statement.VarStmt(Token.identifier("x"), num(41))), globals);
        RunResult rr = interpreter.run(List.of(new Statement.PrintStmt(
                new Expr.Binary(var("x"), Token.of(TokenType.PLUS, "+"), num(1)))), globals);

        assertTrue(rr.isOk());
        assertEquals(List.of("42"), out);
        assertEquals(41.0, globals.get("x").asNumber());
    }

    @Test
    void separateGlobalEnvironments_doNotLeak() {
        Interpreter interpreter = new Interpreter(out::add);
        interpreter.run(List.of(new Statement.VarStmt(Token.identifier("x"), num(1))), new Environment());

        RunResult rr = interpreter.run(List.of(new Statement.PrintStmt(var("x"))), new Environment());

        assertEquals(EvalError.Kind.UNDEFINED_VARIABLE, rr.error().kind());
        assertEquals(0, rr.error().line(), "synthetic tokens carry no line");
    }

    @Test
    void callDepthLimitOfOne_allowsOnlyTopLevelCalls() {
        List<Stmt> program = List.of(
                new Statement.FunctionStmt(Token.identifier("leaf"), List.of(), List.of(
                        new Statement.ReturnStmt(Token.of(TokenType.RETURN, "return"), num(7)))),
                new Statement.FunctionStmt(Token.identifier("outer"), List.of(), List.of(
                        new Statement.ReturnStmt(Token.of(TokenType.RETURN, "return"), call("leaf")))),
                new Statement.PrintStmt(call("leaf")),
                new Statement.PrintStmt(call("outer")));

        RunResult rr = new Interpreter(out::add, 1).run(program, new Environment());

        assertEquals(List.of("7"), out);
        assertEquals(EvalError.Kind.CALL_DEPTH_EXCEEDED, rr.error().kind());
    }

    @Test
    void integerLiteralsAreAccepted() {
        List<Stmt> program = List.of(new Statement.PrintStmt(new Expr.Literal(3)));
        assertTrue(new Interpreter(out::add).run(program, new Environment()).isOk());
        assertEquals(List.of("3"), out);
    }

    @Test
    void nativeValuesAreFunctions() {
        Environment globals = new RlangScript().createGlobalEnvironment();
        Value clock = globals.get("clock");

        assertEquals(Value.Type.FUNC, clock.getType());
        assertEquals(0, clock.asFunction().arity());
        assertEquals("<native fn clock>", clock.display());
    }
}

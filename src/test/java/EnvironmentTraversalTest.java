import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.Test;

import com.rlang.script.parser.Environment;
import com.rlang.script.parser.EvalError;
import com.rlang.script.parser.Value;

public class EnvironmentTraversalTest {

    @Test
    void getTraversal_localThenParentChain() {
        Environment root = new Environment();
        root.define("a", Value.number(1));
        root.define("shadow", Value.number(10));

        Environment child = Environment.childOf(root);
        child.define("b", Value.number(2));
        child.define("shadow", Value.number(20)); // local shadows parent

        assertEquals(2.0, child.get("b").asNumber());
        assertEquals(1.0, child.get("a").asNumber());

        assertEquals(20.0, child.get("shadow").asNumber());
        assertEquals(10.0, root.get("shadow").asNumber());
    }

    @Test
    void assignUpdatesNearestExistingScope_notLocalCopy() {
        Environment root = new Environment();
        root.define("i", Value.number(0));

        Environment child = Environment.childOf(root);

        child.assign("i", Value.number(5));

        assertEquals(5.0, root.get("i").asNumber());
        assertEquals(5.0, child.get("i").asNumber());
        assertFalse(child.existsInCurrentScope("i"), "child should not create its own 'i' entry on assign()");
    }

    @Test
    void assignPicksNearestWhenShadowed() {
        Environment root = new Environment();
        root.define("x", Value.number(1));
        Environment mid = Environment.childOf(root);
        mid.define("x", Value.number(2));
        Environment leaf = Environment.childOf(mid);

        leaf.assign("x", Value.number(3));

        assertEquals(3.0, mid.get("x").asNumber());
        assertEquals(1.0, root.get("x").asNumber());
    }

    @Test
    void assignUndefinedThrows_andCreatesNothing() {
        Environment root = new Environment();
        Environment child = Environment.childOf(root);

        EvalError ex = assertThrows(EvalError.class, () -> child.assign("missing", Value.number(9)));
        assertEquals(EvalError.Kind.UNDEFINED_VARIABLE, ex.kind());
        assertEquals("missing", ex.details().get(0));
        assertFalse(child.exists("missing"));
        assertFalse(root.exists("missing"));
    }

    @Test
    void getUndefinedThrows() {
        Environment root = new Environment();
        EvalError ex = assertThrows(EvalError.class, () -> Environment.childOf(root).get("nope"));
        assertEquals(EvalError.Kind.UNDEFINED_VARIABLE, ex.kind());
        assertTrue(ex.getMessage().toLowerCase().contains("undefined variable"));
    }

    @Test
    void defineCreatesLocal_onlyAndDoesNotTouchParent() {
        Environment root = new Environment();
        root.define("x", Value.number(1));

        Environment child = Environment.childOf(root);
        child.define("x", Value.number(2));

        assertEquals(1.0, root.get("x").asNumber());
        assertEquals(2.0, child.get("x").asNumber());
    }

    @Test
    void redefineOverwritesInSameScope() {
        Environment root = new Environment();
        root.define("x", Value.number(1));
        root.define("x", Value.string("again"));

        assertEquals("again", root.get("x").asString());
        assertEquals(1, root.snapshot().size());
    }

    @Test
    void siblingsSeeEachOthersWritesThroughSharedParent() {
        Environment shared = new Environment();
        shared.define("n", Value.number(0));

        Environment a = Environment.childOf(shared);
        Environment b = Environment.childOf(shared);

        a.assign("n", Value.number(7));

        assertEquals(7.0, b.get("n").asNumber());
    }

    @Test
    void resolveAndDistance() {
        Environment root = new Environment();
        root.define("g", Value.bool(true));
        Environment mid = Environment.childOf(root);
        mid.define("m", Value.nil());
        Environment leaf = Environment.childOf(mid);

        assertSame(root, leaf.resolve("g"));
        assertSame(mid, leaf.resolve("m"));
        assertNull(leaf.resolve("zzz"));

        assertEquals(2, leaf.distanceTo("g"));
        assertEquals(1, leaf.distanceTo("m"));
        assertEquals(-1, leaf.distanceTo("zzz"));

        assertEquals(2, leaf.depth());
        assertEquals(0, root.depth());
        assertSame(root, leaf.root());
    }

    @Test
    void lookupHasNoDepthLimit() {
        Environment root = new Environment();
        root.define("deep", Value.number(42));

        Environment e = root;
        for (int i = 0; i < 5000; i++) e = Environment.childOf(e);

        assertEquals(42.0, e.get("deep").asNumber());
        assertEquals(5000, e.distanceTo("deep"));
    }

    @Test
    void snapshotIsReadOnlyAndOrdered() {
        Environment root = new Environment();
        root.define("b", Value.number(2));
        root.define("a", Value.number(1));

        Map<String, Value> snap = root.snapshot();
        assertEquals("[b, a]", snap.keySet().toString());
        assertThrows(UnsupportedOperationException.class, () -> snap.put("c", Value.nil()));
    }

    @Test
    void childOfNullRejected() {
        assertThrows(IllegalArgumentException.class, () -> Environment.childOf(null));
    }

    @Test
    void nullValueRejected() {
        Environment root = new Environment();
        root.define("x", Value.number(1));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> root.define("y", null));
        assertTrue(e.getMessage().contains("'y'"));
        assertThrows(IllegalArgumentException.class, () -> Environment.childOf(root).assign("x", null));

        assertFalse(root.exists("y"));
        assertEquals(1.0, root.get("x").asNumber());
    }
}

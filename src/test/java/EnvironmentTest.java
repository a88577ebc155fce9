import org.junit.jupiter.api.Test;

import com.minijs.script.parser.Environment;
import com.minijs.script.parser.ReferenceError;
import com.minijs.script.parser.Value;

import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class EnvironmentTest {

    @Test
    void get_missingNameIsReferenceError() {
        ReferenceError e = assertThrows(ReferenceError.class, () -> new Environment().get("x"));
        assertEquals("x is not defined", e.getMessage());
        assertEquals("ReferenceError", e.getErrorName());
    }

    @Test
    void lookup_walksParentChain() {
        Environment root = new Environment(Collections.singletonMap("a", Value.number(1)));
        Environment child = root.childScope(Collections.singletonMap("b", Value.number(2)));

        assertEquals(1.0, child.get("a").asNumber(), 0.0);
        assertEquals(2.0, child.get("b").asNumber(), 0.0);
        assertThrows(ReferenceError.class, () -> root.get("b"));
        assertSame(root, child.resolve("a"));
        assertSame(root, child.root());
        assertFalse(child.isRoot());
        assertTrue(child.exists("a"));
        assertFalse(child.hasOwn("a"));
    }

    @Test
    void set_writesNearestDeclaringScope() {
        Environment root = new Environment(Collections.singletonMap("a", Value.number(1)));
        Environment child = root.childScope(null);

        child.set("a", Value.number(5));
        assertEquals(5.0, root.get("a").asNumber(), 0.0);
        assertFalse(child.hasOwn("a"));
    }

    @Test
    void set_undeclaredCreatesRootBinding() {
        Environment root = new Environment();
        Environment inner = root.childScope(null).childScope(null);

        inner.set("g", Value.string("global"));
        assertTrue(root.hasOwn("g"));
        assertEquals("global", inner.get("g").asString());
    }

    @Test
    void declare_shadowsParent() {
        Environment root = new Environment(Collections.singletonMap("a", Value.number(1)));
        Environment child = root.childScope(null);

        child.declare("a", Value.number(2));
        child.set("a", Value.number(3));
        assertEquals(3.0, child.get("a").asNumber(), 0.0);
        assertEquals(1.0, root.get("a").asNumber(), 0.0);
    }

    @Test
    void nullValuesBecomeUndefined() {
        Environment env = new Environment();
        env.declare("x", null);
        env.set("y", null);
        assertTrue(env.get("x").isUndefined());
        assertTrue(env.get("y").isUndefined());
    }

    @Test
    void snapshot_isACopyOfOwnBindings() {
        Environment root = new Environment(Collections.singletonMap("a", Value.number(1)));
        Environment child = root.childScope(Collections.singletonMap("this", Value.undefined()));

        Map<String, Value> snap = child.snapshot();
        assertEquals(Collections.singleton("this"), snap.keySet());
        snap.put("z", Value.nil());
        assertFalse(child.hasOwn("z"));
        assertTrue(child.getThis().isUndefined());
    }
}

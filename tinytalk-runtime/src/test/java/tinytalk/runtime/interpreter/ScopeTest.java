package tinytalk.runtime.interpreter;

import tinytalk.runtime.TinyInt;
import tinytalk.runtime.TinyValue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 作用域链测试
 */
@DisplayName("作用域")
class ScopeTest {

    private Scope root;
    private Scope globals;

    @BeforeEach
    void setUp() {
        Map<String, TinyValue> builtins = new LinkedHashMap<String, TinyValue>();
        builtins.put("answer", TinyInt.of(42));
        root = Scope.sealedRoot(builtins);
        globals = new Scope(root);
    }

    @Test
    @DisplayName("沿父链查找")
    void testLookup() {
        Scope inner = new Scope(globals);
        globals.define("x", TinyInt.ONE);
        assertEquals(1L, inner.lookup("x").asLong());
        assertEquals(42L, inner.lookup("answer").asLong());
        assertNull(inner.lookup("missing"));
        assertNull(inner.lookupLocal("x"));
    }

    @Test
    @DisplayName("赋值更新定义所在的帧")
    void testAssignWalksChain() {
        globals.define("x", TinyInt.ONE);
        Scope inner = new Scope(globals);
        assertTrue(inner.assign("x", TinyInt.of(2)));
        assertEquals(2L, globals.lookupLocal("x").asLong());
        assertFalse(inner.assign("nope", TinyInt.ONE));
    }

    @Test
    @DisplayName("常量不可重新赋值")
    void testConstants() {
        globals.defineConstant("LIMIT", TinyInt.of(3));
        assertTrue(globals.isConstant("LIMIT"));
        assertThatThrownBy(() -> new Scope(globals).assign("LIMIT", TinyInt.ONE))
                .isInstanceOf(LanguageError.class)
                .hasMessage("Cannot reassign constant 'LIMIT'");
    }

    @Test
    @DisplayName("内建根帧封闭")
    void testSealedRoot() {
        assertTrue(root.isSealed());
        assertThatThrownBy(() -> root.define("y", TinyInt.ONE)).isInstanceOf(LanguageError.class);
        assertThatThrownBy(() -> globals.assign("answer", TinyInt.ONE))
                .hasMessage("Cannot reassign constant 'answer'");
    }

    @Test
    @DisplayName("遮蔽内建名")
    void testShadowing() {
        globals.define("answer", TinyInt.ZERO);
        assertEquals(0L, globals.lookup("answer").asLong());
        assertEquals(42L, root.lookup("answer").asLong());
    }

    @Test
    @DisplayName("收集可见名字")
    void testCollectNames() {
        globals.define("x", TinyInt.ONE);
        Scope inner = new Scope(globals);
        inner.define("y", TinyInt.ONE);
        assertThat(inner.collectNames()).containsExactly("y", "x", "answer");
        assertThat(inner.getVariables()).containsOnlyKeys("y");
        assertThatThrownBy(() -> inner.getVariables().put("z", TinyInt.ONE))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(Scope.sealedRoot(Collections.<String, TinyValue>emptyMap()).collectNames()).isEmpty();
    }
}

package com.tmlang.compiler.analysis.types;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("类型变量绑定")
class TypeVarBindingsTest {

    @Test
    @DisplayName("解析具体类型是幂等的")
    void resolveConcreteIsIdempotent() {
        TypeVarBindings bindings = new TypeVarBindings();
        TmlType concrete = Types.tuple(Types.I32, Types.array(Types.named("Maybe", Types.STR), 4));
        TmlType once = bindings.resolve(concrete);
        assertEquals(concrete, once);
        assertEquals(once, bindings.resolve(once));
    }

    @Test
    @DisplayName("沿绑定链解析到具体类型")
    void resolveChain() {
        TypeVarBindings bindings = new TypeVarBindings();
        TypeVar a = bindings.fresh();
        TypeVar b = bindings.fresh();
        assertTrue(bindings.bind(a, b));
        assertTrue(bindings.bind(b, Types.U8));
        assertEquals(Types.U8, bindings.resolve(a));
        assertEquals(Types.ref(Types.U8), bindings.resolve(Types.ref(a)));
    }

    @Test
    @DisplayName("occurs check 拒绝自引用绑定")
    void occursCheck() {
        TypeVarBindings bindings = new TypeVarBindings();
        TypeVar a = bindings.fresh();
        assertFalse(bindings.bind(a, Types.tuple(a, Types.I32)));
        assertFalse(bindings.isBound(a));
    }

    @Test
    @DisplayName("未绑定的类型变量默认化为 Unit")
    void defaultsToUnit() {
        TypeVarBindings bindings = new TypeVarBindings();
        TypeVar a = bindings.fresh();
        TmlType resolved = bindings.resolveAndDefault(Types.tuple(a, Types.I32));
        assertEquals(Types.tuple(Types.UNIT, Types.I32), resolved);
        assertFalse(Types.containsTypeVar(resolved));
    }
}

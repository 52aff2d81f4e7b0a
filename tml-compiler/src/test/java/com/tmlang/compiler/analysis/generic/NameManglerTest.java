package com.tmlang.compiler.analysis.generic;

import com.tmlang.compiler.analysis.types.DynBehaviorType;
import com.tmlang.compiler.analysis.types.ImplBehaviorType;
import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.analysis.types.Types;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("名字修饰")
class NameManglerTest {

    @Test
    @DisplayName("各类类型的修饰格式")
    void typeFormats() {
        assertEquals("I32", NameMangler.mangleType(Types.I32));
        assertEquals("Pair__I32__Str", NameMangler.mangleType(Types.named("Pair", Types.I32, Types.STR)));
        assertEquals("mutref_I64", NameMangler.mangleType(Types.mutRef(Types.I64)));
        assertEquals("ref_Str", NameMangler.mangleType(Types.ref(Types.STR)));
        assertEquals("arr_U8_4", NameMangler.mangleType(Types.array(Types.U8, 4)));
        assertEquals("tuple_I32_Bool", NameMangler.mangleType(Types.tuple(Types.I32, Types.BOOL)));
        assertEquals("tuple_empty", NameMangler.mangleType(Types.tuple()));
        assertEquals("slice_F64", NameMangler.mangleType(Types.slice(Types.F64)));
        assertEquals("Maybe__List_1_I32",
                NameMangler.mangleType(Types.named("Maybe", Types.named("List", Types.I32))));
    }

    @Test
    @DisplayName("函数实例名与缓存命中")
    void functionNames() {
        NameMangler mangler = new NameMangler(16);
        String a = mangler.mangleFuncName("swap", Arrays.<TmlType>asList(Types.I32, Types.BOOL));
        String b = mangler.mangleFuncName("swap", Arrays.<TmlType>asList(Types.I32, Types.BOOL));

        assertEquals("swap__I32__Bool", a);
        assertSame(a, b);
        assertEquals(1L, mangler.getCache().getStats().getHitCount());
        assertEquals("swap", mangler.mangleFuncName("swap", Collections.<TmlType>emptyList()));
        assertEquals("Pair__I32", mangler.mangleTypeName("Pair", Collections.<TmlType>singletonList(Types.I32)));
    }

    @Test
    @DisplayName("行为类型的实参参与修饰")
    void behaviorTypeArgs() {
        NameMangler mangler = new NameMangler(16);
        TmlType iterI32 = new DynBehaviorType("Iter", Collections.<TmlType>singletonList(Types.I32));
        TmlType iterStr = new DynBehaviorType("Iter", Collections.<TmlType>singletonList(Types.STR));

        assertEquals("f__dyn_Iter_1_I32", mangler.mangleFuncName("f", Collections.singletonList(iterI32)));
        assertEquals("f__dyn_Iter_1_Str", mangler.mangleFuncName("f", Collections.singletonList(iterStr)));
        assertEquals("dyn_Iter__I32", NameMangler.mangleType(iterI32));
        assertEquals("impl_Display", NameMangler.mangleType(
                new ImplBehaviorType("Display", Collections.<TmlType>emptyList())));
        assertEquals("impl_Into__U8", NameMangler.mangleType(
                new ImplBehaviorType("Into", Collections.<TmlType>singletonList(Types.U8))));
    }

    @Test
    @DisplayName("嵌套泛型实参与实参列表不会混淆")
    void nestedArgsAreUnambiguous() {
        NameMangler mangler = new NameMangler(16);
        String split = mangler.mangleFuncName("f",
                Arrays.<TmlType>asList(Types.named("Pair", Types.I32), Types.STR));
        String joined = mangler.mangleFuncName("f",
                Collections.<TmlType>singletonList(Types.named("Pair", Types.I32, Types.STR)));

        assertEquals("f__Pair_1_I32__Str", split);
        assertEquals("f__Pair_2_I32__Str", joined);
        assertNotEquals(split, joined);
        assertNotEquals(NameMangler.mangleType(Types.tuple(Types.tuple(Types.I32), Types.BOOL)),
                NameMangler.mangleType(Types.tuple(Types.tuple(Types.I32, Types.BOOL))));
    }
}

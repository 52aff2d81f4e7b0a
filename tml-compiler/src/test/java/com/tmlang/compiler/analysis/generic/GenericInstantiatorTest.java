package com.tmlang.compiler.analysis.generic;

import com.tmlang.compiler.analysis.env.BoundConstraint;
import com.tmlang.compiler.analysis.env.FuncSig;
import com.tmlang.compiler.analysis.types.GenericType;
import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.analysis.types.Types;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("泛型实例化")
class GenericInstantiatorTest {

    private static final GenericType T = new GenericType("T");
    private static final GenericType U = new GenericType("U");

    private static FuncSig generic(String name, List<TmlType> params, TmlType ret, String... typeParams) {
        return new FuncSig(name, params, ret, Arrays.asList(typeParams), Collections.<String>emptyList(),
                Collections.<BoundConstraint>emptyList(), new LinkedHashMap<String, String>(), null);
    }

    @Nested
    @DisplayName("调用点实例化")
    class CallSites {

        @Test
        @DisplayName("identity[T](x: T) 以 I32 调用得到 {T→I32}")
        void identity() {
            GenericInstantiator instantiator = new GenericInstantiator();
            FuncSig sig = generic("identity", Collections.<TmlType>singletonList(T), T, "T");

            Instantiation inst = instantiator.instantiateCall(sig, null,
                    Collections.<TmlType>singletonList(Types.I32));

            assertEquals(Collections.singletonMap("T", Types.I32), inst.getSubstitution());
            assertEquals(Types.I32, inst.getReturnType());
            assertEquals("identity__I32", inst.getMangledName());
            assertTrue(inst.isComplete());
        }

        @Test
        @DisplayName("显式类型实参优先于推断")
        void explicitArgsWin() {
            GenericInstantiator instantiator = new GenericInstantiator();
            FuncSig sig = generic("identity", Collections.<TmlType>singletonList(T), T, "T");

            Instantiation inst = instantiator.instantiateCall(sig,
                    Collections.<TmlType>singletonList(Types.I64),
                    Collections.<TmlType>singletonList(Types.I32));

            assertEquals(Types.I64, inst.getReturnType());
            assertEquals("identity__I64", inst.getMangledName());
        }

        @Test
        @DisplayName("无法推断的参数留在 unbound 列表中")
        void unboundParam() {
            GenericInstantiator instantiator = new GenericInstantiator();
            FuncSig sig = generic("make", Collections.<TmlType>emptyList(), T, "T");

            Instantiation inst = instantiator.instantiateCall(sig, null, Collections.<TmlType>emptyList());

            assertFalse(inst.isComplete());
            assertEquals(Collections.singletonList("T"), inst.getUnboundParams());
        }

        @Test
        @DisplayName("嵌套结构统一：Pair[T, U] 与 List[T]")
        void structuralUnify() {
            GenericInstantiator instantiator = new GenericInstantiator();
            FuncSig sig = generic("first",
                    Arrays.<TmlType>asList(Types.named("Pair", T, U), Types.slice(U)),
                    Types.tuple(T, U), "T", "U");

            Instantiation inst = instantiator.instantiateCall(sig, null, Arrays.<TmlType>asList(
                    Types.named("Pair", Types.STR, Types.BOOL), Types.array(Types.BOOL, 3)));

            assertEquals(Types.tuple(Types.STR, Types.BOOL), inst.getReturnType());
            assertEquals("first__Str__Bool", inst.getMangledName());
        }

        @Test
        @DisplayName("相同实参两次实例化得到同一个名字实例")
        void sameNameInstance() {
            GenericInstantiator instantiator = new GenericInstantiator();
            FuncSig sig = generic("identity", Collections.<TmlType>singletonList(T), T, "T");
            List<TmlType> args = Collections.<TmlType>singletonList(Types.I32);

            String first = instantiator.instantiateCall(sig, null, args).getMangledName();
            String second = instantiator.instantiateCall(sig, null, args).getMangledName();
            assertSame(first, second);
        }

        @Test
        @DisplayName("非泛型签名保持原名")
        void nonGeneric() {
            Instantiation inst = new GenericInstantiator().instantiateCall(
                    FuncSig.simple("add", Arrays.<TmlType>asList(Types.I32, Types.I32), Types.I32), null,
                    Arrays.<TmlType>asList(Types.I32, Types.I32));
            assertEquals("add", inst.getMangledName());
        }
    }

    @Nested
    @DisplayName("统一")
    class Unify {

        @Test
        @DisplayName("已有绑定不会被覆盖")
        void noOverwrite() {
            GenericInstantiator instantiator = new GenericInstantiator();
            Map<String, TmlType> subst = new HashMap<String, TmlType>();
            subst.put("T", Types.I32);

            instantiator.unify(T, Types.STR, Collections.singletonList("T"), subst);

            assertEquals(Types.I32, subst.get("T"));
        }

        @Test
        @DisplayName("形状不同不产生绑定")
        void shapeMismatch() {
            GenericInstantiator instantiator = new GenericInstantiator();
            Map<String, TmlType> subst = new HashMap<String, TmlType>();

            instantiator.unify(Types.tuple(T), Types.array(Types.I32, 1), Collections.singletonList("T"), subst);

            assertTrue(subst.isEmpty());
        }

        @Test
        @DisplayName("替换保留未绑定的名字")
        void substituteKeepsUnbound() {
            Map<String, TmlType> subst = Collections.<String, TmlType>singletonMap("T", Types.U8);
            TmlType result = GenericInstantiator.substitute(Types.tuple(T, U), subst);
            assertEquals(Types.tuple(Types.U8, U), result);
        }
    }
}

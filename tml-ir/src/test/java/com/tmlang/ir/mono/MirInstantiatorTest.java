package com.tmlang.ir.mono;

import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.analysis.types.Types;
import com.tmlang.ir.mir.MirBuilder;
import com.tmlang.ir.mir.MirEnumDef;
import com.tmlang.ir.mir.MirField;
import com.tmlang.ir.mir.MirFunction;
import com.tmlang.ir.mir.MirInst;
import com.tmlang.ir.mir.MirModule;
import com.tmlang.ir.mir.MirOp;
import com.tmlang.ir.mir.MirStructDef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MirInstantiator 测试")
class MirInstantiatorTest {

    private static final TmlType T = Types.generic("T");

    private MirModule module;
    private MirInstantiator instantiator;

    @BeforeEach
    void setUp() {
        module = new MirModule("mono");
        instantiator = new MirInstantiator();
    }

    /** identity[T](x: T) -> T */
    private MirFunction identityTemplate() {
        MirFunction f = new MirFunction("identity", T);
        f.setTypeParams(Collections.singletonList("T"));
        MirBuilder b = new MirBuilder(f);
        b.emitReturn(b.param("x", T));
        module.addFunction(f);
        return f;
    }

    private MirBuilder concrete(String name, TmlType ret) {
        MirFunction f = new MirFunction(name, ret);
        module.addFunction(f);
        return new MirBuilder(f);
    }

    private static List<String> functionNames(MirModule m) {
        List<String> names = new ArrayList<>();
        for (MirFunction f : m.getFunctions()) names.add(f.getName());
        return names;
    }

    private static List<String> calleesOf(MirFunction f) {
        List<String> names = new ArrayList<>();
        for (MirInst inst : f.getEntryBlock().getInstructions()) {
            if (inst.getOp() == MirOp.CALL) {
                MirInst.CallInfo call = inst.extraAs();
                assertThat(call.isGeneric()).isFalse();
                names.add(call.getFuncName());
            }
        }
        return names;
    }

    @Nested
    @DisplayName("函数实例")
    class Functions {

        @Test
        @DisplayName("相同类型实参的调用共享一个实例")
        void deduplicated() {
            identityTemplate();
            MirBuilder main = concrete("main", Types.UNIT);
            int a = main.emitConstInt(1, Types.I32);
            int flag = main.emitConstBool(true);
            main.emitGenericCall("identity", Collections.<TmlType>singletonList(Types.I32), new int[]{a}, null, Types.I32);
            main.emitGenericCall("identity", Collections.<TmlType>singletonList(Types.I32), new int[]{a}, null, Types.I32);
            main.emitGenericCall("identity", Collections.<TmlType>singletonList(Types.BOOL), new int[]{flag}, null, Types.BOOL);
            main.emitReturnVoid();

            MirModule out = instantiator.run(module);

            assertThat(functionNames(out)).containsExactly("main", "identity__I32", "identity__Bool");
            assertThat(instantiator.getInstances()).containsOnlyKeys("identity__I32", "identity__Bool");
            assertThat(calleesOf(out.findFunction("main")))
                    .containsExactly("identity__I32", "identity__I32", "identity__Bool");
        }

        @Test
        @DisplayName("实例中的类型参数被替换")
        void substitutesTypes() {
            MirFunction template = identityTemplate();
            MirFunction instance = instantiator.instantiate(template, Collections.<TmlType>singletonList(Types.I64));

            assertThat(instance.getName()).isEqualTo("identity__I64");
            assertThat(instance.isGeneric()).isFalse();
            assertThat(instance.getReturnType()).isEqualTo(Types.I64);
            assertThat(instance.getParams().get(0).getType()).isEqualTo(Types.I64);
            assertThat(instance.typeOf(instance.getParams().get(0).getValueId())).isEqualTo(Types.I64);
            assertThat(template.getReturnType()).isEqualTo(T);
        }

        @Test
        @DisplayName("重复实例化返回同一对象")
        void sameInstance() {
            MirFunction template = identityTemplate();
            MirFunction first = instantiator.instantiate(template, Collections.<TmlType>singletonList(Types.STR));
            MirFunction second = instantiator.instantiate(template, Collections.<TmlType>singletonList(Types.STR));

            assertThat(second).isSameAs(first);
        }

        @Test
        @DisplayName("类型实参个数不符抛出 IllegalArgumentException")
        void arityMismatch() {
            MirFunction template = identityTemplate();

            assertThatThrownBy(() -> instantiator.instantiate(template, Arrays.<TmlType>asList(Types.I32, Types.I64)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("identity");
        }

        @Test
        @DisplayName("类型实参仍含泛型参数时拒绝实例化")
        void unresolvedArgument() {
            MirFunction template = identityTemplate();

            assertThatThrownBy(() -> instantiator.instantiate(template,
                    Collections.<TmlType>singletonList(Types.generic("U"))))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("模板内部的泛型调用沿工作表继续实例化")
        void transitiveInstantiation() {
            identityTemplate();
            MirFunction wrap = new MirFunction("wrap", T);
            wrap.setTypeParams(Collections.singletonList("T"));
            MirBuilder wb = new MirBuilder(wrap);
            int x = wb.param("x", T);
            wb.emitReturn(wb.emitGenericCall("identity", Collections.singletonList(T), new int[]{x}, null, T));
            module.addFunction(wrap);

            MirBuilder main = concrete("main", Types.U8);
            int v = main.emitConstInt(7, Types.U8);
            main.emitReturn(main.emitGenericCall("wrap", Collections.<TmlType>singletonList(Types.U8),
                    new int[]{v}, null, Types.U8));

            MirModule out = instantiator.run(module);

            assertThat(functionNames(out)).containsExactly("main", "wrap__U8", "identity__U8");
            assertThat(calleesOf(out.findFunction("wrap__U8"))).containsExactly("identity__U8");
            assertThat(out.findFunction("wrap")).isNull();
        }

        @Test
        @DisplayName("外部泛型函数只改名")
        void externalGenericRenamed() {
            MirBuilder main = concrete("main", Types.I64);
            int a = main.emitConstInt(1, Types.I64);
            main.emitReturn(main.emitGenericCall("max", Collections.<TmlType>singletonList(Types.I64),
                    new int[]{a, a}, null, Types.I64));

            MirModule out = instantiator.run(module);

            assertThat(calleesOf(out.findFunction("main"))).containsExactly("max__I64");
            assertThat(instantiator.getInstances()).isEmpty();
            assertThat(functionNames(out)).containsExactly("main");
        }
    }

    @Nested
    @DisplayName("类型实例")
    class TypeInstances {

        @Test
        @DisplayName("用到的泛型结构体生成具体布局，模板被移除")
        void genericStruct() {
            module.addStruct(new MirStructDef("Pair", Collections.singletonList("T"), Arrays.asList(
                    new MirField("first", T), new MirField("second", T))));
            MirBuilder main = concrete("main", Types.UNIT);
            main.emitAlloca(Types.named("Pair", Types.I32));
            main.emitReturnVoid();

            MirModule out = instantiator.run(module);

            MirStructDef pair = out.findStruct("Pair__I32");
            assertThat(pair).isNotNull();
            assertThat(pair.isGeneric()).isFalse();
            assertThat(pair.getFields()).extracting(MirField::getType).containsExactly(Types.I32, Types.I32);
            assertThat(out.findStruct("Pair")).isNull();
        }

        @Test
        @DisplayName("枚举构造触发泛型枚举实例化")
        void genericEnum() {
            module.addEnum(new MirEnumDef("Maybe", Collections.singletonList("T"), Arrays.asList(
                    new MirEnumDef.Variant("Just", Collections.singletonList(T)),
                    new MirEnumDef.Variant("Nothing", null))));
            MirBuilder main = concrete("main", Types.UNIT);
            int x = main.param("x", Types.I64);
            main.emitEnumInit(new MirInst.EnumInfo("Maybe", Collections.<TmlType>singletonList(Types.I64), "Just", 0),
                    new int[]{x}, Types.named("Maybe", Types.I64));
            main.emitReturnVoid();

            MirModule out = instantiator.run(module);

            MirEnumDef maybe = out.findEnum("Maybe__I64");
            assertThat(maybe).isNotNull();
            assertThat(maybe.getVariants().get(0).getPayloadTypes()).containsExactly(Types.I64);
            assertThat(maybe.getVariants().get(1).getPayloadTypes()).isEmpty();
            assertThat(out.findEnum("Maybe")).isNull();
        }

        @Test
        @DisplayName("嵌套泛型字段递归实例化")
        void nestedStruct() {
            module.addStruct(new MirStructDef("Box", Collections.singletonList("T"),
                    Collections.singletonList(new MirField("value", T))));
            module.addStruct(new MirStructDef("Pair", Collections.singletonList("T"), Arrays.asList(
                    new MirField("first", Types.named("Box", T)), new MirField("second", T))));
            MirBuilder main = concrete("main", Types.UNIT);
            main.emitAlloca(Types.named("Pair", Types.BOOL));
            main.emitReturnVoid();

            MirModule out = instantiator.run(module);

            assertThat(out.findStruct("Pair__Bool")).isNotNull();
            assertThat(out.findStruct("Box__Bool")).isNotNull();
            assertThat(out.findStruct("Pair__Bool").getFields().get(0).getType())
                    .isEqualTo(Types.named("Box", Types.BOOL));
        }
    }
}

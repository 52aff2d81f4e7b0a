package com.tmlang.ir.backend;

import com.tmlang.compiler.analysis.types.ClosureType;
import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.analysis.types.TypeVar;
import com.tmlang.compiler.analysis.types.Types;
import com.tmlang.ir.mir.MirEnumDef;
import com.tmlang.ir.mir.MirField;
import com.tmlang.ir.mir.MirModule;
import com.tmlang.ir.mir.MirStructDef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

@DisplayName("LlvmTypeMapper 测试")
class LlvmTypeMapperTest {

    private MirModule module;
    private LlvmTypeMapper mapper;

    @BeforeEach
    void setUp() {
        module = new MirModule("types");
        mapper = new LlvmTypeMapper(module);
    }

    @Test
    @DisplayName("原始类型映射")
    void primitives() {
        assertThat(mapper.toSized(Types.I8)).isEqualTo("i8");
        assertThat(mapper.toSized(Types.U16)).isEqualTo("i16");
        assertThat(mapper.toSized(Types.CHAR)).isEqualTo("i32");
        assertThat(mapper.toSized(Types.U64)).isEqualTo("i64");
        assertThat(mapper.toSized(Types.I128)).isEqualTo("i128");
        assertThat(mapper.toSized(Types.F32)).isEqualTo("float");
        assertThat(mapper.toSized(Types.F64)).isEqualTo("double");
        assertThat(mapper.toSized(Types.BOOL)).isEqualTo("i1");
        assertThat(mapper.toSized(Types.STR)).isEqualTo("ptr");
    }

    @Test
    @DisplayName("Unit 在返回位置为 void，在值位置为 {}")
    void unit() {
        assertThat(mapper.toLlvm(Types.UNIT)).isEqualTo("void");
        assertThat(mapper.toLlvm(Types.NEVER)).isEqualTo("void");
        assertThat(mapper.toSized(Types.UNIT)).isEqualTo("{}");
    }

    @Test
    @DisplayName("复合类型映射")
    void composites() {
        assertThat(mapper.toSized(Types.tuple(Types.I32, Types.BOOL))).isEqualTo("{ i32, i1 }");
        assertThat(mapper.toSized(Types.tuple())).isEqualTo("{}");
        assertThat(mapper.toSized(Types.array(Types.I64, 4))).isEqualTo("[4 x i64]");
        assertThat(mapper.toSized(Types.slice(Types.U8))).isEqualTo("{ ptr, i64 }");
        assertThat(mapper.toSized(Types.ref(Types.I32))).isEqualTo("ptr");
        assertThat(mapper.toSized(Types.classType("Node"))).isEqualTo("ptr");
        assertThat(mapper.toSized(Types.named("Ptr", Types.I32))).isEqualTo("ptr");
        assertThat(mapper.toSized(Types.named("Pair", Types.I32))).isEqualTo("%struct.Pair__I32");
        assertThat(mapper.toSized(new ClosureType(Collections.<TmlType>emptyList(), Types.UNIT,
                Collections.<ClosureType.Capture>emptyList()))).isEqualTo("{ ptr, ptr }");
        assertThat(mapper.getFallbackCount()).isZero();
    }

    @Test
    @DisplayName("残留类型变量走默认路径并计数")
    void unresolvedTypesFallBack() {
        assertThat(mapper.toSized(new TypeVar(3))).isEqualTo("i32");
        assertThat(mapper.toLlvm(Types.generic("T"))).isEqualTo("void");
        assertThat(mapper.toSized(null)).isEqualTo("i32");
        assertThat(mapper.getFallbackCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("尺寸按字段累加，不计填充")
    void sizes() {
        module.addStruct(new MirStructDef("Point", null, Arrays.asList(
                new MirField("x", Types.I32), new MirField("y", Types.I64))));

        assertThat(mapper.sizeOf(Types.BOOL)).isEqualTo(1);
        assertThat(mapper.sizeOf(Types.U128)).isEqualTo(16);
        assertThat(mapper.sizeOf(Types.UNIT)).isZero();
        assertThat(mapper.sizeOf(Types.array(Types.I32, 10))).isEqualTo(40);
        assertThat(mapper.sizeOf(Types.tuple(Types.I32, Types.I64))).isEqualTo(12);
        assertThat(mapper.sizeOf(Types.slice(Types.I32))).isEqualTo(16);
        assertThat(mapper.sizeOf(Types.named("Point"))).isEqualTo(12);
        assertThat(mapper.sizeOf(Types.named("Unknown"))).isEqualTo(8);
    }

    @Test
    @DisplayName("自引用结构体不会无限递归")
    void recursiveStruct() {
        module.addStruct(new MirStructDef("List", null, Arrays.asList(
                new MirField("head", Types.I64), new MirField("tail", Types.named("List")))));

        assertThat(mapper.sizeOf(Types.named("List"))).isEqualTo(16);
    }

    @Test
    @DisplayName("枚举载荷区至少 8 字节")
    void enumPayload() {
        MirEnumDef small = new MirEnumDef("Flag", null, Arrays.asList(
                new MirEnumDef.Variant("On", Collections.<TmlType>singletonList(Types.BOOL)),
                new MirEnumDef.Variant("Off", null)));
        MirEnumDef wide = new MirEnumDef("Wide", null, Arrays.asList(
                new MirEnumDef.Variant("A", Arrays.<TmlType>asList(Types.I64, Types.I64)),
                new MirEnumDef.Variant("B", Collections.<TmlType>singletonList(Types.I32))));
        module.addEnum(small);
        module.addEnum(wide);

        assertThat(mapper.payloadSize(small)).isEqualTo(8);
        assertThat(mapper.payloadSize(wide)).isEqualTo(16);
        assertThat(mapper.sizeOf(Types.named("Wide"))).isEqualTo(20);
    }

    @Test
    @DisplayName("文本类型判定")
    void textPredicates() {
        assertThat(LlvmTypeMapper.intBits("i32")).isEqualTo(32);
        assertThat(LlvmTypeMapper.intBits("i1")).isEqualTo(1);
        assertThat(LlvmTypeMapper.intBits("ptr")).isEqualTo(-1);
        assertThat(LlvmTypeMapper.intBits("i")).isEqualTo(-1);
        assertThat(LlvmTypeMapper.isFloat("double")).isTrue();
        assertThat(LlvmTypeMapper.isFloat("i64")).isFalse();
        assertThat(LlvmTypeMapper.isAggregate("%struct.Point")).isTrue();
        assertThat(LlvmTypeMapper.isAggregate("[4 x i8]")).isTrue();
        assertThat(LlvmTypeMapper.isAggregate("ptr")).isFalse();
        assertThat(LlvmTypeMapper.alignOf("i8")).isEqualTo(1);
        assertThat(LlvmTypeMapper.alignOf("i16")).isEqualTo(2);
        assertThat(LlvmTypeMapper.alignOf("float")).isEqualTo(4);
        assertThat(LlvmTypeMapper.alignOf("i128")).isEqualTo(16);
        assertThat(LlvmTypeMapper.alignOf("ptr")).isEqualTo(8);
    }
}

package com.tmlang.ir.mir;

import com.tmlang.compiler.analysis.types.PtrType;
import com.tmlang.compiler.analysis.types.Types;
import com.tmlang.compiler.ast.SourceLocation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MirBuilder 测试")
class MirBuilderTest {

    private MirFunction function;
    private MirBuilder builder;

    @BeforeEach
    void setUp() {
        function = new MirFunction("f", Types.I32);
        builder = new MirBuilder(function);
    }

    @Test
    @DisplayName("首个块命名为 entry，后续块为 hint + id")
    void blockNaming() {
        BasicBlock loop = builder.newBlock("loop");
        BasicBlock exit = builder.newBlock("exit");

        assertThat(function.getEntryBlock().getName()).isEqualTo("entry");
        assertThat(loop.getName()).isEqualTo("loop1");
        assertThat(exit.getName()).isEqualTo("exit2");
        assertThat(function.getBlock(2)).isSameAs(exit);
        assertThat(function.getBlock(9)).isNull();
    }

    @Test
    @DisplayName("参数与临时值共享值编号")
    void valueNumbering() {
        int a = builder.param("a", Types.I32);
        int b = builder.param("b", Types.I64);
        int sum = builder.emitBinary(BinaryOp.ADD, a, a, Types.I32);

        assertThat(a).isZero();
        assertThat(b).isEqualTo(1);
        assertThat(sum).isEqualTo(2);
        assertThat(function.getParams()).extracting(MirParam::getName).containsExactly("a", "b");
        assertThat(function.typeOf(b)).isEqualTo(Types.I64);
    }

    @Test
    @DisplayName("比较运算结果为 Bool")
    void comparisonYieldsBool() {
        int a = builder.param("a", Types.I32);
        int lt = builder.emitBinary(BinaryOp.LT, a, a, Types.I32);

        assertThat(function.typeOf(lt)).isEqualTo(Types.BOOL);
    }

    @Test
    @DisplayName("Unit 结果与 store 不分配目标值")
    void voidResults() {
        int p = builder.param("p", Types.mutPtr(Types.I32));
        int v = builder.emitConstInt(3, Types.I32);
        int call = builder.emitCall("log", new int[]{v}, null, Types.UNIT);
        builder.emitStore(p, v, Types.I32);

        assertThat(call).isEqualTo(-1);
        MirInst store = builder.getCurrentBlock().getInstructions().get(2);
        assertThat(store.getOp()).isEqualTo(MirOp.STORE);
        assertThat(store.hasDest()).isFalse();
        assertThat(store.getOperands()).containsExactly(p, v);
    }

    @Test
    @DisplayName("alloca 返回可变指针")
    void allocaType() {
        int slot = builder.emitAlloca(Types.I64);

        assertThat(function.typeOf(slot)).isInstanceOf(PtrType.class);
        PtrType ptr = (PtrType) function.typeOf(slot);
        assertThat(ptr.isMutable()).isTrue();
        assertThat(ptr.getInner()).isEqualTo(Types.I64);
    }

    @Test
    @DisplayName("重复数组展开为等长操作数")
    void arrayRepeat() {
        int zero = builder.emitConstInt(0, Types.U8);
        int arr = builder.emitArrayRepeat(zero, 16, Types.U8);

        MirInst inst = builder.getCurrentBlock().getInstructions().get(1);
        assertThat(inst.getOperands()).hasSize(16).containsOnly(zero);
        assertThat(function.typeOf(arr)).isEqualTo(Types.array(Types.U8, 16));
    }

    @Test
    @DisplayName("方法调用记录接收者与 vtable 槽位")
    void methodCall() {
        int self = builder.param("self", Types.classType("Shape"));
        int scale = builder.emitConstFloat(2.0, Types.F64);
        builder.emitMethodCall(self, Types.classType("Shape"), "scale", new int[]{scale}, Types.F64, 3);

        MirInst inst = builder.getCurrentBlock().getInstructions().get(1);
        MirInst.MethodInfo info = inst.extraAs();
        assertThat(inst.getOperands()).containsExactly(self, scale);
        assertThat(info.getMethodName()).isEqualTo("scale");
        assertThat(info.isVirtual()).isTrue();
        assertThat(info.getVtableSlot()).isEqualTo(3);
        assertThat(info.getArgTypes()).containsExactly(Types.F64);
    }

    @Test
    @DisplayName("常量类型检查")
    void constantTypes() {
        assertThatThrownBy(() -> MirConstant.ofInt(1, Types.F64)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MirConstant.ofFloat(1.0, Types.I32)).isInstanceOf(IllegalArgumentException.class);
        assertThat(MirConstant.ofInt('a', Types.CHAR).getIntValue()).isEqualTo(97);
        assertThat(MirConstant.ofFloat(-0.0, Types.F64).isZero()).isFalse();
        assertThat(MirConstant.ofBool(false).isZero()).isTrue();
        assertThat(MirConstant.ofString("").isZero()).isFalse();
    }

    @Test
    @DisplayName("终止指令与源码位置")
    void terminators() {
        SourceLocation loc = new SourceLocation("a.tml", 4, 2, 1);
        BasicBlock exit = builder.newBlock("exit");
        builder.at(loc).emitGoto(exit);
        builder.switchToBlock(exit);
        builder.emitReturnVoid();

        MirTerminator jump = function.getEntryBlock().getTerminator();
        assertThat(jump.kind).isEqualTo(MirTerminator.KIND_GOTO);
        assertThat(((MirTerminator.Goto) jump).getTargetBlockId()).isEqualTo(exit.getId());
        assertThat(jump.getLocation()).isEqualTo(loc);
        assertThat(exit.getTerminator().kind).isEqualTo(MirTerminator.KIND_RETURN);
        assertThat(((MirTerminator.Return) exit.getTerminator()).hasValue()).isFalse();
    }

    @Test
    @DisplayName("原子指令记录内存序")
    void atomicInfo() {
        int p = builder.param("p", Types.mutPtr(Types.I32));
        builder.emitAtomicLoad(p, Types.I32, null);
        builder.emitFence(AtomicOrdering.RELEASE, true);

        MirInst.AtomicInfo load = builder.getCurrentBlock().getInstructions().get(0).extraAs();
        MirInst.AtomicInfo fence = builder.getCurrentBlock().getInstructions().get(1).extraAs();
        assertThat(load.getOrdering()).isEqualTo(AtomicOrdering.SEQ_CST);
        assertThat(load.getFailureOrdering()).isEqualTo(AtomicOrdering.SEQ_CST);
        assertThat(fence.getOrdering()).isEqualTo(AtomicOrdering.RELEASE);
        assertThat(fence.isSingleThread()).isTrue();
    }

    @Test
    @DisplayName("泛型模板由类型参数标记")
    void genericMarker() {
        assertThat(function.isGeneric()).isFalse();
        function.setTypeParams(Collections.singletonList("T"));
        assertThat(function.isGeneric()).isTrue();
        function.setTypeParams(null);
        assertThat(function.getTypeParams()).isEmpty();
    }
}

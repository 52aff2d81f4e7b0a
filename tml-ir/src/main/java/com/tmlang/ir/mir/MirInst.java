package com.tmlang.ir.mir;

import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.ast.SourceLocation;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * MIR 指令。
 * <p>
 * {@code type} 是结果值的类型；STORE / ATOMIC_STORE 没有结果，此时为被存储值的类型。
 * {@code extra} 按操作码携带附加数据：
 * <ul>
 *   <li>CONST: {@link MirConstant}</li>
 *   <li>BINARY / UNARY / CAST: {@link BinaryOp} / {@link UnaryOp} / {@link CastKind}</li>
 *   <li>ALLOCA / GEP: 被分配类型 / 基址元素类型</li>
 *   <li>EXTRACT_VALUE / INSERT_VALUE: {@code int[]} 下标路径</li>
 *   <li>STRUCT_INIT: 结构体名；ENUM_INIT: {@link EnumInfo}</li>
 *   <li>CALL: {@link CallInfo}；METHOD_CALL: {@link MethodInfo}；CLOSURE_INIT: 函数名</li>
 *   <li>PHI: {@code List<PhiIncoming>}；原子操作: {@link AtomicInfo}</li>
 * </ul>
 */
public class MirInst {

    private final MirOp op;
    private final int dest;            // 结果值 id（-1 = 无返回值）
    private final int[] operands;      // 操作数（值 id）
    private final Object extra;
    private final TmlType type;
    private final SourceLocation location;

    public MirInst(MirOp op, int dest, int[] operands, Object extra, TmlType type, SourceLocation location) {
        this.op = op;
        this.dest = dest;
        this.operands = operands != null ? operands : new int[0];
        this.extra = extra;
        this.type = type;
        this.location = location;
    }

    public MirOp getOp() { return op; }
    public int getDest() { return dest; }
    public boolean hasDest() { return dest >= 0; }
    public int[] getOperands() { return operands; }
    public Object getExtra() { return extra; }
    public TmlType getType() { return type; }
    public SourceLocation getLocation() { return location; }

    /**
     * 获取第 n 个操作数。
     */
    public int operand(int n) {
        return operands[n];
    }

    /**
     * extra 作为指定类型。
     */
    @SuppressWarnings("unchecked")
    public <T> T extraAs() {
        return (T) extra;
    }

    /** 替换 extra 与类型，其余不变 */
    public MirInst withExtra(Object newExtra, TmlType newType) {
        return new MirInst(op, dest, operands, newExtra, newType, location);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (dest >= 0) sb.append('%').append(dest).append(" = ");
        sb.append(op.name());
        for (int i = 0; i < operands.length; i++) {
            sb.append(i == 0 ? " %" : ", %").append(operands[i]);
        }
        if (extra instanceof int[]) {
            sb.append(" [").append(Arrays.toString((int[]) extra)).append(']');
        } else if (extra != null) {
            sb.append(" [").append(extra).append(']');
        }
        if (type != null) sb.append(" : ").append(type);
        return sb.toString();
    }

    // ===== 附加数据 =====

    /**
     * 直接调用目标。typeArgs 非空表示调用泛型函数，单态化后清空。
     */
    public static class CallInfo {
        private final String funcName;
        private final List<TmlType> typeArgs;
        private final List<TmlType> argTypes;

        public CallInfo(String funcName, List<TmlType> typeArgs, List<TmlType> argTypes) {
            this.funcName = funcName;
            this.typeArgs = typeArgs != null ? typeArgs : Collections.<TmlType>emptyList();
            this.argTypes = argTypes != null ? argTypes : Collections.<TmlType>emptyList();
        }

        public String getFuncName() { return funcName; }
        public List<TmlType> getTypeArgs() { return typeArgs; }
        public List<TmlType> getArgTypes() { return argTypes; }
        public boolean isGeneric() { return !typeArgs.isEmpty(); }

        @Override
        public String toString() {
            return typeArgs.isEmpty() ? funcName : funcName + typeArgs;
        }
    }

    /**
     * 方法调用目标。vtableSlot &gt;= 0 表示经虚表分派。
     */
    public static class MethodInfo {
        private final TmlType receiverType;
        private final String methodName;
        private final List<TmlType> argTypes;
        private final int vtableSlot;

        public MethodInfo(TmlType receiverType, String methodName, List<TmlType> argTypes, int vtableSlot) {
            this.receiverType = receiverType;
            this.methodName = methodName;
            this.argTypes = argTypes != null ? argTypes : Collections.<TmlType>emptyList();
            this.vtableSlot = vtableSlot;
        }

        public TmlType getReceiverType() { return receiverType; }
        public String getMethodName() { return methodName; }
        public List<TmlType> getArgTypes() { return argTypes; }
        public int getVtableSlot() { return vtableSlot; }
        public boolean isVirtual() { return vtableSlot >= 0; }

        @Override
        public String toString() {
            return receiverType + "." + methodName + (vtableSlot >= 0 ? " vslot=" + vtableSlot : "");
        }
    }

    /**
     * 枚举变体构造。
     */
    public static class EnumInfo {
        private final String enumName;
        private final List<TmlType> typeArgs;
        private final String variantName;
        private final int variantIndex;

        public EnumInfo(String enumName, List<TmlType> typeArgs, String variantName, int variantIndex) {
            this.enumName = enumName;
            this.typeArgs = typeArgs != null ? typeArgs : Collections.<TmlType>emptyList();
            this.variantName = variantName;
            this.variantIndex = variantIndex;
        }

        public String getEnumName() { return enumName; }
        public List<TmlType> getTypeArgs() { return typeArgs; }
        public String getVariantName() { return variantName; }
        public int getVariantIndex() { return variantIndex; }

        @Override
        public String toString() {
            return enumName + (typeArgs.isEmpty() ? "" : typeArgs.toString()) + "::" + variantName;
        }
    }

    /**
     * PHI 入边。
     */
    public static class PhiIncoming {
        private final int valueId;
        private final int blockId;

        public PhiIncoming(int valueId, int blockId) {
            this.valueId = valueId;
            this.blockId = blockId;
        }

        public int getValueId() { return valueId; }
        public int getBlockId() { return blockId; }

        @Override
        public String toString() {
            return "%" + valueId + " from B" + blockId;
        }
    }

    /**
     * 原子操作参数。ordering 为 null 时按 seq_cst 处理。
     */
    public static class AtomicInfo {
        private final AtomicOrdering ordering;
        private final AtomicOrdering failureOrdering;
        private final AtomicRmwOp rmwOp;
        private final boolean weak;
        private final boolean singleThread;

        public AtomicInfo(AtomicOrdering ordering, AtomicOrdering failureOrdering,
                          AtomicRmwOp rmwOp, boolean weak, boolean singleThread) {
            this.ordering = ordering;
            this.failureOrdering = failureOrdering;
            this.rmwOp = rmwOp;
            this.weak = weak;
            this.singleThread = singleThread;
        }

        public static AtomicInfo of(AtomicOrdering ordering) {
            return new AtomicInfo(ordering, null, null, false, false);
        }

        public AtomicOrdering getOrdering() { return AtomicOrdering.orDefault(ordering); }

        public AtomicOrdering getFailureOrdering() {
            return failureOrdering != null ? failureOrdering : AtomicOrdering.failureOrderingFor(ordering);
        }

        public AtomicRmwOp getRmwOp() { return rmwOp; }
        public boolean isWeak() { return weak; }
        public boolean isSingleThread() { return singleThread; }

        @Override
        public String toString() {
            return (rmwOp != null ? rmwOp.getLlvmName() + " " : "") + getOrdering().getLlvmName();
        }
    }
}

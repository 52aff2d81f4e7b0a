package com.tmlang.ir.mir;

import com.tmlang.compiler.analysis.types.ArrayType;
import com.tmlang.compiler.analysis.types.ClosureType;
import com.tmlang.compiler.analysis.types.PrimitiveType;
import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.analysis.types.TupleType;
import com.tmlang.compiler.analysis.types.Types;
import com.tmlang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * MIR 构建辅助类。
 * 封装创建指令、基本块、SSA 值的便捷方法。
 */
public class MirBuilder {

    private final MirFunction function;
    private BasicBlock currentBlock;
    private SourceLocation location = SourceLocation.UNKNOWN;

    public MirBuilder(MirFunction function) {
        this.function = function;
        this.currentBlock = function.getBlocks().isEmpty() ? function.newBlock() : function.getEntryBlock();
    }

    /** 绑定到已有函数和基本块（不创建新 block） */
    public MirBuilder(MirFunction function, BasicBlock existingBlock) {
        this.function = function;
        this.currentBlock = existingBlock;
    }

    public MirFunction getFunction() { return function; }
    public BasicBlock getCurrentBlock() { return currentBlock; }

    /** 后续指令使用的源码位置 */
    public MirBuilder at(SourceLocation loc) {
        this.location = loc != null ? loc : SourceLocation.UNKNOWN;
        return this;
    }

    // ========== 基本块操作 ==========

    public BasicBlock newBlock(String hint) {
        return function.newBlock(hint);
    }

    public void switchToBlock(BasicBlock block) {
        this.currentBlock = block;
    }

    // ========== SSA 值 ==========

    public int param(String name, TmlType type) {
        return function.addParam(name, type).getValueId();
    }

    public int newTemp(TmlType type) {
        return function.newValue("$t" + function.getValues().size(), type);
    }

    // ========== 指令发射 ==========

    private int emit(MirOp op, TmlType resultType, int[] operands, Object extra) {
        int dest = resultType != null && !Types.isUnit(resultType) ? newTemp(resultType) : -1;
        currentBlock.addInstruction(new MirInst(op, dest, operands, extra, resultType, location));
        return dest;
    }

    private void emitVoid(MirOp op, TmlType type, int[] operands, Object extra) {
        currentBlock.addInstruction(new MirInst(op, -1, operands, extra, type, location));
    }

    public int emitConst(MirConstant constant) {
        int dest = newTemp(constant.getType());
        currentBlock.addInstruction(new MirInst(MirOp.CONST, dest, null, constant, constant.getType(), location));
        return dest;
    }

    public int emitConstInt(long value, PrimitiveType type) {
        return emitConst(MirConstant.ofInt(value, type));
    }

    public int emitConstFloat(double value, PrimitiveType type) {
        return emitConst(MirConstant.ofFloat(value, type));
    }

    public int emitConstBool(boolean value) {
        return emitConst(MirConstant.ofBool(value));
    }

    public int emitConstString(String value) {
        return emitConst(MirConstant.ofString(value));
    }

    public int emitBinary(BinaryOp op, int left, int right, TmlType resultType) {
        TmlType type = op.isComparison() ? Types.BOOL : resultType;
        return emit(MirOp.BINARY, type, new int[]{left, right}, op);
    }

    public int emitUnary(UnaryOp op, int operand, TmlType resultType) {
        return emit(MirOp.UNARY, resultType, new int[]{operand}, op);
    }

    public int emitSelect(int cond, int ifTrue, int ifFalse, TmlType resultType) {
        return emit(MirOp.SELECT, resultType, new int[]{cond, ifTrue, ifFalse}, null);
    }

    public int emitCast(CastKind kind, int operand, TmlType targetType) {
        return emit(MirOp.CAST, targetType, new int[]{operand}, kind);
    }

    // ========== 内存 ==========

    public int emitAlloca(TmlType allocType) {
        return emit(MirOp.ALLOCA, Types.mutPtr(allocType), null, allocType);
    }

    public int emitLoad(int ptr, TmlType resultType) {
        return emit(MirOp.LOAD, resultType, new int[]{ptr}, null);
    }

    public void emitStore(int ptr, int value, TmlType valueType) {
        emitVoid(MirOp.STORE, valueType, new int[]{ptr, value}, null);
    }

    public int emitGep(int base, TmlType baseType, int[] indices, TmlType resultType) {
        int[] ops = new int[indices.length + 1];
        ops[0] = base;
        System.arraycopy(indices, 0, ops, 1, indices.length);
        return emit(MirOp.GEP, resultType, ops, baseType);
    }

    // ========== 聚合体 ==========

    public int emitExtractValue(int aggregate, int[] indices, TmlType resultType) {
        return emit(MirOp.EXTRACT_VALUE, resultType, new int[]{aggregate}, indices);
    }

    public int emitInsertValue(int aggregate, int value, int[] indices, TmlType aggregateType) {
        return emit(MirOp.INSERT_VALUE, aggregateType, new int[]{aggregate, value}, indices);
    }

    /** resultType 为 ClassType 时按引用语义分配 */
    public int emitStructInit(String structName, int[] fields, TmlType resultType) {
        return emit(MirOp.STRUCT_INIT, resultType, fields, structName);
    }

    public int emitEnumInit(MirInst.EnumInfo info, int[] payload, TmlType resultType) {
        return emit(MirOp.ENUM_INIT, resultType, payload, info);
    }

    public int emitTupleInit(int[] elements, TupleType tupleType) {
        return emit(MirOp.TUPLE_INIT, tupleType, elements, null);
    }

    public int emitArrayInit(int[] elements, TmlType elementType) {
        return emit(MirOp.ARRAY_INIT, Types.array(elementType, elements.length), elements, null);
    }

    /** [value; count] */
    public int emitArrayRepeat(int value, int count, TmlType elementType) {
        int[] elements = new int[count];
        Arrays.fill(elements, value);
        return emit(MirOp.ARRAY_INIT, new ArrayType(elementType, count), elements, null);
    }

    // ========== 调用 ==========

    public int emitCall(String funcName, int[] args, List<TmlType> argTypes, TmlType returnType) {
        return emitGenericCall(funcName, Collections.<TmlType>emptyList(), args, argTypes, returnType);
    }

    public int emitGenericCall(String funcName, List<TmlType> typeArgs, int[] args,
                               List<TmlType> argTypes, TmlType returnType) {
        return emit(MirOp.CALL, returnType, args,
                new MirInst.CallInfo(funcName, typeArgs, argTypes != null ? argTypes : typesOf(args)));
    }

    public int emitMethodCall(int receiver, TmlType receiverType, String method, int[] args,
                              TmlType returnType) {
        return emitMethodCall(receiver, receiverType, method, args, returnType, -1);
    }

    public int emitMethodCall(int receiver, TmlType receiverType, String method, int[] args,
                              TmlType returnType, int vtableSlot) {
        int[] ops = new int[args.length + 1];
        ops[0] = receiver;
        System.arraycopy(args, 0, ops, 1, args.length);
        return emit(MirOp.METHOD_CALL, returnType, ops,
                new MirInst.MethodInfo(receiverType, method, typesOf(args), vtableSlot));
    }

    /** env 为 -1 时环境指针为 null */
    public int emitClosure(String funcName, int env, ClosureType closureType) {
        int[] ops = env >= 0 ? new int[]{env} : new int[0];
        return emit(MirOp.CLOSURE_INIT, closureType, ops, funcName);
    }

    public int emitClosureCall(int closure, int[] args, TmlType returnType) {
        int[] ops = new int[args.length + 1];
        ops[0] = closure;
        System.arraycopy(args, 0, ops, 1, args.length);
        return emit(MirOp.CLOSURE_CALL, returnType, ops, null);
    }

    public int emitPhi(List<MirInst.PhiIncoming> incoming, TmlType resultType) {
        return emit(MirOp.PHI, resultType, null, new ArrayList<MirInst.PhiIncoming>(incoming));
    }

    // ========== 原子操作 ==========

    public int emitAtomicLoad(int ptr, TmlType resultType, AtomicOrdering ordering) {
        return emit(MirOp.ATOMIC_LOAD, resultType, new int[]{ptr}, MirInst.AtomicInfo.of(ordering));
    }

    public void emitAtomicStore(int ptr, int value, TmlType valueType, AtomicOrdering ordering) {
        emitVoid(MirOp.ATOMIC_STORE, valueType, new int[]{ptr, value}, MirInst.AtomicInfo.of(ordering));
    }

    public int emitAtomicRmw(AtomicRmwOp op, int ptr, int value, TmlType valueType, AtomicOrdering ordering) {
        return emit(MirOp.ATOMIC_RMW, valueType, new int[]{ptr, value},
                new MirInst.AtomicInfo(ordering, null, op, false, false));
    }

    public int emitCmpXchg(int ptr, int expected, int desired, TmlType valueType,
                           AtomicOrdering success, AtomicOrdering failure, boolean weak) {
        return emit(MirOp.CMPXCHG, valueType, new int[]{ptr, expected, desired},
                new MirInst.AtomicInfo(success, failure, null, weak, false));
    }

    public void emitFence(AtomicOrdering ordering, boolean singleThread) {
        emitVoid(MirOp.FENCE, null, null, new MirInst.AtomicInfo(ordering, null, null, false, singleThread));
    }

    // ========== 终止指令 ==========

    public void emitGoto(BasicBlock target) {
        currentBlock.setTerminator(new MirTerminator.Goto(location, target.getId()));
    }

    public void emitBranch(int cond, BasicBlock thenBlock, BasicBlock elseBlock) {
        currentBlock.setTerminator(new MirTerminator.Branch(location, cond, thenBlock.getId(), elseBlock.getId()));
    }

    public void emitSwitch(int discriminant, Map<Long, Integer> cases, BasicBlock defaultBlock) {
        currentBlock.setTerminator(new MirTerminator.Switch(location, discriminant, cases, defaultBlock.getId()));
    }

    public void emitReturn(int value) {
        currentBlock.setTerminator(new MirTerminator.Return(location, value));
    }

    public void emitReturnVoid() {
        currentBlock.setTerminator(new MirTerminator.Return(location, -1));
    }

    public void emitUnreachable() {
        currentBlock.setTerminator(new MirTerminator.Unreachable(location));
    }

    private List<TmlType> typesOf(int[] ids) {
        List<TmlType> types = new ArrayList<>(ids.length);
        for (int id : ids) {
            types.add(function.typeOf(id));
        }
        return types;
    }
}

package com.tmlang.ir.mir;

/**
 * MIR 指令操作码。
 */
public enum MirOp {
    // 常量
    CONST,          // dest = literal

    // 算术/逻辑
    BINARY,         // dest = src1 op src2
    UNARY,          // dest = op src
    SELECT,         // dest = cond ? a : b
    CAST,           // dest = (T) src

    // 内存
    LOAD,           // dest = *ptr
    STORE,          // *ptr = src
    ALLOCA,         // dest = alloca T
    GEP,            // dest = &base[idx...]

    // 聚合体
    EXTRACT_VALUE,  // dest = agg.idx
    INSERT_VALUE,   // dest = agg with idx = src
    STRUCT_INIT,    // dest = Struct { fields }
    ENUM_INIT,      // dest = Enum::Variant(payload)
    TUPLE_INIT,     // dest = (a, b, ...)
    ARRAY_INIT,     // dest = [a, b, ...]

    // 调用
    CALL,           // dest = func(args)
    METHOD_CALL,    // dest = recv.method(args)
    CLOSURE_INIT,   // dest = { fn, env }
    CLOSURE_CALL,   // dest = closure(args)

    // SSA
    PHI,            // dest = phi [v, B]...

    // 原子操作
    ATOMIC_LOAD,
    ATOMIC_STORE,
    ATOMIC_RMW,
    CMPXCHG,
    FENCE
}

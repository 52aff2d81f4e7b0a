package com.tmlang.ir.mir;

/**
 * 原子操作内存序。
 */
public enum AtomicOrdering {
    MONOTONIC("monotonic"),
    ACQUIRE("acquire"),
    RELEASE("release"),
    ACQ_REL("acq_rel"),
    SEQ_CST("seq_cst");

    private final String llvmName;

    AtomicOrdering(String llvmName) {
        this.llvmName = llvmName;
    }

    public String getLlvmName() {
        return llvmName;
    }

    /** 缺省内存序取最强的 seq_cst */
    public static AtomicOrdering orDefault(AtomicOrdering ordering) {
        return ordering != null ? ordering : SEQ_CST;
    }

    /**
     * cmpxchg 失败路径的内存序：不能含 release 语义。
     */
    public static AtomicOrdering failureOrderingFor(AtomicOrdering success) {
        switch (orDefault(success)) {
            case ACQ_REL: return ACQUIRE;
            case RELEASE: return MONOTONIC;
            default: return orDefault(success);
        }
    }
}

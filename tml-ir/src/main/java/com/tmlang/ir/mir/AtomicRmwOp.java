package com.tmlang.ir.mir;

/**
 * atomicrmw 的读-改-写操作。
 */
public enum AtomicRmwOp {
    XCHG("xchg"),
    ADD("add"),
    SUB("sub"),
    AND("and"),
    NAND("nand"),
    OR("or"),
    XOR("xor"),
    MAX("max"),
    MIN("min"),
    UMAX("umax"),
    UMIN("umin");

    private final String llvmName;

    AtomicRmwOp(String llvmName) {
        this.llvmName = llvmName;
    }

    public String getLlvmName() {
        return llvmName;
    }
}

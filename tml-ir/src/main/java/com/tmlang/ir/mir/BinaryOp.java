package com.tmlang.ir.mir;

/**
 * MIR 二元运算子操作符。
 */
public enum BinaryOp {
    ADD, SUB, MUL, DIV, MOD,
    EQ, NE, LT, LE, GT, GE,
    AND, OR,
    BAND, BOR, BXOR,
    SHL, SHR;

    /** 比较运算，结果恒为 i1 */
    public boolean isComparison() {
        switch (this) {
            case EQ: case NE: case LT: case LE: case GT: case GE:
                return true;
            default:
                return false;
        }
    }
}

package com.tmlang.ir.mir;

/**
 * MIR 一元运算符。
 */
public enum UnaryOp {
    NEG,
    NOT,
    BIT_NOT
}

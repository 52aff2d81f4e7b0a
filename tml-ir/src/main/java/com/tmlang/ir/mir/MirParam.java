package com.tmlang.ir.mir;

import com.tmlang.compiler.analysis.types.TmlType;

/**
 * MIR 函数参数。
 */
public class MirParam {

    private final String name;
    private final TmlType type;
    private final int valueId;

    public MirParam(String name, TmlType type, int valueId) {
        this.name = name;
        this.type = type;
        this.valueId = valueId;
    }

    public String getName() { return name; }
    public TmlType getType() { return type; }
    /** 参数在函数体内对应的 SSA 值 */
    public int getValueId() { return valueId; }
}

package com.tmlang.ir.mir;

import com.tmlang.compiler.analysis.types.TmlType;

/**
 * MIR 结构体字段。
 */
public class MirField {

    private final String name;
    private final TmlType type;

    public MirField(String name, TmlType type) {
        this.name = name;
        this.type = type;
    }

    public String getName() { return name; }
    public TmlType getType() { return type; }
}

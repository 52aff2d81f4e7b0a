package com.tmlang.ir.mir;

import com.tmlang.compiler.analysis.types.TmlType;

/**
 * MIR SSA 值：只有标识和（可选的）静态类型，不携带数据。
 */
public class MirValue {

    private final int id;
    private final String name;
    private final TmlType type;

    public MirValue(int id, String name, TmlType type) {
        this.id = id;
        this.name = name;
        this.type = type;
    }

    public int getId() { return id; }
    public String getName() { return name; }
    public TmlType getType() { return type; }
    public boolean hasType() { return type != null; }

    @Override
    public String toString() {
        return "%" + id + ":" + name + (type != null ? "(" + type + ")" : "");
    }
}

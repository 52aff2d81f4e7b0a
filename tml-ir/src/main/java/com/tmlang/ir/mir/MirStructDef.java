package com.tmlang.ir.mir;

import java.util.Collections;
import java.util.List;

/**
 * MIR 结构体布局（类的布局也用它表示，字段顺序即内存顺序）。
 */
public class MirStructDef {

    private final String name;
    private final List<String> typeParams;
    private final List<MirField> fields;

    public MirStructDef(String name, List<String> typeParams, List<MirField> fields) {
        this.name = name;
        this.typeParams = typeParams != null ? typeParams : Collections.<String>emptyList();
        this.fields = fields;
    }

    public String getName() { return name; }
    public List<String> getTypeParams() { return typeParams; }
    public List<MirField> getFields() { return fields; }
    public boolean isGeneric() { return !typeParams.isEmpty(); }
}

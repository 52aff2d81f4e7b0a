package com.tmlang.compiler.analysis.env;

import com.tmlang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 结构体定义，字段顺序即布局顺序
 */
public final class StructDef {
    private final String name;
    private final List<String> typeParams;
    private final List<FieldDef> fields;
    private final SourceLocation location;

    public StructDef(String name, List<String> typeParams, List<FieldDef> fields, SourceLocation location) {
        this.name = name;
        this.typeParams = typeParams != null ? typeParams : Collections.<String>emptyList();
        this.fields = fields;
        this.location = location;
    }

    public String getName() { return name; }
    public List<String> getTypeParams() { return typeParams; }
    public List<FieldDef> getFields() { return fields; }
    public SourceLocation getLocation() { return location; }

    public FieldDef findField(String fieldName) {
        for (FieldDef f : fields) {
            if (f.getName().equals(fieldName)) return f;
        }
        return null;
    }
}

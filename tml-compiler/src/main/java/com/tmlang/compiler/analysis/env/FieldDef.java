package com.tmlang.compiler.analysis.env;

import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.ast.Visibility;

/**
 * 字段定义
 */
public final class FieldDef {
    private final String name;
    private final TmlType type;
    private final boolean isStatic;
    private final Visibility visibility;

    public FieldDef(String name, TmlType type, boolean isStatic, Visibility visibility) {
        this.name = name;
        this.type = type;
        this.isStatic = isStatic;
        this.visibility = visibility;
    }

    public String getName() { return name; }
    public TmlType getType() { return type; }
    public boolean isStatic() { return isStatic; }
    public Visibility getVisibility() { return visibility; }
}

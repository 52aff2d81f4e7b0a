package com.tmlang.compiler.ast.type;

import com.tmlang.compiler.ast.SourceLocation;

/**
 * 简单类型（如 I32, Str, Point），可带模块限定 std::io::File
 */
public final class SimpleType extends TypeRef {
    private final String name;
    private final String modulePath;

    public SimpleType(SourceLocation location, String name) {
        this(location, name, "");
    }

    public SimpleType(SourceLocation location, String name, String modulePath) {
        super(location);
        this.name = name;
        this.modulePath = modulePath != null ? modulePath : "";
    }

    public String getName() {
        return name;
    }

    public String getModulePath() {
        return modulePath;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitSimple(this);
    }
}

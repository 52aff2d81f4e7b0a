package com.tmlang.compiler.ast.type;

import com.tmlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 带类型实参的类型（如 List[I32], Map[K, V]）
 */
public final class GenericTypeRef extends TypeRef {
    private final String name;
    private final String modulePath;
    private final List<TypeRef> typeArgs;

    public GenericTypeRef(SourceLocation location, String name, List<TypeRef> typeArgs) {
        this(location, name, "", typeArgs);
    }

    public GenericTypeRef(SourceLocation location, String name, String modulePath, List<TypeRef> typeArgs) {
        super(location);
        this.name = name;
        this.modulePath = modulePath != null ? modulePath : "";
        this.typeArgs = typeArgs;
    }

    public String getName() {
        return name;
    }

    public String getModulePath() {
        return modulePath;
    }

    public List<TypeRef> getTypeArgs() {
        return typeArgs;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitGeneric(this);
    }
}

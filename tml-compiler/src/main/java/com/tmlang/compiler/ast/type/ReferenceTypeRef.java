package com.tmlang.compiler.ast.type;

import com.tmlang.compiler.ast.SourceLocation;

/**
 * 引用类型 ref T / ref mut T
 */
public final class ReferenceTypeRef extends TypeRef {
    private final TypeRef inner;
    private final boolean mutable;

    public ReferenceTypeRef(SourceLocation location, TypeRef inner, boolean mutable) {
        super(location);
        this.inner = inner;
        this.mutable = mutable;
    }

    public TypeRef getInner() {
        return inner;
    }

    public boolean isMutable() {
        return mutable;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitReference(this);
    }
}

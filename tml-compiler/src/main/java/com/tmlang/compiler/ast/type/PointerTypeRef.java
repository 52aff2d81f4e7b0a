package com.tmlang.compiler.ast.type;

import com.tmlang.compiler.ast.SourceLocation;

/**
 * 指针类型 ptr T / ptr mut T
 */
public final class PointerTypeRef extends TypeRef {
    private final TypeRef inner;
    private final boolean mutable;

    public PointerTypeRef(SourceLocation location, TypeRef inner, boolean mutable) {
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
        return visitor.visitPointer(this);
    }
}

package com.tmlang.compiler.ast.type;

import com.tmlang.compiler.ast.SourceLocation;

/**
 * 切片类型 [T]
 */
public final class SliceTypeRef extends TypeRef {
    private final TypeRef element;

    public SliceTypeRef(SourceLocation location, TypeRef element) {
        super(location);
        this.element = element;
    }

    public TypeRef getElement() {
        return element;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitSlice(this);
    }
}

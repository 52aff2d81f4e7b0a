package com.tmlang.compiler.ast.type;

import com.tmlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 元组类型 (A, B)
 */
public final class TupleTypeRef extends TypeRef {
    private final List<TypeRef> elements;

    public TupleTypeRef(SourceLocation location, List<TypeRef> elements) {
        super(location);
        this.elements = elements;
    }

    public List<TypeRef> getElements() {
        return elements;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitTuple(this);
    }
}

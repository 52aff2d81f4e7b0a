package com.tmlang.compiler.ast.type;

import com.tmlang.compiler.ast.SourceLocation;
import com.tmlang.compiler.ast.expr.Expression;

/**
 * 定长数组类型 [T; N]，N 为常量表达式，在语义分析时求值
 */
public final class ArrayTypeRef extends TypeRef {
    private final TypeRef element;
    private final Expression size;

    public ArrayTypeRef(SourceLocation location, TypeRef element, Expression size) {
        super(location);
        this.element = element;
        this.size = size;
    }

    public TypeRef getElement() {
        return element;
    }

    public Expression getSize() {
        return size;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitArray(this);
    }
}

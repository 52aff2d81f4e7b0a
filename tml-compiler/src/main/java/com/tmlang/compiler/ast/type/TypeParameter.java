package com.tmlang.compiler.ast.type;

import com.tmlang.compiler.ast.AstNode;
import com.tmlang.compiler.ast.AstVisitor;
import com.tmlang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 类型参数声明（如 [T: Ord + Display], [T: life static], [const N: U64]）
 */
public final class TypeParameter extends AstNode {
    private final String name;
    private final List<TypeRef> bounds;      // 行为约束，可带参数: Comparable[T]
    private final String lifetimeBound;      // life static，null 表示无
    private final TypeRef constType;         // const 泛型参数的类型，null 表示类型参数

    public TypeParameter(SourceLocation location, String name, List<TypeRef> bounds) {
        this(location, name, bounds, null, null);
    }

    public TypeParameter(SourceLocation location, String name, List<TypeRef> bounds,
                         String lifetimeBound, TypeRef constType) {
        super(location);
        this.name = name;
        this.bounds = bounds != null ? bounds : Collections.<TypeRef>emptyList();
        this.lifetimeBound = lifetimeBound;
        this.constType = constType;
    }

    public String getName() {
        return name;
    }

    public List<TypeRef> getBounds() {
        return bounds;
    }

    public String getLifetimeBound() {
        return lifetimeBound;
    }

    public boolean isConst() {
        return constType != null;
    }

    public TypeRef getConstType() {
        return constType;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return null;
    }
}

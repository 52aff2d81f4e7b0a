package com.tmlang.compiler.ast.type;

import com.tmlang.compiler.ast.AstNode;
import com.tmlang.compiler.ast.AstVisitor;
import com.tmlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * where 子句约束: where T: Hash + Eq
 */
public final class WhereClause extends AstNode {
    private final String typeParam;
    private final List<TypeRef> bounds;

    public WhereClause(SourceLocation location, String typeParam, List<TypeRef> bounds) {
        super(location);
        this.typeParam = typeParam;
        this.bounds = bounds;
    }

    public String getTypeParam() {
        return typeParam;
    }

    public List<TypeRef> getBounds() {
        return bounds;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return null;
    }
}

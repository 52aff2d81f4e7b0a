package com.tmlang.compiler.ast.type;

import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.ast.AstNode;
import com.tmlang.compiler.ast.AstVisitor;
import com.tmlang.compiler.ast.SourceLocation;

/**
 * 类型引用基类
 */
public abstract class TypeRef extends AstNode {
    // 语义分析后解析的结构化类型
    protected TmlType resolvedType;

    protected TypeRef(SourceLocation location) {
        super(location);
    }

    public TmlType getResolvedType() {
        return resolvedType;
    }

    public void setResolvedType(TmlType type) {
        this.resolvedType = type;
    }

    /** 接受轻量 TypeRefVisitor 进行类型引用分派 */
    public abstract <R> R accept(TypeRefVisitor<R> visitor);

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return null;
    }
}

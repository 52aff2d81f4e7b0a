package com.tmlang.compiler.ast.decl;

import com.tmlang.compiler.ast.AstNode;
import com.tmlang.compiler.ast.AstVisitor;
import com.tmlang.compiler.ast.SourceLocation;
import com.tmlang.compiler.ast.type.TypeRef;

/**
 * 函数参数
 */
public class Parameter extends AstNode {
    private final String name;
    private final TypeRef type;
    private final boolean mutable;

    public Parameter(SourceLocation location, String name, TypeRef type) {
        this(location, name, type, false);
    }

    public Parameter(SourceLocation location, String name, TypeRef type, boolean mutable) {
        super(location);
        this.name = name;
        this.type = type;
        this.mutable = mutable;
    }

    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }

    public boolean isMutable() {
        return mutable;
    }

    /** 隐式接收者参数 this */
    public boolean isReceiver() {
        return "this".equals(name);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameter(this, context);
    }
}

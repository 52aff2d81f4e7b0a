package com.tmlang.compiler.ast.decl;

import com.tmlang.compiler.ast.AstVisitor;
import com.tmlang.compiler.ast.SourceLocation;
import com.tmlang.compiler.ast.expr.Expression;
import com.tmlang.compiler.ast.type.TypeRef;

/**
 * 常量声明 const NAME: T = expr
 */
public class ConstDecl extends Declaration {
    private final TypeRef type;
    private final Expression value;

    public ConstDecl(SourceLocation location, String name, TypeRef type, Expression value) {
        super(location, null, null, name);
        this.type = type;
        this.value = value;
    }

    public TypeRef getType() {
        return type;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConstDecl(this, context);
    }
}

package com.tmlang.compiler.ast.stmt;

import com.tmlang.compiler.ast.AstVisitor;
import com.tmlang.compiler.ast.SourceLocation;
import com.tmlang.compiler.ast.expr.Expression;
import com.tmlang.compiler.ast.type.TypeRef;

/**
 * 局部变量绑定 let [mut] name[: T] = init
 */
public class LetStmt extends Statement {
    private final String name;
    private final boolean mutable;
    private final TypeRef type;          // 可选
    private final Expression initializer;

    public LetStmt(SourceLocation location, String name, boolean mutable, TypeRef type, Expression initializer) {
        super(location);
        this.name = name;
        this.mutable = mutable;
        this.type = type;
        this.initializer = initializer;
    }

    public String getName() {
        return name;
    }

    public boolean isMutable() {
        return mutable;
    }

    public TypeRef getType() {
        return type;
    }

    public Expression getInitializer() {
        return initializer;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLetStmt(this, context);
    }
}

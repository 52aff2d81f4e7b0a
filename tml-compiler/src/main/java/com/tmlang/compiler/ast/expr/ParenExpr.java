package com.tmlang.compiler.ast.expr;

import com.tmlang.compiler.ast.AstVisitor;
import com.tmlang.compiler.ast.SourceLocation;

/**
 * 括号表达式
 */
public class ParenExpr extends Expression {
    private final Expression inner;

    public ParenExpr(SourceLocation location, Expression inner) {
        super(location);
        this.inner = inner;
    }

    public Expression getInner() {
        return inner;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParenExpr(this, context);
    }
}

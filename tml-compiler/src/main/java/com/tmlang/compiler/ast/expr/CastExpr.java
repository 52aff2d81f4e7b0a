package com.tmlang.compiler.ast.expr;

import com.tmlang.compiler.ast.AstVisitor;
import com.tmlang.compiler.ast.SourceLocation;
import com.tmlang.compiler.ast.type.TypeRef;

/**
 * 类型转换表达式 x as T
 */
public class CastExpr extends Expression {
    private final Expression expression;
    private final TypeRef targetType;

    public CastExpr(SourceLocation location, Expression expression, TypeRef targetType) {
        super(location);
        this.expression = expression;
        this.targetType = targetType;
    }

    public Expression getExpression() {
        return expression;
    }

    public TypeRef getTargetType() {
        return targetType;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCastExpr(this, context);
    }
}

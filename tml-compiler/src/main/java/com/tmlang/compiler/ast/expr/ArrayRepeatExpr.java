package com.tmlang.compiler.ast.expr;

import com.tmlang.compiler.ast.AstVisitor;
import com.tmlang.compiler.ast.SourceLocation;

/**
 * 重复数组字面量 [value; count]，count 必须是编译期常量
 */
public class ArrayRepeatExpr extends Expression {
    private final Expression value;
    private final Expression count;

    public ArrayRepeatExpr(SourceLocation location, Expression value, Expression count) {
        super(location);
        this.value = value;
        this.count = count;
    }

    public Expression getValue() {
        return value;
    }

    public Expression getCount() {
        return count;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayRepeatExpr(this, context);
    }
}

package com.tmlang.compiler.ast.expr;

import com.tmlang.compiler.ast.AstVisitor;
import com.tmlang.compiler.ast.SourceLocation;

/**
 * 成员访问表达式 target.member
 */
public class MemberExpr extends Expression {
    private final Expression target;
    private final String member;

    public MemberExpr(SourceLocation location, Expression target, String member) {
        super(location);
        this.target = target;
        this.member = member;
    }

    public Expression getTarget() {
        return target;
    }

    public String getMember() {
        return member;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMemberExpr(this, context);
    }
}

package com.tmlang.compiler.ast.expr;

import com.tmlang.compiler.ast.AstVisitor;
import com.tmlang.compiler.ast.SourceLocation;
import com.tmlang.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 函数调用表达式: f(a, b) / f[I32](a) / obj.method(a)
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<TypeRef> typeArgs;
    private final List<Expression> args;

    public CallExpr(SourceLocation location, Expression callee, List<Expression> args) {
        this(location, callee, Collections.<TypeRef>emptyList(), args);
    }

    public CallExpr(SourceLocation location, Expression callee, List<TypeRef> typeArgs,
                    List<Expression> args) {
        super(location);
        this.callee = callee;
        this.typeArgs = typeArgs != null ? typeArgs : Collections.<TypeRef>emptyList();
        this.args = args;
    }

    public Expression getCallee() {
        return callee;
    }

    public List<TypeRef> getTypeArgs() {
        return typeArgs;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}

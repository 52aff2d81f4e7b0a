package com.tmlang.compiler.ast.expr;

import com.tmlang.compiler.ast.AstVisitor;
import com.tmlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 数组字面量 [a, b, c]
 */
public class ArrayExpr extends Expression {
    private final List<Expression> elements;

    public ArrayExpr(SourceLocation location, List<Expression> elements) {
        super(location);
        this.elements = elements;
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayExpr(this, context);
    }
}

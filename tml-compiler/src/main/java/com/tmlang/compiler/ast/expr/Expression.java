package com.tmlang.compiler.ast.expr;

import com.tmlang.compiler.ast.AstNode;
import com.tmlang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}

package com.tmlang.compiler.ast.stmt;

import com.tmlang.compiler.ast.AstNode;
import com.tmlang.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}

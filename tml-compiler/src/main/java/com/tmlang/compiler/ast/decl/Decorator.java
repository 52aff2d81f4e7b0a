package com.tmlang.compiler.ast.decl;

import com.tmlang.compiler.ast.AstNode;
import com.tmlang.compiler.ast.AstVisitor;
import com.tmlang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 装饰器 @value / @pool / @sealed(...)
 */
public final class Decorator extends AstNode {
    private final String name;
    private final List<String> args;

    public Decorator(SourceLocation location, String name) {
        this(location, name, Collections.<String>emptyList());
    }

    public Decorator(SourceLocation location, String name, List<String> args) {
        super(location);
        this.name = name;
        this.args = args;
    }

    public String getName() {
        return name;
    }

    public List<String> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return null;
    }
}

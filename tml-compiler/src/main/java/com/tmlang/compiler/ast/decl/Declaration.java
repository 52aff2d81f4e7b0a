package com.tmlang.compiler.ast.decl;

import com.tmlang.compiler.ast.AstNode;
import com.tmlang.compiler.ast.Modifier;
import com.tmlang.compiler.ast.SourceLocation;
import com.tmlang.compiler.ast.Visibility;

import java.util.Collections;
import java.util.List;

/**
 * 声明基类
 */
public abstract class Declaration extends AstNode {
    protected final List<Decorator> decorators;
    protected final List<Modifier> modifiers;
    protected final String name;

    protected Declaration(SourceLocation location, List<Decorator> decorators,
                          List<Modifier> modifiers, String name) {
        super(location);
        this.decorators = decorators != null ? decorators : Collections.<Decorator>emptyList();
        this.modifiers = modifiers != null ? modifiers : Collections.<Modifier>emptyList();
        this.name = name;
    }

    public List<Decorator> getDecorators() {
        return decorators;
    }

    public List<Modifier> getModifiers() {
        return modifiers;
    }

    public String getName() {
        return name;
    }

    public boolean hasModifier(Modifier modifier) {
        return modifiers.contains(modifier);
    }

    /** 是否带有指定名称的装饰器（不含 @） */
    public boolean hasDecorator(String decoratorName) {
        for (Decorator d : decorators) {
            if (d.getName().equals(decoratorName)) return true;
        }
        return false;
    }

    public Visibility getVisibility() {
        return Visibility.of(modifiers);
    }
}

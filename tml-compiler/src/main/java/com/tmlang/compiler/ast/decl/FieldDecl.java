package com.tmlang.compiler.ast.decl;

import com.tmlang.compiler.ast.AstVisitor;
import com.tmlang.compiler.ast.Modifier;
import com.tmlang.compiler.ast.SourceLocation;
import com.tmlang.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 类/结构体字段
 */
public class FieldDecl extends Declaration {
    private final TypeRef type;

    public FieldDecl(SourceLocation location, List<Modifier> modifiers, String name, TypeRef type) {
        super(location, null, modifiers, name);
        this.type = type;
    }

    public TypeRef getType() {
        return type;
    }

    public boolean isStatic() {
        return hasModifier(Modifier.STATIC);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFieldDecl(this, context);
    }
}

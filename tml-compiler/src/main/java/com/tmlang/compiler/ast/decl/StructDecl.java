package com.tmlang.compiler.ast.decl;

import com.tmlang.compiler.ast.AstVisitor;
import com.tmlang.compiler.ast.SourceLocation;
import com.tmlang.compiler.ast.type.TypeParameter;

import java.util.Collections;
import java.util.List;

/**
 * 结构体声明（值语义）
 */
public class StructDecl extends Declaration {
    private final List<TypeParameter> typeParams;
    private final List<FieldDecl> fields;

    public StructDecl(SourceLocation location, List<Decorator> decorators, String name,
                      List<TypeParameter> typeParams, List<FieldDecl> fields) {
        super(location, decorators, null, name);
        this.typeParams = typeParams != null ? typeParams : Collections.<TypeParameter>emptyList();
        this.fields = fields;
    }

    public List<TypeParameter> getTypeParams() {
        return typeParams;
    }

    public List<FieldDecl> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructDecl(this, context);
    }
}

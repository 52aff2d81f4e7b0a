package com.tmlang.compiler.ast.decl;

import com.tmlang.compiler.ast.AstVisitor;
import com.tmlang.compiler.ast.Modifier;
import com.tmlang.compiler.ast.SourceLocation;
import com.tmlang.compiler.ast.type.TypeParameter;
import com.tmlang.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 类声明: [@value] [@pool] [abstract|sealed] class Name[T] extends Base implements I1, I2 { ... }
 */
public class ClassDecl extends Declaration {
    private final List<TypeParameter> typeParams;
    private final TypeRef baseClass;           // 可选
    private final List<TypeRef> interfaces;
    private final List<FieldDecl> fields;
    private final List<FunDecl> methods;
    private final List<FunDecl> constructors;

    public ClassDecl(SourceLocation location, List<Decorator> decorators, List<Modifier> modifiers,
                     String name, List<TypeParameter> typeParams, TypeRef baseClass,
                     List<TypeRef> interfaces, List<FieldDecl> fields, List<FunDecl> methods,
                     List<FunDecl> constructors) {
        super(location, decorators, modifiers, name);
        this.typeParams = typeParams != null ? typeParams : Collections.<TypeParameter>emptyList();
        this.baseClass = baseClass;
        this.interfaces = interfaces != null ? interfaces : Collections.<TypeRef>emptyList();
        this.fields = fields != null ? fields : Collections.<FieldDecl>emptyList();
        this.methods = methods != null ? methods : Collections.<FunDecl>emptyList();
        this.constructors = constructors != null ? constructors : Collections.<FunDecl>emptyList();
    }

    public List<TypeParameter> getTypeParams() {
        return typeParams;
    }

    public TypeRef getBaseClass() {
        return baseClass;
    }

    public List<TypeRef> getInterfaces() {
        return interfaces;
    }

    public List<FieldDecl> getFields() {
        return fields;
    }

    public List<FunDecl> getMethods() {
        return methods;
    }

    public List<FunDecl> getConstructors() {
        return constructors;
    }

    public boolean isAbstract() {
        return hasModifier(Modifier.ABSTRACT);
    }

    public boolean isSealed() {
        return hasModifier(Modifier.SEALED);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitClassDecl(this, context);
    }
}

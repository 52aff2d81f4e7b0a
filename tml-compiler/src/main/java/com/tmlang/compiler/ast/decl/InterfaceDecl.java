package com.tmlang.compiler.ast.decl;

import com.tmlang.compiler.ast.AstVisitor;
import com.tmlang.compiler.ast.SourceLocation;
import com.tmlang.compiler.ast.type.TypeParameter;
import com.tmlang.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 接口声明，方法带 body 即为默认实现
 */
public class InterfaceDecl extends Declaration {
    private final List<TypeParameter> typeParams;
    private final List<TypeRef> extendsList;
    private final List<FunDecl> methods;

    public InterfaceDecl(SourceLocation location, List<Decorator> decorators, String name,
                         List<TypeParameter> typeParams, List<TypeRef> extendsList, List<FunDecl> methods) {
        super(location, decorators, null, name);
        this.typeParams = typeParams != null ? typeParams : Collections.<TypeParameter>emptyList();
        this.extendsList = extendsList != null ? extendsList : Collections.<TypeRef>emptyList();
        this.methods = methods;
    }

    public List<TypeParameter> getTypeParams() {
        return typeParams;
    }

    public List<TypeRef> getExtendsList() {
        return extendsList;
    }

    public List<FunDecl> getMethods() {
        return methods;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitInterfaceDecl(this, context);
    }
}

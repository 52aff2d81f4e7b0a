package com.tmlang.compiler.ast.decl;

import com.tmlang.compiler.ast.AstVisitor;
import com.tmlang.compiler.ast.SourceLocation;
import com.tmlang.compiler.ast.type.TypeParameter;
import com.tmlang.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 行为实现 impl[T] Behavior[Args] for Target { ... }；behavior 为 null 时为固有实现
 */
public class ImplDecl extends Declaration {
    private final List<TypeParameter> typeParams;
    private final TypeRef behavior;
    private final TypeRef target;
    private final List<FunDecl> methods;

    public ImplDecl(SourceLocation location, List<TypeParameter> typeParams, TypeRef behavior,
                    TypeRef target, List<FunDecl> methods) {
        super(location, null, null, "impl");
        this.typeParams = typeParams != null ? typeParams : Collections.<TypeParameter>emptyList();
        this.behavior = behavior;
        this.target = target;
        this.methods = methods != null ? methods : Collections.<FunDecl>emptyList();
    }

    public List<TypeParameter> getTypeParams() {
        return typeParams;
    }

    public TypeRef getBehavior() {
        return behavior;
    }

    public TypeRef getTarget() {
        return target;
    }

    public List<FunDecl> getMethods() {
        return methods;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImplDecl(this, context);
    }
}

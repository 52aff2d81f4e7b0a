package com.tmlang.compiler.ast.decl;

import com.tmlang.compiler.ast.AstVisitor;
import com.tmlang.compiler.ast.Modifier;
import com.tmlang.compiler.ast.SourceLocation;
import com.tmlang.compiler.ast.stmt.Block;
import com.tmlang.compiler.ast.type.TypeParameter;
import com.tmlang.compiler.ast.type.TypeRef;
import com.tmlang.compiler.ast.type.WhereClause;

import java.util.Collections;
import java.util.List;

/**
 * 函数/方法声明。方法的第一个参数可以是隐式接收者 this。
 */
public class FunDecl extends Declaration {
    private final List<TypeParameter> typeParams;
    private final List<Parameter> params;
    private final TypeRef returnType;        // 可选，null 表示 Unit
    private final List<WhereClause> whereClauses;
    private final Block body;                // 抽象方法/接口方法无默认实现时为 null

    public FunDecl(SourceLocation location, List<Decorator> decorators, List<Modifier> modifiers,
                   String name, List<TypeParameter> typeParams, List<Parameter> params,
                   TypeRef returnType, Block body) {
        this(location, decorators, modifiers, name, typeParams, params, returnType,
                Collections.<WhereClause>emptyList(), body);
    }

    public FunDecl(SourceLocation location, List<Decorator> decorators, List<Modifier> modifiers,
                   String name, List<TypeParameter> typeParams, List<Parameter> params,
                   TypeRef returnType, List<WhereClause> whereClauses, Block body) {
        super(location, decorators, modifiers, name);
        this.typeParams = typeParams != null ? typeParams : Collections.<TypeParameter>emptyList();
        this.params = params;
        this.returnType = returnType;
        this.whereClauses = whereClauses != null ? whereClauses : Collections.<WhereClause>emptyList();
        this.body = body;
    }

    public List<TypeParameter> getTypeParams() {
        return typeParams;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    public List<WhereClause> getWhereClauses() {
        return whereClauses;
    }

    public Block getBody() {
        return body;
    }

    public boolean hasBody() {
        return body != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunDecl(this, context);
    }
}

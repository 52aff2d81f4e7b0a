package com.tmlang.compiler.ast.decl;

import com.tmlang.compiler.ast.AstVisitor;
import com.tmlang.compiler.ast.SourceLocation;
import com.tmlang.compiler.ast.type.TypeParameter;
import com.tmlang.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 枚举声明（带载荷的标签联合）
 */
public class EnumDecl extends Declaration {
    private final List<TypeParameter> typeParams;
    private final List<Variant> variants;

    public EnumDecl(SourceLocation location, List<Decorator> decorators, String name,
                    List<TypeParameter> typeParams, List<Variant> variants) {
        super(location, decorators, null, name);
        this.typeParams = typeParams != null ? typeParams : Collections.<TypeParameter>emptyList();
        this.variants = variants;
    }

    public List<TypeParameter> getTypeParams() {
        return typeParams;
    }

    public List<Variant> getVariants() {
        return variants;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEnumDecl(this, context);
    }

    /** 枚举变体: Just(T) / Nothing */
    public static final class Variant {
        private final String name;
        private final List<TypeRef> payload;

        public Variant(String name, List<TypeRef> payload) {
            this.name = name;
            this.payload = payload != null ? payload : Collections.<TypeRef>emptyList();
        }

        public String getName() { return name; }
        public List<TypeRef> getPayload() { return payload; }
    }
}

package com.tmlang.compiler.ast.type;

import com.tmlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 行为类型：impl Behavior[Args] 或 dyn Behavior[Args]
 */
public final class BehaviorTypeRef extends TypeRef {

    public enum Kind { IMPL, DYN }

    private final Kind kind;
    private final String behavior;
    private final List<TypeRef> typeArgs;

    public BehaviorTypeRef(SourceLocation location, Kind kind, String behavior, List<TypeRef> typeArgs) {
        super(location);
        this.kind = kind;
        this.behavior = behavior;
        this.typeArgs = typeArgs;
    }

    public Kind getKind() {
        return kind;
    }

    public String getBehavior() {
        return behavior;
    }

    public List<TypeRef> getTypeArgs() {
        return typeArgs;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitBehavior(this);
    }
}

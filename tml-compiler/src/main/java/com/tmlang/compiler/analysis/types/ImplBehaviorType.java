package com.tmlang.compiler.analysis.types;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 存在类型 impl Behavior[Args]：接受任意实现该行为的命名类型
 */
public final class ImplBehaviorType extends TmlType {

    private final String behavior;
    private final List<TmlType> typeArgs;

    public ImplBehaviorType(String behavior, List<TmlType> typeArgs) {
        this.behavior = behavior;
        this.typeArgs = typeArgs != null
                ? Collections.unmodifiableList(typeArgs) : Collections.<TmlType>emptyList();
    }

    public String getBehavior() {
        return behavior;
    }

    public List<TmlType> getTypeArgs() {
        return typeArgs;
    }

    @Override
    public String toDisplayString() {
        return "impl " + behavior + TypeFormatter.formatArgs(typeArgs);
    }

    @Override
    public <R> R accept(TmlTypeVisitor<R> visitor) {
        return visitor.visitImplBehavior(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImplBehaviorType)) return false;
        ImplBehaviorType that = (ImplBehaviorType) o;
        return behavior.equals(that.behavior) && typeArgs.equals(that.typeArgs);
    }

    @Override
    public int hashCode() {
        return Objects.hash("impl", behavior, typeArgs);
    }
}

package com.tmlang.compiler.analysis.types;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 动态行为对象 dyn Behavior[Args]，表示为 { 数据指针, vtable 指针 }
 */
public final class DynBehaviorType extends TmlType {

    private final String behavior;
    private final List<TmlType> typeArgs;

    public DynBehaviorType(String behavior, List<TmlType> typeArgs) {
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
        return "dyn " + behavior + TypeFormatter.formatArgs(typeArgs);
    }

    @Override
    public <R> R accept(TmlTypeVisitor<R> visitor) {
        return visitor.visitDynBehavior(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DynBehaviorType)) return false;
        DynBehaviorType that = (DynBehaviorType) o;
        return behavior.equals(that.behavior) && typeArgs.equals(that.typeArgs);
    }

    @Override
    public int hashCode() {
        return Objects.hash("dyn", behavior, typeArgs);
    }
}

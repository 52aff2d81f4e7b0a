package com.tmlang.compiler.analysis.types;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 命名类型：用户 struct/enum 或行为类型值，可含类型参数: Pair[I32], List[T]。
 * modulePath 为空串表示当前模块。
 */
public final class NamedType extends TmlType {

    private final String name;
    private final List<TmlType> typeArgs;
    private final String modulePath;

    public NamedType(String name, List<TmlType> typeArgs, String modulePath) {
        this.name = name;
        this.typeArgs = typeArgs != null
                ? Collections.unmodifiableList(typeArgs) : Collections.<TmlType>emptyList();
        this.modulePath = modulePath != null ? modulePath : "";
    }

    public String getName() {
        return name;
    }

    public List<TmlType> getTypeArgs() {
        return typeArgs;
    }

    public boolean hasTypeArgs() {
        return !typeArgs.isEmpty();
    }

    public String getModulePath() {
        return modulePath;
    }

    @Override
    public String toDisplayString() {
        return name + TypeFormatter.formatArgs(typeArgs);
    }

    @Override
    public <R> R accept(TmlTypeVisitor<R> visitor) {
        return visitor.visitNamed(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NamedType)) return false;
        NamedType that = (NamedType) o;
        return name.equals(that.name) && typeArgs.equals(that.typeArgs)
                && modulePath.equals(that.modulePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, typeArgs, modulePath);
    }
}

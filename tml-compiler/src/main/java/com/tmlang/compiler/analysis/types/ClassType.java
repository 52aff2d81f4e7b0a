package com.tmlang.compiler.analysis.types;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 类类型（引用语义对象），可含类型参数。
 */
public final class ClassType extends TmlType {

    private final String name;
    private final List<TmlType> typeArgs;

    public ClassType(String name, List<TmlType> typeArgs) {
        this.name = name;
        this.typeArgs = typeArgs != null
                ? Collections.unmodifiableList(typeArgs) : Collections.<TmlType>emptyList();
    }

    public String getName() {
        return name;
    }

    public List<TmlType> getTypeArgs() {
        return typeArgs;
    }

    @Override
    public String toDisplayString() {
        return name + TypeFormatter.formatArgs(typeArgs);
    }

    @Override
    public <R> R accept(TmlTypeVisitor<R> visitor) {
        return visitor.visitClass(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClassType)) return false;
        ClassType that = (ClassType) o;
        return name.equals(that.name) && typeArgs.equals(that.typeArgs);
    }

    @Override
    public int hashCode() {
        return Objects.hash("class", name, typeArgs);
    }
}

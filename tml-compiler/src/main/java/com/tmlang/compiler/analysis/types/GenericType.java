package com.tmlang.compiler.analysis.types;

/**
 * 泛型类型参数引用（如函数签名中的 T），实例化时由替换映射替换。
 */
public final class GenericType extends TmlType {

    private final String name;

    public GenericType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toDisplayString() {
        return name;
    }

    @Override
    public <R> R accept(TmlTypeVisitor<R> visitor) {
        return visitor.visitGeneric(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GenericType)) return false;
        return name.equals(((GenericType) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 13;
    }
}

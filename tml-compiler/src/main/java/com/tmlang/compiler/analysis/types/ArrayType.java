package com.tmlang.compiler.analysis.types;

import java.util.Objects;

/**
 * 定长数组 [T; N]，长度为编译期常量。
 */
public final class ArrayType extends TmlType {

    private final TmlType element;
    private final long size;

    public ArrayType(TmlType element, long size) {
        if (size < 0) {
            throw new IllegalArgumentException("array size must not be negative: " + size);
        }
        this.element = element;
        this.size = size;
    }

    public TmlType getElement() {
        return element;
    }

    public long getSize() {
        return size;
    }

    @Override
    public String toDisplayString() {
        return "[" + element.toDisplayString() + "; " + size + "]";
    }

    @Override
    public <R> R accept(TmlTypeVisitor<R> visitor) {
        return visitor.visitArray(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayType)) return false;
        ArrayType that = (ArrayType) o;
        return size == that.size && element.equals(that.element);
    }

    @Override
    public int hashCode() {
        return Objects.hash(element, size);
    }
}

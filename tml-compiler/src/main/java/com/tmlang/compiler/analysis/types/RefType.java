package com.tmlang.compiler.analysis.types;

import java.util.Objects;

/**
 * 引用类型 ref T / ref mut T
 */
public final class RefType extends TmlType {

    private final TmlType inner;
    private final boolean mutable;

    public RefType(TmlType inner, boolean mutable) {
        this.inner = inner;
        this.mutable = mutable;
    }

    public TmlType getInner() {
        return inner;
    }

    public boolean isMutable() {
        return mutable;
    }

    @Override
    public String toDisplayString() {
        return (mutable ? "ref mut " : "ref ") + inner.toDisplayString();
    }

    @Override
    public <R> R accept(TmlTypeVisitor<R> visitor) {
        return visitor.visitRef(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RefType)) return false;
        RefType that = (RefType) o;
        return mutable == that.mutable && inner.equals(that.inner);
    }

    @Override
    public int hashCode() {
        return Objects.hash("ref", inner, mutable);
    }
}

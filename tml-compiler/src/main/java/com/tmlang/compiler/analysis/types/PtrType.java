package com.tmlang.compiler.analysis.types;

import java.util.Objects;

/**
 * 裸指针类型 ptr T / ptr mut T。指向 Unit 的指针表示 null。
 */
public final class PtrType extends TmlType {

    private final TmlType inner;
    private final boolean mutable;

    public PtrType(TmlType inner, boolean mutable) {
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
        return (mutable ? "ptr mut " : "ptr ") + inner.toDisplayString();
    }

    @Override
    public <R> R accept(TmlTypeVisitor<R> visitor) {
        return visitor.visitPtr(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PtrType)) return false;
        PtrType that = (PtrType) o;
        return mutable == that.mutable && inner.equals(that.inner);
    }

    @Override
    public int hashCode() {
        return Objects.hash("ptr", inner, mutable);
    }
}

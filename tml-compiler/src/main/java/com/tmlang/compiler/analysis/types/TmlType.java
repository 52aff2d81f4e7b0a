package com.tmlang.compiler.analysis.types;

/**
 * 结构化类型表示基类。
 * <p>
 * 类型实例构造后不可变，可在各阶段之间共享引用；相等性为结构相等。
 */
public abstract class TmlType {

    protected TmlType() {
    }

    /** 人类可读的类型名，用于诊断消息 */
    public abstract String toDisplayString();

    /** 接受 TmlTypeVisitor 进行类型分派 */
    public abstract <R> R accept(TmlTypeVisitor<R> visitor);

    @Override
    public String toString() {
        return toDisplayString();
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();
}

package com.tmlang.compiler.analysis.types;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 闭包类型：参数、返回值以及捕获变量列表（每个捕获带可变性）。
 * 运行时表示为 { 代码指针, 环境指针 } 二元组。
 */
public final class ClosureType extends TmlType {

    /** 捕获的变量 */
    public static final class Capture {
        private final String name;
        private final TmlType type;
        private final boolean mutable;

        public Capture(String name, TmlType type, boolean mutable) {
            this.name = name;
            this.type = type;
            this.mutable = mutable;
        }

        public String getName() { return name; }
        public TmlType getType() { return type; }
        public boolean isMutable() { return mutable; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Capture)) return false;
            Capture that = (Capture) o;
            return mutable == that.mutable && name.equals(that.name) && type.equals(that.type);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, type, mutable);
        }
    }

    private final List<TmlType> params;
    private final TmlType returnType;
    private final List<Capture> captures;

    public ClosureType(List<TmlType> params, TmlType returnType, List<Capture> captures) {
        this.params = Collections.unmodifiableList(params);
        this.returnType = returnType;
        this.captures = captures != null
                ? Collections.unmodifiableList(captures) : Collections.<Capture>emptyList();
    }

    public List<TmlType> getParams() {
        return params;
    }

    public TmlType getReturnType() {
        return returnType;
    }

    public List<Capture> getCaptures() {
        return captures;
    }

    @Override
    public String toDisplayString() {
        return "do" + TypeFormatter.formatParams(params) + " -> " + returnType.toDisplayString();
    }

    @Override
    public <R> R accept(TmlTypeVisitor<R> visitor) {
        return visitor.visitClosure(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClosureType)) return false;
        ClosureType that = (ClosureType) o;
        return params.equals(that.params) && returnType.equals(that.returnType)
                && captures.equals(that.captures);
    }

    @Override
    public int hashCode() {
        return Objects.hash("closure", params, returnType, captures);
    }
}

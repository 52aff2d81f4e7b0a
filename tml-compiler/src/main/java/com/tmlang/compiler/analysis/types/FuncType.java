package com.tmlang.compiler.analysis.types;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 函数类型 func(A, B) -> R
 */
public final class FuncType extends TmlType {

    private final List<TmlType> params;
    private final TmlType returnType;

    public FuncType(List<TmlType> params, TmlType returnType) {
        this.params = Collections.unmodifiableList(params);
        this.returnType = returnType;
    }

    public List<TmlType> getParams() {
        return params;
    }

    public TmlType getReturnType() {
        return returnType;
    }

    @Override
    public String toDisplayString() {
        return "func" + TypeFormatter.formatParams(params) + " -> " + returnType.toDisplayString();
    }

    @Override
    public <R> R accept(TmlTypeVisitor<R> visitor) {
        return visitor.visitFunc(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FuncType)) return false;
        FuncType that = (FuncType) o;
        return params.equals(that.params) && returnType.equals(that.returnType);
    }

    @Override
    public int hashCode() {
        return Objects.hash("func", params, returnType);
    }
}

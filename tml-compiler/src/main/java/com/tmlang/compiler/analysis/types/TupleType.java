package com.tmlang.compiler.analysis.types;

import java.util.Collections;
import java.util.List;

/**
 * 元组类型 (A, B, C)，空元组与 Unit 不同。
 */
public final class TupleType extends TmlType {

    private final List<TmlType> elements;

    public TupleType(List<TmlType> elements) {
        this.elements = Collections.unmodifiableList(elements);
    }

    public List<TmlType> getElements() {
        return elements;
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(elements.get(i).toDisplayString());
        }
        return sb.append(')').toString();
    }

    @Override
    public <R> R accept(TmlTypeVisitor<R> visitor) {
        return visitor.visitTuple(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TupleType)) return false;
        return elements.equals(((TupleType) o).elements);
    }

    @Override
    public int hashCode() {
        return 31 * elements.hashCode() + 7;
    }
}

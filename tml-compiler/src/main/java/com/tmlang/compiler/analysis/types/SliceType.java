package com.tmlang.compiler.analysis.types;

/**
 * 切片 [T]，无长度信息。
 */
public final class SliceType extends TmlType {

    private final TmlType element;

    public SliceType(TmlType element) {
        this.element = element;
    }

    public TmlType getElement() {
        return element;
    }

    @Override
    public String toDisplayString() {
        return "[" + element.toDisplayString() + "]";
    }

    @Override
    public <R> R accept(TmlTypeVisitor<R> visitor) {
        return visitor.visitSlice(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SliceType)) return false;
        return element.equals(((SliceType) o).element);
    }

    @Override
    public int hashCode() {
        return 17 * element.hashCode() + 3;
    }
}

package com.tmlang.compiler.analysis.types;

/**
 * 原始类型：定宽整数、浮点、Bool、Char、Str、Unit、Never。
 */
public final class PrimitiveType extends TmlType {

    private final PrimitiveKind kind;

    PrimitiveType(PrimitiveKind kind) {
        this.kind = kind;
    }

    public PrimitiveKind getKind() {
        return kind;
    }

    @Override
    public String toDisplayString() {
        return kind.getTypeName();
    }

    @Override
    public <R> R accept(TmlTypeVisitor<R> visitor) {
        return visitor.visitPrimitive(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PrimitiveType)) return false;
        return kind == ((PrimitiveType) o).kind;
    }

    @Override
    public int hashCode() {
        return kind.hashCode();
    }
}

package com.tmlang.compiler.analysis.types;

/**
 * 推断占位类型变量，绑定关系保存在 {@link TypeVarBindings} 中。
 * 降级前必须被解析或默认化，不能出现在输出里。
 */
public final class TypeVar extends TmlType {

    private final int id;

    public TypeVar(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    @Override
    public String toDisplayString() {
        return "?" + id;
    }

    @Override
    public <R> R accept(TmlTypeVisitor<R> visitor) {
        return visitor.visitTypeVar(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeVar)) return false;
        return id == ((TypeVar) o).id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id) * 31 + 1;
    }
}

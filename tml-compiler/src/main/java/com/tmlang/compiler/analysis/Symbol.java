package com.tmlang.compiler.analysis;

import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.ast.SourceLocation;

/**
 * 作用域中的符号
 */
public final class Symbol {
    private final String name;
    private final SymbolKind kind;
    private final TmlType type;
    private final boolean mutable;
    private final SourceLocation location;

    public Symbol(String name, SymbolKind kind, TmlType type, boolean mutable, SourceLocation location) {
        this.name = name;
        this.kind = kind;
        this.type = type;
        this.mutable = mutable;
        this.location = location;
    }

    public String getName() { return name; }
    public SymbolKind getKind() { return kind; }
    public TmlType getType() { return type; }
    public boolean isMutable() { return mutable; }
    public SourceLocation getLocation() { return location; }

    @Override
    public String toString() {
        return kind + " " + name + ": " + type;
    }
}

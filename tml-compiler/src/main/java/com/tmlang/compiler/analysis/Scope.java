package com.tmlang.compiler.analysis;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 作用域
 */
public final class Scope {

    public enum ScopeType {
        GLOBAL,     // 顶层
        CLASS,      // class body
        FUNCTION,   // function body
        BLOCK       // 嵌套块
    }

    private final ScopeType type;
    private final Scope parent;
    private final Map<String, Symbol> symbols = new LinkedHashMap<String, Symbol>();

    // 所属类型名（class scope 中 = 类名，用于 this 与可见性检查）
    private String ownerTypeName;

    public Scope(ScopeType type, Scope parent) {
        this.type = type;
        this.parent = parent;
    }

    public ScopeType getType() { return type; }
    public Scope getParent() { return parent; }
    public Map<String, Symbol> getSymbols() { return symbols; }

    public String getOwnerTypeName() { return ownerTypeName; }
    public void setOwnerTypeName(String ownerTypeName) { this.ownerTypeName = ownerTypeName; }

    /** 注册符号到当前作用域 */
    public void define(Symbol symbol) {
        symbols.put(symbol.getName(), symbol);
    }

    /** 从当前作用域向上查找 */
    public Symbol resolve(String name) {
        Symbol s = symbols.get(name);
        if (s != null) return s;
        if (parent != null) return parent.resolve(name);
        return null;
    }

    /** 仅查找当前作用域 */
    public Symbol resolveLocal(String name) {
        return symbols.get(name);
    }

    /** 查找最近的类作用域的 ownerTypeName */
    public String getEnclosingTypeName() {
        if (type == ScopeType.CLASS) return ownerTypeName;
        if (parent != null) return parent.getEnclosingTypeName();
        return null;
    }
}

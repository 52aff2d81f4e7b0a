package com.tmlang.compiler.ast;

import java.util.Collection;

/**
 * 成员可见性，未声明时为 PUBLIC。
 */
public enum Visibility {
    PUBLIC,
    PROTECTED,
    PRIVATE;

    public static Visibility of(Collection<Modifier> modifiers) {
        if (modifiers.contains(Modifier.PRIVATE)) return PRIVATE;
        if (modifiers.contains(Modifier.PROTECTED)) return PROTECTED;
        return PUBLIC;
    }
}

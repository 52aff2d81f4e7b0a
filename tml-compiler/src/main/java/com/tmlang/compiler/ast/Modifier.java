package com.tmlang.compiler.ast;

/**
 * 声明修饰符
 */
public enum Modifier {
    // 可见性
    PUBLIC,
    PRIVATE,
    PROTECTED,

    // 类与成员
    STATIC,
    VIRTUAL,
    OVERRIDE,
    ABSTRACT,
    FINAL,
    SEALED
}

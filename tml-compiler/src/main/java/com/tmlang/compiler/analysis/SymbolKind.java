package com.tmlang.compiler.analysis;

/**
 * 符号类型
 */
public enum SymbolKind {
    VARIABLE,           // let 局部变量
    PARAMETER,          // 函数参数
    CONSTANT,           // const 声明
    CONST_GENERIC,      // const 泛型参数，实例化前值未知
    TYPE_PARAMETER      // 泛型类型参数
}

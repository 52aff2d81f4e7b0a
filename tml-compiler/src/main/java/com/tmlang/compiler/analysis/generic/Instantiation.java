package com.tmlang.compiler.analysis.generic;

import com.tmlang.compiler.analysis.types.TmlType;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 一次调用点的实例化结果：替换映射、替换后的形参/返回类型与实例符号名。
 */
public final class Instantiation {
    private final String calleeName;
    private final Map<String, TmlType> substitution;
    private final List<TmlType> typeArgs;
    private final List<TmlType> paramTypes;
    private final TmlType returnType;
    private final String mangledName;
    private final List<String> unboundParams;

    public Instantiation(String calleeName, Map<String, TmlType> substitution, List<TmlType> typeArgs,
                         List<TmlType> paramTypes, TmlType returnType, String mangledName,
                         List<String> unboundParams) {
        this.calleeName = calleeName;
        this.substitution = Collections.unmodifiableMap(substitution);
        this.typeArgs = Collections.unmodifiableList(typeArgs);
        this.paramTypes = Collections.unmodifiableList(paramTypes);
        this.returnType = returnType;
        this.mangledName = mangledName;
        this.unboundParams = Collections.unmodifiableList(unboundParams);
    }

    public String getCalleeName() { return calleeName; }

    /** 有序的 参数名 → 具体类型 */
    public Map<String, TmlType> getSubstitution() { return substitution; }

    /** 按声明顺序排列的类型实参，未绑定的参数保留为泛型参数 */
    public List<TmlType> getTypeArgs() { return typeArgs; }
    public List<TmlType> getParamTypes() { return paramTypes; }
    public TmlType getReturnType() { return returnType; }
    public String getMangledName() { return mangledName; }

    /** 推断后仍未绑定的类型参数 */
    public List<String> getUnboundParams() { return unboundParams; }

    public boolean isComplete() {
        return unboundParams.isEmpty();
    }
}

package com.tmlang.compiler.analysis.types;

import java.util.List;

/**
 * 类型相等与兼容性判断。
 * <p>
 * 兼容性比相等宽松：支持部分推断、整数字面量强制转换、null 指针、数组到切片等。
 * 行为约束是否真正满足由约束检查器负责，这里只做形状判断。
 * 两个方法均为全函数，不抛异常。
 */
public final class TypeCompatibility {

    private TypeCompatibility() {}

    /** 结构相等，用于 override 签名等需要严格匹配的场合 */
    public static boolean typesEqual(TmlType a, TmlType b) {
        if (a == null || b == null) return a == b;
        return a.equals(b);
    }

    /**
     * 判断 actual 能否用在期望 expected 的位置。
     */
    public static boolean isCompatible(TmlType expected, TmlType actual) {
        if (expected == null || actual == null) return false;
        if (expected.equals(actual)) return true;

        // 类型变量兼容任意类型
        if (expected instanceof TypeVar || actual instanceof TypeVar) return true;

        // 整数之间、浮点之间互相兼容
        if (expected instanceof PrimitiveType && actual instanceof PrimitiveType) {
            PrimitiveKind e = ((PrimitiveType) expected).getKind();
            PrimitiveKind a = ((PrimitiveType) actual).getKind();
            if (e.isInteger() && a.isInteger()) return true;
            if (e.isFloat() && a.isFloat()) return true;
            return false;
        }

        // null 可赋给任意指针，两侧均可
        if (Types.isNullPointer(actual) && Types.isPointerLike(expected)) return true;
        if (Types.isNullPointer(expected) && Types.isPointerLike(actual)) return true;

        if (actual instanceof ArrayType) {
            ArrayType array = (ArrayType) actual;
            if (expected instanceof SliceType) {
                return isCompatible(((SliceType) expected).getElement(), array.getElement());
            }
            if (expected instanceof ArrayType) {
                ArrayType exp = (ArrayType) expected;
                return exp.getSize() == array.getSize()
                        && isCompatible(exp.getElement(), array.getElement());
            }
            if (expected instanceof NamedType) {
                NamedType named = (NamedType) expected;
                if (("List".equals(named.getName()) || "Slice".equals(named.getName()))
                        && named.getTypeArgs().size() == 1) {
                    return isCompatible(named.getTypeArgs().get(0), array.getElement());
                }
            }
            return false;
        }

        // 闭包可用于参数与返回类型完全相同的函数类型
        if (expected instanceof FuncType && actual instanceof ClosureType) {
            FuncType func = (FuncType) expected;
            ClosureType closure = (ClosureType) actual;
            return paramsEqual(func.getParams(), closure.getParams())
                    && typesEqual(func.getReturnType(), closure.getReturnType());
        }

        // impl Behavior 接受任意命名类型，约束由检查器验证
        if (expected instanceof ImplBehaviorType) {
            return actual instanceof NamedType || actual instanceof ClassType;
        }

        return false;
    }

    private static boolean paramsEqual(List<TmlType> a, List<TmlType> b) {
        if (a.size() != b.size()) return false;
        for (int i = 0; i < a.size(); i++) {
            if (!typesEqual(a.get(i), b.get(i))) return false;
        }
        return true;
    }
}

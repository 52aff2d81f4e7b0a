package com.tmlang.compiler.analysis.types;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 预定义类型常量和工厂方法。
 */
public final class Types {

    private Types() {}

    public static final PrimitiveType I8 = new PrimitiveType(PrimitiveKind.I8);
    public static final PrimitiveType I16 = new PrimitiveType(PrimitiveKind.I16);
    public static final PrimitiveType I32 = new PrimitiveType(PrimitiveKind.I32);
    public static final PrimitiveType I64 = new PrimitiveType(PrimitiveKind.I64);
    public static final PrimitiveType I128 = new PrimitiveType(PrimitiveKind.I128);
    public static final PrimitiveType U8 = new PrimitiveType(PrimitiveKind.U8);
    public static final PrimitiveType U16 = new PrimitiveType(PrimitiveKind.U16);
    public static final PrimitiveType U32 = new PrimitiveType(PrimitiveKind.U32);
    public static final PrimitiveType U64 = new PrimitiveType(PrimitiveKind.U64);
    public static final PrimitiveType U128 = new PrimitiveType(PrimitiveKind.U128);
    public static final PrimitiveType F32 = new PrimitiveType(PrimitiveKind.F32);
    public static final PrimitiveType F64 = new PrimitiveType(PrimitiveKind.F64);
    public static final PrimitiveType BOOL = new PrimitiveType(PrimitiveKind.BOOL);
    public static final PrimitiveType CHAR = new PrimitiveType(PrimitiveKind.CHAR);
    public static final PrimitiveType STR = new PrimitiveType(PrimitiveKind.STR);
    public static final PrimitiveType UNIT = new PrimitiveType(PrimitiveKind.UNIT);
    public static final PrimitiveType NEVER = new PrimitiveType(PrimitiveKind.NEVER);

    private static final PrimitiveType[] PRIMITIVES = {
            I8, I16, I32, I64, I128, U8, U16, U32, U64, U128, F32, F64, BOOL, CHAR, STR, UNIT, NEVER
    };

    /** null 指针字面量的类型：ptr Unit */
    public static final PtrType NULL_PTR = new PtrType(UNIT, false);

    public static PrimitiveType primitive(PrimitiveKind kind) {
        return PRIMITIVES[kind.ordinal()];
    }

    /** 根据类型名查找原始类型，非原始类型名返回 null */
    public static PrimitiveType fromName(String name) {
        PrimitiveKind kind = PrimitiveKind.fromName(name);
        return kind != null ? primitive(kind) : null;
    }

    public static List<PrimitiveType> allPrimitives() {
        return Collections.unmodifiableList(Arrays.asList(PRIMITIVES));
    }

    public static NamedType named(String name, TmlType... args) {
        return new NamedType(name, Arrays.asList(args), "");
    }

    public static NamedType named(String name, List<TmlType> args) {
        return new NamedType(name, args, "");
    }

    public static ClassType classType(String name, TmlType... args) {
        return new ClassType(name, Arrays.asList(args));
    }

    public static RefType ref(TmlType inner) {
        return new RefType(inner, false);
    }

    public static RefType mutRef(TmlType inner) {
        return new RefType(inner, true);
    }

    public static PtrType ptr(TmlType inner) {
        return new PtrType(inner, false);
    }

    public static PtrType mutPtr(TmlType inner) {
        return new PtrType(inner, true);
    }

    public static TupleType tuple(TmlType... elements) {
        return new TupleType(Arrays.asList(elements));
    }

    public static ArrayType array(TmlType element, long size) {
        return new ArrayType(element, size);
    }

    public static SliceType slice(TmlType element) {
        return new SliceType(element);
    }

    public static FuncType func(List<TmlType> params, TmlType ret) {
        return new FuncType(params, ret);
    }

    public static GenericType generic(String name) {
        return new GenericType(name);
    }

    public static ImplBehaviorType implBehavior(String behavior, TmlType... args) {
        return new ImplBehaviorType(behavior, Arrays.asList(args));
    }

    // ============ 种类判断 ============

    public static PrimitiveKind kindOf(TmlType type) {
        return type instanceof PrimitiveType ? ((PrimitiveType) type).getKind() : null;
    }

    public static boolean isInteger(TmlType type) {
        PrimitiveKind kind = kindOf(type);
        return kind != null && kind.isInteger();
    }

    public static boolean isSignedInteger(TmlType type) {
        PrimitiveKind kind = kindOf(type);
        return kind != null && kind.isSignedInteger();
    }

    public static boolean isUnsignedInteger(TmlType type) {
        PrimitiveKind kind = kindOf(type);
        return kind != null && kind.isUnsignedInteger();
    }

    public static boolean isFloat(TmlType type) {
        PrimitiveKind kind = kindOf(type);
        return kind != null && kind.isFloat();
    }

    public static boolean isNumeric(TmlType type) {
        PrimitiveKind kind = kindOf(type);
        return kind != null && kind.isNumeric();
    }

    public static boolean isBool(TmlType type) {
        return kindOf(type) == PrimitiveKind.BOOL;
    }

    public static boolean isUnit(TmlType type) {
        return kindOf(type) == PrimitiveKind.UNIT;
    }

    /** ptr Unit，即 null */
    public static boolean isNullPointer(TmlType type) {
        return type instanceof PtrType && isUnit(((PtrType) type).getInner());
    }

    /** PtrType 或单参数的 Named "Ptr" */
    public static boolean isPointerLike(TmlType type) {
        if (type instanceof PtrType) return true;
        if (type instanceof NamedType) {
            NamedType named = (NamedType) type;
            return "Ptr".equals(named.getName()) && named.getTypeArgs().size() == 1;
        }
        return false;
    }

    // ============ 结构查询 ============

    public static boolean containsTypeVar(TmlType type) {
        return contains(type, new Predicate() {
            @Override
            public boolean test(TmlType t) { return t instanceof TypeVar; }
        });
    }

    public static boolean containsGeneric(TmlType type) {
        return contains(type, new Predicate() {
            @Override
            public boolean test(TmlType t) { return t instanceof GenericType; }
        });
    }

    public static boolean containsReference(TmlType type) {
        return contains(type, new Predicate() {
            @Override
            public boolean test(TmlType t) { return t instanceof RefType; }
        });
    }

    /** occurs check：var 是否出现在 type 中 */
    public static boolean occurs(final TypeVar var, TmlType type) {
        return contains(type, new Predicate() {
            @Override
            public boolean test(TmlType t) { return var.equals(t); }
        });
    }

    /** 所有类型变量替换为 Unit */
    public static TmlType defaultTypeVars(TmlType type) {
        return new TypeTransformer() {
            @Override
            public TmlType visitTypeVar(TypeVar var) {
                return UNIT;
            }
        }.transform(type);
    }

    private interface Predicate {
        boolean test(TmlType type);
    }

    private static boolean contains(TmlType type, final Predicate predicate) {
        if (type == null) return false;
        final boolean[] found = {false};
        new TypeTransformer() {
            @Override
            public TmlType transform(TmlType t) {
                if (found[0] || t == null) return t;
                if (predicate.test(t)) {
                    found[0] = true;
                    return t;
                }
                return super.transform(t);
            }
        }.transform(type);
        return found[0];
    }
}

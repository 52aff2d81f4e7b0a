package com.tmlang.compiler.analysis.generic;

import com.tmlang.compiler.analysis.types.ArrayType;
import com.tmlang.compiler.analysis.types.ClassType;
import com.tmlang.compiler.analysis.types.ClosureType;
import com.tmlang.compiler.analysis.types.DynBehaviorType;
import com.tmlang.compiler.analysis.types.FuncType;
import com.tmlang.compiler.analysis.types.GenericType;
import com.tmlang.compiler.analysis.types.ImplBehaviorType;
import com.tmlang.compiler.analysis.types.NamedType;
import com.tmlang.compiler.analysis.types.PrimitiveType;
import com.tmlang.compiler.analysis.types.PtrType;
import com.tmlang.compiler.analysis.types.RefType;
import com.tmlang.compiler.analysis.types.SliceType;
import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.analysis.types.TmlTypeVisitor;
import com.tmlang.compiler.analysis.types.TupleType;
import com.tmlang.compiler.analysis.types.TypeVar;
import com.tmlang.compiler.cache.BoundedCache;
import com.tmlang.compiler.cache.CaffeineCache;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 泛型实例的确定性符号修饰。
 * <p>
 * 相同的基名与有序类型实参总是得到同一个名字（并从缓存返回同一实例），
 * 后端可据此去重单态化结果。
 * <pre>
 *   I32                 → I32
 *   Pair[I32, Str]      → Pair__I32__Str
 *   Maybe[List[I32]]    → Maybe__List_1_I32
 *   dyn Iter[I32]       → dyn_Iter__I32
 *   ref mut T           → mutref_T
 *   [U8; 4]             → arr_U8_4
 *   (I32, Bool)         → tuple_I32_Bool
 *   identity + [I32]    → identity__I32
 * </pre>
 */
public final class NameMangler {

    public static final int DEFAULT_CACHE_SIZE = 1024;

    private final BoundedCache<List<Object>, String> cache;

    public NameMangler() {
        this(DEFAULT_CACHE_SIZE);
    }

    public NameMangler(long cacheSize) {
        this.cache = new CaffeineCache<List<Object>, String>(cacheSize);
    }

    /** 修饰单个类型 */
    public static String mangleType(TmlType type) {
        if (type == null) return "Unit";
        return type.accept(TOP_LEVEL);
    }

    /** 修饰类型实参列表：A__B__C，元素按嵌套形式修饰 */
    public static String mangleArgs(List<TmlType> args) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append("__");
            sb.append(mangleNested(args.get(i)));
        }
        return sb.toString();
    }

    private static String mangleNested(TmlType type) {
        if (type == null) return "Unit";
        return type.accept(NESTED);
    }

    /**
     * 函数实例名：base__A__B；无类型实参时返回 base。
     */
    public String mangleFuncName(final String base, final List<TmlType> typeArgs) {
        if (typeArgs == null || typeArgs.isEmpty()) return base;
        List<Object> key = Arrays.<Object>asList(base, Collections.unmodifiableList(new ArrayList<TmlType>(typeArgs)));
        return cache.computeIfAbsent(key, k -> base + "__" + mangleArgs(typeArgs));
    }

    /** 泛型结构体/枚举实例名，规则与函数相同 */
    public String mangleTypeName(String base, List<TmlType> typeArgs) {
        return mangleFuncName(base, typeArgs);
    }

    public BoundedCache<List<Object>, String> getCache() {
        return cache;
    }

    /**
     * 顶层与嵌套两种形式。嵌套位置上带实参的类型写出实参个数，
     * 如 f[Pair[I32], Str] 为 f__Pair_1_I32__Str，f[Pair[I32, Str]] 为 f__Pair_2_I32__Str。
     */
    private static final class MangleVisitor implements TmlTypeVisitor<String> {

        private final boolean nested;

        MangleVisitor(boolean nested) {
            this.nested = nested;
        }

        private String withArgs(String head, List<TmlType> args) {
            if (args.isEmpty()) return head;
            if (nested) return head + "_" + args.size() + "_" + mangleArgs(args);
            return head + "__" + mangleArgs(args);
        }

        private String joinMangled(String prefix, List<TmlType> types) {
            StringBuilder sb = new StringBuilder(prefix);
            if (nested) sb.append('_').append(types.size());
            for (TmlType t : types) sb.append('_').append(mangleNested(t));
            return sb.toString();
        }

        @Override
        public String visitPrimitive(PrimitiveType type) {
            return type.getKind().getTypeName();
        }

        @Override
        public String visitNamed(NamedType type) {
            return withArgs(type.getName(), type.getTypeArgs());
        }

        @Override
        public String visitRef(RefType type) {
            return (type.isMutable() ? "mutref_" : "ref_") + mangleNested(type.getInner());
        }

        @Override
        public String visitPtr(PtrType type) {
            return (type.isMutable() ? "mutptr_" : "ptr_") + mangleNested(type.getInner());
        }

        @Override
        public String visitTuple(TupleType type) {
            if (type.getElements().isEmpty()) return "tuple_empty";
            return joinMangled("tuple", type.getElements());
        }

        @Override
        public String visitArray(ArrayType type) {
            return "arr_" + mangleNested(type.getElement()) + "_" + type.getSize();
        }

        @Override
        public String visitSlice(SliceType type) {
            return "slice_" + mangleNested(type.getElement());
        }

        @Override
        public String visitFunc(FuncType type) {
            return joinMangled("fn", type.getParams()) + "_ret_" + mangleNested(type.getReturnType());
        }

        @Override
        public String visitClosure(ClosureType type) {
            return joinMangled("closure", type.getParams()) + "_ret_" + mangleNested(type.getReturnType());
        }

        @Override
        public String visitClass(ClassType type) {
            return withArgs(type.getName(), type.getTypeArgs());
        }

        @Override
        public String visitImplBehavior(ImplBehaviorType type) {
            return withArgs("impl_" + type.getBehavior(), type.getTypeArgs());
        }

        @Override
        public String visitDynBehavior(DynBehaviorType type) {
            return withArgs("dyn_" + type.getBehavior(), type.getTypeArgs());
        }

        @Override
        public String visitGeneric(GenericType type) {
            return type.getName();
        }

        @Override
        public String visitTypeVar(TypeVar type) {
            // 未解析的类型变量不应到达此处
            return "Unit";
        }
    }

    private static final MangleVisitor TOP_LEVEL = new MangleVisitor(false);
    private static final MangleVisitor NESTED = new MangleVisitor(true);
}

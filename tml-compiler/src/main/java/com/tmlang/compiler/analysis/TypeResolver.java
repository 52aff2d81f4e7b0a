package com.tmlang.compiler.analysis;

import com.tmlang.compiler.analysis.env.ModuleTable;
import com.tmlang.compiler.analysis.env.TypeEnvironment;
import com.tmlang.compiler.analysis.types.ArrayType;
import com.tmlang.compiler.analysis.types.ClassType;
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
import com.tmlang.compiler.analysis.types.TupleType;
import com.tmlang.compiler.analysis.types.Types;
import com.tmlang.compiler.ast.type.ArrayTypeRef;
import com.tmlang.compiler.ast.type.BehaviorTypeRef;
import com.tmlang.compiler.ast.type.FunctionTypeRef;
import com.tmlang.compiler.ast.type.GenericTypeRef;
import com.tmlang.compiler.ast.type.PointerTypeRef;
import com.tmlang.compiler.ast.type.ReferenceTypeRef;
import com.tmlang.compiler.ast.type.SimpleType;
import com.tmlang.compiler.ast.type.SliceTypeRef;
import com.tmlang.compiler.ast.type.TupleTypeRef;
import com.tmlang.compiler.ast.type.TypeParameter;
import com.tmlang.compiler.ast.type.TypeRef;
import com.tmlang.compiler.ast.type.TypeRefVisitor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * TypeRef → TmlType 解析。
 * <p>
 * 顶层声明名在注册前预先登记（{@link #predeclare}），因此前向引用可以正确解析。
 * 无法解析的类型报告 T006 并回退为 Unit。
 */
public final class TypeResolver {

    /** 预声明的种类 */
    public enum DeclKind { CLASS, STRUCT, ENUM, INTERFACE }

    /** 标准库泛型容器等内置命名类型，无需声明即可使用 */
    private static final Set<String> BUILTIN_NAMED = new HashSet<String>(Arrays.asList(
            "List", "Slice", "Ptr", "Maybe", "Outcome", "HashMap", "Ordering", "Heap", "Shared", "Sync"));

    /** 语言内置行为，原始类型的实现由环境预先登记 */
    public static final Set<String> BUILTIN_BEHAVIORS = new HashSet<String>(Arrays.asList(
            "Eq", "PartialEq", "Ord", "PartialOrd", "Copy", "Clone", "Hash", "Debug", "Display", "Default",
            "Add", "Sub", "Mul", "Div", "Rem", "Neg", "BitAnd", "BitOr", "BitXor", "Shl", "Shr"));

    private final TypeEnvironment env;
    private final SemanticChecker checker;
    private final ConstEvaluator constEvaluator;
    private final Map<String, DeclKind> predeclared = new HashMap<String, DeclKind>();
    private final Deque<Set<String>> typeParamScopes = new ArrayDeque<Set<String>>();

    public TypeResolver(TypeEnvironment env, SemanticChecker checker, ConstEvaluator constEvaluator) {
        this.env = env;
        this.checker = checker;
        this.constEvaluator = constEvaluator;
    }

    public void predeclare(String name, DeclKind kind) {
        predeclared.put(name, kind);
    }

    public DeclKind getDeclKind(String name) {
        return predeclared.get(name);
    }

    // ============ 泛型参数作用域 ============

    public void enterTypeParams(List<TypeParameter> params) {
        Set<String> names = new HashSet<String>();
        for (TypeParameter tp : params) {
            if (!tp.isConst()) names.add(tp.getName());
        }
        typeParamScopes.push(names);
    }

    public void enterTypeParamNames(List<String> names) {
        typeParamScopes.push(new HashSet<String>(names));
    }

    public void exitTypeParams() {
        typeParamScopes.pop();
    }

    public boolean isTypeParam(String name) {
        for (Set<String> scope : typeParamScopes) {
            if (scope.contains(name)) return true;
        }
        return false;
    }

    // ============ 解析 ============

    /** 解析类型引用，null 表示 Unit */
    public TmlType resolve(TypeRef ref) {
        if (ref == null) return Types.UNIT;
        TmlType type = ref.accept(visitor);
        ref.setResolvedType(type);
        return type;
    }

    public List<TmlType> resolveAll(List<TypeRef> refs) {
        List<TmlType> result = new ArrayList<TmlType>(refs.size());
        for (TypeRef ref : refs) result.add(resolve(ref));
        return result;
    }

    private TmlType resolveName(TypeRef ref, String name, String modulePath, List<TmlType> args) {
        if (modulePath != null && !modulePath.isEmpty()) {
            ModuleTable module = env.getModule(modulePath);
            if (module == null) {
                checker.error(ErrorCodes.UNKNOWN_TYPE, "Unknown module '" + modulePath + "'", ref);
                return Types.UNIT;
            }
            if (module.getClass(name) != null) return new ClassType(name, args);
            if (module.hasType(name)) return new NamedType(name, args, modulePath);
            checker.error(ErrorCodes.UNKNOWN_TYPE,
                    "Unknown type '" + modulePath + "::" + name + "'", ref);
            return Types.UNIT;
        }

        if (args.isEmpty()) {
            PrimitiveType prim = Types.fromName(name);
            if (prim != null) return prim;
            if (isTypeParam(name)) return new GenericType(name);
        }

        DeclKind kind = predeclared.get(name);
        if (kind == null) {
            if (env.lookupClass(name) != null) kind = DeclKind.CLASS;
            else if (env.lookupStruct(name) != null) kind = DeclKind.STRUCT;
            else if (env.lookupEnum(name) != null) kind = DeclKind.ENUM;
            else if (env.lookupInterface(name) != null) kind = DeclKind.INTERFACE;
        }
        if (kind == DeclKind.CLASS) return new ClassType(name, args);
        if (kind != null || BUILTIN_NAMED.contains(name)) return new NamedType(name, args, "");

        checker.error(ErrorCodes.UNKNOWN_TYPE, "Unknown type '" + name + "'", ref);
        return Types.UNIT;
    }

    /** 内置命名类型（List、Maybe 等） */
    public static boolean isBuiltinNamed(String name) {
        return BUILTIN_NAMED.contains(name);
    }

    /** 行为名是否已知：内置行为或已声明的接口 */
    public boolean isKnownBehavior(String name) {
        return BUILTIN_BEHAVIORS.contains(name) || predeclared.get(name) == DeclKind.INTERFACE
                || env.lookupInterface(name) != null;
    }

    private final TypeRefVisitor<TmlType> visitor = new TypeRefVisitor<TmlType>() {
        @Override
        public TmlType visitSimple(SimpleType type) {
            return resolveName(type, type.getName(), type.getModulePath(), Collections.<TmlType>emptyList());
        }

        @Override
        public TmlType visitGeneric(GenericTypeRef type) {
            return resolveName(type, type.getName(), type.getModulePath(), resolveAll(type.getTypeArgs()));
        }

        @Override
        public TmlType visitReference(ReferenceTypeRef type) {
            return new RefType(resolve(type.getInner()), type.isMutable());
        }

        @Override
        public TmlType visitPointer(PointerTypeRef type) {
            return new PtrType(resolve(type.getInner()), type.isMutable());
        }

        @Override
        public TmlType visitTuple(TupleTypeRef type) {
            if (type.getElements().isEmpty()) return Types.UNIT;
            return new TupleType(resolveAll(type.getElements()));
        }

        @Override
        public TmlType visitArray(ArrayTypeRef type) {
            TmlType element = resolve(type.getElement());
            long size = constEvaluator.evaluateArraySize(type.getSize());
            // 长度未知（const 泛型）时按切片处理
            if (size < 0) return new SliceType(element);
            return new ArrayType(element, size);
        }

        @Override
        public TmlType visitSlice(SliceTypeRef type) {
            return new SliceType(resolve(type.getElement()));
        }

        @Override
        public TmlType visitFunction(FunctionTypeRef type) {
            return new FuncType(resolveAll(type.getParamTypes()), resolve(type.getReturnType()));
        }

        @Override
        public TmlType visitBehavior(BehaviorTypeRef type) {
            List<TmlType> args = resolveAll(type.getTypeArgs());
            if (!isKnownBehavior(type.getBehavior())) {
                checker.error(ErrorCodes.UNKNOWN_TYPE, "Unknown behavior '" + type.getBehavior() + "'", type);
            }
            if (type.getKind() == BehaviorTypeRef.Kind.DYN) {
                return new DynBehaviorType(type.getBehavior(), args);
            }
            return new ImplBehaviorType(type.getBehavior(), args);
        }
    };
}

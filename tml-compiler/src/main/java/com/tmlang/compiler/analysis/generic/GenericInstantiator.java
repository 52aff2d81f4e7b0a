package com.tmlang.compiler.analysis.generic;

import com.tmlang.compiler.analysis.env.FuncSig;
import com.tmlang.compiler.analysis.types.ArrayType;
import com.tmlang.compiler.analysis.types.ClassType;
import com.tmlang.compiler.analysis.types.ClosureType;
import com.tmlang.compiler.analysis.types.FuncType;
import com.tmlang.compiler.analysis.types.GenericType;
import com.tmlang.compiler.analysis.types.NamedType;
import com.tmlang.compiler.analysis.types.PtrType;
import com.tmlang.compiler.analysis.types.RefType;
import com.tmlang.compiler.analysis.types.SliceType;
import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.analysis.types.TupleType;
import com.tmlang.compiler.analysis.types.TypeTransformer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 泛型实例化：实参类型与形参类型结构化统一得到替换映射，再替换返回类型并生成实例名。
 * <p>
 * 调用点显式给出的类型实参先写入映射，推断结果不会覆盖它们。
 */
public final class GenericInstantiator {

    private static final Logger LOG = Logger.getLogger(GenericInstantiator.class.getName());

    private final NameMangler mangler;

    public GenericInstantiator() {
        this(new NameMangler());
    }

    public GenericInstantiator(NameMangler mangler) {
        this.mangler = mangler;
    }

    public NameMangler getMangler() {
        return mangler;
    }

    /**
     * 实例化一次调用。
     *
     * @param explicitTypeArgs 调用点显式类型实参（按声明顺序），可为空
     * @param argTypes         实参类型
     */
    public Instantiation instantiateCall(FuncSig sig, List<TmlType> explicitTypeArgs, List<TmlType> argTypes) {
        Map<String, TmlType> subst = new LinkedHashMap<String, TmlType>();
        List<String> typeParams = sig.getTypeParams();

        int explicitCount = explicitTypeArgs != null ? Math.min(explicitTypeArgs.size(), typeParams.size()) : 0;
        for (int i = 0; i < explicitCount; i++) {
            subst.put(typeParams.get(i), explicitTypeArgs.get(i));
        }

        int count = Math.min(sig.getParams().size(), argTypes.size());
        for (int i = 0; i < count; i++) {
            unify(sig.getParams().get(i), argTypes.get(i), typeParams, subst);
        }

        // 按声明顺序重排映射
        Map<String, TmlType> ordered = new LinkedHashMap<String, TmlType>();
        List<TmlType> typeArgs = new ArrayList<TmlType>();
        List<String> unbound = new ArrayList<String>();
        for (String tp : typeParams) {
            TmlType bound = subst.get(tp);
            if (bound != null) {
                ordered.put(tp, bound);
                typeArgs.add(bound);
            } else {
                unbound.add(tp);
                typeArgs.add(new GenericType(tp));
            }
        }

        List<TmlType> paramTypes = new ArrayList<TmlType>(sig.getParams().size());
        for (TmlType p : sig.getParams()) {
            paramTypes.add(substitute(p, ordered));
        }
        TmlType returnType = substitute(sig.getReturnType(), ordered);
        String mangled = mangler.mangleFuncName(sig.getName(), typeParams.isEmpty()
                ? new ArrayList<TmlType>() : typeArgs);
        LOG.finer("instantiate " + sig.getName() + " with " + ordered + " -> " + mangled);
        return new Instantiation(sig.getName(), ordered, typeArgs, paramTypes, returnType, mangled, unbound);
    }

    /**
     * 结构化统一形参类型与实参类型，收集绑定。已有绑定不会被覆盖。
     */
    public void unify(TmlType param, TmlType arg, Collection<String> typeParams, Map<String, TmlType> subst) {
        if (param == null || arg == null) return;

        String paramName = typeParamName(param, typeParams);
        if (paramName != null) {
            if (!subst.containsKey(paramName)) subst.put(paramName, arg);
            return;
        }

        if (param instanceof NamedType && arg instanceof NamedType) {
            NamedType p = (NamedType) param;
            NamedType a = (NamedType) arg;
            if (p.getName().equals(a.getName()) && p.getTypeArgs().size() == a.getTypeArgs().size()) {
                unifyAll(p.getTypeArgs(), a.getTypeArgs(), typeParams, subst);
            }
        } else if (param instanceof ClassType && arg instanceof ClassType) {
            ClassType p = (ClassType) param;
            ClassType a = (ClassType) arg;
            if (p.getName().equals(a.getName()) && p.getTypeArgs().size() == a.getTypeArgs().size()) {
                unifyAll(p.getTypeArgs(), a.getTypeArgs(), typeParams, subst);
            }
        } else if (param instanceof RefType && arg instanceof RefType) {
            unify(((RefType) param).getInner(), ((RefType) arg).getInner(), typeParams, subst);
        } else if (param instanceof PtrType && arg instanceof PtrType) {
            unify(((PtrType) param).getInner(), ((PtrType) arg).getInner(), typeParams, subst);
        } else if (param instanceof TupleType && arg instanceof TupleType) {
            List<TmlType> p = ((TupleType) param).getElements();
            List<TmlType> a = ((TupleType) arg).getElements();
            if (p.size() == a.size()) unifyAll(p, a, typeParams, subst);
        } else if (param instanceof ArrayType && arg instanceof ArrayType) {
            unify(((ArrayType) param).getElement(), ((ArrayType) arg).getElement(), typeParams, subst);
        } else if (param instanceof SliceType) {
            TmlType elem = ((SliceType) param).getElement();
            if (arg instanceof SliceType) {
                unify(elem, ((SliceType) arg).getElement(), typeParams, subst);
            } else if (arg instanceof ArrayType) {
                unify(elem, ((ArrayType) arg).getElement(), typeParams, subst);
            }
        } else if (param instanceof FuncType) {
            FuncType p = (FuncType) param;
            if (arg instanceof FuncType) {
                FuncType a = (FuncType) arg;
                if (p.getParams().size() == a.getParams().size()) unifyAll(p.getParams(), a.getParams(), typeParams, subst);
                unify(p.getReturnType(), a.getReturnType(), typeParams, subst);
            } else if (arg instanceof ClosureType) {
                ClosureType a = (ClosureType) arg;
                if (p.getParams().size() == a.getParams().size()) unifyAll(p.getParams(), a.getParams(), typeParams, subst);
                unify(p.getReturnType(), a.getReturnType(), typeParams, subst);
            }
        } else if (param instanceof ClosureType && arg instanceof ClosureType) {
            ClosureType p = (ClosureType) param;
            ClosureType a = (ClosureType) arg;
            if (p.getParams().size() == a.getParams().size()) unifyAll(p.getParams(), a.getParams(), typeParams, subst);
            unify(p.getReturnType(), a.getReturnType(), typeParams, subst);
        }
    }

    private void unifyAll(List<TmlType> params, List<TmlType> args, Collection<String> typeParams,
                          Map<String, TmlType> subst) {
        for (int i = 0; i < params.size(); i++) {
            unify(params.get(i), args.get(i), typeParams, subst);
        }
    }

    /** 裸类型参数名：GenericType 或无实参且名字是类型参数的 NamedType */
    private static String typeParamName(TmlType type, Collection<String> typeParams) {
        if (type instanceof GenericType) {
            String name = ((GenericType) type).getName();
            return typeParams.contains(name) ? name : null;
        }
        if (type instanceof NamedType) {
            NamedType named = (NamedType) type;
            if (!named.hasTypeArgs() && typeParams.contains(named.getName())) return named.getName();
        }
        return null;
    }

    /**
     * 递归替换类型中的类型参数，未绑定的名字原样保留。
     */
    public static TmlType substitute(TmlType type, final Map<String, TmlType> subst) {
        if (type == null || subst.isEmpty()) return type;
        return new TypeTransformer() {
            @Override
            public TmlType visitGeneric(GenericType generic) {
                TmlType bound = subst.get(generic.getName());
                return bound != null ? bound : generic;
            }

            @Override
            public TmlType visitNamed(NamedType named) {
                if (!named.hasTypeArgs()) {
                    TmlType bound = subst.get(named.getName());
                    if (bound != null) return bound;
                }
                return super.visitNamed(named);
            }
        }.transform(type);
    }
}

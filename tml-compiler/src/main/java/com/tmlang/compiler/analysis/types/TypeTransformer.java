package com.tmlang.compiler.analysis.types;

import java.util.ArrayList;
import java.util.List;

/**
 * 结构化重建访问者：默认递归变换所有子类型，子类型未变化时返回原实例。
 * 子类覆盖叶子节点（泛型参数、类型变量等）即可实现替换或解析。
 */
public abstract class TypeTransformer implements TmlTypeVisitor<TmlType> {

    public TmlType transform(TmlType type) {
        return type == null ? null : type.accept(this);
    }

    protected List<TmlType> transformAll(List<TmlType> types, boolean[] changed) {
        List<TmlType> result = new ArrayList<TmlType>(types.size());
        for (TmlType t : types) {
            TmlType sub = transform(t);
            if (sub != t) changed[0] = true;
            result.add(sub);
        }
        return result;
    }

    @Override
    public TmlType visitPrimitive(PrimitiveType type) {
        return type;
    }

    @Override
    public TmlType visitNamed(NamedType type) {
        boolean[] changed = {false};
        List<TmlType> args = transformAll(type.getTypeArgs(), changed);
        return changed[0] ? new NamedType(type.getName(), args, type.getModulePath()) : type;
    }

    @Override
    public TmlType visitRef(RefType type) {
        TmlType inner = transform(type.getInner());
        return inner != type.getInner() ? new RefType(inner, type.isMutable()) : type;
    }

    @Override
    public TmlType visitPtr(PtrType type) {
        TmlType inner = transform(type.getInner());
        return inner != type.getInner() ? new PtrType(inner, type.isMutable()) : type;
    }

    @Override
    public TmlType visitTuple(TupleType type) {
        boolean[] changed = {false};
        List<TmlType> elems = transformAll(type.getElements(), changed);
        return changed[0] ? new TupleType(elems) : type;
    }

    @Override
    public TmlType visitArray(ArrayType type) {
        TmlType elem = transform(type.getElement());
        return elem != type.getElement() ? new ArrayType(elem, type.getSize()) : type;
    }

    @Override
    public TmlType visitSlice(SliceType type) {
        TmlType elem = transform(type.getElement());
        return elem != type.getElement() ? new SliceType(elem) : type;
    }

    @Override
    public TmlType visitFunc(FuncType type) {
        boolean[] changed = {false};
        List<TmlType> params = transformAll(type.getParams(), changed);
        TmlType ret = transform(type.getReturnType());
        if (ret != type.getReturnType()) changed[0] = true;
        return changed[0] ? new FuncType(params, ret) : type;
    }

    @Override
    public TmlType visitClosure(ClosureType type) {
        boolean[] changed = {false};
        List<TmlType> params = transformAll(type.getParams(), changed);
        TmlType ret = transform(type.getReturnType());
        if (ret != type.getReturnType()) changed[0] = true;
        List<ClosureType.Capture> captures = new ArrayList<ClosureType.Capture>();
        for (ClosureType.Capture c : type.getCaptures()) {
            TmlType ct = transform(c.getType());
            if (ct != c.getType()) changed[0] = true;
            captures.add(ct == c.getType() ? c : new ClosureType.Capture(c.getName(), ct, c.isMutable()));
        }
        return changed[0] ? new ClosureType(params, ret, captures) : type;
    }

    @Override
    public TmlType visitClass(ClassType type) {
        boolean[] changed = {false};
        List<TmlType> args = transformAll(type.getTypeArgs(), changed);
        return changed[0] ? new ClassType(type.getName(), args) : type;
    }

    @Override
    public TmlType visitImplBehavior(ImplBehaviorType type) {
        boolean[] changed = {false};
        List<TmlType> args = transformAll(type.getTypeArgs(), changed);
        return changed[0] ? new ImplBehaviorType(type.getBehavior(), args) : type;
    }

    @Override
    public TmlType visitDynBehavior(DynBehaviorType type) {
        boolean[] changed = {false};
        List<TmlType> args = transformAll(type.getTypeArgs(), changed);
        return changed[0] ? new DynBehaviorType(type.getBehavior(), args) : type;
    }

    @Override
    public TmlType visitGeneric(GenericType type) {
        return type;
    }

    @Override
    public TmlType visitTypeVar(TypeVar type) {
        return type;
    }
}

package com.tmlang.compiler.analysis.types;

/**
 * TmlType 访问者接口，每个类型变体一个方法，新增变体时编译器会强制所有访问者补全分支。
 */
public interface TmlTypeVisitor<R> {
    R visitPrimitive(PrimitiveType type);
    R visitNamed(NamedType type);
    R visitRef(RefType type);
    R visitPtr(PtrType type);
    R visitTuple(TupleType type);
    R visitArray(ArrayType type);
    R visitSlice(SliceType type);
    R visitFunc(FuncType type);
    R visitClosure(ClosureType type);
    R visitClass(ClassType type);
    R visitImplBehavior(ImplBehaviorType type);
    R visitDynBehavior(DynBehaviorType type);
    R visitGeneric(GenericType type);
    R visitTypeVar(TypeVar type);
}

package com.tmlang.compiler.ast.type;

/**
 * TypeRef 轻量访问者接口，用于替代 instanceof 分派。
 */
public interface TypeRefVisitor<R> {
    R visitSimple(SimpleType type);
    R visitGeneric(GenericTypeRef type);
    R visitReference(ReferenceTypeRef type);
    R visitPointer(PointerTypeRef type);
    R visitTuple(TupleTypeRef type);
    R visitArray(ArrayTypeRef type);
    R visitSlice(SliceTypeRef type);
    R visitFunction(FunctionTypeRef type);
    R visitBehavior(BehaviorTypeRef type);
}

package com.tmlang.compiler.analysis.env;

import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 类定义。声明部分在注册阶段确定后不再修改；
 * 派生属性（继承深度、估算大小、栈分配资格、vtable 布局）在所有类注册完成后计算一次。
 */
public final class ClassDef {
    private final String name;
    private final String baseClass;
    private final List<TmlType> baseTypeArgs;
    private final List<String> interfaces;
    private final List<BoundConstraint.BehaviorRef> interfaceRefs;
    private final List<String> typeParams;
    private final List<String> constParams;
    private final List<FieldDef> fields;
    private final List<MethodDef> methods;
    private final List<FuncSig> constructors;
    private final boolean isValue;
    private final boolean isPooled;
    private final boolean isSealed;
    private final boolean isAbstract;
    private final SourceLocation location;

    // 派生属性
    private int inheritanceDepth;
    private long estimatedSize;
    private boolean stackAllocatable;
    private List<String> vtable = Collections.emptyList();

    public ClassDef(String name, String baseClass, List<TmlType> baseTypeArgs,
                    List<BoundConstraint.BehaviorRef> interfaces, List<String> typeParams,
                    List<String> constParams, List<FieldDef> fields, List<MethodDef> methods,
                    List<FuncSig> constructors, boolean isValue, boolean isPooled, boolean isSealed,
                    boolean isAbstract, SourceLocation location) {
        this.name = name;
        this.baseClass = baseClass;
        this.baseTypeArgs = listOrEmpty(baseTypeArgs);
        this.interfaceRefs = listOrEmpty(interfaces);
        List<String> names = new ArrayList<String>();
        for (BoundConstraint.BehaviorRef ref : this.interfaceRefs) names.add(ref.getName());
        this.interfaces = Collections.unmodifiableList(names);
        this.typeParams = listOrEmpty(typeParams);
        this.constParams = listOrEmpty(constParams);
        this.fields = listOrEmpty(fields);
        this.methods = listOrEmpty(methods);
        this.constructors = listOrEmpty(constructors);
        this.isValue = isValue;
        this.isPooled = isPooled;
        // @value 隐含 sealed
        this.isSealed = isSealed || isValue;
        this.isAbstract = isAbstract;
        this.location = location;
    }

    private static <T> List<T> listOrEmpty(List<T> list) {
        return list != null ? Collections.unmodifiableList(new ArrayList<T>(list)) : Collections.<T>emptyList();
    }

    public String getName() { return name; }
    public String getBaseClass() { return baseClass; }
    public boolean hasBaseClass() { return baseClass != null; }
    /** extends 处给出的基类类型实参，如 Box[I32] 中的 I32 */
    public List<TmlType> getBaseTypeArgs() { return baseTypeArgs; }
    public List<String> getInterfaces() { return interfaces; }

    /** implements 列表，保留接口的类型实参 */
    public List<BoundConstraint.BehaviorRef> getInterfaceRefs() { return interfaceRefs; }
    public List<String> getTypeParams() { return typeParams; }
    public List<String> getConstParams() { return constParams; }
    public List<FieldDef> getFields() { return fields; }
    public List<MethodDef> getMethods() { return methods; }
    public List<FuncSig> getConstructors() { return constructors; }
    public boolean isValue() { return isValue; }
    public boolean isPooled() { return isPooled; }
    public boolean isSealed() { return isSealed; }
    public boolean isAbstract() { return isAbstract; }
    public SourceLocation getLocation() { return location; }

    public FieldDef findField(String fieldName) {
        for (FieldDef f : fields) {
            if (f.getName().equals(fieldName)) return f;
        }
        return null;
    }

    public MethodDef findMethod(String methodName) {
        for (MethodDef m : methods) {
            if (m.getName().equals(methodName)) return m;
        }
        return null;
    }

    public int getInheritanceDepth() { return inheritanceDepth; }
    public long getEstimatedSize() { return estimatedSize; }
    public boolean isStackAllocatable() { return stackAllocatable; }

    /** vtable 槽位，按索引排列的方法名 */
    public List<String> getVtable() { return vtable; }

    public int getVtableIndex(String methodName) {
        return vtable.indexOf(methodName);
    }

    public void setDerived(int inheritanceDepth, long estimatedSize, boolean stackAllocatable, List<String> vtable) {
        this.inheritanceDepth = inheritanceDepth;
        this.estimatedSize = estimatedSize;
        this.stackAllocatable = stackAllocatable;
        this.vtable = Collections.unmodifiableList(new ArrayList<String>(vtable));
    }
}

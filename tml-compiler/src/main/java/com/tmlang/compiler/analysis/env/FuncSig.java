package com.tmlang.compiler.analysis.env;

import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 函数签名。方法签名的 params 不含隐式接收者。
 */
public final class FuncSig {
    private final String name;
    private final List<TmlType> params;
    private final TmlType returnType;
    private final List<String> typeParams;
    private final List<String> constParams;
    private final List<BoundConstraint> constraints;
    private final Map<String, String> lifetimeBounds;
    private final SourceLocation location;

    public FuncSig(String name, List<TmlType> params, TmlType returnType, List<String> typeParams,
                   List<String> constParams, List<BoundConstraint> constraints,
                   Map<String, String> lifetimeBounds, SourceLocation location) {
        this.name = name;
        this.params = Collections.unmodifiableList(params);
        this.returnType = returnType;
        this.typeParams = typeParams != null ? typeParams : Collections.<String>emptyList();
        this.constParams = constParams != null ? constParams : Collections.<String>emptyList();
        this.constraints = constraints != null ? constraints : Collections.<BoundConstraint>emptyList();
        this.lifetimeBounds = lifetimeBounds != null ? lifetimeBounds : Collections.<String, String>emptyMap();
        this.location = location;
    }

    /** 非泛型签名 */
    public static FuncSig simple(String name, List<TmlType> params, TmlType returnType) {
        return new FuncSig(name, params, returnType, null, null, null, null, null);
    }

    public String getName() { return name; }
    public List<TmlType> getParams() { return params; }
    public TmlType getReturnType() { return returnType; }
    public List<String> getTypeParams() { return typeParams; }
    public List<String> getConstParams() { return constParams; }
    public List<BoundConstraint> getConstraints() { return constraints; }
    public Map<String, String> getLifetimeBounds() { return lifetimeBounds; }
    public SourceLocation getLocation() { return location; }

    public boolean isGeneric() {
        return !typeParams.isEmpty();
    }
}

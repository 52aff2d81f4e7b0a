package com.tmlang.compiler.analysis.env;

import com.tmlang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 接口（行为）定义
 */
public final class InterfaceDef {
    private final String name;
    private final List<String> typeParams;
    private final List<String> extendsList;
    private final List<MethodDef> methods;
    private final SourceLocation location;

    public InterfaceDef(String name, List<String> typeParams, List<String> extendsList,
                        List<MethodDef> methods, SourceLocation location) {
        this.name = name;
        this.typeParams = typeParams != null ? typeParams : Collections.<String>emptyList();
        this.extendsList = extendsList != null ? extendsList : Collections.<String>emptyList();
        this.methods = methods != null ? methods : Collections.<MethodDef>emptyList();
        this.location = location;
    }

    public String getName() { return name; }
    public List<String> getTypeParams() { return typeParams; }
    public List<String> getExtendsList() { return extendsList; }
    public List<MethodDef> getMethods() { return methods; }
    public SourceLocation getLocation() { return location; }
}

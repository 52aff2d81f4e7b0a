package com.tmlang.compiler.analysis;

import com.tmlang.compiler.analysis.env.ClassDef;
import com.tmlang.compiler.analysis.env.MethodDef;
import com.tmlang.compiler.analysis.env.TypeEnvironment;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * vtable 布局：基类槽位在前，override 复用基类槽位，新的 virtual/abstract 方法追加槽位。
 * 值类没有 vtable。
 */
final class VtableBuilder {

    private final TypeEnvironment env;

    VtableBuilder(TypeEnvironment env) {
        this.env = env;
    }

    List<String> build(ClassDef cls) {
        return build(cls, new HashSet<String>());
    }

    private List<String> build(ClassDef cls, Set<String> visited) {
        List<String> slots = new ArrayList<String>();
        if (cls.isValue() || !visited.add(cls.getName())) return slots;

        if (cls.hasBaseClass()) {
            ClassDef base = env.lookupClass(cls.getBaseClass());
            if (base != null) slots.addAll(build(base, visited));
        }
        for (MethodDef method : cls.getMethods()) {
            if (method.isStatic()) continue;
            if (slots.contains(method.getName())) continue;
            if (method.isVirtual() || method.isAbstract() || method.isOverride()) {
                slots.add(method.getName());
            }
        }
        return slots;
    }
}

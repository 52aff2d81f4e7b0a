package com.tmlang.compiler.analysis.env;

import com.tmlang.compiler.analysis.ConstValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单个模块的导出表：函数（可重载）、结构体、枚举、类、接口、常量。
 */
public final class ModuleTable {
    private final String path;
    private final Map<String, List<FuncSig>> functions = new LinkedHashMap<String, List<FuncSig>>();
    private final Map<String, StructDef> structs = new LinkedHashMap<String, StructDef>();
    private final Map<String, EnumDef> enums = new LinkedHashMap<String, EnumDef>();
    private final Map<String, ClassDef> classes = new LinkedHashMap<String, ClassDef>();
    private final Map<String, InterfaceDef> interfaces = new LinkedHashMap<String, InterfaceDef>();
    private final Map<String, ConstValue> constants = new LinkedHashMap<String, ConstValue>();

    public ModuleTable(String path) {
        this.path = path;
    }

    public String getPath() { return path; }

    public void addFunction(FuncSig sig) {
        List<FuncSig> overloads = functions.get(sig.getName());
        if (overloads == null) {
            overloads = new ArrayList<FuncSig>();
            functions.put(sig.getName(), overloads);
        }
        overloads.add(sig);
    }

    public List<FuncSig> getFunctions(String name) {
        List<FuncSig> overloads = functions.get(name);
        return overloads != null ? overloads : Collections.<FuncSig>emptyList();
    }

    public void addStruct(StructDef def) { structs.put(def.getName(), def); }
    public void addEnum(EnumDef def) { enums.put(def.getName(), def); }
    public void addClass(ClassDef def) { classes.put(def.getName(), def); }
    public void addInterface(InterfaceDef def) { interfaces.put(def.getName(), def); }
    public void addConstant(String name, ConstValue value) { constants.put(name, value); }

    public StructDef getStruct(String name) { return structs.get(name); }
    public EnumDef getEnum(String name) { return enums.get(name); }
    public ClassDef getClass(String name) { return classes.get(name); }
    public InterfaceDef getInterface(String name) { return interfaces.get(name); }
    public ConstValue getConstant(String name) { return constants.get(name); }

    public Map<String, StructDef> getStructs() { return structs; }
    public Map<String, EnumDef> getEnums() { return enums; }
    public Map<String, ClassDef> getClasses() { return classes; }
    public Map<String, InterfaceDef> getInterfaces() { return interfaces; }

    /** 任意类型定义是否已存在（用于重复定义检查） */
    public boolean hasType(String name) {
        return structs.containsKey(name) || enums.containsKey(name)
                || classes.containsKey(name) || interfaces.containsKey(name);
    }
}

package com.tmlang.ir.mir;

import java.util.ArrayList;
import java.util.List;

/**
 * MIR 模块（编译单元）。
 */
public class MirModule {

    private final String name;
    private final List<MirStructDef> structs;
    private final List<MirEnumDef> enums;
    private final List<MirFunction> functions;

    public MirModule(String name) {
        this(name, new ArrayList<MirStructDef>(), new ArrayList<MirEnumDef>(), new ArrayList<MirFunction>());
    }

    public MirModule(String name, List<MirStructDef> structs, List<MirEnumDef> enums,
                     List<MirFunction> functions) {
        this.name = name;
        this.structs = structs;
        this.enums = enums;
        this.functions = functions;
    }

    public String getName() { return name; }
    public List<MirStructDef> getStructs() { return structs; }
    public List<MirEnumDef> getEnums() { return enums; }
    public List<MirFunction> getFunctions() { return functions; }

    public void addStruct(MirStructDef def) { structs.add(def); }
    public void addEnum(MirEnumDef def) { enums.add(def); }
    public void addFunction(MirFunction func) { functions.add(func); }

    public MirFunction findFunction(String funcName) {
        for (MirFunction f : functions) {
            if (f.getName().equals(funcName)) return f;
        }
        return null;
    }

    public MirStructDef findStruct(String structName) {
        for (MirStructDef s : structs) {
            if (s.getName().equals(structName)) return s;
        }
        return null;
    }

    public MirEnumDef findEnum(String enumName) {
        for (MirEnumDef e : enums) {
            if (e.getName().equals(enumName)) return e;
        }
        return null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("module ").append(name).append('\n');
        for (MirFunction f : functions) {
            sb.append(f);
        }
        return sb.toString();
    }
}

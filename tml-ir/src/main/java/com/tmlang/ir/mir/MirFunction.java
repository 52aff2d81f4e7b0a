package com.tmlang.ir.mir;

import com.tmlang.compiler.analysis.types.TmlType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * MIR 函数（包含 CFG）。
 */
public class MirFunction {

    private final String name;
    private final TmlType returnType;
    private final List<MirParam> params;
    private final List<BasicBlock> blocks;
    private final List<MirValue> values;
    /** 类型参数名列表，非空即泛型模板，只在单态化后输出 */
    private List<String> typeParams = Collections.emptyList();
    private boolean isPublic = true;
    /** 显式要求 sret 返回约定 */
    private boolean sret;

    public MirFunction(String name, TmlType returnType) {
        this.name = name;
        this.returnType = returnType;
        this.params = new ArrayList<>();
        this.blocks = new ArrayList<>();
        this.values = new ArrayList<>();
    }

    public String getName() { return name; }
    public TmlType getReturnType() { return returnType; }
    public List<MirParam> getParams() { return params; }
    public List<BasicBlock> getBlocks() { return blocks; }
    public List<MirValue> getValues() { return values; }

    public List<String> getTypeParams() { return typeParams; }
    public void setTypeParams(List<String> tp) { this.typeParams = tp != null ? tp : Collections.<String>emptyList(); }
    public boolean isGeneric() { return !typeParams.isEmpty(); }

    public boolean isPublic() { return isPublic; }
    public void setPublic(boolean isPublic) { this.isPublic = isPublic; }

    public boolean isSret() { return sret; }
    public void setSret(boolean sret) { this.sret = sret; }

    public BasicBlock getEntryBlock() {
        return blocks.isEmpty() ? null : blocks.get(0);
    }

    public BasicBlock getBlock(int id) {
        for (BasicBlock b : blocks) {
            if (b.getId() == id) return b;
        }
        return null;
    }

    /** 第一个块命名为 entry，其余为 bbN */
    public BasicBlock newBlock() {
        return newBlock(blocks.isEmpty() ? "entry" : "bb");
    }

    /** 以 hint 为前缀新建块，标签 = hint + id（entry 除外） */
    public BasicBlock newBlock(String hint) {
        int id = blocks.size();
        String label = "entry".equals(hint) && id == 0 ? hint : hint + id;
        BasicBlock block = new BasicBlock(id, label);
        blocks.add(block);
        return block;
    }

    /** 添加一个带标签的现成块（克隆时使用） */
    public void addBlock(BasicBlock block) {
        blocks.add(block);
    }

    public MirParam addParam(String paramName, TmlType type) {
        int id = newValue(paramName, type);
        MirParam param = new MirParam(paramName, type, id);
        params.add(param);
        return param;
    }

    /** 追加已有参数描述（其值须已由 newValue 创建） */
    public void addParam(MirParam param) {
        params.add(param);
    }

    public int newValue(String valueName, TmlType type) {
        int id = values.size();
        values.add(new MirValue(id, valueName, type));
        return id;
    }

    public MirValue getValue(int id) {
        return id >= 0 && id < values.size() ? values.get(id) : null;
    }

    public TmlType typeOf(int id) {
        MirValue v = getValue(id);
        return v != null ? v.getType() : null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("fn ").append(name);
        if (!typeParams.isEmpty()) sb.append(typeParams);
        sb.append("(");
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(params.get(i).getName()).append(": ").append(params.get(i).getType());
        }
        sb.append(") -> ").append(returnType).append(" {\n");
        for (BasicBlock block : blocks) {
            sb.append(block);
        }
        sb.append("}\n");
        return sb.toString();
    }
}

package com.tmlang.ir.mir;

import java.util.ArrayList;
import java.util.List;

/**
 * MIR 基本块。name 即输出时的标签。
 */
public class BasicBlock {

    private final int id;
    private final String name;
    private final List<MirInst> instructions;
    private MirTerminator terminator;

    public BasicBlock(int id, String name) {
        this.id = id;
        this.name = name;
        this.instructions = new ArrayList<>();
    }

    public int getId() { return id; }
    public String getName() { return name; }

    public List<MirInst> getInstructions() { return instructions; }

    public void addInstruction(MirInst inst) {
        instructions.add(inst);
    }

    public MirTerminator getTerminator() { return terminator; }

    public void setTerminator(MirTerminator terminator) {
        this.terminator = terminator;
    }

    public boolean hasTerminator() {
        return terminator != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("B").append(id).append(" (").append(name).append("):\n");
        for (MirInst inst : instructions) {
            sb.append("  ").append(inst).append('\n');
        }
        if (terminator != null) {
            sb.append("  ").append(terminator).append('\n');
        }
        return sb.toString();
    }
}

package com.tmlang.ir.mir;

import com.tmlang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * MIR 基本块终止指令。每个基本块必须恰好有一个终止指令。
 */
public abstract class MirTerminator {

    // ===== 快速分派标记 =====
    public static final int KIND_BRANCH = 0;
    public static final int KIND_GOTO = 1;
    public static final int KIND_RETURN = 2;
    public static final int KIND_SWITCH = 3;
    public static final int KIND_UNREACHABLE = 4;

    protected final SourceLocation location;
    /** 子类类型标记，消除 instanceof 链。 */
    public final int kind;

    protected MirTerminator(SourceLocation location) {
        this.location = location;
        if (this instanceof Branch) this.kind = KIND_BRANCH;
        else if (this instanceof Goto) this.kind = KIND_GOTO;
        else if (this instanceof Return) this.kind = KIND_RETURN;
        else if (this instanceof Switch) this.kind = KIND_SWITCH;
        else this.kind = KIND_UNREACHABLE;
    }

    public SourceLocation getLocation() { return location; }

    /**
     * 无条件跳转。
     */
    public static class Goto extends MirTerminator {
        private final int targetBlockId;

        public Goto(SourceLocation location, int targetBlockId) {
            super(location);
            this.targetBlockId = targetBlockId;
        }

        public int getTargetBlockId() { return targetBlockId; }

        @Override
        public String toString() {
            return "goto B" + targetBlockId;
        }
    }

    /**
     * 条件分支。
     */
    public static class Branch extends MirTerminator {
        private final int condition;
        private final int thenBlock;
        private final int elseBlock;

        public Branch(SourceLocation location, int condition, int thenBlock, int elseBlock) {
            super(location);
            this.condition = condition;
            this.thenBlock = thenBlock;
            this.elseBlock = elseBlock;
        }

        public int getCondition() { return condition; }
        public int getThenBlock() { return thenBlock; }
        public int getElseBlock() { return elseBlock; }

        @Override
        public String toString() {
            return "branch %" + condition + " ? B" + thenBlock + " : B" + elseBlock;
        }
    }

    /**
     * 返回。
     */
    public static class Return extends MirTerminator {
        private final int value;   // -1 = void

        public Return(SourceLocation location, int value) {
            super(location);
            this.value = value;
        }

        public int getValue() { return value; }
        public boolean hasValue() { return value >= 0; }

        @Override
        public String toString() {
            return value >= 0 ? "return %" + value : "return";
        }
    }

    /**
     * Switch（多路分支），case 按插入顺序输出。
     */
    public static class Switch extends MirTerminator {
        private final int discriminant;
        private final Map<Long, Integer> cases;
        private final int defaultBlock;

        public Switch(SourceLocation location, int discriminant, Map<Long, Integer> cases, int defaultBlock) {
            super(location);
            this.discriminant = discriminant;
            this.cases = Collections.unmodifiableMap(new LinkedHashMap<Long, Integer>(cases));
            this.defaultBlock = defaultBlock;
        }

        public int getDiscriminant() { return discriminant; }
        public Map<Long, Integer> getCases() { return cases; }
        public int getDefaultBlock() { return defaultBlock; }

        @Override
        public String toString() {
            return "switch %" + discriminant + " cases=" + cases.size() + " default=B" + defaultBlock;
        }
    }

    /**
     * 不可达。
     */
    public static class Unreachable extends MirTerminator {
        public Unreachable(SourceLocation location) {
            super(location);
        }

        @Override
        public String toString() { return "unreachable"; }
    }
}

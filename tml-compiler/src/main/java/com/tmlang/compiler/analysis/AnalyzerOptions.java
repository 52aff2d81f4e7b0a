package com.tmlang.compiler.analysis;

/**
 * 语义分析选项
 */
public final class AnalyzerOptions {

    /** 栈分配类的最大估算字节数 */
    public static final long DEFAULT_MAX_STACK_CLASS_SIZE = 256;

    private long maxStackClassSize = DEFAULT_MAX_STACK_CLASS_SIZE;

    public static AnalyzerOptions defaults() {
        return new AnalyzerOptions();
    }

    public long getMaxStackClassSize() {
        return maxStackClassSize;
    }

    public AnalyzerOptions setMaxStackClassSize(long maxStackClassSize) {
        if (maxStackClassSize < 0) {
            throw new IllegalArgumentException("maxStackClassSize must not be negative");
        }
        this.maxStackClassSize = maxStackClassSize;
        return this;
    }
}

package com.tmlang.ir.backend;

/**
 * 文本 IR 生成选项
 */
public final class CodegenOptions {

    public static final String DEFAULT_TARGET_TRIPLE = "x86_64-pc-linux-gnu";
    /** 超过该元素数的统一值数组改用栈上内存初始化 */
    public static final int DEFAULT_BULK_ZERO_THRESHOLD = 100;
    public static final long DEFAULT_INSTANTIATION_CACHE_SIZE = 1024;
    /** 返回值超过该字节数时使用 sret */
    public static final long DEFAULT_SRET_THRESHOLD = 16;

    private String targetTriple = DEFAULT_TARGET_TRIPLE;
    private boolean emitComments = true;
    private int bulkZeroThreshold = DEFAULT_BULK_ZERO_THRESHOLD;
    private long instantiationCacheSize = DEFAULT_INSTANTIATION_CACHE_SIZE;
    private long sretThreshold = DEFAULT_SRET_THRESHOLD;

    public static CodegenOptions defaults() {
        return new CodegenOptions();
    }

    public String getTargetTriple() {
        return targetTriple;
    }

    public CodegenOptions setTargetTriple(String targetTriple) {
        if (targetTriple == null || targetTriple.isEmpty()) {
            throw new IllegalArgumentException("targetTriple must not be empty");
        }
        this.targetTriple = targetTriple;
        return this;
    }

    public boolean isEmitComments() {
        return emitComments;
    }

    public CodegenOptions setEmitComments(boolean emitComments) {
        this.emitComments = emitComments;
        return this;
    }

    public int getBulkZeroThreshold() {
        return bulkZeroThreshold;
    }

    public CodegenOptions setBulkZeroThreshold(int bulkZeroThreshold) {
        if (bulkZeroThreshold < 0) {
            throw new IllegalArgumentException("bulkZeroThreshold must not be negative");
        }
        this.bulkZeroThreshold = bulkZeroThreshold;
        return this;
    }

    public long getInstantiationCacheSize() {
        return instantiationCacheSize;
    }

    public CodegenOptions setInstantiationCacheSize(long instantiationCacheSize) {
        if (instantiationCacheSize <= 0) {
            throw new IllegalArgumentException("instantiationCacheSize must be positive");
        }
        this.instantiationCacheSize = instantiationCacheSize;
        return this;
    }

    public long getSretThreshold() {
        return sretThreshold;
    }

    public CodegenOptions setSretThreshold(long sretThreshold) {
        if (sretThreshold < 0) {
            throw new IllegalArgumentException("sretThreshold must not be negative");
        }
        this.sretThreshold = sretThreshold;
        return this;
    }
}

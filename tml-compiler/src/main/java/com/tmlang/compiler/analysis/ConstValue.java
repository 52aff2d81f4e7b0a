package com.tmlang.compiler.analysis;

import java.util.Objects;

/**
 * 编译期常量值：有符号 64 位、无符号 64 位、Bool、Char。
 * U64 以 long 位模式保存，按无符号解释。
 */
public final class ConstValue {

    public enum Kind { I64, U64, BOOL, CHAR }

    private final Kind kind;
    private final long bits;

    private ConstValue(Kind kind, long bits) {
        this.kind = kind;
        this.bits = bits;
    }

    public static ConstValue ofI64(long value) {
        return new ConstValue(Kind.I64, value);
    }

    public static ConstValue ofU64(long bits) {
        return new ConstValue(Kind.U64, bits);
    }

    public static ConstValue ofBool(boolean value) {
        return new ConstValue(Kind.BOOL, value ? 1 : 0);
    }

    public static ConstValue ofChar(int codePoint) {
        return new ConstValue(Kind.CHAR, codePoint);
    }

    public Kind getKind() { return kind; }

    public boolean isInteger() {
        return kind == Kind.I64 || kind == Kind.U64;
    }

    public long asI64() { return bits; }

    /** 无符号位模式 */
    public long asU64() { return bits; }

    public boolean asBool() { return bits != 0; }

    public int asChar() { return (int) bits; }

    /** 作为非负长度使用；负数或超出 long 范围返回 -1 */
    public long asLength() {
        if (kind == Kind.I64) return bits >= 0 ? bits : -1;
        if (kind == Kind.U64) return bits >= 0 ? bits : -1;
        return -1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConstValue)) return false;
        ConstValue that = (ConstValue) o;
        return kind == that.kind && bits == that.bits;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, bits);
    }

    @Override
    public String toString() {
        switch (kind) {
            case I64: return Long.toString(bits);
            case U64: return Long.toUnsignedString(bits);
            case BOOL: return bits != 0 ? "true" : "false";
            case CHAR: return "'" + new String(Character.toChars((int) bits)) + "'";
            default: return "?";
        }
    }
}

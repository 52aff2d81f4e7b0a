package com.tmlang.compiler.analysis.types;

/**
 * 原始类型种类。
 */
public enum PrimitiveKind {
    I8("I8", 8, true),
    I16("I16", 16, true),
    I32("I32", 32, true),
    I64("I64", 64, true),
    I128("I128", 128, true),
    U8("U8", 8, false),
    U16("U16", 16, false),
    U32("U32", 32, false),
    U64("U64", 64, false),
    U128("U128", 128, false),
    F32("F32", 32, true),
    F64("F64", 64, true),
    BOOL("Bool", 1, false),
    CHAR("Char", 32, false),
    STR("Str", 0, false),
    UNIT("Unit", 0, false),
    NEVER("Never", 0, false);

    private final String typeName;
    private final int bitWidth;
    private final boolean signed;

    PrimitiveKind(String typeName, int bitWidth, boolean signed) {
        this.typeName = typeName;
        this.bitWidth = bitWidth;
        this.signed = signed;
    }

    /** 源码中的类型名（如 "I32", "Bool"） */
    public String getTypeName() {
        return typeName;
    }

    /** 位宽；Str/Unit/Never 为 0 */
    public int getBitWidth() {
        return bitWidth;
    }

    public boolean isSigned() {
        return signed;
    }

    public boolean isInteger() {
        switch (this) {
            case I8: case I16: case I32: case I64: case I128:
            case U8: case U16: case U32: case U64: case U128:
                return true;
            default:
                return false;
        }
    }

    public boolean isSignedInteger() {
        return isInteger() && signed;
    }

    public boolean isUnsignedInteger() {
        return isInteger() && !signed;
    }

    public boolean isFloat() {
        return this == F32 || this == F64;
    }

    public boolean isNumeric() {
        return isInteger() || isFloat();
    }

    /** 根据源码类型名查找，未知名返回 null */
    public static PrimitiveKind fromName(String name) {
        if (name == null) return null;
        for (PrimitiveKind kind : values()) {
            if (kind.typeName.equals(name)) return kind;
        }
        return null;
    }
}

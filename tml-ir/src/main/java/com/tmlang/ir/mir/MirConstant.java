package com.tmlang.ir.mir;

import com.tmlang.compiler.analysis.types.PrimitiveKind;
import com.tmlang.compiler.analysis.types.PrimitiveType;
import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.analysis.types.Types;

/**
 * MIR 编译期常量。
 */
public final class MirConstant {

    public enum Kind { INT, FLOAT, BOOL, STRING, UNIT }

    private final Kind kind;
    private final long intValue;
    private final double floatValue;
    private final String stringValue;
    private final TmlType type;

    private MirConstant(Kind kind, long intValue, double floatValue, String stringValue, TmlType type) {
        this.kind = kind;
        this.intValue = intValue;
        this.floatValue = floatValue;
        this.stringValue = stringValue;
        this.type = type;
    }

    public static MirConstant ofInt(long value, PrimitiveType type) {
        if (!type.getKind().isInteger() && type.getKind() != PrimitiveKind.CHAR) {
            throw new IllegalArgumentException("Integer constant needs an integer type, got " + type);
        }
        return new MirConstant(Kind.INT, value, 0, null, type);
    }

    public static MirConstant ofI32(long value) {
        return ofInt(value, Types.I32);
    }

    public static MirConstant ofI64(long value) {
        return ofInt(value, Types.I64);
    }

    public static MirConstant ofFloat(double value, PrimitiveType type) {
        if (!type.getKind().isFloat()) {
            throw new IllegalArgumentException("Float constant needs a float type, got " + type);
        }
        return new MirConstant(Kind.FLOAT, 0, value, null, type);
    }

    public static MirConstant ofBool(boolean value) {
        return new MirConstant(Kind.BOOL, value ? 1 : 0, 0, null, Types.BOOL);
    }

    public static MirConstant ofString(String value) {
        if (value == null) throw new IllegalArgumentException("String constant must not be null");
        return new MirConstant(Kind.STRING, 0, 0, value, Types.STR);
    }

    public static MirConstant unit() {
        return new MirConstant(Kind.UNIT, 0, 0, null, Types.UNIT);
    }

    public Kind getKind() { return kind; }
    public long getIntValue() { return intValue; }
    public double getFloatValue() { return floatValue; }
    public boolean getBoolValue() { return intValue != 0; }
    public String getStringValue() { return stringValue; }
    public TmlType getType() { return type; }

    /** 全零位模式（0、0.0、false） */
    public boolean isZero() {
        switch (kind) {
            case INT:
            case BOOL:
                return intValue == 0;
            case FLOAT:
                return Double.doubleToRawLongBits(floatValue) == 0L;
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        switch (kind) {
            case INT: return intValue + ":" + type;
            case FLOAT: return floatValue + ":" + type;
            case BOOL: return String.valueOf(getBoolValue());
            case STRING: return '"' + stringValue + '"';
            default: return "()";
        }
    }
}

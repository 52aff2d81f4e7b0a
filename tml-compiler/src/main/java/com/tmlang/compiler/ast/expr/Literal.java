package com.tmlang.compiler.ast.expr;

import com.tmlang.compiler.ast.AstVisitor;
import com.tmlang.compiler.ast.SourceLocation;

import java.math.BigInteger;

/**
 * 字面量表达式。整数字面量的值为 {@link BigInteger}，可表示完整的 U64 范围。
 */
public class Literal extends Expression {
    private final Object value;
    private final LiteralKind kind;

    public Literal(SourceLocation location, Object value, LiteralKind kind) {
        super(location);
        this.value = value;
        this.kind = kind;
    }

    public static Literal ofInt(SourceLocation location, long value) {
        return new Literal(location, BigInteger.valueOf(value), LiteralKind.INT);
    }

    public static Literal ofBool(SourceLocation location, boolean value) {
        return new Literal(location, value, LiteralKind.BOOL);
    }

    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        INT,
        FLOAT,
        CHAR,
        STRING,
        BOOL,
        NULL
    }
}

package com.tmlang.compiler.ast.expr;

import com.tmlang.compiler.ast.AstVisitor;
import com.tmlang.compiler.ast.SourceLocation;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 二元运算符
     */
    public enum BinaryOp {
        // 算术
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        MOD("%"),

        // 位运算
        BIT_AND("&"),
        BIT_OR("|"),
        BIT_XOR("^"),
        SHL("<<"),
        SHR(">>"),

        // 比较
        EQ("=="),
        NE("!="),
        LT("<"),
        GT(">"),
        LE("<="),
        GE(">="),

        // 逻辑
        AND("and"),
        OR("or");

        private final String source;

        BinaryOp(String source) {
            this.source = source;
        }

        public String getSource() {
            return source;
        }

        public boolean isComparison() {
            switch (this) {
                case EQ: case NE: case LT: case GT: case LE: case GE:
                    return true;
                default:
                    return false;
            }
        }

        public boolean isLogical() {
            return this == AND || this == OR;
        }
    }
}

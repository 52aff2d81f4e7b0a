package com.tmlang.compiler.analysis;

import com.tmlang.compiler.analysis.env.TypeEnvironment;
import com.tmlang.compiler.analysis.types.PrimitiveKind;
import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.analysis.types.Types;
import com.tmlang.compiler.ast.AstVisitor;
import com.tmlang.compiler.ast.expr.BinaryExpr;
import com.tmlang.compiler.ast.expr.CastExpr;
import com.tmlang.compiler.ast.expr.Expression;
import com.tmlang.compiler.ast.expr.Identifier;
import com.tmlang.compiler.ast.expr.Literal;
import com.tmlang.compiler.ast.expr.ParenExpr;
import com.tmlang.compiler.ast.expr.UnaryExpr;

import java.math.BigInteger;
import java.util.Optional;

/**
 * 编译期常量求值：数组长度、const 泛型实参、const 声明。
 * <p>
 * 返回 {@link Optional#empty()} 表示"在此上下文中不是编译期常量"，这是正常结果；
 * 只有除零/模零会额外报告诊断。
 */
public final class ConstEvaluator implements AstVisitor<Optional<ConstValue>, TmlType> {

    private static final BigInteger U64_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private final TypeEnvironment env;
    private final SemanticChecker checker;
    private TypeResolver typeResolver;

    public ConstEvaluator(TypeEnvironment env, SemanticChecker checker) {
        this.env = env;
        this.checker = checker;
    }

    /** 设置类型解析器，用于求值 cast 表达式的目标类型 */
    public void setTypeResolver(TypeResolver typeResolver) {
        this.typeResolver = typeResolver;
    }

    /**
     * 求值常量表达式。
     *
     * @param expectedType 期望类型，决定整数字面量的有无符号；可为 null
     */
    public Optional<ConstValue> evaluate(Expression expr, TmlType expectedType) {
        if (expr == null) return Optional.empty();
        Optional<ConstValue> result = expr.accept(this, expectedType);
        return result != null ? result : Optional.<ConstValue>empty();
    }

    /**
     * 求值数组长度，必须为非负整数常量。
     *
     * @return 长度，失败返回 -1（已报告诊断，const 泛型参数除外）
     */
    public long evaluateArraySize(Expression expr) {
        Optional<ConstValue> value = evaluate(expr, Types.U64);
        if (!value.isPresent()) {
            if (!isConstGenericRef(expr)) {
                checker.error(ErrorCodes.CONST_INVALID_LENGTH,
                        "Array length must be a compile-time constant", expr);
            }
            return -1;
        }
        long length = value.get().asLength();
        if (length < 0) {
            checker.error(ErrorCodes.CONST_INVALID_LENGTH,
                    "Array length must be a non-negative integer, found " + value.get(), expr);
        }
        return length;
    }

    private boolean isConstGenericRef(Expression expr) {
        if (expr instanceof ParenExpr) return isConstGenericRef(((ParenExpr) expr).getInner());
        if (!(expr instanceof Identifier)) return false;
        Symbol sym = env.lookup(((Identifier) expr).getName());
        return sym != null && sym.getKind() == SymbolKind.CONST_GENERIC;
    }

    // ============ 字面量与引用 ============

    @Override
    public Optional<ConstValue> visitLiteral(Literal node, TmlType expected) {
        switch (node.getKind()) {
            case INT: {
                BigInteger value = (BigInteger) node.getValue();
                if (value.signum() < 0 || value.compareTo(U64_MAX) > 0) return Optional.empty();
                if (Types.isSignedInteger(expected) && value.bitLength() < 64) {
                    return Optional.of(ConstValue.ofI64(value.longValue()));
                }
                return Optional.of(ConstValue.ofU64(value.longValue()));
            }
            case BOOL:
                return Optional.of(ConstValue.ofBool((Boolean) node.getValue()));
            case CHAR: {
                Object v = node.getValue();
                int cp = v instanceof Character ? (Character) v : ((Number) v).intValue();
                return Optional.of(ConstValue.ofChar(cp));
            }
            default:
                return Optional.empty();
        }
    }

    @Override
    public Optional<ConstValue> visitIdentifier(Identifier node, TmlType expected) {
        Symbol sym = env.lookup(node.getName());
        // const 泛型参数在实例化前没有值
        if (sym != null && sym.getKind() == SymbolKind.CONST_GENERIC) return Optional.empty();
        ConstValue value = env.lookupConstant(node.getName());
        return Optional.ofNullable(value);
    }

    @Override
    public Optional<ConstValue> visitParenExpr(ParenExpr node, TmlType expected) {
        return evaluate(node.getInner(), expected);
    }

    @Override
    public Optional<ConstValue> visitCastExpr(CastExpr node, TmlType expected) {
        if (typeResolver == null) return Optional.empty();
        TmlType target = typeResolver.resolve(node.getTargetType());
        if (!Types.isInteger(target)) return Optional.empty();
        Optional<ConstValue> inner = evaluate(node.getExpression(), target);
        if (!inner.isPresent() || !inner.get().isInteger()) return Optional.empty();
        return Optional.of(truncate(inner.get().asI64(), Types.kindOf(target)));
    }

    /** 截断到目标宽度，有符号类型做符号扩展 */
    private static ConstValue truncate(long bits, PrimitiveKind kind) {
        int width = kind.getBitWidth();
        if (width < 64) {
            long mask = (1L << width) - 1;
            bits &= mask;
            if (kind.isSigned() && (bits & (1L << (width - 1))) != 0) {
                bits |= ~mask;
            }
        }
        return kind.isSigned() ? ConstValue.ofI64(bits) : ConstValue.ofU64(bits);
    }

    // ============ 一元 ============

    @Override
    public Optional<ConstValue> visitUnaryExpr(UnaryExpr node, TmlType expected) {
        Optional<ConstValue> operand = evaluate(node.getOperand(), expected);
        if (!operand.isPresent()) return Optional.empty();
        ConstValue v = operand.get();
        switch (node.getOperator()) {
            case NEG:
                if (v.isInteger()) return Optional.of(ConstValue.ofI64(-v.asI64()));
                return Optional.empty();
            case NOT:
                if (v.getKind() == ConstValue.Kind.BOOL) return Optional.of(ConstValue.ofBool(!v.asBool()));
                return Optional.empty();
            case BIT_NOT:
                if (v.getKind() == ConstValue.Kind.I64) return Optional.of(ConstValue.ofI64(~v.asI64()));
                if (v.getKind() == ConstValue.Kind.U64) return Optional.of(ConstValue.ofU64(~v.asU64()));
                return Optional.empty();
            default:
                return Optional.empty();
        }
    }

    // ============ 二元 ============

    @Override
    public Optional<ConstValue> visitBinaryExpr(BinaryExpr node, TmlType expected) {
        // 比较与逻辑运算的期望类型是 Bool，操作数按无期望类型求值
        TmlType operandExpected = node.getOperator().isComparison() || node.getOperator().isLogical()
                ? null : expected;
        Optional<ConstValue> left = evaluate(node.getLeft(), operandExpected);
        Optional<ConstValue> right = evaluate(node.getRight(), operandExpected);
        if (!left.isPresent() || !right.isPresent()) return Optional.empty();
        ConstValue l = left.get();
        ConstValue r = right.get();
        if (l.getKind() != r.getKind()) return Optional.empty();

        switch (l.getKind()) {
            case I64: return evalSigned(node, l.asI64(), r.asI64());
            case U64: return evalUnsigned(node, l.asU64(), r.asU64());
            case BOOL: return evalBool(node.getOperator(), l.asBool(), r.asBool());
            case CHAR: return evalChar(node.getOperator(), l.asChar(), r.asChar());
            default: return Optional.empty();
        }
    }

    private Optional<ConstValue> evalSigned(BinaryExpr node, long a, long b) {
        switch (node.getOperator()) {
            case ADD: return Optional.of(ConstValue.ofI64(a + b));
            case SUB: return Optional.of(ConstValue.ofI64(a - b));
            case MUL: return Optional.of(ConstValue.ofI64(a * b));
            case DIV:
                if (b == 0) return divisionByZero(node);
                return Optional.of(ConstValue.ofI64(a / b));
            case MOD:
                if (b == 0) return moduloByZero(node);
                return Optional.of(ConstValue.ofI64(a % b));
            case BIT_AND: return Optional.of(ConstValue.ofI64(a & b));
            case BIT_OR: return Optional.of(ConstValue.ofI64(a | b));
            case BIT_XOR: return Optional.of(ConstValue.ofI64(a ^ b));
            case SHL: return Optional.of(ConstValue.ofI64(a << (b & 63)));
            case SHR: return Optional.of(ConstValue.ofI64(a >> (b & 63)));
            case EQ: return Optional.of(ConstValue.ofBool(a == b));
            case NE: return Optional.of(ConstValue.ofBool(a != b));
            case LT: return Optional.of(ConstValue.ofBool(a < b));
            case LE: return Optional.of(ConstValue.ofBool(a <= b));
            case GT: return Optional.of(ConstValue.ofBool(a > b));
            case GE: return Optional.of(ConstValue.ofBool(a >= b));
            default: return Optional.empty();
        }
    }

    private Optional<ConstValue> evalUnsigned(BinaryExpr node, long a, long b) {
        switch (node.getOperator()) {
            case ADD: return Optional.of(ConstValue.ofU64(a + b));
            case SUB: return Optional.of(ConstValue.ofU64(a - b));
            case MUL: return Optional.of(ConstValue.ofU64(a * b));
            case DIV:
                if (b == 0) return divisionByZero(node);
                return Optional.of(ConstValue.ofU64(Long.divideUnsigned(a, b)));
            case MOD:
                if (b == 0) return moduloByZero(node);
                return Optional.of(ConstValue.ofU64(Long.remainderUnsigned(a, b)));
            case BIT_AND: return Optional.of(ConstValue.ofU64(a & b));
            case BIT_OR: return Optional.of(ConstValue.ofU64(a | b));
            case BIT_XOR: return Optional.of(ConstValue.ofU64(a ^ b));
            case SHL: return Optional.of(ConstValue.ofU64(a << (b & 63)));
            case SHR: return Optional.of(ConstValue.ofU64(a >>> (b & 63)));
            case EQ: return Optional.of(ConstValue.ofBool(a == b));
            case NE: return Optional.of(ConstValue.ofBool(a != b));
            case LT: return Optional.of(ConstValue.ofBool(Long.compareUnsigned(a, b) < 0));
            case LE: return Optional.of(ConstValue.ofBool(Long.compareUnsigned(a, b) <= 0));
            case GT: return Optional.of(ConstValue.ofBool(Long.compareUnsigned(a, b) > 0));
            case GE: return Optional.of(ConstValue.ofBool(Long.compareUnsigned(a, b) >= 0));
            default: return Optional.empty();
        }
    }

    private static Optional<ConstValue> evalBool(BinaryExpr.BinaryOp op, boolean a, boolean b) {
        switch (op) {
            case AND: return Optional.of(ConstValue.ofBool(a && b));
            case OR: return Optional.of(ConstValue.ofBool(a || b));
            case EQ: return Optional.of(ConstValue.ofBool(a == b));
            case NE: return Optional.of(ConstValue.ofBool(a != b));
            default: return Optional.empty();
        }
    }

    private static Optional<ConstValue> evalChar(BinaryExpr.BinaryOp op, int a, int b) {
        switch (op) {
            case EQ: return Optional.of(ConstValue.ofBool(a == b));
            case NE: return Optional.of(ConstValue.ofBool(a != b));
            default: return Optional.empty();
        }
    }

    private Optional<ConstValue> divisionByZero(BinaryExpr node) {
        checker.error(ErrorCodes.CONST_DIVISION_BY_ZERO, "Division by zero in const expression", node);
        return Optional.empty();
    }

    private Optional<ConstValue> moduloByZero(BinaryExpr node) {
        checker.error(ErrorCodes.CONST_MODULO_BY_ZERO, "Modulo by zero in const expression", node);
        return Optional.empty();
    }
}

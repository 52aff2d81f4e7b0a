package com.tmlang.compiler.analysis;

import com.tmlang.compiler.analysis.env.TypeEnvironment;
import com.tmlang.compiler.analysis.types.Types;
import com.tmlang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.tmlang.compiler.ast.expr.Expression;
import com.tmlang.compiler.ast.type.ArrayTypeRef;
import com.tmlang.compiler.ast.type.TypeRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.tmlang.compiler.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("常量求值")
class ConstEvaluatorTest {

    private List<SemanticDiagnostic> diagnostics;
    private TypeEnvironment env;
    private ConstEvaluator evaluator;

    @BeforeEach
    void setUp() {
        diagnostics = new ArrayList<SemanticDiagnostic>();
        env = new TypeEnvironment("test");
        evaluator = new ConstEvaluator(env, new SemanticChecker(diagnostics));
    }

    private boolean reported(String code) {
        for (SemanticDiagnostic d : diagnostics) {
            if (code.equals(d.getCode())) return true;
        }
        return false;
    }

    @Nested
    @DisplayName("算术")
    class Arithmetic {

        @Test
        @DisplayName("(2 + 3) * 4 = 20")
        void nestedArithmetic() {
            Expression expr = binary(binary(intLit(2), BinaryOp.ADD, intLit(3)), BinaryOp.MUL, intLit(4));
            assertEquals(Optional.of(ConstValue.ofU64(20)), evaluator.evaluate(expr, null));
            assertEquals(Optional.of(ConstValue.ofI64(20)), evaluator.evaluate(expr, Types.I64));
            assertTrue(diagnostics.isEmpty());
        }

        @Test
        @DisplayName("无符号除法与取模")
        void unsignedDivision() {
            assertEquals(Optional.of(ConstValue.ofU64(3)),
                    evaluator.evaluate(binary(intLit(10), BinaryOp.DIV, intLit(3)), Types.U32));
            assertEquals(Optional.of(ConstValue.ofU64(1)),
                    evaluator.evaluate(binary(intLit(10), BinaryOp.MOD, intLit(3)), Types.U32));
        }

        @Test
        @DisplayName("比较结果为 Bool")
        void comparison() {
            assertEquals(Optional.of(ConstValue.ofBool(true)),
                    evaluator.evaluate(binary(intLit(1), BinaryOp.LT, intLit(2)), Types.BOOL));
        }

        @Test
        @DisplayName("位移")
        void shift() {
            assertEquals(Optional.of(ConstValue.ofI64(32)),
                    evaluator.evaluate(binary(intLit(1), BinaryOp.SHL, intLit(5)), Types.I32));
        }
    }

    @Nested
    @DisplayName("除零")
    class DivisionByZero {

        @Test
        @DisplayName("除以零返回空并报告 C001")
        void divisionByZero() {
            Optional<ConstValue> value = evaluator.evaluate(binary(intLit(1), BinaryOp.DIV, intLit(0)), Types.I32);
            assertFalse(value.isPresent());
            assertTrue(reported(ErrorCodes.CONST_DIVISION_BY_ZERO));
        }

        @Test
        @DisplayName("模零返回空并报告 C002")
        void moduloByZero() {
            Optional<ConstValue> value = evaluator.evaluate(binary(intLit(7), BinaryOp.MOD, intLit(0)), null);
            assertFalse(value.isPresent());
            assertTrue(reported(ErrorCodes.CONST_MODULO_BY_ZERO));
            assertFalse(reported(ErrorCodes.CONST_DIVISION_BY_ZERO));
        }
    }

    @Nested
    @DisplayName("非常量")
    class NotConstant {

        @Test
        @DisplayName("字符串与浮点字面量不是常量，且不报告诊断")
        void nonConstantLiterals() {
            assertFalse(evaluator.evaluate(strLit("x"), null).isPresent());
            assertFalse(evaluator.evaluate(floatLit(1.5), null).isPresent());
            assertTrue(diagnostics.isEmpty());
        }

        @Test
        @DisplayName("未定义标识符不是常量")
        void unknownIdentifier() {
            assertFalse(evaluator.evaluate(ident("missing"), null).isPresent());
        }

        @Test
        @DisplayName("已定义常量参与运算")
        void definedConstant() {
            env.defineConstant("N", ConstValue.ofU64(4));
            assertEquals(Optional.of(ConstValue.ofU64(8)),
                    evaluator.evaluate(binary(ident("N"), BinaryOp.MUL, intLit(2)), null));
        }

        @Test
        @DisplayName("数组长度不是常量时报告 C003")
        void invalidArrayLength() {
            assertEquals(-1, evaluator.evaluateArraySize(ident("n")));
            assertTrue(reported(ErrorCodes.CONST_INVALID_LENGTH));
        }
    }

    @Nested
    @DisplayName("const 声明")
    class ConstDeclarations {

        @Test
        @DisplayName("const 声明的值登记到环境，可用作数组长度")
        void constUsedAsLength() {
            AnalysisResult result = new SemanticAnalyzer().analyze(program(
                    constant("N", type("U64"), binary(intLit(2), BinaryOp.MUL, intLit(2))),
                    fun("f", params(), null,
                            let("a", arrayTypeOf("N"), array(intLit(1), intLit(2), intLit(3), intLit(4))))));
            assertFalse(result.hasErrors(), result.getDiagnostics().toString());
            assertEquals(ConstValue.ofU64(4), result.getEnvironment().lookupConstant("N"));
        }

        @Test
        @DisplayName("初始化除零只报告 C001")
        void constDivisionByZero() {
            AnalysisResult result = new SemanticAnalyzer().analyze(program(
                    constant("BAD", type("I32"), binary(intLit(1), BinaryOp.DIV, intLit(0)))));
            assertTrue(result.hasCode(ErrorCodes.CONST_DIVISION_BY_ZERO));
            assertFalse(result.hasCode(ErrorCodes.CONST_NOT_EVALUABLE));
            assertNull(result.getEnvironment().lookupConstant("BAD"));
        }

        @Test
        @DisplayName("非常量初始化报告 C004")
        void constNotEvaluable() {
            AnalysisResult result = new SemanticAnalyzer().analyze(program(
                    constant("S", type("Str"), strLit("hello"))));
            assertTrue(result.hasCode(ErrorCodes.CONST_NOT_EVALUABLE));
        }
    }

    private static TypeRef arrayTypeOf(String lengthConst) {
        return new ArrayTypeRef(LOC, type("I32"), ident(lengthConst));
    }
}

package com.tmlang.compiler.analysis;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.tmlang.compiler.analysis.generic.Instantiation;
import com.tmlang.compiler.analysis.types.Types;
import com.tmlang.compiler.ast.decl.FunDecl;
import com.tmlang.compiler.ast.decl.Program;
import com.tmlang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.tmlang.compiler.ast.expr.CallExpr;
import com.tmlang.compiler.ast.type.TypeParameter;
import com.tmlang.compiler.ast.type.TypeRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.tmlang.compiler.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("语义分析")
class SemanticAnalyzerTest {

    private static FunDecl identityFn() {
        return genericFun("identity", Collections.singletonList(typeParam("T")),
                params(param("x", type("T"))), type("T"), ret(ident("x")));
    }

    @Nested
    @DisplayName("泛型调用")
    class GenericCalls {

        @Test
        @DisplayName("调用点实例化被记录，返回类型为 I32")
        void instantiationRecorded() {
            CallExpr call = call("identity", intLit(5));
            AnalysisResult result = new SemanticAnalyzer().analyze(program(
                    identityFn(),
                    fun("main", params(), type("I32"), let("y", type("I32"), call), ret(ident("y")))));

            assertFalse(result.hasErrors(), result.getDiagnostics().toString());
            Map<CallExpr, Instantiation> insts = result.getInstantiations();
            assertEquals(1, insts.size());
            Instantiation inst = result.getInstantiation(call);
            assertEquals("identity__I32", inst.getMangledName());
            assertEquals(Types.I32, inst.getSubstitution().get("T"));
            assertEquals(Types.I32, result.getExprType(call));
        }

        @Test
        @DisplayName("显式类型实参")
        void explicitTypeArgs() {
            CallExpr call = callWith("identity", Collections.<TypeRef>singletonList(type("I64")), intLit(5));
            AnalysisResult result = new SemanticAnalyzer().analyze(program(
                    identityFn(),
                    fun("main", params(), null, expr(call))));

            assertFalse(result.hasErrors(), result.getDiagnostics().toString());
            assertEquals("identity__I64", result.getInstantiation(call).getMangledName());
        }

        @Test
        @DisplayName("不满足行为约束报告 T026")
        void boundNotSatisfied() {
            FunDecl max = genericFun("largest", Collections.singletonList(typeParam("T", type("Ord"))),
                    params(param("a", type("T")), param("b", type("T"))), type("T"), ret(ident("a")));
            AnalysisResult ok = new SemanticAnalyzer().analyze(program(max,
                    fun("main", params(), null, expr(call("largest", strLit("a"), strLit("b"))))));
            assertFalse(ok.hasErrors(), ok.getDiagnostics().toString());

            AnalysisResult bad = new SemanticAnalyzer().analyze(program(max,
                    fun("main", params(), null, expr(call("largest", boolLit(true), boolLit(false))))));
            assertTrue(bad.hasCode(ErrorCodes.BOUND_NOT_SATISFIED));
        }

        @Test
        @DisplayName("类实现的接口实参须与约束一致")
        void parameterizedInterfaceBound() {
            FunDecl pick = genericFun("pick", Collections.singletonList(typeParam("T", type("Compare", type("I32")))),
                    params(param("x", type("T"))), null);
            FunDecl check = fun("check", params(param("b", type("Box"))), null, expr(call("pick", ident("b"))));
            List<TypeParameter> tps = Collections.singletonList(typeParam("T"));

            AnalysisResult ok = new SemanticAnalyzer().analyze(program(genericIface("Compare", tps),
                    cls("Box").implement(type("Compare", type("I32"))).build(), pick, check));
            assertFalse(ok.hasErrors(), ok.getDiagnostics().toString());

            AnalysisResult bad = new SemanticAnalyzer().analyze(program(genericIface("Compare", tps),
                    cls("Box").implement(type("Compare", type("Str"))).build(), pick, check));
            assertTrue(bad.hasCode(ErrorCodes.BOUND_NOT_SATISFIED));
        }

        @Test
        @DisplayName("无法推断的类型参数报告 T059")
        void uninferred() {
            FunDecl make = genericFun("make", Collections.singletonList(typeParam("T")), params(), type("I32"),
                    ret(intLit(0)));
            AnalysisResult result = new SemanticAnalyzer().analyze(program(make,
                    fun("main", params(), null, expr(call("make")))));
            assertTrue(result.hasCode(ErrorCodes.UNINFERRED_TYPE_PARAM));
        }
    }

    @Nested
    @DisplayName("调用检查")
    class Calls {

        @Test
        @DisplayName("未定义函数报告 T005")
        void undefinedFunction() {
            AnalysisResult result = new SemanticAnalyzer().analyze(program(
                    fun("main", params(), null, expr(call("nowhere", intLit(1))))));
            assertTrue(result.hasCode(ErrorCodes.UNDEFINED_FUNCTION));
        }

        @Test
        @DisplayName("参数个数不符报告 T004")
        void paramCount() {
            AnalysisResult result = new SemanticAnalyzer().analyze(program(
                    fun("add", params(param("a", type("I32")), param("b", type("I32"))), type("I32"),
                            ret(binary(ident("a"), BinaryOp.ADD, ident("b")))),
                    fun("main", params(), null, expr(call("add", intLit(1))))));
            assertTrue(result.hasCode(ErrorCodes.PARAM_COUNT_MISMATCH));
        }

        @Test
        @DisplayName("let 类型不符报告 T001")
        void letMismatch() {
            AnalysisResult result = new SemanticAnalyzer().analyze(program(
                    fun("main", params(), null, let("s", type("Str"), intLit(1)))));
            assertTrue(result.hasCode(ErrorCodes.TYPE_MISMATCH));
        }

        @Test
        @DisplayName("整数字面量可赋给任意整数类型")
        void integerLiteralCoercion() {
            AnalysisResult result = new SemanticAnalyzer().analyze(program(
                    fun("main", params(), null,
                            let("a", type("U8"), intLit(1)),
                            let("b", type("I128"), intLit(2)))));
            assertFalse(result.hasErrors(), result.getDiagnostics().toString());
        }

        @Test
        @DisplayName("未定义标识符报告 T002")
        void undefinedName() {
            AnalysisResult result = new SemanticAnalyzer().analyze(program(
                    fun("main", params(), type("I32"), ret(ident("ghost")))));
            assertTrue(result.hasCode(ErrorCodes.UNDEFINED_NAME));
        }

        @Test
        @DisplayName("重复定义报告 T008")
        void duplicate() {
            AnalysisResult result = new SemanticAnalyzer().analyze(program(
                    cls("Twice").build(), cls("Twice").build()));
            assertTrue(result.hasCode(ErrorCodes.DUPLICATE_DEFINITION));
        }
    }

    @Nested
    @DisplayName("诊断报告")
    class Report {

        @Test
        @DisplayName("诊断导出为 JSON")
        void jsonReport() {
            Program program = program(fun("main", params(), null, expr(call("nowhere"))));
            AnalysisResult result = new SemanticAnalyzer().analyze(program);

            JsonObject report = JsonParser.parseString(DiagnosticReport.toJson(result.getDiagnostics()))
                    .getAsJsonObject();
            assertEquals(result.getErrors().size(), report.get("errorCount").getAsInt());
            JsonArray items = report.getAsJsonArray("diagnostics");
            JsonObject first = items.get(0).getAsJsonObject();
            assertEquals("error", first.get("severity").getAsString());
            assertEquals(ErrorCodes.UNDEFINED_FUNCTION, first.get("code").getAsString());
            assertEquals("test.tml", first.get("file").getAsString());
            assertEquals(1, first.get("line").getAsInt());
        }
    }
}

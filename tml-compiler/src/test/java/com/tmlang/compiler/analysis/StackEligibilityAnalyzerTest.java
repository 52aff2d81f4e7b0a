package com.tmlang.compiler.analysis;

import com.tmlang.compiler.analysis.env.ClassDef;
import com.tmlang.compiler.analysis.env.TypeEnvironment;
import com.tmlang.compiler.analysis.types.Types;
import com.tmlang.compiler.ast.Modifier;
import com.tmlang.compiler.ast.decl.Declaration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.tmlang.compiler.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("栈分配资格")
class StackEligibilityAnalyzerTest {

    private static TypeEnvironment analyze(Declaration... decls) {
        AnalysisResult result = new SemanticAnalyzer().analyze(program(decls));
        assertFalse(result.hasErrors(), result.getDiagnostics().toString());
        return result.getEnvironment();
    }

    @Test
    @DisplayName("sealed 类：vtable 指针 + 两个 I32 字段 = 16 字节，可栈分配")
    void sealedPoint() {
        TypeEnvironment env = analyze(cls("Point").modifier(Modifier.SEALED)
                .field("x", type("I32")).field("y", type("I32")).build());
        ClassDef point = env.lookupClass("Point");
        assertEquals(16, point.getEstimatedSize());
        assertTrue(point.isStackAllocatable());
        assertEquals(0, point.getInheritanceDepth());
    }

    @Test
    @DisplayName("@value 类没有 vtable 指针，8 字节，可栈分配")
    void valuePoint() {
        TypeEnvironment env = analyze(cls("Point").value()
                .field("x", type("I32")).field("y", type("I32")).build());
        ClassDef point = env.lookupClass("Point");
        assertEquals(8, point.getEstimatedSize());
        assertTrue(point.isStackAllocatable());
    }

    @Test
    @DisplayName("非 sealed 的普通类不可栈分配")
    void openPoint() {
        TypeEnvironment env = analyze(cls("Point")
                .field("x", type("I32")).field("y", type("I32")).build());
        ClassDef point = env.lookupClass("Point");
        assertEquals(16, point.getEstimatedSize());
        assertFalse(point.isStackAllocatable());
    }

    @Test
    @DisplayName("抽象类不可栈分配")
    void abstractClass() {
        TypeEnvironment env = analyze(cls("Shape").modifier(Modifier.ABSTRACT).modifier(Modifier.SEALED).build());
        assertFalse(env.lookupClass("Shape").isStackAllocatable());
    }

    @Test
    @DisplayName("超过上限的类不可栈分配")
    void tooLarge() {
        TypeEnvironment env = analyze(cls("Big").modifier(Modifier.SEALED)
                .field("data", arrayType(type("I64"), 64)).build());
        ClassDef big = env.lookupClass("Big");
        assertEquals(8 + 64 * 8, big.getEstimatedSize());
        assertFalse(big.isStackAllocatable());

        StackEligibilityAnalyzer relaxed = new StackEligibilityAnalyzer(env, 1024);
        assertTrue(relaxed.analyze(big).isStackAllocatable());
    }

    @Test
    @DisplayName("继承字段只计一次 vtable 指针")
    void inheritedFields() {
        TypeEnvironment env = analyze(
                cls("Base").field("a", type("I64")).build(),
                cls("Derived").extend("Base").field("b", type("I32")).build());
        ClassDef derived = env.lookupClass("Derived");
        assertEquals(8 + 8 + 4, derived.getEstimatedSize());
        assertEquals(1, derived.getInheritanceDepth());
    }

    @Test
    @DisplayName("类型尺寸估算")
    void typeSizes() {
        StackEligibilityAnalyzer analyzer = new StackEligibilityAnalyzer(new TypeEnvironment("test"));
        assertEquals(1, analyzer.typeSize(Types.BOOL));
        assertEquals(16, analyzer.typeSize(Types.I128));
        assertEquals(12, analyzer.typeSize(Types.tuple(Types.I32, Types.I64)));
        assertEquals(40, analyzer.typeSize(Types.array(Types.I32, 10)));
        assertEquals(16, analyzer.typeSize(Types.slice(Types.U8)));
        assertEquals(8, analyzer.typeSize(Types.named("List", Types.I32)));
    }
}

package com.tmlang.ir.backend;

import com.tmlang.compiler.analysis.types.ClosureType;
import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.analysis.types.Types;
import com.tmlang.compiler.ast.SourceLocation;
import com.tmlang.ir.mir.AtomicOrdering;
import com.tmlang.ir.mir.AtomicRmwOp;
import com.tmlang.ir.mir.BasicBlock;
import com.tmlang.ir.mir.BinaryOp;
import com.tmlang.ir.mir.CastKind;
import com.tmlang.ir.mir.MirBuilder;
import com.tmlang.ir.mir.MirEnumDef;
import com.tmlang.ir.mir.MirField;
import com.tmlang.ir.mir.MirFunction;
import com.tmlang.ir.mir.MirInst;
import com.tmlang.ir.mir.MirModule;
import com.tmlang.ir.mir.MirStructDef;
import com.tmlang.ir.mir.MirTerminator;
import com.tmlang.ir.mir.UnaryOp;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MirCodeGenerator 测试")
class MirCodeGeneratorTest {

    private MirModule module;
    private MirCodeGenerator generator;

    @BeforeEach
    void setUp() {
        module = new MirModule("demo");
        generator = new MirCodeGenerator();
    }

    private MirBuilder function(String name, TmlType returnType) {
        MirFunction f = new MirFunction(name, returnType);
        module.addFunction(f);
        return new MirBuilder(f);
    }

    private String generate() {
        return generator.generate(module);
    }

    private static int count(String text, String needle) {
        int n = 0;
        int from = 0;
        while ((from = text.indexOf(needle, from)) >= 0) {
            n++;
            from += needle.length();
        }
        return n;
    }

    @Nested
    @DisplayName("模块结构")
    class ModuleLayout {

        @Test
        @DisplayName("输出模块头和目标三元组")
        void header() {
            String ir = generate();
            assertThat(ir).startsWith("; ModuleID = 'demo'\nsource_filename = \"demo\"\n"
                    + "target triple = \"x86_64-pc-linux-gnu\"\n");
            assertThat(ir).contains("declare ptr @str_concat_opt(ptr, ptr)");
        }

        @Test
        @DisplayName("目标三元组可配置")
        void customTriple() {
            generator = new MirCodeGenerator(CodegenOptions.defaults().setTargetTriple("aarch64-apple-darwin"));
            assertThat(generate()).contains("target triple = \"aarch64-apple-darwin\"");
        }

        @Test
        @DisplayName("简单函数：参数用名字，临时值用 %vN")
        void simpleFunction() {
            MirBuilder b = function("add", Types.I32);
            int x = b.param("a", Types.I32);
            int y = b.param("b", Types.I32);
            b.emitReturn(b.emitBinary(BinaryOp.ADD, x, y, Types.I32));

            String ir = generate();
            assertThat(ir).contains("define i32 @add(i32 %a, i32 %b) {\nentry:\n");
            assertThat(ir).contains("  %v2 = add i32 %a, %b\n");
            assertThat(ir).contains("  ret i32 %v2\n}");
        }

        @Test
        @DisplayName("泛型模板不输出")
        void genericTemplateSkipped() {
            MirBuilder b = function("id", Types.generic("T"));
            b.getFunction().setTypeParams(Collections.singletonList("T"));
            b.emitReturn(b.param("x", Types.generic("T")));

            assertThat(generate()).doesNotContain("@id(");
        }

        @Test
        @DisplayName("字符串常量转义为十六进制")
        void stringEscapes() {
            MirBuilder b = function("greet", Types.STR);
            b.emitReturn(b.emitConstString("hi\n\""));

            String ir = generate();
            assertThat(ir).contains("@.str.0 = private unnamed_addr constant [5 x i8] c\"hi\\0A\\22\\00\", align 1");
            assertThat(ir).contains("ret ptr @.str.0");
        }

        @Test
        @DisplayName("相同字符串只生成一个全局")
        void stringsDeduplicated() {
            MirBuilder b = function("twice", Types.UNIT);
            b.emitConstString("same");
            b.emitConstString("same");
            b.emitReturnVoid();

            String ir = generate();
            assertThat(count(ir, "private unnamed_addr constant")).isEqualTo(1);
        }

        @Test
        @DisplayName("调用未定义函数生成 declare，模块路径分隔符改写")
        void externalDeclarations() {
            MirBuilder b = function("main", Types.UNIT);
            int x = b.param("x", Types.I32);
            b.emitCall("puts_int", new int[]{x}, null, Types.I32);
            b.emitCall("io::print", new int[]{x}, null, Types.UNIT);
            b.emitReturnVoid();

            String ir = generate();
            assertThat(ir).contains("  %v1 = call i32 @puts_int(i32 %x)");
            assertThat(ir).contains("declare i32 @puts_int(i32)");
            assertThat(ir).contains("  call void @io__print(i32 %x)");
            assertThat(ir).contains("declare void @io__print(i32)");
        }

        @Test
        @DisplayName("模块内已定义的函数不生成 declare")
        void noDeclarationForLocalFunction() {
            MirBuilder callee = function("helper", Types.I32);
            callee.emitReturn(callee.emitConstInt(1, Types.I32));
            MirBuilder b = function("main", Types.I32);
            b.emitReturn(b.emitCall("helper", new int[0], null, Types.I32));

            String ir = generate();
            assertThat(ir).contains("  %v0 = call i32 @helper()");
            assertThat(ir).doesNotContain("declare i32 @helper");
        }

        @Test
        @DisplayName("泛型调用使用修饰名")
        void genericCallMangled() {
            MirBuilder b = function("main", Types.I32);
            int x = b.param("x", Types.I32);
            b.emitReturn(b.emitGenericCall("identity", Collections.<TmlType>singletonList(Types.I32),
                    new int[]{x}, null, Types.I32));

            assertThat(generate()).contains("  %v1 = call i32 @identity__I32(i32 %x)");
        }
    }

    @Nested
    @DisplayName("算术与转换")
    class Arithmetic {

        @Test
        @DisplayName("无符号整数使用 udiv / icmp ult")
        void unsignedOps() {
            MirBuilder b = function("f", Types.BOOL);
            int x = b.param("a", Types.U32);
            int y = b.param("b", Types.U32);
            b.emitBinary(BinaryOp.DIV, x, y, Types.U32);
            b.emitBinary(BinaryOp.SHR, x, y, Types.U32);
            b.emitReturn(b.emitBinary(BinaryOp.LT, x, y, Types.BOOL));

            String ir = generate();
            assertThat(ir).contains("  %v2 = udiv i32 %a, %b");
            assertThat(ir).contains("  %v3 = lshr i32 %a, %b");
            assertThat(ir).contains("  %v4 = icmp ult i32 %a, %b");
            assertThat(ir).contains("  ret i1 %v4");
        }

        @Test
        @DisplayName("有符号整数使用 sdiv / srem / ashr")
        void signedOps() {
            MirBuilder b = function("f", Types.I64);
            int x = b.param("a", Types.I64);
            int y = b.param("b", Types.I64);
            b.emitBinary(BinaryOp.DIV, x, y, Types.I64);
            b.emitBinary(BinaryOp.MOD, x, y, Types.I64);
            b.emitReturn(b.emitBinary(BinaryOp.SHR, x, y, Types.I64));

            String ir = generate();
            assertThat(ir).contains("  %v2 = sdiv i64 %a, %b");
            assertThat(ir).contains("  %v3 = srem i64 %a, %b");
            assertThat(ir).contains("  %v4 = ashr i64 %a, %b");
        }

        @Test
        @DisplayName("浮点比较使用有序谓词")
        void floatCompare() {
            MirBuilder b = function("f", Types.BOOL);
            int x = b.param("a", Types.F64);
            int y = b.param("b", Types.F64);
            b.emitBinary(BinaryOp.MUL, x, y, Types.F64);
            b.emitReturn(b.emitBinary(BinaryOp.NE, x, y, Types.BOOL));

            String ir = generate();
            assertThat(ir).contains("  %v2 = fmul double %a, %b");
            assertThat(ir).contains("  %v3 = fcmp one double %a, %b");
        }

        @Test
        @DisplayName("宽度不一致时插入 sext，字面量不转换")
        void widthCoercion() {
            MirBuilder b = function("widen", Types.I32);
            int x = b.param("x", Types.I8);
            int y = b.param("y", Types.I32);
            int sum = b.emitBinary(BinaryOp.ADD, x, y, Types.I32);
            int one = b.emitConstInt(1, Types.I64);
            b.emitReturn(b.emitBinary(BinaryOp.ADD, sum, one, Types.I32));

            String ir = generate();
            assertThat(ir).contains("  %ext.0 = sext i8 %x to i32");
            assertThat(ir).contains("  %v2 = add i32 %ext.0, %y");
            assertThat(ir).contains("  %v4 = add i32 %v2, 1");
        }

        @Test
        @DisplayName("无符号扩展使用 zext")
        void unsignedWidening() {
            MirBuilder b = function("widen", Types.U64);
            int x = b.param("x", Types.U8);
            int y = b.param("y", Types.U64);
            b.emitReturn(b.emitBinary(BinaryOp.ADD, x, y, Types.U64));

            assertThat(generate()).contains("  %ext.0 = zext i8 %x to i64");
        }

        @Test
        @DisplayName("Str 相加调用运行时拼接")
        void stringConcat() {
            MirBuilder b = function("join", Types.STR);
            int s = b.param("s", Types.STR);
            int t = b.param("t", Types.STR);
            b.emitReturn(b.emitBinary(BinaryOp.ADD, s, t, Types.STR));

            String ir = generate();
            assertThat(ir).contains("  %v2 = call ptr @str_concat_opt(ptr %s, ptr %t)");
            assertThat(count(ir, "declare ptr @str_concat_opt")).isEqualTo(1);
        }

        @Test
        @DisplayName("一元运算")
        void unary() {
            MirBuilder b = function("f", Types.UNIT);
            int i = b.param("i", Types.I32);
            int d = b.param("d", Types.F64);
            int c = b.param("c", Types.BOOL);
            b.emitUnary(UnaryOp.NEG, i, Types.I32);
            b.emitUnary(UnaryOp.NEG, d, Types.F64);
            b.emitUnary(UnaryOp.NOT, c, Types.BOOL);
            b.emitReturnVoid();

            String ir = generate();
            assertThat(ir).contains("  %v3 = sub i32 0, %i");
            assertThat(ir).contains("  %v4 = fneg double %d");
            assertThat(ir).contains("  %v5 = xor i1 %c, true");
        }

        @Test
        @DisplayName("数值转换指令")
        void casts() {
            MirBuilder b = function("f", Types.UNIT);
            int wide = b.param("w", Types.I64);
            int real = b.param("r", Types.F64);
            int small = b.param("s", Types.U16);
            b.emitCast(CastKind.TRUNC, wide, Types.I32);
            b.emitCast(CastKind.FP_TO_SI, real, Types.I32);
            b.emitCast(CastKind.ZEXT, small, Types.I64);
            b.emitCast(CastKind.FP_TRUNC, real, Types.F32);
            b.emitCast(CastKind.TRUNC, wide, Types.BOOL);
            b.emitReturnVoid();

            String ir = generate();
            assertThat(ir).contains("  %v3 = trunc i64 %w to i32");
            assertThat(ir).contains("  %v4 = fptosi double %r to i32");
            assertThat(ir).contains("  %v5 = zext i16 %s to i64");
            assertThat(ir).contains("  %v6 = fptrunc double %r to float");
            assertThat(ir).contains("  %v7 = icmp ne i64 %w, 0");
        }

        @Test
        @DisplayName("浮点常量以十六进制位模式书写")
        void floatConstant() {
            MirBuilder b = function("half", Types.F64);
            b.emitReturn(b.emitConstFloat(1.5, Types.F64));

            assertThat(generate()).contains("  ret double 0x3FF8000000000000");
        }
    }

    @Nested
    @DisplayName("数组初始化")
    class ArrayInit {

        @Test
        @DisplayName("全零大数组只生成一次整块写入")
        void bulkZero() {
            MirBuilder b = function("zeros", Types.UNIT);
            int zero = b.emitConstInt(0, Types.I32);
            b.emitArrayRepeat(zero, 1000, Types.I32);
            b.emitReturnVoid();

            String ir = generate();
            assertThat(ir).contains("  %arr.0 = alloca [1000 x i32], align 16");
            assertThat(count(ir, "store [1000 x i32] zeroinitializer, ptr %arr.0, align 16")).isEqualTo(1);
            assertThat(ir).contains("  %v1 = load [1000 x i32], ptr %arr.0, align 16");
            assertThat(ir).doesNotContain("insertvalue");
        }

        @Test
        @DisplayName("非零常量统一值超过阈值时整块写入字面量")
        void uniformNonZeroConstant() {
            MirBuilder b = function("sevens", Types.UNIT);
            int seven = b.emitConstInt(7, Types.I32);
            b.emitArrayRepeat(seven, 200, Types.I32);
            b.emitReturnVoid();

            String ir = generate();
            assertThat(count(ir, "store [200 x i32] [i32 7")).isEqualTo(1);
            assertThat(count(ir, "i32 7")).isEqualTo(200);
            assertThat(ir).doesNotContain("insertvalue");
        }

        @Test
        @DisplayName("运行时统一值逐元素写入")
        void uniformRuntimeValue() {
            MirBuilder b = function("fill", Types.UNIT);
            int x = b.param("x", Types.I32);
            b.emitArrayRepeat(x, 150, Types.I32);
            b.emitReturnVoid();

            String ir = generate();
            assertThat(ir).contains("  %arr.elem.1 = getelementptr inbounds [150 x i32], ptr %arr.0, i32 0, i32 0");
            assertThat(ir).contains("  store i32 %x, ptr %arr.elem.1");
            assertThat(count(ir, "%arr.elem.")).isEqualTo(300);
        }

        @Test
        @DisplayName("小数组使用 insertvalue 链")
        void smallArray() {
            MirBuilder b = function("small", Types.UNIT);
            int a = b.emitConstInt(1, Types.I32);
            int c = b.emitConstInt(2, Types.I32);
            int d = b.emitConstInt(3, Types.I32);
            b.emitArrayInit(new int[]{a, c, d}, Types.I32);
            b.emitReturnVoid();

            String ir = generate();
            assertThat(ir).contains("  %ins.0 = insertvalue [3 x i32] undef, i32 1, 0");
            assertThat(ir).contains("  %ins.1 = insertvalue [3 x i32] %ins.0, i32 2, 1");
            assertThat(ir).contains("  %v3 = insertvalue [3 x i32] %ins.1, i32 3, 2");
        }

        @Test
        @DisplayName("阈值可配置")
        void thresholdConfigurable() {
            generator = new MirCodeGenerator(CodegenOptions.defaults().setBulkZeroThreshold(4));
            MirBuilder b = function("fives", Types.UNIT);
            int five = b.emitConstInt(5, Types.I32);
            b.emitArrayRepeat(five, 6, Types.I32);
            b.emitReturnVoid();

            assertThat(generate()).contains("store [6 x i32] [i32 5, i32 5, i32 5, i32 5, i32 5, i32 5]");
        }
    }

    @Nested
    @DisplayName("聚合体与 sret")
    class Aggregates {

        @Test
        @DisplayName("大于阈值的结构体返回值走 sret")
        void sretDefinitionAndCall() {
            module.addStruct(new MirStructDef("Big", null, Arrays.asList(
                    new MirField("a", Types.I64), new MirField("b", Types.I64), new MirField("c", Types.I64))));
            MirBuilder make = function("make", Types.named("Big"));
            int a = make.emitConstInt(1, Types.I64);
            int b2 = make.emitConstInt(2, Types.I64);
            int c = make.emitConstInt(3, Types.I64);
            make.emitReturn(make.emitStructInit("Big", new int[]{a, b2, c}, Types.named("Big")));

            MirBuilder use = function("use", Types.UNIT);
            use.emitCall("make", new int[0], null, Types.named("Big"));
            use.emitReturnVoid();

            String ir = generate();
            assertThat(ir).contains("%struct.Big = type { i64, i64, i64 }");
            assertThat(ir).contains("define void @make(ptr sret(%struct.Big) %sret) {");
            assertThat(ir).contains("  %v3 = insertvalue %struct.Big %ins.1, i64 3, 2");
            assertThat(ir).contains("  store %struct.Big %v3, ptr %sret\n  ret void");
            assertThat(ir).contains("  %sret.slot.0 = alloca %struct.Big, align 8");
            assertThat(ir).contains("  call void @make(ptr sret(%struct.Big) %sret.slot.0)");
            assertThat(ir).contains("  %v0 = load %struct.Big, ptr %sret.slot.0, align 8");
            assertThat(ir).doesNotContain("declare void @make");
        }

        @Test
        @DisplayName("小结构体按值返回")
        void smallStructByValue() {
            module.addStruct(new MirStructDef("Point", null, Arrays.asList(
                    new MirField("x", Types.I32), new MirField("y", Types.I32))));
            MirBuilder b = function("origin", Types.named("Point"));
            int zero = b.emitConstInt(0, Types.I32);
            b.emitReturn(b.emitStructInit("Point", new int[]{zero, zero}, Types.named("Point")));

            String ir = generate();
            assertThat(ir).contains("define %struct.Point @origin() {");
            assertThat(ir).contains("ret %struct.Point %v1");
        }

        @Test
        @DisplayName("显式 sret 标记优先")
        void explicitSret() {
            MirBuilder b = function("pair", Types.tuple(Types.I32, Types.I32));
            b.getFunction().setSret(true);
            int one = b.emitConstInt(1, Types.I32);
            b.emitReturn(b.emitTupleInit(new int[]{one, one}, Types.tuple(Types.I32, Types.I32)));

            assertThat(generate()).contains("define void @pair(ptr sret({ i32, i32 }) %sret) {");
        }

        @Test
        @DisplayName("类实例按引用语义分配并逐字段写入")
        void classInit() {
            module.addStruct(new MirStructDef("Node", null, Collections.singletonList(new MirField("v", Types.I32))));
            MirBuilder b = function("mk", Types.UNIT);
            int five = b.emitConstInt(5, Types.I32);
            b.emitStructInit("Node", new int[]{five}, Types.classType("Node"));
            b.emitReturnVoid();

            String ir = generate();
            assertThat(ir).contains("  %v1 = alloca %struct.Node");
            assertThat(ir).contains("  %field.0 = getelementptr inbounds %struct.Node, ptr %v1, i32 0, i32 0");
            assertThat(ir).contains("  store i32 5, ptr %field.0");
        }

        @Test
        @DisplayName("无载荷枚举只含标签")
        void fieldlessEnum() {
            module.addEnum(new MirEnumDef("Color", null, Arrays.asList(
                    new MirEnumDef.Variant("Red", null),
                    new MirEnumDef.Variant("Green", null),
                    new MirEnumDef.Variant("Blue", null))));
            MirBuilder b = function("blue", Types.UNIT);
            b.emitEnumInit(new MirInst.EnumInfo("Color", null, "Blue", 2), new int[0], Types.named("Color"));
            b.emitReturnVoid();

            String ir = generate();
            assertThat(ir).contains("%struct.Color = type { i32 }");
            assertThat(ir).contains("  %v0 = insertvalue %struct.Color undef, i32 2, 0");
        }

        @Test
        @DisplayName("带载荷枚举写入标签和载荷区")
        void payloadEnum() {
            module.addEnum(new MirEnumDef("Opt", null, Arrays.asList(
                    new MirEnumDef.Variant("None", null),
                    new MirEnumDef.Variant("Some", Collections.<TmlType>singletonList(Types.I64)))));
            MirBuilder b = function("some", Types.UNIT);
            int x = b.param("x", Types.I64);
            b.emitEnumInit(new MirInst.EnumInfo("Opt", null, "Some", 1), new int[]{x}, Types.named("Opt"));
            b.emitReturnVoid();

            String ir = generate();
            assertThat(ir).contains("%struct.Opt = type { i32, [8 x i8] }");
            assertThat(ir).contains("  %enum.0 = alloca %struct.Opt\n"
                    + "  %tag.0 = getelementptr inbounds %struct.Opt, ptr %enum.0, i32 0, i32 0\n"
                    + "  store i32 1, ptr %tag.0\n"
                    + "  %payload.0 = getelementptr inbounds %struct.Opt, ptr %enum.0, i32 0, i32 1\n"
                    + "  store i64 %x, ptr %payload.0\n"
                    + "  %v1 = load %struct.Opt, ptr %enum.0\n");
        }

        @Test
        @DisplayName("多个载荷按偏移写入")
        void multiPayloadOffsets() {
            module.addEnum(new MirEnumDef("Msg", null, Arrays.asList(
                    new MirEnumDef.Variant("Quit", null),
                    new MirEnumDef.Variant("Move", Arrays.<TmlType>asList(Types.I32, Types.I64)))));
            MirBuilder b = function("move", Types.UNIT);
            int x = b.param("x", Types.I32);
            int y = b.param("y", Types.I64);
            b.emitEnumInit(new MirInst.EnumInfo("Msg", null, "Move", 1), new int[]{x, y}, Types.named("Msg"));
            b.emitReturnVoid();

            String ir = generate();
            assertThat(ir).contains("%struct.Msg = type { i32, [12 x i8] }");
            assertThat(ir).contains("  store i32 %x, ptr %payload.0");
            assertThat(ir).contains("  %payload.0.1 = getelementptr inbounds i8, ptr %payload.0, i64 4");
            assertThat(ir).contains("  store i64 %y, ptr %payload.0.1");
        }
    }

    @Nested
    @DisplayName("方法调用与闭包")
    class Calls {

        @Test
        @DisplayName("整数 cmp 内联为无分支比较")
        void inlineCmp() {
            MirBuilder b = function("order", Types.named("Ordering"));
            int x = b.param("a", Types.I32);
            int y = b.param("b", Types.I32);
            b.emitReturn(b.emitMethodCall(x, Types.I32, "cmp", new int[]{y}, Types.named("Ordering")));

            String ir = generate();
            assertThat(ir).contains("%struct.Ordering = type { i32 }");
            assertThat(ir).contains("  %cmp_lt.2 = icmp slt i32 %a, %b\n"
                    + "  %cmp_gt.2 = icmp sgt i32 %a, %b\n"
                    + "  %tag_1.2 = select i1 %cmp_lt.2, i32 0, i32 1\n"
                    + "  %tag_2.2 = select i1 %cmp_gt.2, i32 2, i32 %tag_1.2\n"
                    + "  %v2 = insertvalue %struct.Ordering undef, i32 %tag_2.2, 0\n");
            assertThat(ir).doesNotContain("@I32__cmp");
        }

        @Test
        @DisplayName("引用接收者先 load")
        void inlineCmpThroughReference() {
            MirBuilder b = function("order", Types.named("Ordering"));
            int x = b.param("a", Types.ref(Types.U64));
            int y = b.param("b", Types.ref(Types.U64));
            b.emitReturn(b.emitMethodCall(x, Types.ref(Types.U64), "cmp", new int[]{y}, Types.named("Ordering")));

            String ir = generate();
            assertThat(ir).contains("  %self.2 = load i64, ptr %a");
            assertThat(ir).contains("  %other.2 = load i64, ptr %b");
            assertThat(ir).contains("  %cmp_lt.2 = icmp ult i64 %self.2, %other.2");
        }

        @Test
        @DisplayName("浮点 partial_cmp 在无序时返回 Nothing")
        void inlinePartialCmp() {
            TmlType maybe = Types.named("Maybe", Types.named("Ordering"));
            MirBuilder b = function("porder", maybe);
            int x = b.param("a", Types.F64);
            int y = b.param("b", Types.F64);
            b.emitReturn(b.emitMethodCall(x, Types.F64, "partial_cmp", new int[]{y}, maybe));

            String ir = generate();
            assertThat(ir).contains("%struct.Maybe__Ordering = type { i32, [8 x i8] }");
            assertThat(ir).contains("  %cmp_lt.2 = fcmp olt double %a, %b");
            assertThat(ir).contains("  %unord.2 = fcmp uno double %a, %b");
            assertThat(ir).contains("  %maybe_tag_v.2 = select i1 %unord.2, i32 1, i32 0");
            assertThat(ir).contains("  store i32 %maybe_tag_v.2, ptr %maybe_tag.2");
            assertThat(ir).contains("  %v2 = load %struct.Maybe__Ordering, ptr %maybe.2");
        }

        @Test
        @DisplayName("虚方法经 vtable 槽位间接调用")
        void virtualCall() {
            MirBuilder b = function("area", Types.F64);
            int self = b.param("self", Types.classType("Shape"));
            b.emitReturn(b.emitMethodCall(self, Types.classType("Shape"), "area", new int[0], Types.F64, 2));

            String ir = generate();
            assertThat(ir).contains("  %vt.0 = load ptr, ptr %self\n"
                    + "  %slot.0 = getelementptr ptr, ptr %vt.0, i32 2\n"
                    + "  %fn.0 = load ptr, ptr %slot.0\n"
                    + "  %v1 = call double %fn.0(ptr %self)\n");
        }

        @Test
        @DisplayName("非虚方法直接调用 Type__method")
        void directMethodCall() {
            MirBuilder b = function("area", Types.F64);
            int self = b.param("self", Types.classType("Shape"));
            b.emitReturn(b.emitMethodCall(self, Types.classType("Shape"), "area", new int[0], Types.F64));

            String ir = generate();
            assertThat(ir).contains("  %v1 = call double @Shape__area(ptr %self)");
            assertThat(ir).contains("declare double @Shape__area(ptr)");
        }

        @Test
        @DisplayName("闭包为 { 函数指针, 环境指针 } 对")
        void closures() {
            ClosureType ct = new ClosureType(Collections.<TmlType>singletonList(Types.I32), Types.I32,
                    Collections.<ClosureType.Capture>emptyList());
            MirBuilder b = function("run", Types.I32);
            int clo = b.emitClosure("adder", -1, ct);
            int four = b.emitConstInt(4, Types.I32);
            b.emitReturn(b.emitClosureCall(clo, new int[]{four}, Types.I32));

            String ir = generate();
            assertThat(ir).contains("  %clo.0 = insertvalue { ptr, ptr } undef, ptr @adder, 0\n"
                    + "  %v0 = insertvalue { ptr, ptr } %clo.0, ptr null, 1\n");
            assertThat(ir).contains("  %clo.fn.1 = extractvalue { ptr, ptr } %v0, 0\n"
                    + "  %clo.env.1 = extractvalue { ptr, ptr } %v0, 1\n"
                    + "  %v2 = call i32 %clo.fn.1(ptr %clo.env.1, i32 4)\n");
        }
    }

    @Nested
    @DisplayName("原子操作")
    class Atomics {

        @Test
        @DisplayName("未指定内存序时默认 seq_cst")
        void defaultOrdering() {
            MirBuilder b = function("atomics", Types.UNIT);
            int p = b.param("p", Types.mutPtr(Types.I64));
            int v = b.emitAtomicLoad(p, Types.I64, null);
            b.emitAtomicStore(p, v, Types.I64, AtomicOrdering.RELEASE);
            int old = b.emitAtomicRmw(AtomicRmwOp.ADD, p, v, Types.I64, null);
            b.emitCmpXchg(p, v, old, Types.I64, AtomicOrdering.ACQ_REL, null, true);
            b.emitFence(null, true);
            b.emitFence(AtomicOrdering.ACQUIRE, false);
            b.emitReturnVoid();

            String ir = generate();
            assertThat(ir).contains("  %v1 = load atomic i64, ptr %p seq_cst, align 8");
            assertThat(ir).contains("  store atomic i64 %v1, ptr %p release, align 8");
            assertThat(ir).contains("  %v2 = atomicrmw add ptr %p, i64 %v1 seq_cst");
            assertThat(ir).contains("  %cmpxchg.0 = cmpxchg weak ptr %p, i64 %v1, i64 %v2 acq_rel acquire");
            assertThat(ir).contains("  %v3 = extractvalue { i64, i1 } %cmpxchg.0, 0");
            assertThat(ir).contains("  fence syncscope(\"singlethread\") seq_cst");
            assertThat(ir).contains("  fence acquire");
        }

        @Test
        @DisplayName("窄类型原子访问使用自然对齐")
        void narrowAlignment() {
            MirBuilder b = function("flag", Types.UNIT);
            int p = b.param("p", Types.mutPtr(Types.I32));
            b.emitAtomicLoad(p, Types.I32, AtomicOrdering.ACQUIRE);
            b.emitReturnVoid();

            assertThat(generate()).contains("  %v1 = load atomic i32, ptr %p acquire, align 4");
        }
    }

    @Nested
    @DisplayName("终止指令")
    class Terminators {

        @Test
        @DisplayName("条件分支与 phi")
        void branchAndPhi() {
            MirBuilder b = function("pick", Types.I32);
            int c = b.param("c", Types.BOOL);
            BasicBlock then = b.newBlock("then");
            BasicBlock other = b.newBlock("else");
            BasicBlock join = b.newBlock("join");
            b.emitBranch(c, then, other);

            b.switchToBlock(then);
            int one = b.emitConstInt(1, Types.I32);
            b.emitGoto(join);
            b.switchToBlock(other);
            int two = b.emitConstInt(2, Types.I32);
            b.emitGoto(join);
            b.switchToBlock(join);
            b.emitReturn(b.emitPhi(Arrays.asList(new MirInst.PhiIncoming(one, then.getId()),
                    new MirInst.PhiIncoming(two, other.getId())), Types.I32));

            String ir = generate();
            assertThat(ir).contains("  br i1 %c, label %then1, label %else2");
            assertThat(ir).contains("then1:\n  br label %join3");
            assertThat(ir).contains("  %v3 = phi i32 [ 1, %then1 ], [ 2, %else2 ]");
            assertThat(generator.getFallbackCount()).isZero();
        }

        @Test
        @DisplayName("switch 列出全部分支")
        void switchTerminator() {
            MirBuilder b = function("sw", Types.UNIT);
            int d = b.param("d", Types.I32);
            BasicBlock one = b.newBlock("one");
            BasicBlock two = b.newBlock("two");
            BasicBlock dflt = b.newBlock("dflt");
            Map<Long, Integer> cases = new LinkedHashMap<>();
            cases.put(1L, one.getId());
            cases.put(2L, two.getId());
            b.emitSwitch(d, cases, dflt);
            for (BasicBlock block : Arrays.asList(one, two, dflt)) {
                b.switchToBlock(block);
                b.emitReturnVoid();
            }

            assertThat(generate()).contains("  switch i32 %d, label %dflt3 [\n"
                    + "    i32 1, label %one1\n"
                    + "    i32 2, label %two2\n"
                    + "  ]\n");
        }

        @Test
        @DisplayName("switch 分支无法落地时整条指令不可达")
        void switchCaseWithoutLabel() {
            MirBuilder b = function("spin", Types.UNIT);
            int d = b.param("d", Types.I32);
            BasicBlock loop = b.newBlock("loop");
            Map<Long, Integer> cases = new LinkedHashMap<>();
            cases.put(1L, 99);
            b.emitSwitch(d, cases, loop);
            b.switchToBlock(loop);
            b.emitGoto(loop);

            String ir = generate();
            assertThat(ir).contains("entry:\n  unreachable\n");
            assertThat(ir).doesNotContain("switch i32");
            assertThat(generator.getFallbackCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("缺失标签退回首个 return 块")
        void missingLabelFallsBackToReturnBlock() {
            MirBuilder b = function("f", Types.I32);
            int c = b.param("c", Types.BOOL);
            BasicBlock exit = b.newBlock("exit");
            b.getCurrentBlock().setTerminator(new MirTerminator.Branch(SourceLocation.UNKNOWN, c, exit.getId(), 99));
            b.switchToBlock(exit);
            b.emitReturn(b.emitConstInt(0, Types.I32));

            String ir = generate();
            assertThat(ir).contains("  br i1 %c, label %exit1, label %exit1");
            assertThat(generator.getFallbackCount()).isGreaterThan(0);
        }

        @Test
        @DisplayName("没有 return 块时缺失标签输出 unreachable")
        void missingLabelWithoutFallback() {
            MirBuilder b = function("spin", Types.UNIT);
            b.getCurrentBlock().setTerminator(new MirTerminator.Goto(SourceLocation.UNKNOWN, 42));

            assertThat(generate()).contains("entry:\n  unreachable\n");
        }

        @Test
        @DisplayName("无终止指令的块补 unreachable")
        void missingTerminator() {
            function("empty", Types.UNIT);

            String ir = generate();
            assertThat(ir).contains("define void @empty() {\nentry:\n  unreachable\n}");
            assertThat(generator.getFallbackCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("非 void 函数无值返回输出 undef")
        void returnWithoutValue() {
            MirBuilder b = function("f", Types.I64);
            b.emitReturnVoid();

            assertThat(generate()).contains("  ret i64 undef");
        }

        @Test
        @DisplayName("phi 入边缺失标签时退回 return 块")
        void phiIncomingFallsBack() {
            MirBuilder b = function("f", Types.I32);
            int one = b.emitConstInt(1, Types.I32);
            BasicBlock next = b.newBlock("next");
            b.emitGoto(next);
            b.switchToBlock(next);
            int phi = b.emitPhi(Arrays.asList(new MirInst.PhiIncoming(one, 0),
                    new MirInst.PhiIncoming(one, 77)), Types.I32);
            b.emitReturn(phi);

            String ir = generate();
            assertThat(ir).contains("  %v1 = phi i32 [ 1, %entry ], [ 1, %next1 ]");
        }
    }
}

package com.tmlang.ir;

import com.tmlang.compiler.analysis.AnalysisResult;
import com.tmlang.compiler.analysis.AnalyzerOptions;
import com.tmlang.compiler.analysis.SemanticAnalyzer;
import com.tmlang.compiler.analysis.env.TypeEnvironment;
import com.tmlang.compiler.analysis.generic.NameMangler;
import com.tmlang.compiler.ast.decl.Program;
import com.tmlang.ir.backend.CodegenOptions;
import com.tmlang.ir.backend.MirCodeGenerator;
import com.tmlang.ir.mir.MirModule;
import com.tmlang.ir.mono.MirInstantiator;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.logging.Logger;

/**
 * 编译器门面。
 * 管线：AST → 语义分析 → (MIR 由外部构建) → 单态化 → 文本 IR。
 * 同一实例内的语义分析与单态化共用一个 {@link NameMangler}，修饰名一致。
 */
public class TmlIrCompiler {

    private static final Logger LOG = Logger.getLogger(TmlIrCompiler.class.getName());

    private final CodegenOptions codegenOptions;
    private final AnalyzerOptions analyzerOptions;
    private final NameMangler mangler;

    public TmlIrCompiler() {
        this(CodegenOptions.defaults(), AnalyzerOptions.defaults());
    }

    public TmlIrCompiler(CodegenOptions codegenOptions, AnalyzerOptions analyzerOptions) {
        this.codegenOptions = codegenOptions;
        this.analyzerOptions = analyzerOptions;
        this.mangler = new NameMangler(codegenOptions.getInstantiationCacheSize());
    }

    public NameMangler getMangler() {
        return mangler;
    }

    /**
     * 只做语义分析，诊断通过返回值给出，不抛异常。
     */
    public AnalysisResult check(Program program) {
        SemanticAnalyzer analyzer = new SemanticAnalyzer(analyzerOptions,
                new TypeEnvironment(program.getModulePath()), mangler);
        return analyzer.analyze(program);
    }

    /**
     * 分析后单态化并生成文本 IR。
     *
     * @throws CompilationException 编译单元存在语义错误
     */
    public String compile(Program program, MirModule module) {
        AnalysisResult result = check(program);
        if (result.hasErrors()) {
            throw new CompilationException("Compilation of " + program.getModulePath() + " failed with "
                    + result.getErrors().size() + " error(s)", result.getDiagnostics());
        }
        return lower(module);
    }

    /**
     * 对已通过检查的 MIR 单态化并生成文本 IR。
     */
    public String lower(MirModule module) {
        MirModule concrete = new MirInstantiator(mangler).run(module);
        String text = new MirCodeGenerator(codegenOptions, mangler).generate(concrete);
        LOG.fine("Lowered " + module.getName() + ": " + concrete.getFunctions().size() + " functions");
        return text;
    }

    /**
     * 编译并写入文件。
     */
    public void compileToFile(Program program, MirModule module, File outFile) throws IOException {
        String text = compile(program, module);
        File parent = outFile.getAbsoluteFile().getParentFile();
        if (parent != null) parent.mkdirs();
        Files.write(outFile.toPath(), text.getBytes(StandardCharsets.UTF_8));
    }
}

package com.tmlang.ir;

import com.tmlang.compiler.analysis.DiagnosticReport;
import com.tmlang.compiler.analysis.SemanticDiagnostic;

import java.util.Collections;
import java.util.List;

/**
 * 编译单元存在语义错误，不能进入 lowering
 */
public class CompilationException extends RuntimeException {
    private final List<SemanticDiagnostic> diagnostics;

    public CompilationException(String message, List<SemanticDiagnostic> diagnostics) {
        super(message);
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    public List<SemanticDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    /** JSON 形式的诊断报告 */
    public String toReport() {
        return DiagnosticReport.toJson(diagnostics);
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        int shown = 0;
        for (SemanticDiagnostic d : diagnostics) {
            if (!d.isError()) continue;
            sb.append("\n  ").append(d);
            if (++shown == 10) {
                sb.append("\n  ...");
                break;
            }
        }
        return sb.toString();
    }
}

package com.tmlang.compiler.analysis;

import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.analysis.types.TypeCompatibility;
import com.tmlang.compiler.ast.AstNode;
import com.tmlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 诊断收集：所有检查器共享同一个诊断列表，错误不抛出，检查继续进行。
 */
public final class SemanticChecker {

    private final List<SemanticDiagnostic> diagnostics;

    public SemanticChecker(List<SemanticDiagnostic> diagnostics) {
        this.diagnostics = diagnostics;
    }

    public List<SemanticDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    /** 报告错误 */
    public void error(String code, String message, SourceLocation location) {
        report(SemanticDiagnostic.Severity.ERROR, code, message, location);
    }

    public void error(String code, String message, AstNode node) {
        error(code, message, node != null ? node.getLocation() : null);
    }

    public void warning(String code, String message, SourceLocation location) {
        report(SemanticDiagnostic.Severity.WARNING, code, message, location);
    }

    public void report(SemanticDiagnostic.Severity severity, String code, String message, SourceLocation location) {
        int length = location != null ? Math.max(location.getLength(), 1) : 1;
        diagnostics.add(new SemanticDiagnostic(severity, code, message, location, length));
    }

    /**
     * 类型兼容性检查，不兼容时报告 code 对应的错误。
     *
     * @return 是否兼容
     */
    public boolean checkCompatible(TmlType expected, TmlType actual, String code, String context, AstNode node) {
        if (expected == null || actual == null) return true;
        if (TypeCompatibility.isCompatible(expected, actual)) return true;
        error(code, context + ": expected '" + expected.toDisplayString()
                + "' but found '" + actual.toDisplayString() + "'", node);
        return false;
    }

    public boolean hasErrors() {
        for (SemanticDiagnostic d : diagnostics) {
            if (d.isError()) return true;
        }
        return false;
    }

    public int errorCount() {
        int count = 0;
        for (SemanticDiagnostic d : diagnostics) {
            if (d.isError()) count++;
        }
        return count;
    }
}

package com.tmlang.compiler.analysis;

import com.tmlang.compiler.analysis.env.TypeEnvironment;
import com.tmlang.compiler.analysis.generic.Instantiation;
import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.ast.expr.CallExpr;
import com.tmlang.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 语义分析结果：诊断、表达式类型与调用点实例化。
 */
public final class AnalysisResult {
    private final List<SemanticDiagnostic> diagnostics;
    private final Map<Expression, TmlType> exprTypes;
    private final Map<CallExpr, Instantiation> instantiations;
    private final TypeEnvironment environment;

    public AnalysisResult(List<SemanticDiagnostic> diagnostics, Map<Expression, TmlType> exprTypes,
                          Map<CallExpr, Instantiation> instantiations, TypeEnvironment environment) {
        this.diagnostics = Collections.unmodifiableList(diagnostics);
        this.exprTypes = Collections.unmodifiableMap(exprTypes);
        this.instantiations = Collections.unmodifiableMap(instantiations);
        this.environment = environment;
    }

    public List<SemanticDiagnostic> getDiagnostics() { return diagnostics; }
    public Map<Expression, TmlType> getExprTypes() { return exprTypes; }
    public Map<CallExpr, Instantiation> getInstantiations() { return instantiations; }
    public TypeEnvironment getEnvironment() { return environment; }

    /** 获取单个表达式的类型 */
    public TmlType getExprType(Expression expr) {
        return exprTypes.get(expr);
    }

    public Instantiation getInstantiation(CallExpr call) {
        return instantiations.get(call);
    }

    public boolean hasErrors() {
        for (SemanticDiagnostic d : diagnostics) {
            if (d.isError()) return true;
        }
        return false;
    }

    public List<SemanticDiagnostic> getErrors() {
        List<SemanticDiagnostic> errors = new ArrayList<SemanticDiagnostic>();
        for (SemanticDiagnostic d : diagnostics) {
            if (d.isError()) errors.add(d);
        }
        return errors;
    }

    /** 是否包含指定错误码的诊断 */
    public boolean hasCode(String code) {
        for (SemanticDiagnostic d : diagnostics) {
            if (d.getCode().equals(code)) return true;
        }
        return false;
    }
}

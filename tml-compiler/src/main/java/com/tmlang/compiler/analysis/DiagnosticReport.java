package com.tmlang.compiler.analysis;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.tmlang.compiler.ast.SourceLocation;

import java.util.List;
import java.util.Locale;

/**
 * 诊断的 JSON 报告，供编辑器和构建工具消费。
 * <pre>
 * { "errorCount": 1, "warningCount": 0,
 *   "diagnostics": [ { "severity": "error", "code": "T026", "message": "...",
 *                      "file": "a.tml", "line": 3, "column": 5, "length": 4 } ] }
 * </pre>
 */
public final class DiagnosticReport {

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private DiagnosticReport() {}

    public static JsonObject toJsonObject(List<SemanticDiagnostic> diagnostics) {
        JsonObject report = new JsonObject();
        JsonArray items = new JsonArray();
        int errors = 0, warnings = 0;
        for (SemanticDiagnostic sd : diagnostics) {
            if (sd.getSeverity() == SemanticDiagnostic.Severity.ERROR) errors++;
            else if (sd.getSeverity() == SemanticDiagnostic.Severity.WARNING) warnings++;

            JsonObject diag = new JsonObject();
            diag.addProperty("severity", sd.getSeverity().name().toLowerCase(Locale.ROOT));
            diag.addProperty("code", sd.getCode());
            diag.addProperty("message", sd.getMessage());
            SourceLocation loc = sd.getLocation();
            if (loc != null) {
                diag.addProperty("file", loc.getFile());
                diag.addProperty("line", loc.getLine());
                diag.addProperty("column", loc.getColumn());
            }
            diag.addProperty("length", sd.getLength());
            items.add(diag);
        }
        report.addProperty("errorCount", errors);
        report.addProperty("warningCount", warnings);
        report.add("diagnostics", items);
        return report;
    }

    public static String toJson(List<SemanticDiagnostic> diagnostics) {
        return GSON.toJson(toJsonObject(diagnostics));
    }
}

package com.tmlang.compiler.analysis;

import com.tmlang.compiler.ast.SourceLocation;

import java.util.Locale;

/**
 * 语义诊断条目
 */
public final class SemanticDiagnostic {

    public enum Severity {
        ERROR, WARNING, INFO, HINT
    }

    private final Severity severity;
    private final String code;
    private final String message;
    private final SourceLocation location;
    private final int length;

    public SemanticDiagnostic(Severity severity, String code, String message, SourceLocation location, int length) {
        this.severity = severity;
        this.code = code;
        this.message = message;
        this.location = location;
        this.length = length;
    }

    public Severity getSeverity() { return severity; }
    public String getCode() { return code; }
    public String getMessage() { return message; }
    public SourceLocation getLocation() { return location; }
    public int getLength() { return length; }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return (location != null ? location + ": " : "") + severity.name().toLowerCase(Locale.ROOT)
                + "[" + code + "]: " + message;
    }
}

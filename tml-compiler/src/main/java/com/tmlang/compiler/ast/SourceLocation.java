package com.tmlang.compiler.ast;

/**
 * 源码位置信息
 */
public final class SourceLocation {
    private final String file;
    private final int line;
    private final int column;
    private final int length;

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0, 0);

    public SourceLocation(String file, int line, int column, int length) {
        this.file = file;
        this.line = line;
        this.column = column;
        this.length = length;
    }

    public static SourceLocation at(String file, int line, int column) {
        return new SourceLocation(file, line, column, 1);
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getLength() {
        return length;
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}

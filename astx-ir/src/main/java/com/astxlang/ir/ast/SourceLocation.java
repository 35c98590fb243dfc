package com.astxlang.ir.ast;

/**
 * 源码位置信息，随节点携带，核心不做解释
 */
public final class SourceLocation {
    private final String file;
    private final int line;
    private final int column;

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", -1, -1);

    public SourceLocation(String file, int line, int column) {
        this.file = file != null ? file.intern() : null;
        this.line = line;
        this.column = column;
    }

    public SourceLocation(int line, int column) {
        this(null, line, column);
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

    public boolean isKnown() {
        return this != UNKNOWN && line >= 0;
    }

    @Override
    public String toString() {
        return (file != null ? file : "<unknown>") + ":" + line + ":" + column;
    }
}

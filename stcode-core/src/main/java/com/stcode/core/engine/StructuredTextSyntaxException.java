package com.stcode.core.engine;

/**
 * The source text does not match the grammar.
 */
public class StructuredTextSyntaxException extends StructuredTextException {

    private final int line;
    private final int column;

    public StructuredTextSyntaxException(String filename, int line, int column, String detail) {
        super(filename, String.format("%s:%d:%d: %s", filename, line, column, detail));
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}

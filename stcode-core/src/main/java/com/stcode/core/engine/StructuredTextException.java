package com.stcode.core.engine;

/**
 * Base class of all failures raised while turning a source file into an AST.
 * Carries the filename the failure belongs to.
 */
public class StructuredTextException extends RuntimeException {

    private final String filename;

    public StructuredTextException(String filename, String message) {
        super(message);
        this.filename = filename;
    }

    public StructuredTextException(String filename, String message, Throwable cause) {
        super(message, cause);
        this.filename = filename;
    }

    public String getFilename() {
        return filename;
    }
}

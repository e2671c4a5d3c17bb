package com.stcode.core.engine;

/**
 * Parses Structured Text into an untyped {@link GenericTree}.
 *
 * <p>Implementations need not be thread-safe. Callers that parse concurrently either
 * give each worker its own engine or rely on the implementation's own locking.
 */
public interface GrammarEngine {

    /**
     * @param text complete source text
     * @param filename label used in diagnostics
     * @return parse tree rooted at {@code iec_source}
     * @throws StructuredTextSyntaxException if the text does not match the grammar
     */
    GenericTree parse(String text, String filename);
}

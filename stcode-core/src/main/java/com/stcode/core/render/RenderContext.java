package com.stcode.core.render;

/**
 * Formatting settings applied while rendering an AST back to source text.
 *
 * @param indent indentation unit prepended once per nesting level
 * @param blankLineBetweenItems whether top-level source items are separated by an empty line
 */
public record RenderContext(
    String indent,
    boolean blankLineBetweenItems
) {
    public static final String DEFAULT_INDENT = "    ";

    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        if (indent == null) {
            indent = DEFAULT_INDENT;
        }
        if (indent.isEmpty()) {
            throw new IllegalArgumentException("indent must not be empty");
        }
        if (!indent.isBlank()) {
            throw new IllegalArgumentException("indent must only contain whitespace: '" + indent + "'");
        }
    }

    /**
     * Four-space indentation with a blank line between top-level items.
     *
     * @return default render context
     */
    public static RenderContext defaults() {
        return new RenderContext(DEFAULT_INDENT, true);
    }

    /**
     * Creates a context indenting with the given number of spaces.
     *
     * @param spaces spaces per nesting level, at least 1
     * @param blankLineBetweenItems whether top-level items are separated by an empty line
     * @return render context
     */
    public static RenderContext ofSpaces(int spaces, boolean blankLineBetweenItems) {
        if (spaces < 1) {
            throw new IllegalArgumentException("spaces must be positive: " + spaces);
        }
        return new RenderContext(" ".repeat(spaces), blankLineBetweenItems);
    }
}

package com.stcode.core.ast;

import com.stcode.core.render.RenderContext;

import java.util.List;

/**
 * Common interface of every typed Structured Text syntax node.
 *
 * <p>Nodes are immutable records (or enums for keyword-like grammar products) that
 * render themselves back to formatted source text. Rendering is a fixed point:
 * parsing the rendered text again yields an equal tree that renders identically.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SourceCode source = parser.parse(text, "FB_Motor.st").root();
 * String formatted = source.render(RenderContext.ofSpaces(2, true));
 * }</pre>
 */
public interface AstNode {

    /**
     * Renders this node using the given formatting settings.
     *
     * @param context indentation and layout settings
     * @return source text without a trailing newline
     */
    String render(RenderContext context);

    /**
     * Renders this node with {@link RenderContext#defaults()}.
     *
     * @return source text without a trailing newline
     */
    default String render() {
        return render(RenderContext.defaults());
    }

    /**
     * Child nodes in source order, absent optional parts left out. Keyword enums such as
     * access specifiers and variable attributes are not listed.
     *
     * @return direct children, empty for leaves
     */
    default List<AstNode> children() {
        return List.of();
    }
}

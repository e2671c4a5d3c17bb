package com.stcode.core.ast;

/**
 * Node kind that accepts comments and pragmas found in the source text before it.
 *
 * <p>Declarations, declaration blocks, units, unit bodies and statements are comment
 * consumers. Their attached comments are rendered one per line directly above the
 * node's own text.
 */
public interface CommentConsumer extends AstNode {

    /**
     * Source position and attached comments of this node.
     *
     * @return node metadata, never {@code null}
     */
    Meta meta();
}

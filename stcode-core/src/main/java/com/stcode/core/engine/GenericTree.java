package com.stcode.core.engine;

import java.util.List;
import java.util.Objects;

/**
 * Untyped parse tree produced by a {@link GrammarEngine}.
 *
 * <p>Children are {@link Token}s and nested {@code GenericTree}s in source order. The
 * tree is transient: it is consumed once by the transformer and then discarded.
 *
 * @param rule grammar rule name
 * @param children tokens and subtrees
 * @param line 1-based line of the first token
 * @param endLine 1-based line of the last token
 * @param startIndex offset of the first character
 * @param stopIndex offset of the last character, {@code startIndex - 1} for an empty match
 */
public record GenericTree(
    String rule,
    List<Object> children,
    int line,
    int endLine,
    int startIndex,
    int stopIndex
) {
    public GenericTree {
        Objects.requireNonNull(rule, "rule must not be null");
        children = List.copyOf(children);
        for (Object child : children) {
            if (!(child instanceof Token) && !(child instanceof GenericTree)) {
                throw new IllegalArgumentException("Unexpected child in rule " + rule + ": " + child);
            }
        }
    }
}

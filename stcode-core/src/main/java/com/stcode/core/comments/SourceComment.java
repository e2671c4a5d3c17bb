package com.stcode.core.comments;

import java.util.Objects;

/**
 * Comment or pragma found in the raw source text.
 *
 * @param kind comment or pragma
 * @param text full text including delimiters; continuation lines of a multi-line span
 *             are dedented by the column the span starts at
 * @param line 1-based line of the first character
 * @param startIndex 0-based character offset of the first character
 */
public record SourceComment(CommentKind kind, String text, int line, int startIndex) {

    public SourceComment {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }
}

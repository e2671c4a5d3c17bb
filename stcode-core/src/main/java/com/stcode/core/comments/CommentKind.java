package com.stcode.core.comments;

/**
 * Kind of a span the grammar skips.
 */
public enum CommentKind {
    /** {@code // ...} or {@code (* ... *)}. */
    COMMENT,
    /** {@code { ... }}. */
    PRAGMA
}

package com.stcode.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Source position and attached comments of a {@link CommentConsumer} node.
 *
 * <p>Positions come from the first and last token of the node. Comments are set
 * exactly once, by the comment merge pass, after the tree has been built; a second
 * attach fails.
 *
 * <p>Equality considers only the attached comments. Two trees parsed from the same
 * structure laid out differently therefore compare equal, while a tree that lost or
 * moved a comment does not.
 */
public final class Meta {

    private final int line;
    private final int endLine;
    private final int startIndex;
    private final int stopIndex;
    private List<String> comments;

    /**
     * Creates metadata for a node spanning the given source range.
     *
     * @param line 1-based line of the first token
     * @param endLine 1-based line of the last token
     * @param startIndex 0-based character offset of the first token
     * @param stopIndex 0-based character offset of the last character (inclusive)
     */
    public Meta(int line, int endLine, int startIndex, int stopIndex) {
        this.line = line;
        this.endLine = endLine;
        this.startIndex = startIndex;
        this.stopIndex = stopIndex;
    }

    /**
     * Metadata for a node that was built in code rather than parsed.
     *
     * @return fresh metadata without a source position
     */
    public static Meta none() {
        return new Meta(0, 0, -1, -1);
    }

    public int line() {
        return line;
    }

    public int endLine() {
        return endLine;
    }

    public int startIndex() {
        return startIndex;
    }

    public int stopIndex() {
        return stopIndex;
    }

    /**
     * @return whether this node came from parsed source text
     */
    public boolean hasPosition() {
        return startIndex >= 0 && stopIndex >= startIndex;
    }

    /**
     * @return attached comments in source order, empty until the merge pass ran
     */
    public synchronized List<String> comments() {
        return comments == null ? List.of() : comments;
    }

    /**
     * @return whether the merge pass already attached comments to this node
     */
    public synchronized boolean commentsAttached() {
        return comments != null;
    }

    /**
     * Attaches the comments that precede this node.
     *
     * @param attached comment and pragma texts in source order
     * @throws IllegalStateException if comments were already attached
     */
    public synchronized void attachComments(List<String> attached) {
        Objects.requireNonNull(attached, "attached must not be null");
        if (comments != null) {
            throw new IllegalStateException("Comments already attached to node at line " + line);
        }
        comments = List.copyOf(attached);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Meta)) {
            return false;
        }
        return comments().equals(((Meta) o).comments());
    }

    @Override
    public int hashCode() {
        return comments().hashCode();
    }

    @Override
    public String toString() {
        return "Meta{line=" + line + ", endLine=" + endLine + ", comments=" + comments() + '}';
    }
}

package com.stcode.core.parse;

import com.stcode.core.ast.CommentConsumer;
import com.stcode.core.ast.Meta;
import com.stcode.core.ast.SourceCode;
import com.stcode.core.comments.SourceComment;
import com.stcode.core.render.RenderContext;

import java.util.List;
import java.util.Objects;

/**
 * Result of parsing one source text.
 *
 * @param filename label the text was parsed under
 * @param text original source text
 * @param root typed AST with comments attached
 * @param comments every comment and pragma found in the text
 * @param unattachedComments comments after the last comment consumer
 */
public record ParsedSource(
    String filename,
    String text,
    SourceCode root,
    List<SourceComment> comments,
    List<SourceComment> unattachedComments
) {
    public ParsedSource {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(root, "root must not be null");
        comments = List.copyOf(comments);
        unattachedComments = List.copyOf(unattachedComments);
    }

    /**
     * Returns the raw source text a node was parsed from, for linking generated
     * documentation back to the original code.
     *
     * @param node node of this source's tree
     * @return original text of the node, empty for nodes built in code
     */
    public String sourceOf(CommentConsumer node) {
        Meta meta = node.meta();
        if (!meta.hasPosition()) {
            return "";
        }
        // Offsets count code points
        int begin = text.offsetByCodePoints(0, meta.startIndex());
        int end = text.offsetByCodePoints(begin, meta.stopIndex() - meta.startIndex() + 1);
        return text.substring(begin, end);
    }

    /**
     * Renders the tree, followed by any comments that trail the last node.
     *
     * @param context formatting settings
     * @return formatted source text ending with a newline
     */
    public String render(RenderContext context) {
        StringBuilder output = new StringBuilder(root.render(context));
        for (SourceComment comment : unattachedComments) {
            if (output.length() > 0) {
                output.append('\n');
            }
            output.append(comment.text());
        }
        if (output.length() > 0) {
            output.append('\n');
        }
        return output.toString();
    }
}

package com.stcode.core.comments;

import com.stcode.core.ast.AstNode;
import com.stcode.core.ast.CommentConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Attaches extracted comments to the AST.
 *
 * <p>Walks the tree in document order through {@link AstNode#children()}. At every
 * {@link CommentConsumer} starting on line {@code L}, all pending comments on lines up
 * to {@code L} are attached to it and removed from the pending queue. The pass is
 * greedy: the first consumer reached wins.
 *
 * <p>Comments after the last consumer stay unattached and are returned to the caller.
 */
public class CommentMerger {

    private static final Logger log = LoggerFactory.getLogger(CommentMerger.class);

    /**
     * @param root AST root; comments are attached in place through each node's metadata
     * @param comments comments in source order
     * @return comments that no consumer took, in source order
     * @throws IllegalStateException if a node already has comments attached
     */
    public List<SourceComment> merge(AstNode root, List<SourceComment> comments) {
        Deque<SourceComment> pending = new ArrayDeque<>(comments);
        visit(root, pending);
        if (!pending.isEmpty()) {
            log.debug("{} comment(s) left unattached", pending.size());
        }
        return new ArrayList<>(pending);
    }

    private void visit(AstNode node, Deque<SourceComment> pending) {
        if (pending.isEmpty()) {
            return;
        }
        if (node instanceof CommentConsumer) {
            attach((CommentConsumer) node, pending);
        }
        for (AstNode child : node.children()) {
            visit(child, pending);
        }
    }

    private static void attach(CommentConsumer consumer, Deque<SourceComment> pending) {
        int line = consumer.meta().line();
        List<String> taken = new ArrayList<>();
        while (!pending.isEmpty() && pending.peekFirst().line() <= line) {
            taken.add(pending.removeFirst().text());
        }
        if (!taken.isEmpty()) {
            consumer.meta().attachComments(taken);
        }
    }
}

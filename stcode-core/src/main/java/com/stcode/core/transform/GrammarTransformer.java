package com.stcode.core.transform;

import com.stcode.core.ast.GenericNode;
import com.stcode.core.ast.SourceCode;
import com.stcode.core.engine.GenericTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link GenericTree} into the typed AST.
 *
 * <p>The walk is bottom-up: every child subtree is transformed before the handler of
 * its parent rule runs, so handlers only see typed values and tokens. A rule without a
 * handler becomes a {@link GenericNode} instead of failing the file.
 *
 * <p>The transformer holds no mutable state and can be shared between threads.
 */
public class GrammarTransformer {

    private static final Logger log = LoggerFactory.getLogger(GrammarTransformer.class);
    private static final HandlerRegistry STANDARD = HandlerRegistry.standard();

    private final HandlerRegistry registry;

    public GrammarTransformer() {
        this(STANDARD);
    }

    public GrammarTransformer(HandlerRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param tree parse tree rooted at {@code iec_source}
     * @param filename label used in diagnostics
     * @return root of the typed AST
     * @throws ConstructionException if a handler cannot build its node
     */
    public SourceCode transformSource(GenericTree tree, String filename) {
        Object root = transform(tree, filename);
        if (!(root instanceof SourceCode)) {
            throw new ConstructionException(filename, tree.rule(), tree.children().size(),
                "root rule did not produce source code");
        }
        return (SourceCode) root;
    }

    /**
     * Transforms any subtree.
     *
     * @return the value built by the rule's handler, or a {@link GenericNode}
     */
    public Object transform(GenericTree tree, String filename) {
        List<Object> items = new ArrayList<>(tree.children().size());
        for (Object child : tree.children()) {
            items.add(child instanceof GenericTree ? transform((GenericTree) child, filename) : child);
        }

        RuleHandler handler = registry.find(tree.rule());
        if (handler == null) {
            log.debug("No handler for rule '{}' in {} (line {}), keeping generic node",
                tree.rule(), filename, tree.line());
            return new GenericNode(tree.rule(), items);
        }
        return handler.handle(new Children(filename, tree, items));
    }
}

package com.stcode.core.parse;

import com.stcode.core.ast.SourceCode;
import com.stcode.core.comments.CommentExtractor;
import com.stcode.core.comments.CommentMerger;
import com.stcode.core.comments.SourceComment;
import com.stcode.core.engine.AntlrGrammarEngine;
import com.stcode.core.engine.GenericTree;
import com.stcode.core.engine.GrammarEngine;
import com.stcode.core.transform.GrammarTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Parses Structured Text into a typed AST with comments attached.
 *
 * <p>Runs the comment extractor, the grammar engine, the transformer and the comment
 * merge pass, in that order. Failures propagate: a syntax error raises
 * {@link com.stcode.core.engine.StructuredTextSyntaxException}, a handler mismatch a
 * {@link com.stcode.core.transform.ConstructionException}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SourceCodeParser parser = new SourceCodeParser();
 * ParsedSource parsed = parser.parse(Files.readString(path), path.getFileName().toString());
 * System.out.println(parsed.render(RenderContext.defaults()));
 * }</pre>
 */
public class SourceCodeParser {

    private static final Logger log = LoggerFactory.getLogger(SourceCodeParser.class);

    private final GrammarEngine engine;
    private final GrammarTransformer transformer;
    private final CommentExtractor extractor;
    private final CommentMerger merger;

    /**
     * Creates a parser with its own ANTLR engine.
     */
    public SourceCodeParser() {
        this(new AntlrGrammarEngine());
    }

    public SourceCodeParser(GrammarEngine engine) {
        this(engine, new GrammarTransformer(), new CommentExtractor(), new CommentMerger());
    }

    public SourceCodeParser(GrammarEngine engine, GrammarTransformer transformer,
                            CommentExtractor extractor, CommentMerger merger) {
        this.engine = engine;
        this.transformer = transformer;
        this.extractor = extractor;
        this.merger = merger;
    }

    /**
     * @param text complete source text
     * @param filename label used in diagnostics
     * @return AST, comments and the original text
     */
    public ParsedSource parse(String text, String filename) {
        List<SourceComment> comments = extractor.extract(text);
        GenericTree tree = engine.parse(text, filename);
        SourceCode root = transformer.transformSource(tree, filename);
        List<SourceComment> unattached = merger.merge(root, comments);
        log.debug("Parsed {}: {} item(s), {} comment(s), {} unattached",
            filename, root.items().size(), comments.size(), unattached.size());
        return new ParsedSource(filename, text, root, comments, unattached);
    }
}

package com.stcode.core.engine;

import com.stcode.parser.StructuredTextLexer;
import com.stcode.parser.StructuredTextParser;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link GrammarEngine} backed by the ANTLR-generated Structured Text lexer and parser.
 *
 * <p>One lexer and one parser are created up front and reused for every file. Calls to
 * {@link #parse(String, String)} are serialized with a lock, so an instance can be
 * shared, but concurrent callers wait for each other. Give each worker its own engine
 * to parse in parallel.
 *
 * <p>The first syntax error reported by the lexer or parser aborts the file.
 */
public class AntlrGrammarEngine implements GrammarEngine {

    private static final Logger log = LoggerFactory.getLogger(AntlrGrammarEngine.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final StructuredTextLexer lexer;
    private final StructuredTextParser parser;
    private final ParseTreeAdapter adapter;

    public AntlrGrammarEngine() {
        this.lexer = new StructuredTextLexer(CharStreams.fromString(""));
        this.parser = new StructuredTextParser(new CommonTokenStream(lexer));
        this.adapter = new ParseTreeAdapter(parser.getRuleNames(), parser.getVocabulary());
    }

    @Override
    public GenericTree parse(String text, String filename) {
        Objects.requireNonNull(text, "text must not be null");
        lock.lock();
        try {
            FirstErrorListener errors = new FirstErrorListener();

            lexer.setInputStream(CharStreams.fromString(text, filename));
            lexer.removeErrorListeners();
            lexer.addErrorListener(errors);

            parser.setTokenStream(new CommonTokenStream(lexer));
            parser.removeErrorListeners();
            parser.addErrorListener(errors);

            StructuredTextParser.Iec_sourceContext tree = parser.iec_source();
            if (errors.found) {
                log.debug("Syntax error in {} at {}:{}: {}", filename, errors.line, errors.column, errors.message);
                throw new StructuredTextSyntaxException(filename, errors.line, errors.column, errors.message);
            }
            return adapter.adapt(tree);
        } finally {
            lock.unlock();
        }
    }

    private static final class FirstErrorListener extends BaseErrorListener {
        private boolean found;
        private int line;
        private int column;
        private String message;

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            if (!found) {
                found = true;
                this.line = line;
                this.column = charPositionInLine;
                this.message = msg;
            }
        }
    }
}

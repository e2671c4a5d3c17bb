package com.stcode.parser;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Token;

/**
 * Base class for the Structured Text lexer.
 *
 * <p>Remembers the type of the last token sent to the parser so that context-sensitive
 * operators such as {@code S=} and {@code R=} are only recognized after a variable.
 */
public abstract class StructuredTextLexerBase extends Lexer {

    private int lastTokenType = Token.INVALID_TYPE;

    protected StructuredTextLexerBase(CharStream input) {
        super(input);
    }

    @Override
    public Token emit() {
        Token token = super.emit();
        if (token.getChannel() == Token.DEFAULT_CHANNEL) {
            lastTokenType = token.getType();
        }
        return token;
    }

    @Override
    public void reset() {
        super.reset();
        lastTokenType = Token.INVALID_TYPE;
    }

    /**
     * @param types token types to accept
     * @return whether the previous default-channel token has one of the given types
     */
    protected boolean lastTokenIs(int... types) {
        for (int type : types) {
            if (lastTokenType == type) {
                return true;
            }
        }
        return false;
    }
}

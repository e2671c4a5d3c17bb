package com.stcode.core.engine;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Copies an ANTLR parse tree into engine-neutral {@link GenericTree}s.
 *
 * <p>Every token is kept, keywords and punctuation included, so handlers can tell
 * optional parts apart. The EOF token is dropped.
 */
final class ParseTreeAdapter {

    private final String[] ruleNames;
    private final Vocabulary vocabulary;

    ParseTreeAdapter(String[] ruleNames, Vocabulary vocabulary) {
        this.ruleNames = ruleNames;
        this.vocabulary = vocabulary;
    }

    GenericTree adapt(ParserRuleContext context) {
        List<Object> children = new ArrayList<>();
        for (int i = 0; i < context.getChildCount(); i++) {
            ParseTree child = context.getChild(i);
            if (child instanceof ParserRuleContext) {
                children.add(adapt((ParserRuleContext) child));
            } else if (child instanceof TerminalNode) {
                org.antlr.v4.runtime.Token symbol = ((TerminalNode) child).getSymbol();
                if (symbol.getType() != org.antlr.v4.runtime.Token.EOF) {
                    children.add(token(symbol));
                }
            }
        }

        org.antlr.v4.runtime.Token start = context.getStart();
        org.antlr.v4.runtime.Token stop = context.getStop();
        int line = start.getLine();
        int startIndex = start.getStartIndex();
        if (stop == null || stop.getTokenIndex() < start.getTokenIndex()) {
            return new GenericTree(ruleNames[context.getRuleIndex()], children, line, line, startIndex, startIndex - 1);
        }
        if (stop.getType() == org.antlr.v4.runtime.Token.EOF) {
            // Root rule: end at the last real character
            return new GenericTree(ruleNames[context.getRuleIndex()], children, line, stop.getLine(),
                startIndex, stop.getStartIndex() - 1);
        }
        return new GenericTree(ruleNames[context.getRuleIndex()], children, line, stop.getLine(),
            startIndex, stop.getStopIndex());
    }

    private Token token(org.antlr.v4.runtime.Token symbol) {
        return new Token(vocabulary.getSymbolicName(symbol.getType()), symbol.getText(), symbol.getLine(),
            symbol.getStartIndex(), symbol.getStopIndex());
    }
}

package com.stcode.core.ast;

import com.stcode.core.render.RenderContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Stand-in for a grammar production that has no registered handler.
 *
 * <p>Keeps the rule name and the children as they arrived (typed nodes and raw
 * tokens) so that nothing is lost. Renders the children separated by spaces.
 *
 * @param rule grammar rule name
 * @param parts transformed child nodes and tokens
 */
public record GenericNode(String rule, List<Object> parts) implements Expression {

    public GenericNode {
        Objects.requireNonNull(rule, "rule must not be null");
        parts = List.copyOf(parts);
    }

    /**
     * @return the typed nodes among the parts; raw tokens are left out
     */
    @Override
    public List<AstNode> children() {
        List<AstNode> nodes = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof AstNode) {
                nodes.add((AstNode) part);
            }
        }
        return nodes;
    }

    @Override
    public String render(RenderContext context) {
        List<String> rendered = new ArrayList<>();
        for (Object part : parts) {
            rendered.add(part instanceof AstNode ? ((AstNode) part).render(context) : part.toString());
        }
        return String.join(" ", rendered);
    }
}

package com.stcode.core.ast;

import com.stcode.core.render.RenderContext;

/**
 * Indirect access through a pointer or a reference. Absence is modelled as {@code null}.
 */
public enum IndirectionType implements AstNode {
    POINTER("POINTER TO"),
    REFERENCE("REFERENCE TO");

    private final String keyword;

    IndirectionType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    @Override
    public String render(RenderContext context) {
        return keyword;
    }
}

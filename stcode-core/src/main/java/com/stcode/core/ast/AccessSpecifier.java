package com.stcode.core.ast;

import com.stcode.core.render.RenderContext;

import java.util.Collection;
import java.util.Set;

/**
 * Access and inheritance modifiers of function blocks and methods.
 */
public enum AccessSpecifier implements AstNode {
    ABSTRACT,
    FINAL,
    PUBLIC,
    PRIVATE,
    PROTECTED,
    INTERNAL;

    /**
     * @param values modifiers in any order, may be {@code null}
     * @return immutable set ordered by declaration
     */
    public static Set<AccessSpecifier> setOf(Collection<AccessSpecifier> values) {
        return EnumSets.copyOf(AccessSpecifier.class, values);
    }

    static String keywords(Set<AccessSpecifier> values) {
        return EnumSets.keywords(values);
    }

    @Override
    public String render(RenderContext context) {
        return name();
    }
}

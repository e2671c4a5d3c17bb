package com.stcode.core.ast;

import com.stcode.core.render.RenderContext;

import java.util.Collection;
import java.util.Set;

/**
 * Qualifier written after a {@code VAR_*} keyword.
 */
public enum VariableAttribute implements AstNode {
    CONSTANT,
    RETAIN,
    NON_RETAIN,
    PERSISTENT;

    /**
     * @param values attributes in any order, may be {@code null}
     * @return immutable set ordered by declaration
     */
    public static Set<VariableAttribute> setOf(Collection<VariableAttribute> values) {
        return EnumSets.copyOf(VariableAttribute.class, values);
    }

    static String keywords(Set<VariableAttribute> values) {
        return EnumSets.keywords(values);
    }

    @Override
    public String render(RenderContext context) {
        return name();
    }
}

package com.stcode.core.ast;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable, declaration-ordered enum sets for record components.
 */
final class EnumSets {

    private EnumSets() {
    }

    static <E extends Enum<E>> Set<E> copyOf(Class<E> type, Collection<E> values) {
        EnumSet<E> set = EnumSet.noneOf(type);
        if (values != null) {
            set.addAll(values);
        }
        return Collections.unmodifiableSet(set);
    }

    static <E extends Enum<E>> String keywords(Set<E> values) {
        if (values.isEmpty()) {
            return null;
        }
        return values.stream().map(Enum::name).collect(Collectors.joining(" "));
    }
}

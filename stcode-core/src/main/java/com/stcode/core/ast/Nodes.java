package com.stcode.core.ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Builds {@link AstNode#children()} lists. Absent optional parts are skipped.
 */
final class Nodes {

    private Nodes() {
        // Utility class - no instantiation
    }

    static List<AstNode> of(AstNode... nodes) {
        return builder().add(nodes).build();
    }

    static Builder builder() {
        return new Builder();
    }

    static final class Builder {
        private final List<AstNode> nodes = new ArrayList<>();

        Builder add(AstNode... parts) {
            for (AstNode part : parts) {
                if (part != null) {
                    nodes.add(part);
                }
            }
            return this;
        }

        Builder addAll(Collection<? extends AstNode> parts) {
            if (parts != null) {
                parts.forEach(this::add);
            }
            return this;
        }

        List<AstNode> build() {
            return List.copyOf(nodes);
        }
    }
}

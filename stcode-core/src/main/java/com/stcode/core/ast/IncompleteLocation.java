package com.stcode.core.ast;

import com.stcode.core.render.RenderContext;

import java.util.Locale;

/**
 * Location placeholder ({@code AT %I*}) completed later by a configuration.
 */
public enum IncompleteLocation implements AstNode {
    INPUT("%I*"),
    OUTPUT("%Q*"),
    MEMORY("%M*");

    private final String code;

    IncompleteLocation(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Resolves the location token text, for example {@code %q*}.
     *
     * @param text location text, case insensitive
     * @return matching location
     * @throws IllegalArgumentException if the text is not an incomplete location
     */
    public static IncompleteLocation fromCode(String text) {
        String normalized = text.toUpperCase(Locale.ROOT);
        for (IncompleteLocation location : values()) {
            if (location.code.equals(normalized)) {
                return location;
            }
        }
        throw new IllegalArgumentException("Not an incomplete location: " + text);
    }

    @Override
    public String render(RenderContext context) {
        return "AT " + code;
    }
}

package com.stcode.core.engine;

import java.util.Objects;

/**
 * Terminal of a {@link GenericTree}, copied out of the grammar engine.
 *
 * @param type symbolic token name, for example {@code IDENTIFIER} or {@code ASSIGN}
 * @param text matched source text
 * @param line 1-based line of the first character
 * @param startIndex 0-based offset of the first character
 * @param stopIndex 0-based offset of the last character (inclusive)
 */
public record Token(String type, String text, int line, int startIndex, int stopIndex) {

    public Token {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    public boolean is(String tokenType) {
        return type.equals(tokenType);
    }

    @Override
    public String toString() {
        return text;
    }
}

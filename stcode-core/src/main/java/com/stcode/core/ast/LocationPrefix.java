package com.stcode.core.ast;

/**
 * Memory area of a directly represented variable.
 */
public enum LocationPrefix {
    INPUT('I'),
    OUTPUT('Q'),
    MEMORY('M');

    private final char code;

    LocationPrefix(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    public static LocationPrefix fromCode(char code) {
        char upper = Character.toUpperCase(code);
        for (LocationPrefix prefix : values()) {
            if (prefix.code == upper) {
                return prefix;
            }
        }
        throw new IllegalArgumentException("Unknown location prefix: " + code);
    }
}

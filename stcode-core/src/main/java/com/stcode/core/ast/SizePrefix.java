package com.stcode.core.ast;

/**
 * Access width of a directly represented variable. Omitted in source means {@link #BIT}.
 */
public enum SizePrefix {
    BIT('X'),
    BYTE('B'),
    WORD('W'),
    DWORD('D'),
    LWORD('L');

    private final char code;

    SizePrefix(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    public static SizePrefix fromCode(char code) {
        char upper = Character.toUpperCase(code);
        for (SizePrefix prefix : values()) {
            if (prefix.code == upper) {
                return prefix;
            }
        }
        throw new IllegalArgumentException("Unknown size prefix: " + code);
    }
}

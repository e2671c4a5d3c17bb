package com.stcode.core.transform;

import com.stcode.core.engine.StructuredTextException;

/**
 * A rule handler received children it cannot build a node from. Points at a mismatch
 * between the grammar and its handler; aborts the file.
 */
public class ConstructionException extends StructuredTextException {

    private final String rule;
    private final int childCount;

    public ConstructionException(String filename, String rule, int childCount, String detail) {
        super(filename, String.format("Cannot build '%s' from %d children in %s: %s",
            rule, childCount, filename, detail));
        this.rule = rule;
        this.childCount = childCount;
    }

    public String getRule() {
        return rule;
    }

    public int getChildCount() {
        return childCount;
    }
}

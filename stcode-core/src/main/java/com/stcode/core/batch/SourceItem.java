package com.stcode.core.batch;

import java.util.Objects;

/**
 * One named source text submitted to a {@link BatchParser}.
 *
 * @param name unique key of the item within the batch
 * @param filename label used in diagnostics
 * @param text source text
 */
public record SourceItem(String name, String filename, String text) {

    public SourceItem {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(text, "text must not be null");
        filename = filename == null ? name : filename;
    }

    public static SourceItem of(String filename, String text) {
        return new SourceItem(filename, filename, text);
    }
}

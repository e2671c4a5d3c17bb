package com.stcode.core.batch;

import com.stcode.core.parse.ParsedSource;

import java.util.Objects;

/**
 * Result of one batch item: either the parsed source or the failure.
 *
 * @param item submitted item
 * @param parsed parse result, {@code null} on failure
 * @param error captured failure, {@code null} on success
 */
public record ItemOutcome(SourceItem item, ParsedSource parsed, RuntimeException error) {

    public ItemOutcome {
        Objects.requireNonNull(item, "item must not be null");
        if ((parsed == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of parsed and error must be set");
        }
    }

    public static ItemOutcome succeeded(SourceItem item, ParsedSource parsed) {
        return new ItemOutcome(item, parsed, null);
    }

    public static ItemOutcome failed(SourceItem item, RuntimeException error) {
        return new ItemOutcome(item, null, error);
    }

    public boolean success() {
        return parsed != null;
    }

    /**
     * @return {@code * [filename] name: (Type) message}
     */
    public String describeFailure() {
        if (error == null) {
            return "";
        }
        return String.format("* [%s] %s: (%s) %s",
            item.filename(), item.name(), error.getClass().getSimpleName(), error.getMessage());
    }
}

package com.stcode.core.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * String helpers shared by every node's {@code render} implementation.
 *
 * <p>All helpers produce text without a trailing newline. Nesting is expressed by
 * {@link #indent(String, RenderContext)}, which shifts every non-blank line of an
 * already rendered block by one indentation unit.
 */
public final class Render {

    private Render() {
        // Utility class - no instantiation
    }

    /**
     * Joins two optional parts with a delimiter, skipping whichever part is {@code null}.
     *
     * <p>{@code joinIf("VAR", " ", "CONSTANT")} gives {@code "VAR CONSTANT"};
     * {@code joinIf("VAR", " ", null)} gives {@code "VAR"}.
     */
    public static String joinIf(Object first, String delimiter, Object second) {
        if (first == null && second == null) {
            return "";
        }
        if (first == null) {
            return String.valueOf(second);
        }
        if (second == null) {
            return String.valueOf(first);
        }
        return first + delimiter + second;
    }

    /**
     * Shifts every non-blank line of {@code text} by one indentation unit.
     */
    public static String indent(String text, RenderContext context) {
        return text.lines()
            .map(line -> line.isBlank() ? line : context.indent() + line)
            .collect(Collectors.joining("\n"));
    }

    /**
     * Places attached comments, one per line, directly above {@code text}.
     */
    public static String commented(List<String> comments, String text) {
        if (comments == null || comments.isEmpty()) {
            return text;
        }
        List<String> lines = new ArrayList<>(comments);
        lines.add(text);
        return String.join("\n", lines);
    }

    /**
     * Joins the non-null lines with newlines.
     */
    public static String lines(String... lines) {
        List<String> present = new ArrayList<>();
        for (String line : lines) {
            if (line != null) {
                present.add(line);
            }
        }
        return String.join("\n", present);
    }

    /**
     * Renders each item and joins the results with {@code delimiter}.
     */
    public static <T> String join(List<? extends T> items, String delimiter, Function<T, String> renderer) {
        return items.stream()
            .map(renderer)
            .collect(Collectors.joining(delimiter));
    }

    /**
     * Renders the header, one indented {@code item;} line per item, and the closing keyword.
     */
    public static <T> String declarationBlock(String header, List<? extends T> items,
                                              Function<T, String> renderer, String footer,
                                              RenderContext context) {
        Objects.requireNonNull(header, "header must not be null");
        List<String> lines = new ArrayList<>();
        lines.add(header);
        for (T item : items) {
            lines.add(indent(renderer.apply(item) + ";", context));
        }
        lines.add(footer);
        return String.join("\n", lines);
    }
}

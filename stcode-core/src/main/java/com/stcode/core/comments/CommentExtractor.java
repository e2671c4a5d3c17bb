package com.stcode.core.comments;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds comments and pragmas in raw Structured Text.
 *
 * <p>A single regular expression scans the text. String literals are matched as well
 * and skipped, so comment markers inside strings are ignored. Results are ordered by
 * position.
 *
 * <p>The extractor is stateless and thread-safe.
 */
public class CommentExtractor {

    private static final Pattern SPANS = Pattern.compile(
        "(?<string>'(?:\\$.|[^'$\\r\\n])*'|\"(?:\\$.|[^\"$\\r\\n])*\")"
            + "|(?<line>//[^\\r\\n]*)"
            + "|(?<block>\\(\\*.*?\\*\\))"
            + "|(?<pragma>\\{.*?\\})",
        Pattern.DOTALL);

    /**
     * @param text raw source text
     * @return comments and pragmas in source order
     */
    public List<SourceComment> extract(String text) {
        LineIndex lines = LineIndex.of(text);
        List<SourceComment> comments = new ArrayList<>();
        Matcher matcher = SPANS.matcher(text);
        while (matcher.find()) {
            if (matcher.group("string") != null) {
                continue;
            }
            CommentKind kind = matcher.group("pragma") != null ? CommentKind.PRAGMA : CommentKind.COMMENT;
            int start = matcher.start();
            String body = dedent(matcher.group(), lines.columnOf(start));
            comments.add(new SourceComment(kind, body, lines.lineOf(start), start));
        }
        return comments;
    }

    /**
     * Strips up to {@code column} leading blanks from every continuation line and drops
     * trailing whitespace and carriage returns.
     */
    static String dedent(String span, int column) {
        String[] lines = span.split("\r?\n", -1);
        StringBuilder text = new StringBuilder(lines[0].stripTrailing());
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            int strip = 0;
            while (strip < column && strip < line.length() && (line.charAt(strip) == ' ' || line.charAt(strip) == '\t')) {
                strip++;
            }
            text.append('\n').append(line.substring(strip).stripTrailing());
        }
        return text.toString();
    }
}

package com.stcode.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.stcode.core.render.RenderContext;

import java.util.List;
import java.util.Locale;

/**
 * Root configuration, loaded from {@code stcode.yaml}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * format:
 *   indent: 2
 *   blankLineBetweenItems: true
 *
 * batch:
 *   keepPartialResults: false
 *   extensions:
 *     - .st
 *     - .exp
 * }</pre>
 *
 * <p>Missing sections and fields fall back to {@link #defaults()}.
 *
 * @param format rendering settings
 * @param batch batch processing settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StcodeConfig(
    @JsonProperty("format") FormatConfig format,
    @JsonProperty("batch") BatchConfig batch
) {
    public StcodeConfig {
        format = format == null ? FormatConfig.defaults() : format;
        batch = batch == null ? BatchConfig.defaults() : batch;
    }

    public static StcodeConfig defaults() {
        return new StcodeConfig(FormatConfig.defaults(), BatchConfig.defaults());
    }

    /**
     * @return render context built from the format section
     */
    public RenderContext renderContext() {
        return RenderContext.ofSpaces(format.indent(), format.blankLineBetweenItems());
    }

    /**
     * @param indent spaces per nesting level
     * @param blankLineBetweenItems whether top-level items are separated by an empty line
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FormatConfig(
        @JsonProperty("indent") Integer indent,
        @JsonProperty("blankLineBetweenItems") Boolean blankLineBetweenItems
    ) {
        public FormatConfig {
            indent = indent == null || indent < 1 ? RenderContext.DEFAULT_INDENT.length() : indent;
            blankLineBetweenItems = blankLineBetweenItems == null || blankLineBetweenItems;
        }

        public static FormatConfig defaults() {
            return new FormatConfig(null, null);
        }
    }

    /**
     * @param keepPartialResults write the output of files that parsed even when others failed
     * @param extensions file extensions picked up when a directory is given
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BatchConfig(
        @JsonProperty("keepPartialResults") Boolean keepPartialResults,
        @JsonProperty("extensions") List<String> extensions
    ) {
        public BatchConfig {
            keepPartialResults = keepPartialResults != null && keepPartialResults;
            extensions = extensions == null || extensions.isEmpty() ? List.of(".st") : List.copyOf(extensions);
        }

        public static BatchConfig defaults() {
            return new BatchConfig(null, null);
        }

        /**
         * @return whether the file name ends with one of the configured extensions, ignoring case
         */
        public boolean accepts(String filename) {
            String lower = filename.toLowerCase(Locale.ROOT);
            return extensions.stream()
                .anyMatch(extension -> lower.endsWith(extension.toLowerCase(Locale.ROOT)));
        }
    }
}

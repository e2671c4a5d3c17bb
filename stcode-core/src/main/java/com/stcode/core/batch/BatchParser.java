package com.stcode.core.batch;

import com.stcode.core.parse.ParsedSource;
import com.stcode.core.parse.SourceCodeParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses many source items, isolating failures per item.
 *
 * <p>A failing item is recorded with its exception and the batch moves on. Items run
 * sequentially through one {@link SourceCodeParser}; there is no retry and no
 * cancellation.
 */
public class BatchParser {

    private static final Logger log = LoggerFactory.getLogger(BatchParser.class);

    private final SourceCodeParser parser;

    public BatchParser() {
        this(new SourceCodeParser());
    }

    public BatchParser(SourceCodeParser parser) {
        this.parser = parser;
    }

    /**
     * @param items items to parse, names should be unique
     * @return one outcome per item in submission order
     */
    public BatchResult parseAll(List<SourceItem> items) {
        List<ItemOutcome> outcomes = new ArrayList<>(items.size());
        for (SourceItem item : items) {
            outcomes.add(parseOne(item));
        }
        BatchResult result = new BatchResult(outcomes);
        if (result.success()) {
            log.info("Parsed {} source item(s)", items.size());
        } else {
            log.warn("Parsed {} source item(s), {} failed", items.size(), result.failures().size());
        }
        return result;
    }

    private ItemOutcome parseOne(SourceItem item) {
        try {
            ParsedSource parsed = parser.parse(item.text(), item.filename());
            return ItemOutcome.succeeded(item, parsed);
        } catch (RuntimeException e) {
            log.warn("Failed to parse {}: {}", item.filename(), e.getMessage());
            log.debug("Parse failure details for {}", item.filename(), e);
            return ItemOutcome.failed(item, e);
        }
    }
}

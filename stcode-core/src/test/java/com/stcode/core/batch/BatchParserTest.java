package com.stcode.core.batch;

import com.stcode.core.engine.StructuredTextSyntaxException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link BatchParser}.
 */
class BatchParserTest {

    private final BatchParser batchParser = new BatchParser();

    @Test
    void parseAll_oneInvalidItem_isolatesFailure() {
        List<SourceItem> items = List.of(
            SourceItem.of("a.st", "PROGRAM A\nEND_PROGRAM\n"),
            SourceItem.of("b.st", "PROGRAM B\nx := ;\nEND_PROGRAM\n"),
            SourceItem.of("c.st", "FUNCTION C : INT\nC := 1;\nEND_FUNCTION\n"));

        BatchResult result = batchParser.parseAll(items);

        assertThat(result.success()).isFalse();
        assertThat(result.outcomes()).extracting(o -> o.item().name()).containsExactly("a.st", "b.st", "c.st");
        assertThat(result.successes()).extracting(o -> o.item().name()).containsExactly("a.st", "c.st");
        assertThat(result.failures()).hasSize(1);

        ItemOutcome failure = result.failures().get(0);
        assertThat(failure.error()).isInstanceOf(StructuredTextSyntaxException.class);
        assertThat(failure.parsed()).isNull();
        assertThat(failure.describeFailure()).startsWith("* [b.st] b.st: (StructuredTextSyntaxException) b.st:2:");
    }

    @Test
    void parseAll_validItems_succeeds() {
        BatchResult result = batchParser.parseAll(List.of(
            new SourceItem("main", "Main.st", "PROGRAM Main\nEND_PROGRAM\n")));

        assertThat(result.success()).isTrue();
        assertThat(result.failures()).isEmpty();
        assertThat(result.byName()).containsOnlyKeys("main");
        assertThat(result.byName().get("main").parsed().filename()).isEqualTo("Main.st");
        assertThat(result.byName().get("main").describeFailure()).isEmpty();
    }

    @Test
    void parseAll_emptyBatch_succeeds() {
        assertThat(batchParser.parseAll(List.of()).success()).isTrue();
    }

    @Test
    void itemOutcome_bothOrNeitherSet_throws() {
        SourceItem item = SourceItem.of("x.st", "");

        assertThatThrownBy(() -> new ItemOutcome(item, null, null)).isInstanceOf(IllegalArgumentException.class);
    }
}

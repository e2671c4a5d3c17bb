package com.stcode.core.comments;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link CommentExtractor}.
 */
class CommentExtractorTest {

    private final CommentExtractor extractor = new CommentExtractor();

    @Test
    void extract_allCommentForms_returnsThemInOrder() {
        String text = """
            (* header *)
            {attribute 'hide'}
            x := 1; // trailing
            """;

        List<SourceComment> comments = extractor.extract(text);

        assertThat(comments)
            .extracting(SourceComment::kind, SourceComment::text, SourceComment::line)
            .containsExactly(
                tuple(CommentKind.COMMENT, "(* header *)", 1),
                tuple(CommentKind.PRAGMA, "{attribute 'hide'}", 2),
                tuple(CommentKind.COMMENT, "// trailing", 3));
    }

    @Test
    void extract_markersInsideStrings_areIgnored() {
        String text = """
            sUrl := 'http://example.com (* not a comment *)';
            wsText := "{no pragma} // none";
            """;

        assertThat(extractor.extract(text)).isEmpty();
    }

    @Test
    void extract_escapedQuoteInString_keepsStringOpen() {
        String text = "s := 'it$'s // still text'; // real\n";

        assertThat(extractor.extract(text))
            .extracting(SourceComment::text)
            .containsExactly("// real");
    }

    @Test
    void extract_multiLineBlock_dedentsContinuationLines() {
        String text = "    (* first\n         second\n    *)\n";

        List<SourceComment> comments = extractor.extract(text);

        assertThat(comments).hasSize(1);
        assertThat(comments.get(0).text()).isEqualTo("(* first\n     second\n*)");
        assertThat(comments.get(0).startIndex()).isEqualTo(4);
    }

    @Test
    void dedent_lessIndentedLine_stripsOnlyAvailableBlanks() {
        assertThat(CommentExtractor.dedent("(* a\n  b   \n*)", 4)).isEqualTo("(* a\nb\n*)");
    }
}

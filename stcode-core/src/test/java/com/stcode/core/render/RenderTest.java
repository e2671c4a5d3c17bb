package com.stcode.core.render;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Render}.
 */
class RenderTest {

    @Test
    void joinIf_skipsNullParts() {
        assertThat(Render.joinIf("VAR", " ", "CONSTANT")).isEqualTo("VAR CONSTANT");
        assertThat(Render.joinIf("VAR", " ", null)).isEqualTo("VAR");
        assertThat(Render.joinIf(null, " ", "RETAIN")).isEqualTo("RETAIN");
        assertThat(Render.joinIf(null, " ", null)).isEmpty();
    }

    @Test
    void indent_leavesBlankLinesUntouched() {
        String text = Render.indent("a\n\nb", RenderContext.ofSpaces(2, true));

        assertThat(text).isEqualTo("  a\n\n  b");
    }

    @Test
    void declarationBlock_rendersOneIndentedItemPerLine() {
        String text = Render.declarationBlock("VAR_INPUT", List.of("a : INT", "b : BOOL"),
            Function.identity(), "END_VAR", RenderContext.defaults());

        assertThat(text).isEqualTo("VAR_INPUT\n    a : INT;\n    b : BOOL;\nEND_VAR");
    }

    @Test
    void commented_placesCommentsAboveText() {
        assertThat(Render.commented(List.of("// a", "(* b *)"), "x := 1;")).isEqualTo("// a\n(* b *)\nx := 1;");
        assertThat(Render.commented(List.of(), "x := 1;")).isEqualTo("x := 1;");
    }

    @Test
    void ofSpaces_buildsIndentUnit() {
        RenderContext context = RenderContext.ofSpaces(3, false);

        assertThat(context.indent()).isEqualTo("   ");
        assertThat(context.blankLineBetweenItems()).isFalse();
    }
}

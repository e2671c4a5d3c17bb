package com.stcode.core.parse;

import com.stcode.core.Fixtures;
import com.stcode.core.comments.SourceComment;
import com.stcode.core.render.RenderContext;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Rendering a parsed file and parsing the result again must give the same tree and the
 * same text.
 */
class RoundTripTest {

    private final SourceCodeParser parser = new SourceCodeParser();

    @ParameterizedTest
    @ValueSource(strings = {"motor_control.st", "data_types.st", "plant_program.st"})
    void render_thenReparse_yieldsEqualTreeAndText(String fixture) {
        RenderContext context = RenderContext.defaults();
        ParsedSource first = parser.parse(Fixtures.read(fixture), fixture);
        String rendered = first.render(context);

        ParsedSource second = parser.parse(rendered, fixture);

        assertThat(second.root()).isEqualTo(first.root());
        assertThat(second.render(context)).isEqualTo(rendered);
        assertThat(second.unattachedComments())
            .extracting(SourceComment::text)
            .containsExactlyElementsOf(first.unattachedComments().stream().map(SourceComment::text).toList());
    }

    @ParameterizedTest
    @ValueSource(strings = {"motor_control.st", "data_types.st", "plant_program.st"})
    void render_withCompactLayout_isStable(String fixture) {
        RenderContext compact = RenderContext.ofSpaces(2, false);
        ParsedSource first = parser.parse(Fixtures.read(fixture), fixture);
        String rendered = first.render(compact);

        ParsedSource second = parser.parse(rendered, fixture);

        assertThat(second.root()).isEqualTo(first.root());
        assertThat(second.render(compact)).isEqualTo(rendered);
    }

    @ParameterizedTest
    @ValueSource(strings = {"motor_control.st", "data_types.st", "plant_program.st"})
    void parse_fixture_keepsEveryComment(String fixture) {
        ParsedSource parsed = parser.parse(Fixtures.read(fixture), fixture);
        String rendered = parsed.render(RenderContext.defaults());

        assertThat(parsed.comments()).isNotEmpty();
        for (SourceComment comment : parsed.comments()) {
            assertThat(rendered).contains(comment.text());
        }
    }
}

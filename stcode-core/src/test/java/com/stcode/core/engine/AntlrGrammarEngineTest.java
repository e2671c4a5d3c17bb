package com.stcode.core.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AntlrGrammarEngine}.
 */
class AntlrGrammarEngineTest {

    private final AntlrGrammarEngine engine = new AntlrGrammarEngine();

    @Test
    void parse_validSource_returnsTreeWithPositions() {
        String text = "PROGRAM P\nRETURN;\nEND_PROGRAM";

        GenericTree root = engine.parse(text, "p.st");

        assertThat(root.rule()).isEqualTo("iec_source");
        assertThat(root.line()).isEqualTo(1);
        assertThat(root.endLine()).isEqualTo(3);
        assertThat(root.startIndex()).isZero();
        assertThat(root.stopIndex()).isEqualTo(text.length() - 1);
        assertThat(root.children()).hasSize(1).allMatch(GenericTree.class::isInstance);

        GenericTree program = (GenericTree) ((GenericTree) root.children().get(0)).children().get(0);
        assertThat(program.rule()).isEqualTo("program_declaration");
        assertThat(program.children().get(0)).isEqualTo(new Token("PROGRAM", "PROGRAM", 1, 0, 6));
    }

    @Test
    void parse_keepsKeywordCaseInTokenText() {
        GenericTree root = engine.parse("program p end_program", "p.st");

        GenericTree program = (GenericTree) ((GenericTree) root.children().get(0)).children().get(0);
        Token keyword = (Token) program.children().get(0);
        assertThat(keyword.type()).isEqualTo("PROGRAM");
        assertThat(keyword.text()).isEqualTo("program");
    }

    @Test
    void parse_sameEngineTwice_resetsState() {
        assertThatThrownBy(() -> engine.parse("PROGRAM", "broken.st"))
            .isInstanceOf(StructuredTextSyntaxException.class);

        GenericTree root = engine.parse("FUNCTION F\nEND_FUNCTION", "f.st");

        assertThat(root.children()).hasSize(1);
    }

    @Test
    void parse_unknownCharacter_reportsLexerError() {
        assertThatThrownBy(() -> engine.parse("PROGRAM P\nx := 1 ? 2;\nEND_PROGRAM", "lex.st"))
            .isInstanceOfSatisfying(StructuredTextSyntaxException.class, e -> {
                assertThat(e.getLine()).isEqualTo(2);
                assertThat(e.getColumn()).isEqualTo(7);
            });
    }
}

package com.stcode.core.transform;

import com.stcode.core.ast.GenericNode;
import com.stcode.core.ast.Statements.AssignmentStatement;
import com.stcode.core.ast.Units.Program;
import com.stcode.core.comments.CommentExtractor;
import com.stcode.core.comments.CommentMerger;
import com.stcode.core.engine.AntlrGrammarEngine;
import com.stcode.core.engine.GenericTree;
import com.stcode.core.engine.Token;
import com.stcode.core.parse.ParsedSource;
import com.stcode.core.parse.SourceCodeParser;
import com.stcode.core.render.RenderContext;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link GrammarTransformer}.
 */
class GrammarTransformerTest {

    private static HandlerRegistry standardWithout(String missingRule) {
        HandlerRegistry standard = HandlerRegistry.standard();
        HandlerRegistry registry = new HandlerRegistry();
        for (String rule : standard.rules()) {
            if (!rule.equals(missingRule)) {
                registry.register(rule, standard.find(rule));
            }
        }
        return registry;
    }

    @Test
    void transform_ruleWithoutHandler_keepsGenericNode() {
        SourceCodeParser parser = new SourceCodeParser(new AntlrGrammarEngine(),
            new GrammarTransformer(standardWithout("variable_name")), new CommentExtractor(), new CommentMerger());

        ParsedSource parsed = parser.parse("PROGRAM P\nx := 1;\nEND_PROGRAM\n", "generic.st");

        Program program = parsed.root().programs().get(0);
        AssignmentStatement assignment = (AssignmentStatement) program.body().statements().statements().get(0);
        assertThat(assignment.variables().get(0)).isInstanceOfSatisfying(GenericNode.class, node -> {
            assertThat(node.rule()).isEqualTo("variable_name");
            assertThat(node.render()).isEqualTo("x");
        });
        assertThat(parsed.render(RenderContext.defaults())).isEqualTo("PROGRAM P\n    x := 1;\nEND_PROGRAM\n");
    }

    @Test
    void transform_handlerMismatch_throwsConstructionException() {
        Token name = new Token("IDENTIFIER", "x", 1, 0, 0);
        GenericTree tree = new GenericTree("assignment_statement", List.of(name), 1, 1, 0, 0);

        assertThatThrownBy(() -> new GrammarTransformer().transform(tree, "broken.st"))
            .isInstanceOf(ConstructionException.class)
            .hasMessageContaining("broken.st")
            .hasMessageContaining("assignment_statement");
    }

    @Test
    void transformSource_nonSourceRoot_throws() {
        GenericTree tree = new GenericTree("exit_statement",
            List.of(new Token("EXIT", "EXIT", 1, 0, 3), new Token("SEMI", ";", 1, 4, 4)), 1, 1, 0, 4);

        assertThatThrownBy(() -> new GrammarTransformer().transformSource(tree, "stmt.st"))
            .isInstanceOf(ConstructionException.class);
    }
}

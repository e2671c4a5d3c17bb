package com.stcode.core.transform;

import com.stcode.parser.StructuredTextParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link HandlerRegistry}.
 */
class HandlerRegistryTest {

    @Test
    void standard_coversEveryGrammarRule() {
        HandlerRegistry registry = HandlerRegistry.standard();

        assertThat(registry.rules()).containsExactlyInAnyOrder(StructuredTextParser.ruleNames);
    }

    @Test
    void register_sameRuleTwice_throws() {
        HandlerRegistry registry = new HandlerRegistry().register("expression", ExpressionRules::foldLeft);

        assertThatThrownBy(() -> registry.register("expression", Children::sole))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("expression");
    }

    @Test
    void passThrough_registersEachRule() {
        HandlerRegistry registry = new HandlerRegistry().passThrough("statement", "constant");

        assertThat(registry.rules()).containsExactlyInAnyOrder("statement", "constant");
        assertThat(registry.find("missing")).isNull();
    }
}

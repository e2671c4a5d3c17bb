package com.stcode.core.ast;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Meta}.
 */
class MetaTest {

    @Test
    void attachComments_secondCall_throws() {
        Meta meta = new Meta(3, 3, 10, 20);
        meta.attachComments(List.of("// first"));

        assertThatThrownBy(() -> meta.attachComments(List.of("// second")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("line 3");
        assertThat(meta.comments()).containsExactly("// first");
    }

    @Test
    void equals_ignoresPositions() {
        Meta parsed = new Meta(1, 4, 0, 57);
        Meta reparsed = new Meta(7, 9, 120, 160);

        assertThat(parsed).isEqualTo(reparsed);

        parsed.attachComments(List.of("// note"));
        assertThat(parsed).isNotEqualTo(reparsed);
    }

    @Test
    void none_hasNoPosition() {
        assertThat(Meta.none().hasPosition()).isFalse();
        assertThat(new Meta(1, 1, 0, 0).hasPosition()).isTrue();
    }
}

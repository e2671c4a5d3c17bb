package com.stcode.core.comments;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link LineIndex}.
 */
class LineIndexTest {

    @Test
    void lineOf_offsetsAcrossLines_returnsOneBasedLines() {
        LineIndex index = LineIndex.of("ab\ncd\n\nef");

        assertThat(index.lineOf(0)).isEqualTo(1);
        assertThat(index.lineOf(2)).isEqualTo(1);
        assertThat(index.lineOf(3)).isEqualTo(2);
        assertThat(index.lineOf(6)).isEqualTo(3);
        assertThat(index.lineOf(7)).isEqualTo(4);
        assertThat(index.lineCount()).isEqualTo(4);
    }

    @Test
    void lineOf_crlfText_countsLikeLf() {
        LineIndex index = LineIndex.of("a\r\nb\r\nc");

        assertThat(index.lineOf(3)).isEqualTo(2);
        assertThat(index.lineOf(6)).isEqualTo(3);
        assertThat(index.columnOf(6)).isZero();
    }

    @Test
    void columnOf_returnsOffsetWithinLine() {
        LineIndex index = LineIndex.of("VAR\n    x : INT;");

        assertThat(index.columnOf(8)).isEqualTo(4);
    }

    @Test
    void lineOf_endOfText_isAccepted() {
        LineIndex index = LineIndex.of("abc\n");

        assertThat(index.lineOf(4)).isEqualTo(2);
    }

    @Test
    void lineOf_outsideText_throws() {
        LineIndex index = LineIndex.of("abc");

        assertThatThrownBy(() -> index.lineOf(4)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> index.lineOf(-1)).isInstanceOf(IndexOutOfBoundsException.class);
    }
}

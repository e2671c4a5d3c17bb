package com.stcode.core.ast;

import com.stcode.core.ast.Literals.BitStringLiteral;
import com.stcode.core.ast.Literals.DateLiteral;
import com.stcode.core.ast.Literals.DateTimeLiteral;
import com.stcode.core.ast.Literals.DurationLiteral;
import com.stcode.core.ast.Literals.IntegerLiteral;
import com.stcode.core.ast.Literals.StringLiteral;
import com.stcode.core.ast.Literals.TimeOfDayLiteral;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for literal rendering in {@link Literals}.
 */
class LiteralsTest {

    @Test
    void integerLiteral_typedHex_rendersPrefixAndBase() {
        assertThat(new IntegerLiteral("2A", "INT", 16).render()).isEqualTo("INT#16#2A");
        assertThat(IntegerLiteral.decimal("42").render()).isEqualTo("42");
        assertThat(IntegerLiteral.decimal("42").withTypeName("DINT").render()).isEqualTo("DINT#42");
    }

    @Test
    void integerLiteral_unsupportedBase_throws() {
        assertThatThrownBy(() -> new IntegerLiteral("12", null, 3))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void bitStringLiteral_rendersTypeAndBase() {
        assertThat(new BitStringLiteral("FF", "BYTE", 16).render()).isEqualTo("BYTE#16#FF");
    }

    @Test
    void durationLiteral_rendersPresentComponentsInOrder() {
        DurationLiteral duration = new DurationLiteral(BigDecimal.ONE, new BigDecimal("2"), null, null, null, false);
        DurationLiteral seconds = new DurationLiteral(null, null, null, new BigDecimal("30"), null, false);
        DurationLiteral negative = new DurationLiteral(null, null, null, new BigDecimal("1.5"), null, true);

        assertThat(duration.render()).isEqualTo("TIME#1D2H");
        assertThat(seconds.render()).isEqualTo("TIME#30S");
        assertThat(negative.render()).isEqualTo("TIME#-1.5S");
    }

    @Test
    void durationLiteral_withoutComponents_throws() {
        assertThatThrownBy(() -> new DurationLiteral(null, null, null, null, null, false))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void dateAndTimeLiterals_renderZeroPadded() {
        TimeOfDayLiteral time = new TimeOfDayLiteral(6, 5, new BigDecimal("7.5"));
        DateLiteral date = new DateLiteral(2024, 1, 5);

        assertThat(time.render()).isEqualTo("TIME_OF_DAY#06:05:07.5");
        assertThat(date.render()).isEqualTo("DATE#2024-01-05");
        assertThat(new DateTimeLiteral(date, time).render()).isEqualTo("DATE_AND_TIME#2024-01-05-06:05:07.5");
    }

    @Test
    void stringLiteral_keepsQuotesAndEscapes() {
        StringLiteral wide = new StringLiteral("\"a$\"b\"");

        assertThat(wide.render()).isEqualTo("\"a$\"b\"");
        assertThat(wide.wide()).isTrue();
        assertThat(new StringLiteral("'x'").wide()).isFalse();
    }
}

package com.stcode.core.ast;

import com.stcode.core.render.Render;
import com.stcode.core.render.RenderContext;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Literal constants of Structured Text.
 *
 * <p>Typed literals keep their type prefix ({@code INT#}, {@code REAL#}); numeric
 * literals keep their base. Values are stored as source text so that rendering never
 * changes precision or digit grouping.
 */
public final class Literals {

    private static final Set<Integer> BASES = Set.of(2, 8, 10, 16);

    private Literals() {
        // Utility class - no instantiation
    }

    private static String based(int base, String value) {
        return base == 10 ? value : base + "#" + value;
    }

    private static void checkBase(int base) {
        if (!BASES.contains(base)) {
            throw new IllegalArgumentException("Unsupported numeric base: " + base);
        }
    }

    /**
     * Integer literal such as {@code 42}, {@code 16#2A} or {@code INT#16#2A}.
     *
     * @param value digits without base prefix, optionally signed
     * @param typeName optional type prefix without {@code #}
     * @param base one of 2, 8, 10 or 16
     */
    public record IntegerLiteral(String value, String typeName, int base) implements Literal {
        public IntegerLiteral {
            Objects.requireNonNull(value, "value must not be null");
            checkBase(base);
        }

        public static IntegerLiteral decimal(String value) {
            return new IntegerLiteral(value, null, 10);
        }

        /**
         * @param name type prefix to apply
         * @return the same literal carrying the given type prefix
         */
        public IntegerLiteral withTypeName(String name) {
            return new IntegerLiteral(value, name, base);
        }

        @Override
        public String render(RenderContext context) {
            return Render.joinIf(typeName, "#", based(base, value));
        }
    }

    /**
     * @param value decimal or exponent notation, optionally signed
     * @param typeName optional {@code REAL} or {@code LREAL}
     */
    public record RealLiteral(String value, String typeName) implements Literal {
        public RealLiteral {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String render(RenderContext context) {
            return Render.joinIf(typeName, "#", value);
        }
    }

    /**
     * Bit string literal such as {@code BYTE#16#FF}.
     */
    public record BitStringLiteral(String value, String typeName, int base) implements Literal {
        public BitStringLiteral {
            Objects.requireNonNull(value, "value must not be null");
            Objects.requireNonNull(typeName, "typeName must not be null");
            checkBase(base);
        }

        @Override
        public String render(RenderContext context) {
            return typeName + "#" + based(base, value);
        }
    }

    /**
     * @param typeName {@code BOOL} when written with a {@code BOOL#} prefix, otherwise {@code null}
     */
    public record BooleanLiteral(boolean value, String typeName) implements Literal {
        public BooleanLiteral(boolean value) {
            this(value, null);
        }

        @Override
        public String render(RenderContext context) {
            return Render.joinIf(typeName, "#", value ? "TRUE" : "FALSE");
        }
    }

    /**
     * Duration such as {@code TIME#1D2H30M}. Absent components are {@code null}.
     *
     * @param typeName {@code TIME} or {@code LTIME}
     */
    public record DurationLiteral(
        BigDecimal days,
        BigDecimal hours,
        BigDecimal minutes,
        BigDecimal seconds,
        BigDecimal milliseconds,
        boolean negative,
        String typeName
    ) implements Literal {
        public DurationLiteral {
            if (days == null && hours == null && minutes == null && seconds == null && milliseconds == null) {
                throw new IllegalArgumentException("Duration needs at least one component");
            }
            typeName = typeName == null ? "TIME" : typeName;
        }

        public DurationLiteral(BigDecimal days, BigDecimal hours, BigDecimal minutes, BigDecimal seconds,
                               BigDecimal milliseconds, boolean negative) {
            this(days, hours, minutes, seconds, milliseconds, negative, null);
        }

        @Override
        public String render(RenderContext context) {
            StringBuilder text = new StringBuilder(typeName).append('#');
            if (negative) {
                text.append('-');
            }
            append(text, days, "D");
            append(text, hours, "H");
            append(text, minutes, "M");
            append(text, seconds, "S");
            append(text, milliseconds, "MS");
            return text.toString();
        }

        private static void append(StringBuilder text, BigDecimal value, String suffix) {
            if (value != null) {
                text.append(value.toPlainString()).append(suffix);
            }
        }
    }

    /**
     * @param typeName {@code TIME_OF_DAY} or {@code LTOD}
     */
    public record TimeOfDayLiteral(int hour, int minute, BigDecimal second, String typeName) implements Literal {
        public TimeOfDayLiteral {
            Objects.requireNonNull(second, "second must not be null");
            typeName = typeName == null ? "TIME_OF_DAY" : typeName;
        }

        public TimeOfDayLiteral(int hour, int minute, BigDecimal second) {
            this(hour, minute, second, null);
        }

        String clock() {
            String seconds = second.toPlainString();
            if (second.compareTo(BigDecimal.TEN) < 0) {
                seconds = "0" + seconds;
            }
            return String.format("%02d:%02d:%s", hour, minute, seconds);
        }

        @Override
        public String render(RenderContext context) {
            return typeName + "#" + clock();
        }
    }

    /**
     * @param typeName {@code DATE} or {@code LDATE}
     */
    public record DateLiteral(int year, int month, int day, String typeName) implements Literal {
        public DateLiteral {
            typeName = typeName == null ? "DATE" : typeName;
        }

        public DateLiteral(int year, int month, int day) {
            this(year, month, day, null);
        }

        String calendar() {
            return String.format("%04d-%02d-%02d", year, month, day);
        }

        @Override
        public String render(RenderContext context) {
            return typeName + "#" + calendar();
        }
    }

    /**
     * @param typeName {@code DATE_AND_TIME} or {@code LDT}
     */
    public record DateTimeLiteral(DateLiteral date, TimeOfDayLiteral time, String typeName) implements Literal {
        public DateTimeLiteral {
            Objects.requireNonNull(date, "date must not be null");
            Objects.requireNonNull(time, "time must not be null");
            typeName = typeName == null ? "DATE_AND_TIME" : typeName;
        }

        public DateTimeLiteral(DateLiteral date, TimeOfDayLiteral time) {
            this(date, time, null);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(date, time);
        }

        @Override
        public String render(RenderContext context) {
            return typeName + "#" + date.calendar() + "-" + time.clock();
        }
    }

    /**
     * @param value literal text including its quotes and {@code $} escapes
     */
    public record StringLiteral(String value) implements Literal {
        public StringLiteral {
            Objects.requireNonNull(value, "value must not be null");
        }

        /**
         * @return whether this is a double-quoted {@code WSTRING} literal
         */
        public boolean wide() {
            return value.startsWith("\"");
        }

        @Override
        public String render(RenderContext context) {
            return value;
        }
    }
}

package com.stcode.core.transform;

import com.stcode.core.ast.Literals.BitStringLiteral;
import com.stcode.core.ast.Literals.BooleanLiteral;
import com.stcode.core.ast.Literals.DateLiteral;
import com.stcode.core.ast.Literals.DateTimeLiteral;
import com.stcode.core.ast.Literals.DurationLiteral;
import com.stcode.core.ast.Literals.IntegerLiteral;
import com.stcode.core.ast.Literals.RealLiteral;
import com.stcode.core.ast.Literals.StringLiteral;
import com.stcode.core.ast.Literals.TimeOfDayLiteral;
import com.stcode.core.engine.Token;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Handlers for literal constants.
 *
 * <p>The numeric base is a property of the rule ({@code binary_integer} is base 2, and so
 * on). {@code integer_literal} then applies an optional type prefix to the untyped value.
 */
final class LiteralRules {

    private static final Pattern DURATION_PART =
        Pattern.compile("(\\d[\\d_]*(?:\\.\\d[\\d_]*)?)(ms|d|h|m|s)_?", Pattern.CASE_INSENSITIVE);

    private LiteralRules() {
    }

    static void register(HandlerRegistry registry) {
        registry
            .passThrough("constant")
            .register("signed_integer", LiteralRules::signedInteger)
            .register("binary_integer", c -> based(c, "BINARY_INTEGER", 2))
            .register("octal_integer", c -> based(c, "OCTAL_INTEGER", 8))
            .register("hex_integer", c -> based(c, "HEX_INTEGER", 16))
            .register("integer_literal", LiteralRules::integerLiteral)
            .register("real_literal", LiteralRules::realLiteral)
            .register("bit_string_literal", LiteralRules::bitStringLiteral)
            .register("boolean_literal", LiteralRules::booleanLiteral)
            .register("duration_literal", c -> duration(c, c.tokenText("DURATION_LITERAL")))
            .register("time_of_day_literal", LiteralRules::timeOfDayLiteral)
            .register("date_literal", LiteralRules::dateLiteral)
            .register("date_and_time_literal", LiteralRules::dateAndTime)
            .register("string_literal", c -> new StringLiteral(c.firstToken().text()));
    }

    private static IntegerLiteral signedInteger(Children c) {
        String digits = c.tokenText("INTEGER");
        Token sign = c.optionalToken("MINUS");
        if (sign == null) {
            sign = c.optionalToken("PLUS");
        }
        return IntegerLiteral.decimal(sign == null ? digits : sign.text() + digits);
    }

    private static IntegerLiteral based(Children c, String tokenType, int base) {
        String value = afterHash(c.tokenText(tokenType)).toUpperCase(Locale.ROOT);
        return new IntegerLiteral(value, null, base);
    }

    private static IntegerLiteral integerLiteral(Children c) {
        IntegerLiteral value = c.node(IntegerLiteral.class);
        Token prefix = c.optionalToken("INTEGER_TYPE_PREFIX");
        return prefix == null ? value : value.withTypeName(typeName(prefix));
    }

    private static RealLiteral realLiteral(Children c) {
        Token prefix = c.optionalToken("REAL_TYPE_PREFIX");
        Token number = c.optionalToken("REAL_NUMBER");
        if (number == null) {
            number = c.token("INTEGER");
        }
        String value = number.text().toUpperCase(Locale.ROOT);
        if (c.hasToken("MINUS")) {
            value = "-" + value;
        } else if (c.hasToken("PLUS")) {
            value = "+" + value;
        }
        return new RealLiteral(value, prefix == null ? null : typeName(prefix));
    }

    private static BitStringLiteral bitStringLiteral(Children c) {
        IntegerLiteral value = c.node(IntegerLiteral.class);
        return new BitStringLiteral(value.value(), typeName(c.token("BIT_STRING_TYPE_PREFIX")), value.base());
    }

    private static BooleanLiteral booleanLiteral(Children c) {
        Token prefix = c.optionalToken("BOOL_TYPE_PREFIX");
        return new BooleanLiteral(c.hasToken("TRUE"), prefix == null ? null : typeName(prefix));
    }

    static DurationLiteral duration(Children c, String text) {
        String body = afterHash(text);
        boolean negative = body.startsWith("-");
        if (negative) {
            body = body.substring(1);
        }
        BigDecimal[] parts = new BigDecimal[5];
        Matcher matcher = DURATION_PART.matcher(body);
        int consumed = 0;
        while (matcher.find()) {
            if (matcher.start() != consumed) {
                throw c.failure("malformed duration " + text);
            }
            consumed = matcher.end();
            int slot = slot(matcher.group(2).toLowerCase(Locale.ROOT));
            BigDecimal value = new BigDecimal(matcher.group(1).replace("_", ""));
            parts[slot] = parts[slot] == null ? value : parts[slot].add(value);
        }
        if (consumed != body.length() || consumed == 0) {
            throw c.failure("malformed duration " + text);
        }
        return new DurationLiteral(parts[0], parts[1], parts[2], parts[3], parts[4], negative,
            longForm(text) ? "LTIME" : "TIME");
    }

    private static int slot(String unit) {
        switch (unit) {
            case "d":
                return 0;
            case "h":
                return 1;
            case "m":
                return 2;
            case "s":
                return 3;
            default:
                return 4;
        }
    }

    private static TimeOfDayLiteral timeOfDayLiteral(Children c) {
        String text = c.tokenText("TIME_OF_DAY_LITERAL");
        return timeOfDay(c, afterHash(text), longForm(text) ? "LTOD" : "TIME_OF_DAY");
    }

    private static TimeOfDayLiteral timeOfDay(Children c, String clock, String typeName) {
        String[] parts = clock.split(":");
        if (parts.length != 3) {
            throw c.failure("malformed time of day " + clock);
        }
        return new TimeOfDayLiteral(number(parts[0]), number(parts[1]), new BigDecimal(parts[2].replace("_", "")),
            typeName);
    }

    private static DateLiteral dateLiteral(Children c) {
        String text = c.tokenText("DATE_LITERAL");
        return date(c, afterHash(text), longForm(text) ? "LDATE" : "DATE");
    }

    private static DateLiteral date(Children c, String calendar, String typeName) {
        String[] parts = calendar.split("-");
        if (parts.length != 3) {
            throw c.failure("malformed date " + calendar);
        }
        return new DateLiteral(number(parts[0]), number(parts[1]), number(parts[2]), typeName);
    }

    private static DateTimeLiteral dateAndTime(Children c) {
        String literal = c.tokenText("DATE_AND_TIME_LITERAL");
        String text = afterHash(literal);
        int split = text.lastIndexOf('-');
        if (split < 0) {
            throw c.failure("malformed date and time " + text);
        }
        return new DateTimeLiteral(date(c, text.substring(0, split), null), timeOfDay(c, text.substring(split + 1), null),
            longForm(literal) ? "LDT" : "DATE_AND_TIME");
    }

    private static int number(String digits) {
        return Integer.parseInt(digits.replace("_", ""));
    }

    private static String typeName(Token prefix) {
        String text = prefix.text();
        return text.substring(0, text.length() - 1).toUpperCase(Locale.ROOT);
    }

    /**
     * @return whether the prefix names a long type: {@code LTIME}, {@code LT}, {@code LTOD},
     *     {@code LDATE} or {@code LDT}
     */
    private static boolean longForm(String literal) {
        return literal.toUpperCase(Locale.ROOT).startsWith("L");
    }

    private static String afterHash(String text) {
        return text.substring(text.indexOf('#') + 1);
    }
}

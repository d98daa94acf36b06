package com.raditha.clonegen.renaming;

import com.raditha.clonegen.model.Language;
import com.raditha.clonegen.model.LiteralKind;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * Produces a different value of the same literal kind.
 * <p>
 * Numbers keep their radix prefix, letter case, digit width and suffix;
 * floats keep their precision. Integers in Java, C, C++ and JavaScript stay
 * within the range of the type the original literal has: a change that would
 * overflow it moves the value down instead. Strings keep prefix and quotes
 * and take a word from a fixed pool. Raw, interpolated and multi-line
 * strings and format strings ({@code "%d items"}, {@code "{} of {}"}) are
 * returned unchanged, as are null literals and, unless enabled, booleans.
 */
public class LiteralMutator {

    static final List<String> STRING_POOL = List.of(
            "alpha", "beta", "gamma", "delta", "sample", "value", "item", "data");
    static final List<String> CHAR_POOL = List.of("x", "y", "z", "a", "b", "c");

    private static final int MAX_FRACTION_DIGITS = 6;

    private static final Pattern FORMAT_PLACEHOLDER = Pattern.compile(
            "%(\\d+\\$|\\([A-Za-z_]\\w*\\))?[-+ #0']*(\\d+|\\*)?(\\.(\\d+|\\*))?(hh|h|ll|l|L|q|j|z|t)?"
                    + "[diouxXeEfFgGaAcspnrb%]"
                    + "|\\{[A-Za-z0-9_.\\[\\]]*(![rsa])?(:[^{}]*)?\\}");

    private static final BigInteger INT_MAX = BigInteger.ONE.shiftLeft(31).subtract(BigInteger.ONE);
    private static final BigInteger UINT_MAX = BigInteger.ONE.shiftLeft(32).subtract(BigInteger.ONE);
    private static final BigInteger LONG_MAX = BigInteger.ONE.shiftLeft(63).subtract(BigInteger.ONE);
    private static final BigInteger ULONG_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);
    private static final BigInteger SAFE_INTEGER_MAX = BigInteger.ONE.shiftLeft(53).subtract(BigInteger.ONE);

    private final boolean mutateBooleans;

    public LiteralMutator(boolean mutateBooleans) {
        this.mutateBooleans = mutateBooleans;
    }

    /**
     * Replacement text for {@code text}, or {@code text} itself when the
     * literal is not mutable.
     */
    public String mutate(String text, LiteralKind kind, Language language, Random random) {
        return switch (kind) {
            case INT -> mutateInt(text, language, random);
            case HEX -> mutateRadix(text, 2, 16, 10, language, random);
            case BINARY -> mutateRadix(text, 2, 2, 5, language, random);
            case OCTAL -> mutateOctal(text, language, random);
            case FLOAT -> mutateFloat(text, random);
            case SCIENTIFIC -> mutateScientific(text, random);
            case STRING -> mutateString(text, language, random);
            case BOOL -> mutateBooleans ? flip(text) : text;
            case NULL -> text;
        };
    }

    private static String mutateInt(String text, Language language, Random random) {
        int end = digitsEnd(text, 0, 10);
        if (end == 0) {
            return text;
        }
        BigInteger value = new BigInteger(stripSeparators(text.substring(0, end)));
        BigInteger tenth = value.divide(BigInteger.TEN);
        int bound = tenth.compareTo(BigInteger.valueOf(10)) <= 0
                ? 10
                : tenth.min(BigInteger.valueOf(Integer.MAX_VALUE)).intValue();
        String suffix = text.substring(end);
        BigInteger result = shift(value, BigInteger.valueOf(1L + random.nextInt(bound)),
                upperBound(value, language, suffix, true));
        if (result == null) {
            return text;
        }
        return result.toString() + suffix;
    }

    private static String mutateOctal(String text, Language language, Random random) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.startsWith("0o")) {
            return mutateRadix(text, 2, 8, 5, language, random);
        }
        return mutateRadix(text, 1, 8, 5, language, random);
    }

    /**
     * {@code value + delta}, or {@code value - delta} when the sum would pass
     * {@code max}. Null when neither stays in {@code 0..max}.
     */
    private static BigInteger shift(BigInteger value, BigInteger delta, BigInteger max) {
        BigInteger up = value.add(delta);
        if (max == null || up.compareTo(max) <= 0) {
            return up;
        }
        BigInteger down = value.subtract(delta);
        return down.signum() >= 0 ? down : null;
    }

    /**
     * Largest value the literal can take without changing its type or sign,
     * or null when the language has no fixed integer width. Decimal literals
     * without a suffix are {@code int} (or {@code long} in C when they are
     * already larger); hexadecimal, octal and binary literals may also use
     * the unsigned range of their width.
     */
    static BigInteger upperBound(BigInteger value, Language language, String suffix, boolean decimal) {
        String lower = suffix.toLowerCase(Locale.ROOT);
        List<BigInteger> widths;
        switch (language) {
            case PYTHON:
                return null;
            case JAVASCRIPT:
                return lower.contains("n") ? null : SAFE_INTEGER_MAX;
            case JAVA:
                boolean javaLong = lower.contains("l");
                if (decimal) {
                    widths = List.of(javaLong ? LONG_MAX : INT_MAX);
                } else {
                    widths = javaLong ? List.of(LONG_MAX, ULONG_MAX) : List.of(INT_MAX, UINT_MAX);
                }
                break;
            default:
                boolean unsigned = lower.contains("u");
                boolean cLong = lower.contains("l");
                if (decimal && unsigned) {
                    widths = cLong ? List.of(ULONG_MAX) : List.of(UINT_MAX, ULONG_MAX);
                } else if (decimal) {
                    widths = cLong ? List.of(LONG_MAX) : List.of(INT_MAX, LONG_MAX);
                } else if (unsigned) {
                    widths = cLong ? List.of(ULONG_MAX) : List.of(UINT_MAX, ULONG_MAX);
                } else {
                    widths = cLong ? List.of(LONG_MAX, ULONG_MAX) : List.of(INT_MAX, UINT_MAX, LONG_MAX, ULONG_MAX);
                }
                break;
        }
        for (BigInteger width : widths) {
            if (value.compareTo(width) <= 0) {
                return width;
            }
        }
        return value;
    }

    /**
     * Adds 1..maxDelta to a prefixed literal, keeping prefix, case, zero
     * padding and suffix.
     */
    private static String mutateRadix(String text, int prefixLength, int radix, int maxDelta, Language language,
            Random random) {
        int end = digitsEnd(text, prefixLength, radix);
        if (end == prefixLength) {
            return text;
        }
        String digits = stripSeparators(text.substring(prefixLength, end));
        BigInteger value = new BigInteger(digits, radix);
        BigInteger shifted = shift(value, BigInteger.valueOf(1L + random.nextInt(maxDelta)),
                upperBound(value, language, text.substring(end), false));
        if (shifted == null) {
            return text;
        }
        String result = shifted.toString(radix);
        if (digits.chars().anyMatch(Character::isUpperCase)) {
            result = result.toUpperCase(Locale.ROOT);
        }
        if (result.length() < digits.length()) {
            result = "0".repeat(digits.length() - result.length()) + result;
        }
        return text.substring(0, prefixLength) + result + text.substring(end);
    }

    private static String mutateFloat(String text, Random random) {
        int end = decimalEnd(text, 0);
        if (end == 0) {
            return text;
        }
        return shiftDecimal(text.substring(0, end), random) + text.substring(end);
    }

    /**
     * Changes the mantissa, keeps the exponent.
     */
    private static String mutateScientific(String text, Random random) {
        int exponent = Math.max(text.indexOf('e'), text.indexOf('E'));
        if (exponent <= 0) {
            return text;
        }
        String mantissa = text.substring(0, exponent);
        if (mantissa.indexOf('.') < 0) {
            String digits = stripSeparators(mantissa);
            if (digits.isEmpty()) {
                return text;
            }
            BigInteger value = new BigInteger(digits).add(BigInteger.valueOf(1L + random.nextInt(9)));
            return value + text.substring(exponent);
        }
        return shiftDecimal(mantissa, random) + text.substring(exponent);
    }

    /**
     * Adds a positive amount to a decimal number, printed with the same
     * number of fraction digits (at least one, at most six).
     */
    private static String shiftDecimal(String number, Random random) {
        String plain = stripSeparators(number);
        int dot = plain.indexOf('.');
        int fraction = dot < 0 ? 0 : plain.length() - dot - 1;
        int precision = Math.max(1, Math.min(MAX_FRACTION_DIGITS, fraction));
        double value = plain.equals(".") ? 0.0 : Double.parseDouble(plain);
        double unit = Math.pow(10, -precision);
        double scale = Math.max(1.0, value * 0.1);
        double delta = Math.max(unit, random.nextDouble() * scale);
        return String.format(Locale.ROOT, "%." + precision + "f", value + delta);
    }

    private static String mutateString(String text, Language language, Random random) {
        StringLiteralParts parts = StringLiteralParts.parse(text, language);
        if (parts == null || parts.isRaw() || parts.isMultiLine()) {
            return text;
        }
        if (parts.isInterpolated() && (parts.body().indexOf('{') >= 0 || parts.body().indexOf('$') >= 0)) {
            return text;
        }
        if (isFormatString(parts.body())) {
            return text;
        }
        List<String> pool = parts.isCharacter() ? CHAR_POOL : STRING_POOL;
        String replacement = pool.get(random.nextInt(pool.size()));
        if (replacement.equals(parts.body())) {
            replacement = pool.get((pool.indexOf(replacement) + 1) % pool.size());
        }
        return parts.withBody(replacement);
    }

    static boolean isFormatString(String body) {
        return FORMAT_PLACEHOLDER.matcher(body).find();
    }

    private static String flip(String text) {
        return switch (text) {
            case "true" -> "false";
            case "false" -> "true";
            case "True" -> "False";
            case "False" -> "True";
            default -> text;
        };
    }

    private static int digitsEnd(String text, int from, int radix) {
        int i = from;
        while (i < text.length()) {
            char c = text.charAt(i);
            boolean separator = (c == '_' || c == '\'') && i > from && i + 1 < text.length()
                    && Character.digit(text.charAt(i + 1), radix) >= 0;
            if (Character.digit(c, radix) < 0 && !separator) {
                break;
            }
            i++;
        }
        return i;
    }

    private static int decimalEnd(String text, int from) {
        int i = from;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (!Character.isDigit(c) && c != '.' && c != '_' && c != '\'') {
                break;
            }
            i++;
        }
        return i;
    }

    private static String stripSeparators(String digits) {
        return digits.replace("_", "").replace("'", "");
    }
}

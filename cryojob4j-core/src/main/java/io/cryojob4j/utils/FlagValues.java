package io.cryojob4j.utils;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.function.ToIntFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rendering of numeric flag values and decoding of dropdown labels.
 */
public final class FlagValues {

    private static final Pattern TRAILING_CODE = Pattern.compile("\\((-?\\d+)\\)\\s*$");
    private static final Pattern BARE_INT = Pattern.compile("^\\s*-?\\d+\\s*$");

    private FlagValues() {
    }

    /**
     * Integral values print without a fraction ({@code 1.0 -> "1"}), others in the shortest plain
     * decimal form ({@code 0.75}, {@code 2.5}).
     */
    public static String format(Number value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return value.toString();
        }
        if (value instanceof BigDecimal bd) {
            return plain(bd);
        }
        return format(value.doubleValue());
    }

    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return String.valueOf(value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return plain(BigDecimal.valueOf(value));
    }

    /**
     * Numeric code carried by a dropdown label.
     *
     * <p>{@code "90 degrees (1)"} yields 1, {@code "2"} yields 2, a number yields its integer value.
     * Labels without a code go through {@code keywordFallback}. Null and codes outside the int range yield 0.
     */
    public static int labelCode(Object value, ToIntFunction<String> keywordFallback) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d > Integer.MAX_VALUE || d < Integer.MIN_VALUE || Double.isNaN(d) ? 0 : n.intValue();
        }
        String label = value.toString();
        Matcher m = TRAILING_CODE.matcher(label);
        if (m.find()) {
            return code(m.group(1));
        }
        if (BARE_INT.matcher(label).matches()) {
            return code(label.trim());
        }
        return keywordFallback.applyAsInt(label.toLowerCase(Locale.ROOT));
    }

    private static int code(String digits) {
        if (digits.length() > 11) {
            return 0;
        }
        long parsed = Long.parseLong(digits);
        return parsed > Integer.MAX_VALUE || parsed < Integer.MIN_VALUE ? 0 : (int) parsed;
    }

    private static String plain(BigDecimal bd) {
        BigDecimal stripped = bd.stripTrailingZeros();
        if (stripped.scale() < 0) {
            stripped = stripped.setScale(0);
        }
        return stripped.toPlainString();
    }
}

package org.typeset.lite.pretty;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Iterator;
import java.util.function.Consumer;

/**
 * Accumulates printed source text.
 */
public final class Printer {

    // 17 significant digits always identify a double
    private static final int MAX_DIGITS = 17;

    private final StringBuilder buffer = new StringBuilder();

    public Printer push(String text) {
        buffer.append(text);
        return this;
    }

    public Printer push(char c) {
        buffer.append(c);
        return this;
    }

    public Printer pushInt(long value) {
        buffer.append(value);
        return this;
    }

    public Printer pushFloat(double value) {
        buffer.append(formatFloat(value));
        return this;
    }

    /**
     * Renders each item with the given renderer, pushing the separator
     * between consecutive items.
     */
    public <T> Printer join(Iterable<? extends T> items, String separator, Consumer<? super T> renderer) {
        Iterator<? extends T> it = items.iterator();
        while (it.hasNext()) {
            renderer.accept(it.next());
            if (it.hasNext()) {
                buffer.append(separator);
            }
        }
        return this;
    }

    public String finish() {
        return buffer.toString();
    }

    @Override
    public String toString() {
        return buffer.toString();
    }

    /**
     * Formats a float as the shortest decimal that reads back as the same
     * value, without exponent or trailing zeros: {@code 2.50} gives
     * {@code 2.5} and {@code 1e2} gives {@code 100}.
     */
    public static String formatFloat(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0.0) {
            return Double.doubleToRawLongBits(value) < 0 ? "-0" : "0";
        }
        BigDecimal exact = new BigDecimal(value);
        for (int precision = 1; precision < MAX_DIGITS; precision++) {
            BigDecimal rounded = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (rounded.doubleValue() == value) {
                return rounded.stripTrailingZeros().toPlainString();
            }
        }
        return exact.round(new MathContext(MAX_DIGITS, RoundingMode.HALF_EVEN)).stripTrailingZeros().toPlainString();
    }
}

package org.clausewitz.cwt.schema;

import java.util.Optional;

/**
 * Inclusive numeric bounds of {@code int[a..b]} and {@code float[a..b]}; {@code inf} and
 * {@code -inf} map to infinities.
 */
public record NumericRange(double min, double max) {

    public static Optional<NumericRange> parse(String text) {
        int sep = text.indexOf("..");
        if (sep < 0) {
            return Optional.empty();
        }
        try {
            return Optional.of(new NumericRange(bound(text.substring(0, sep)), bound(text.substring(sep + 2))));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static double bound(String text) {
        var t = text.strip();
        if (t.equalsIgnoreCase("inf")) {
            return Double.POSITIVE_INFINITY;
        }
        if (t.equalsIgnoreCase("-inf")) {
            return Double.NEGATIVE_INFINITY;
        }
        return Double.parseDouble(t);
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    @Override
    public String toString() {
        return format(min) + ".." + format(max);
    }

    private static String format(double bound) {
        if (Double.isInfinite(bound)) {
            return bound > 0
                   ? "inf"
                   : "-inf";
        }
        return bound == Math.rint(bound)
               ? String.valueOf((long) bound)
               : String.valueOf(bound);
    }
}

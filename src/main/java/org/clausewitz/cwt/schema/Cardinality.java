package org.clausewitz.cwt.schema;

import java.util.Optional;

/**
 * Allowed occurrence count of a key within its enclosing block, e.g. {@code 0..1} or {@code ~1..inf}.
 *
 * @param min  Minimum occurrences
 * @param max  Maximum occurrences, {@link #UNBOUNDED} for no limit
 * @param soft Violations are reported as warnings ({@code ~} prefix)
 */
public record Cardinality(int min, int max, boolean soft) {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public static final Cardinality REQUIRED = new Cardinality(1, 1, false);
    public static final Cardinality OPTIONAL = new Cardinality(0, 1, false);
    public static final Cardinality ANY = new Cardinality(0, UNBOUNDED, false);

    public Cardinality {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("Invalid cardinality " + min + ".." + max);
        }
    }

    /**
     * Parse {@code a..b}, {@code ~a..b}, with {@code inf} as an unbounded maximum.
     */
    public static Optional<Cardinality> parse(String text) {
        var body = text.strip();
        boolean soft = body.startsWith("~");
        if (soft) {
            body = body.substring(1);
        }
        int sep = body.indexOf("..");
        if (sep < 0) {
            return Optional.empty();
        }
        try {
            int min = Integer.parseInt(body.substring(0, sep));
            var maxText = body.substring(sep + 2);
            int max = maxText.equalsIgnoreCase("inf")
                      ? UNBOUNDED
                      : Integer.parseInt(maxText);
            if (min < 0 || max < min) {
                return Optional.empty();
            }
            return Optional.of(new Cardinality(min, max, soft));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public boolean isSatisfied(int count) {
        return count >= min && count <= max;
    }

    public boolean isRequired() {
        return min > 0;
    }

    public boolean allowsMultiple() {
        return max > 1;
    }

    public boolean isForbidden() {
        return max == 0;
    }

    /**
     * Most permissive combination of two declarations for the same key.
     */
    public Cardinality widen(Cardinality other) {
        return new Cardinality(Math.min(min, other.min), Math.max(max, other.max), soft && other.soft);
    }

    public String maxText() {
        return max == UNBOUNDED
               ? "inf"
               : String.valueOf(max);
    }

    @Override
    public String toString() {
        var prefix = soft
                     ? "~"
                     : "";
        return prefix + min + ".." + maxText();
    }
}

package com.example.property.search.model;

/**
 * Inclusive numeric range; a null bound is open.
 */
public record NumericRange(Long min, Long max) {

    public static final String OPEN_BOUND = "*";

    private static final NumericRange UNBOUNDED = new NumericRange(null, null);

    public static NumericRange unbounded() {
        return UNBOUNDED;
    }

    public static NumericRange between(Long min, Long max) {
        return new NumericRange(min, max);
    }

    public static NumericRange atLeast(long min) {
        return new NumericRange(min, null);
    }

    public static NumericRange atMost(long max) {
        return new NumericRange(null, max);
    }

    /**
     * A missing value never violates the range.
     */
    public boolean contains(Number value) {
        if (value == null) {
            return true;
        }
        long v = value.longValue();
        return (min == null || v >= min) && (max == null || v <= max);
    }

    public boolean hasMin() {
        return min != null;
    }

    public boolean hasMax() {
        return max != null;
    }

    public String canonical() {
        return bound(min) + ".." + bound(max);
    }

    private static String bound(Long value) {
        return value == null ? OPEN_BOUND : Long.toString(value);
    }
}

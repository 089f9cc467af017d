package com.neoplatform.common.validation;

/**
 * Expected physical bounds of a numeric quantity.
 *
 * <p>A value outside the bounds is a gross violation when it lies below
 * {@code min × 0.1} or above {@code max × 10}.
 */
public record PhysicalRange(double min, double max, String unit, boolean maxExclusive) {

    static final double GROSS_FACTOR = 10.0;

    public PhysicalRange {
        if (min > max) {
            throw new IllegalArgumentException("min " + min + " exceeds max " + max);
        }
        if (unit == null) unit = "";
    }

    public static PhysicalRange of(double min, double max, String unit) {
        return new PhysicalRange(min, max, unit, false);
    }

    public static PhysicalRange halfOpen(double min, double max, String unit) {
        return new PhysicalRange(min, max, unit, true);
    }

    public boolean contains(double value) {
        return value >= min && (maxExclusive ? value < max : value <= max);
    }

    public boolean isGrossViolation(double value) {
        return value < min / GROSS_FACTOR || value > max * GROSS_FACTOR;
    }

    public String describe() {
        String upper = maxExclusive ? ")" : "]";
        return ("[" + min + ", " + max + upper + " " + unit).trim();
    }
}

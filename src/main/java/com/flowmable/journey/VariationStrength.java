package com.flowmable.journey;

/**
 * Magnitude of the seeded micro-variation.
 */
public enum VariationStrength {
    /** Magnitude 0.02. */
    SUBTLE(0.02),
    /** Magnitude 0.05. */
    NOTICEABLE(0.05),
    /** Uses {@code variationCustomMagnitude}. */
    CUSTOM(Double.NaN);

    private final double magnitude;

    VariationStrength(double magnitude) {
        this.magnitude = magnitude;
    }

    public double magnitude() {
        return magnitude;
    }
}

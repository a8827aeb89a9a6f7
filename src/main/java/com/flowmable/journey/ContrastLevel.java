package com.flowmable.journey;

/**
 * Minimum OKLab ΔE between adjacent entries of a discrete palette.
 */
public enum ContrastLevel {
    /** ΔE ≥ 0.05. Soft separation. */
    LOW(0.05),
    /** ΔE ≥ 0.10. Recommended for UI categories. */
    MEDIUM(0.10),
    /** ΔE ≥ 0.15. Strong separation. */
    HIGH(0.15),
    /** Uses {@code contrastCustomThreshold}. */
    CUSTOM(Double.NaN);

    private final double threshold;

    ContrastLevel(double threshold) {
        this.threshold = threshold;
    }

    /**
     * Preset threshold; NaN for {@link #CUSTOM}, which is resolved against the config.
     */
    public double threshold() {
        return threshold;
    }
}

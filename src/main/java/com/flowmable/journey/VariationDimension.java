package com.flowmable.journey;

/**
 * Color axes the variation layer may perturb. Combined as a bitmask in
 * {@link JourneyConfig#variationDimensions()}.
 */
public enum VariationDimension {
    HUE(1),
    LIGHTNESS(1 << 1),
    CHROMA(1 << 2);

    /** All three dimensions. */
    public static final int ALL = HUE.bit | LIGHTNESS.bit | CHROMA.bit;

    private final int bit;

    VariationDimension(int bit) {
        this.bit = bit;
    }

    public int bit() {
        return bit;
    }

    public boolean isSetIn(int mask) {
        return (mask & bit) != 0;
    }

    public static int maskOf(VariationDimension... dimensions) {
        int mask = 0;
        for (VariationDimension d : dimensions) {
            mask |= d.bit;
        }
        return mask;
    }
}

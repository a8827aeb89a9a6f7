package com.flowmable.journey;

/**
 * Perceptual biases applied to each interpolated sample: lightness bias,
 * chroma bias and the mid-journey vibrancy boost.
 * <p>
 * The vibrancy boost is a triangular bump centered at t = 0.5:
 * {@code C × (1 + vibrancy × 0.6 × max(0, 1 − |t − 0.5| / 0.35))}.
 * It is zero for t outside [0.15, 0.85].
 */
public final class JourneyDynamics {

    static final double LIGHTNESS_SHIFT = 0.2;
    static final double MUTED_FACTOR = 0.6;
    static final double VIVID_FACTOR = 1.4;

    static final double VIBRANCY_GAIN = 0.6;
    static final double VIBRANCY_HALF_WIDTH = 0.35;

    static final double MAX_CHROMA = 0.4;

    private final LightnessBias lightnessBias;
    private final double lightnessCustomWeight;
    private final ChromaBias chromaBias;
    private final double chromaCustomMultiplier;
    private final double vibrancy;

    public JourneyDynamics(JourneyConfig config) {
        this.lightnessBias = config.lightnessBias();
        this.lightnessCustomWeight = config.lightnessCustomWeight();
        this.chromaBias = config.chromaBias();
        this.chromaCustomMultiplier = config.chromaCustomMultiplier();
        this.vibrancy = config.midJourneyVibrancy();
    }

    /**
     * @param color    Interpolated waypoint color
     * @param position Loop-folded journey position in [0, 1]
     */
    public LchColor apply(LchColor color, double position) {
        double L = color.L();
        double C = color.C();

        switch (lightnessBias) {
            case LIGHTER -> L = ColorSpaceUtils.lerp(L, 1.0, LIGHTNESS_SHIFT);
            case DARKER -> L = ColorSpaceUtils.lerp(L, 0.0, LIGHTNESS_SHIFT);
            case CUSTOM -> L += lightnessCustomWeight * LIGHTNESS_SHIFT;
            case NEUTRAL -> { }
        }

        switch (chromaBias) {
            case MUTED -> C *= MUTED_FACTOR;
            case VIVID -> C *= VIVID_FACTOR;
            case CUSTOM -> C *= chromaCustomMultiplier;
            case NEUTRAL -> { }
        }

        C *= vibrancyBoost(vibrancy, position);

        return new LchColor(
                ColorSpaceUtils.clamp(L, 0.0, 1.0),
                ColorSpaceUtils.clamp(C, 0.0, MAX_CHROMA),
                color.h());
    }

    /**
     * Chroma multiplier from the mid-journey bump; 1.0 outside the window.
     */
    static double vibrancyBoost(double vibrancy, double position) {
        double envelope = Math.max(0.0, 1.0 - Math.abs(position - 0.5) / VIBRANCY_HALF_WIDTH);
        return 1.0 + vibrancy * VIBRANCY_GAIN * envelope;
    }
}

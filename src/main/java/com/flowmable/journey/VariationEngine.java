package com.flowmable.journey;

/**
 * Optional seeded micro-variation of hue, lightness and chroma.
 * <p>
 * Every call derives a fresh mixer from the journey seed and the sample position,
 * so output depends only on (seed, position) and never on call history.
 * Draws are consumed in the order hue, lightness, chroma, one per enabled dimension.
 */
public final class VariationEngine {

    private static final double CHROMA_SCALE = 0.5;

    private final boolean enabled;
    private final int dimensions;
    private final double magnitude;
    private final long seed;

    public VariationEngine(JourneyConfig config) {
        this.enabled = config.variationEnabled();
        this.dimensions = config.variationDimensions();
        this.magnitude = config.variationMagnitude();
        this.seed = config.effectiveSeed();
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * @param color    Color after dynamics
     * @param position Loop-folded journey position in [0, 1]
     */
    public LchColor apply(LchColor color, double position) {
        if (!enabled || dimensions == 0) {
            return color;
        }
        SeededMixer mixer = new SeededMixer(SeededMixer.positionSeed(seed, position));

        double h = color.h();
        double L = color.L();
        double C = color.C();

        if (VariationDimension.HUE.isSetIn(dimensions)) {
            h += (mixer.nextDouble() - 0.5) * magnitude * Math.PI;
        }
        if (VariationDimension.LIGHTNESS.isSetIn(dimensions)) {
            L = ColorSpaceUtils.clamp(L + (mixer.nextDouble() - 0.5) * magnitude, 0.0, 1.0);
        }
        if (VariationDimension.CHROMA.isSetIn(dimensions)) {
            C = ColorSpaceUtils.clamp(C + (mixer.nextDouble() - 0.5) * magnitude * CHROMA_SCALE,
                    0.0, JourneyDynamics.MAX_CHROMA);
        }
        return new LchColor(L, C, h);
    }
}

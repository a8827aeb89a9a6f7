package com.flowmable.journey;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable description of a color journey.
 * <p>
 * {@link #DEFAULT} carries no anchors; add them with {@link #withAnchors(RgbColor...)}
 * before creating a {@link Journey}. Values are checked when the journey is created,
 * not here, so a partially filled config can be passed around freely.
 *
 * @param anchors                  1–8 anchor colors in linear RGB, in journey order
 * @param lightnessBias            Lightness shaping
 * @param lightnessCustomWeight    Weight for {@link LightnessBias#CUSTOM}, [-1, 1]
 * @param chromaBias               Chroma shaping
 * @param chromaCustomMultiplier   Multiplier for {@link ChromaBias#CUSTOM}, [0.5, 2.0]
 * @param contrastLevel            Minimum adjacent ΔE for discrete palettes
 * @param contrastCustomThreshold  Threshold for {@link ContrastLevel#CUSTOM}
 * @param midJourneyVibrancy       Chroma boost around t = 0.5, [0, 1]
 * @param temperatureBias          Warm/cool hue rotation of the waypoints
 * @param loopMode                 Boundary behavior of t
 * @param variationEnabled         Whether the seeded variation layer runs
 * @param variationDimensions      Bitmask of {@link VariationDimension} bits
 * @param variationStrength        Variation magnitude preset
 * @param variationCustomMagnitude Magnitude for {@link VariationStrength#CUSTOM}
 * @param variationSeed            Variation seed; 0 selects {@link #DEFAULT_SEED}
 */
public record JourneyConfig(
        List<RgbColor> anchors,
        LightnessBias lightnessBias,
        double lightnessCustomWeight,
        ChromaBias chromaBias,
        double chromaCustomMultiplier,
        ContrastLevel contrastLevel,
        double contrastCustomThreshold,
        double midJourneyVibrancy,
        TemperatureBias temperatureBias,
        LoopMode loopMode,
        boolean variationEnabled,
        int variationDimensions,
        VariationStrength variationStrength,
        double variationCustomMagnitude,
        long variationSeed
) {
    public static final int MAX_ANCHORS = 8;

    public static final long DEFAULT_SEED = 0x123456789ABCDEF0L;

    public static final JourneyConfig DEFAULT = new JourneyConfig(
            List.of(),
            LightnessBias.NEUTRAL, 0.0,
            ChromaBias.NEUTRAL, 1.0,
            ContrastLevel.MEDIUM, ContrastLevel.MEDIUM.threshold(),
            0.3,  // midJourneyVibrancy
            TemperatureBias.NEUTRAL,
            LoopMode.OPEN,
            false,
            VariationDimension.ALL,
            VariationStrength.SUBTLE, VariationStrength.SUBTLE.magnitude(),
            DEFAULT_SEED
    );

    public JourneyConfig {
        // Null entries are kept so that Journey.create can report them
        anchors = anchors == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(anchors));
    }

    public int anchorCount() {
        return anchors.size();
    }

    /** Minimum adjacent ΔE with CUSTOM resolved. */
    public double minDeltaE() {
        return contrastLevel == ContrastLevel.CUSTOM ? contrastCustomThreshold : contrastLevel.threshold();
    }

    /** Variation magnitude with CUSTOM resolved. */
    public double variationMagnitude() {
        return variationStrength == VariationStrength.CUSTOM
                ? variationCustomMagnitude
                : variationStrength.magnitude();
    }

    /** The seed the variation layer actually uses. */
    public long effectiveSeed() {
        return variationSeed == 0L ? DEFAULT_SEED : variationSeed;
    }

    public JourneyConfig withAnchors(RgbColor... colors) {
        return withAnchors(Arrays.asList(colors));
    }

    public JourneyConfig withAnchors(List<RgbColor> colors) {
        return new JourneyConfig(colors, lightnessBias, lightnessCustomWeight, chromaBias,
                chromaCustomMultiplier, contrastLevel, contrastCustomThreshold, midJourneyVibrancy,
                temperatureBias, loopMode, variationEnabled, variationDimensions, variationStrength,
                variationCustomMagnitude, variationSeed);
    }

    public JourneyConfig withLightness(LightnessBias bias) {
        return withLightness(bias, lightnessCustomWeight);
    }

    public JourneyConfig withLightness(LightnessBias bias, double customWeight) {
        return new JourneyConfig(anchors, bias, customWeight, chromaBias,
                chromaCustomMultiplier, contrastLevel, contrastCustomThreshold, midJourneyVibrancy,
                temperatureBias, loopMode, variationEnabled, variationDimensions, variationStrength,
                variationCustomMagnitude, variationSeed);
    }

    public JourneyConfig withChroma(ChromaBias bias) {
        return withChroma(bias, chromaCustomMultiplier);
    }

    public JourneyConfig withChroma(ChromaBias bias, double customMultiplier) {
        return new JourneyConfig(anchors, lightnessBias, lightnessCustomWeight, bias,
                customMultiplier, contrastLevel, contrastCustomThreshold, midJourneyVibrancy,
                temperatureBias, loopMode, variationEnabled, variationDimensions, variationStrength,
                variationCustomMagnitude, variationSeed);
    }

    public JourneyConfig withContrast(ContrastLevel level) {
        return withContrast(level, contrastCustomThreshold);
    }

    public JourneyConfig withContrast(ContrastLevel level, double customThreshold) {
        return new JourneyConfig(anchors, lightnessBias, lightnessCustomWeight, chromaBias,
                chromaCustomMultiplier, level, customThreshold, midJourneyVibrancy,
                temperatureBias, loopMode, variationEnabled, variationDimensions, variationStrength,
                variationCustomMagnitude, variationSeed);
    }

    public JourneyConfig withVibrancy(double vibrancy) {
        return new JourneyConfig(anchors, lightnessBias, lightnessCustomWeight, chromaBias,
                chromaCustomMultiplier, contrastLevel, contrastCustomThreshold, vibrancy,
                temperatureBias, loopMode, variationEnabled, variationDimensions, variationStrength,
                variationCustomMagnitude, variationSeed);
    }

    public JourneyConfig withTemperature(TemperatureBias bias) {
        return new JourneyConfig(anchors, lightnessBias, lightnessCustomWeight, chromaBias,
                chromaCustomMultiplier, contrastLevel, contrastCustomThreshold, midJourneyVibrancy,
                bias, loopMode, variationEnabled, variationDimensions, variationStrength,
                variationCustomMagnitude, variationSeed);
    }

    public JourneyConfig withLoopMode(LoopMode mode) {
        return new JourneyConfig(anchors, lightnessBias, lightnessCustomWeight, chromaBias,
                chromaCustomMultiplier, contrastLevel, contrastCustomThreshold, midJourneyVibrancy,
                temperatureBias, mode, variationEnabled, variationDimensions, variationStrength,
                variationCustomMagnitude, variationSeed);
    }

    /**
     * Enable variation on the given dimensions.
     */
    public JourneyConfig withVariation(VariationStrength strength, int dimensions, long seed) {
        return withVariation(strength, variationCustomMagnitude, dimensions, seed);
    }

    public JourneyConfig withVariation(VariationStrength strength, double customMagnitude,
                                       int dimensions, long seed) {
        return new JourneyConfig(anchors, lightnessBias, lightnessCustomWeight, chromaBias,
                chromaCustomMultiplier, contrastLevel, contrastCustomThreshold, midJourneyVibrancy,
                temperatureBias, loopMode, true, dimensions, strength,
                customMagnitude, seed);
    }

    public JourneyConfig withoutVariation() {
        return new JourneyConfig(anchors, lightnessBias, lightnessCustomWeight, chromaBias,
                chromaCustomMultiplier, contrastLevel, contrastCustomThreshold, midJourneyVibrancy,
                temperatureBias, loopMode, false, variationDimensions, variationStrength,
                variationCustomMagnitude, variationSeed);
    }
}

package com.flowmable.journey;

import java.util.List;

/**
 * Null-tolerant functional entry points over {@link Journey}.
 * <p>
 * These mirror the engine's flat function surface for callers that hold a journey
 * which may be absent: index accessors degrade to black or do nothing instead of
 * throwing, and {@link #destroyJourney(Journey)} accepts null and repeated calls.
 */
public final class ColorJourneys {

    private ColorJourneys() {}

    /**
     * No anchors, neutral biases, MEDIUM contrast, OPEN loop, variation off, default seed.
     */
    public static JourneyConfig initDefaultConfig() {
        return JourneyConfig.DEFAULT;
    }

    /**
     * @throws InvalidConfigException if the config cannot produce a journey
     */
    public static Journey createJourney(JourneyConfig config) {
        return Journey.create(config);
    }

    public static void destroyJourney(Journey journey) {
        if (journey != null) {
            journey.close();
        }
    }

    public static RgbColor sample(Journey journey, double t) {
        return journey == null ? RgbColor.BLACK : journey.sample(t);
    }

    /**
     * @param count At least 1
     * @return Empty list for a null journey
     */
    public static List<RgbColor> discrete(Journey journey, int count) {
        if (count < 1) {
            throw new IllegalArgumentException("Palette count must be at least 1, got " + count);
        }
        return journey == null ? List.of() : journey.discrete(count);
    }

    /**
     * @return {@link RgbColor#BLACK} for a null journey or negative index
     */
    public static RgbColor discreteAt(Journey journey, int index) {
        return journey == null ? RgbColor.BLACK : journey.discreteAt(index);
    }

    /**
     * Fill {@code out} with stream colors; no-op for a null journey, negative start,
     * non-positive count or null buffer.
     */
    public static void discreteRange(Journey journey, int start, int count, RgbColor[] out) {
        if (journey != null) {
            journey.discreteRange(start, count, out);
        }
    }

    public static List<RgbColor> discreteRange(Journey journey, int start, int count) {
        return journey == null ? List.of() : journey.discreteRange(start, count);
    }
}

package com.flowmable.journey;

/**
 * Overall lightness shaping applied to every sample.
 */
public enum LightnessBias {
    /** Keep the lightness of the anchors. */
    NEUTRAL,
    /** Move 20% of the way toward white. */
    LIGHTER,
    /** Move 20% of the way toward black. */
    DARKER,
    /** Add {@code lightnessCustomWeight × 0.2}; weight in [-1, 1]. */
    CUSTOM
}

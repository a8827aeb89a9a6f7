package com.flowmable.journey;

/**
 * Overall saturation shaping applied to every sample.
 */
public enum ChromaBias {
    /** Keep the chroma of the anchors. */
    NEUTRAL,
    /** Chroma × 0.6, pastel feel. */
    MUTED,
    /** Chroma × 1.4, bold feel. */
    VIVID,
    /** Chroma × {@code chromaCustomMultiplier}; multiplier in [0.5, 2.0]. */
    CUSTOM
}

package com.flowmable.journey;

/**
 * Boundary behavior of the journey parameter t.
 */
public enum LoopMode {
    /** t is clamped to [0, 1]; start and end differ. */
    OPEN,
    /** t wraps modulo 1; t = 0 and t = 1 are the same color. */
    CLOSED,
    /** t runs 0 → 1 → 0 over each period of 2. */
    PINGPONG
}

package com.flowmable.journey;

/**
 * Deterministic 64-bit mixer behind the variation layer.
 * <p>
 * The state is split into two 32-bit halves. Each draw returns the low 24 bits of
 * their sum scaled to [0, 1), then scrambles the halves:
 * <pre>
 * s0 = state &amp; 0xFFFFFFFF;  s1 = state &gt;&gt;&gt; 32
 * draw = ((s0 + s1) &amp; 0xFFFFFF) / 2^24
 * s1 ^= s0
 * s0 = rotl24(s0) ^ s1 ^ (s1 &lt;&lt; 16)      (64-bit shifts, not a true 32-bit rotate)
 * s1 = (s1 &lt;&lt; 37) | (s1 &gt;&gt;&gt; 27)
 * state = (s1 &lt;&lt; 32) | s0             (high bits of s1 fall off)
 * </pre>
 * This sequence is part of the seeded-reproducibility contract: changing any step
 * changes every varied palette ever generated. Instances are cheap, single-use and
 * not thread-safe.
 */
public final class SeededMixer {

    private static final long LOW_32 = 0xFFFFFFFFL;
    private static final int DRAW_BITS = 24;

    private long state;

    public SeededMixer(long seed) {
        this.state = seed;
    }

    /**
     * Seed for a given journey position, so the same position always varies the same way.
     */
    public static long positionSeed(long journeySeed, double position) {
        return journeySeed ^ (long) Math.floor(position * 1_000_000.0);
    }

    public long nextBits() {
        long s0 = state & LOW_32;
        long s1 = state >>> 32;
        long result = s0 + s1;

        s1 ^= s0;
        s0 = ((s0 << 24) | (s0 >>> 8)) ^ s1 ^ (s1 << 16);
        s1 = (s1 << 37) | (s1 >>> 27);
        state = (s1 << 32) | s0;

        return result;
    }

    /** Next draw in [0, 1). */
    public double nextDouble() {
        return (nextBits() & ((1L << DRAW_BITS) - 1)) / (double) (1L << DRAW_BITS);
    }

    long state() {
        return state;
    }
}

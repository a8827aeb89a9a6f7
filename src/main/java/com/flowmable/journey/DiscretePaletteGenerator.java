package com.flowmable.journey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.DoubleFunction;

/**
 * Turns the continuous journey into discrete, mutually distinguishable colors.
 * <p>
 * Two addressing schemes exist:
 * <ul>
 *   <li>{@link #palette(int)}: a fixed-size palette whose positions are spread over the
 *       journey according to the loop mode. Palettes larger than 20 entries get a
 *       periodic chroma pulse after contrast enforcement.</li>
 *   <li>{@link #colorAt(int)}, {@link #range(int, int)} and {@link #sequence()}: an
 *       unbounded index stream stepping t by 0.05 (20 positions per cycle), independent
 *       of any count. Index i is always contrast-enforced against index i − 1 of the same
 *       stream, so {@code colorAt(i)} equals element i of {@code range(0, i + 1)}.</li>
 * </ul>
 * In both schemes the first entry is unconstrained and each later entry is pushed away
 * from the actual previous output by {@link ContrastEnforcer}.
 */
public final class DiscretePaletteGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    static final int STREAM_POSITIONS_PER_CYCLE = 20;

    static final int PULSE_MIN_COUNT = 20;
    private static final double PULSE_AMPLITUDE = 0.1;
    private static final double PULSE_PERIOD_DIVISOR = 5.0;

    private final DoubleFunction<RgbColor> sampler;
    private final LoopMode loopMode;
    private final double minDeltaE;

    /**
     * @param sampler   Continuous journey sampler returning clamped RGB for raw t
     * @param loopMode  Loop mode used for palette spacing
     * @param minDeltaE Minimum ΔE between adjacent entries
     */
    public DiscretePaletteGenerator(DoubleFunction<RgbColor> sampler, LoopMode loopMode, double minDeltaE) {
        this.sampler = sampler;
        this.loopMode = loopMode;
        this.minDeltaE = minDeltaE;
    }

    /**
     * Journey position of palette entry {@code index} out of {@code count}.
     * A single-entry palette sits at the midpoint.
     */
    public static double palettePosition(int index, int count, LoopMode loopMode) {
        if (count <= 1) {
            return 0.5;
        }
        return switch (loopMode) {
            case CLOSED -> (double) index / count;
            case PINGPONG -> {
                double t = 2.0 * index / (count - 1);
                yield t > 1.0 ? 2.0 - t : t;
            }
            case OPEN -> (double) index / (count - 1);
        };
    }

    /**
     * Journey position of stream index {@code index}: {@code (index × 0.05) mod 1}.
     */
    public static double streamPosition(int index) {
        return (double) (index % STREAM_POSITIONS_PER_CYCLE) / STREAM_POSITIONS_PER_CYCLE;
    }

    /**
     * Generate a palette of {@code count} colors.
     *
     * @param count Number of colors, at least 1
     * @return Unmodifiable list of gamut-clamped colors
     */
    public List<RgbColor> palette(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("Palette count must be at least 1, got " + count);
        }

        List<RgbColor> colors = new ArrayList<>(count);
        RgbColor previous = null;
        for (int i = 0; i < count; i++) {
            RgbColor color = sampler.apply(palettePosition(i, count, loopMode));
            if (previous != null) {
                color = ContrastEnforcer.enforceMinimum(color, previous, minDeltaE);
            }
            colors.add(color);
            previous = color;
        }

        if (count > PULSE_MIN_COUNT) {
            for (int i = 0; i < count; i++) {
                colors.set(i, applyChromaPulse(colors.get(i), i));
            }
        }

        if (LOG.isTraceEnabled()) {
            LOG.trace("Generated {} colors ({} spacing, min ΔE {})", count, loopMode, minDeltaE);
        }
        return Collections.unmodifiableList(colors);
    }

    /**
     * Saturation rhythm for large palettes: {@code C × (1 + 0.1 cos(iπ/5))}.
     */
    static RgbColor applyChromaPulse(RgbColor color, int index) {
        LchColor lch = color.toOklab().toLch();
        double pulse = 1.0 + PULSE_AMPLITUDE * Math.cos(index * Math.PI / PULSE_PERIOD_DIVISOR);
        double chroma = ColorSpaceUtils.clamp(lch.C() * pulse, 0.0, JourneyDynamics.MAX_CHROMA);
        return lch.withChroma(chroma).toOklab().toRgb().clamped();
    }

    /**
     * Color at stream index {@code index}. Replays the stream from index 0, so the cost
     * is O(index); sequential consumers should prefer {@link #sequence()}.
     *
     * @return The color, or {@link RgbColor#BLACK} for a negative index
     * @throws IllegalArgumentException for {@code Integer.MAX_VALUE}, past the end of the stream
     */
    public RgbColor colorAt(int index) {
        if (index < 0) {
            return RgbColor.BLACK;
        }
        requireWithinStream(index, 1);
        return sequence(index).next();
    }

    /**
     * Stream colors {@code start .. start + count - 1}.
     *
     * @return Unmodifiable list; empty when {@code start < 0} or {@code count <= 0}
     * @throws IllegalArgumentException if the range runs past index
     *                                  {@code Integer.MAX_VALUE - 1}, the end of the stream
     */
    public List<RgbColor> range(int start, int count) {
        if (start < 0 || count <= 0) {
            return List.of();
        }
        requireWithinStream(start, count);
        RgbColor[] out = new RgbColor[count];
        range(start, count, out);
        return List.of(out);
    }

    /**
     * Fill {@code out[0 .. count-1]} with stream colors starting at {@code start}.
     * Does nothing when {@code start < 0}, {@code count <= 0} or {@code out} is null.
     *
     * @throws IllegalArgumentException if {@code out} is shorter than {@code count} or the
     *                                  range runs past the end of the stream
     */
    public void range(int start, int count, RgbColor[] out) {
        if (out == null || start < 0 || count <= 0) {
            return;
        }
        if (out.length < count) {
            throw new IllegalArgumentException("Output buffer holds " + out.length
                    + " colors, " + count + " requested");
        }
        requireWithinStream(start, count);
        DiscreteSequence sequence = sequence(start);
        for (int i = 0; i < count; i++) {
            out[i] = sequence.next();
        }
    }

    // Last addressable index is Integer.MAX_VALUE - 1
    private static void requireWithinStream(int start, int count) {
        if (count > Integer.MAX_VALUE - start) {
            throw new IllegalArgumentException("Range " + start + " + " + count
                    + " runs past the end of the index stream");
        }
    }

    /** Iterator over the stream from index 0. */
    public DiscreteSequence sequence() {
        return new DiscreteSequence(this);
    }

    /**
     * Iterator positioned so that its first {@code next()} returns index {@code start}.
     */
    public DiscreteSequence sequence(int start) {
        DiscreteSequence sequence = new DiscreteSequence(this);
        sequence.skip(start);
        return sequence;
    }

    RgbColor streamColor(int index, RgbColor previous) {
        RgbColor color = sampler.apply(streamPosition(index));
        return previous == null ? color : ContrastEnforcer.enforceMinimum(color, previous, minDeltaE);
    }

    public double minDeltaE() {
        return minDeltaE;
    }
}

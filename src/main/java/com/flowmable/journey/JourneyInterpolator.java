package com.flowmable.journey;

import java.util.List;

/**
 * Maps the journey parameter t onto the waypoint path.
 * <p>
 * t is first folded into [0, 1] according to the {@link LoopMode}; the folded
 * position then selects one of {@code W - 1} equal-width segments, whose local
 * parameter is eased with smoothstep. Lightness and chroma blend linearly, hue
 * along the shortest arc so the path never takes the long way round the wheel.
 */
public final class JourneyInterpolator {

    /** Returned when there are no waypoints to interpolate. */
    static final LchColor NEUTRAL_GRAY = new LchColor(0.5, 0.1, 0.0);

    private final List<Waypoint> waypoints;
    private final LoopMode loopMode;

    public JourneyInterpolator(List<Waypoint> waypoints, LoopMode loopMode) {
        this.waypoints = List.copyOf(waypoints);
        this.loopMode = loopMode;
    }

    /**
     * Fold t into [0, 1]. NaN is treated as 0.
     */
    public static double normalizePosition(double t, LoopMode loopMode) {
        if (Double.isNaN(t)) {
            return 0.0;
        }
        switch (loopMode) {
            case CLOSED -> {
                t = t % 1.0;
                if (t < 0) t += 1.0;
            }
            case PINGPONG -> {
                t = t % 2.0;
                if (t < 0) t += 2.0;
                if (t > 1.0) t = 2.0 - t;
            }
            case OPEN -> { }
        }
        // Infinite inputs come out of % as NaN
        return ColorSpaceUtils.clamp(t, 0.0, 1.0);
    }

    public double normalize(double t) {
        return normalizePosition(t, loopMode);
    }

    /**
     * Interpolated waypoint color at raw parameter t.
     */
    public LchColor sample(double t) {
        return interpolate(normalize(t));
    }

    /**
     * Interpolated waypoint color at an already-folded position in [0, 1].
     */
    public LchColor interpolate(double position) {
        int count = waypoints.size();
        if (count == 0) {
            return NEUTRAL_GRAY;
        }
        if (count == 1) {
            return waypoints.get(0).anchor();
        }

        double segmentWidth = 1.0 / (count - 1);
        int segment = (int) (position / segmentWidth);
        if (segment > count - 2) segment = count - 2;

        double localT = (position - segment * segmentWidth) / segmentWidth;
        localT = ColorSpaceUtils.smoothstep(localT);

        LchColor a = waypoints.get(segment).anchor();
        LchColor b = waypoints.get(segment + 1).anchor();
        return blend(a, b, localT);
    }

    /**
     * Blend two LCh colors; hue travels the shorter way round.
     */
    public static LchColor blend(LchColor a, LchColor b, double t) {
        double hueDelta = ColorSpaceUtils.shortestHueDelta(a.h(), b.h());
        return new LchColor(
                ColorSpaceUtils.lerp(a.L(), b.L(), t),
                ColorSpaceUtils.lerp(a.C(), b.C(), t),
                a.h() + hueDelta * t);
    }

    public List<Waypoint> waypoints() {
        return waypoints;
    }

    public LoopMode loopMode() {
        return loopMode;
    }
}

package com.flowmable.journey;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JourneyInterpolatorTest {

    private static final double EPS = 1e-12;

    @Test
    void open_clampsOutsideUnitRange() {
        assertEquals(0.0, JourneyInterpolator.normalizePosition(-0.5, LoopMode.OPEN));
        assertEquals(0.3, JourneyInterpolator.normalizePosition(0.3, LoopMode.OPEN));
        assertEquals(1.0, JourneyInterpolator.normalizePosition(1.5, LoopMode.OPEN));
        assertEquals(1.0, JourneyInterpolator.normalizePosition(Double.POSITIVE_INFINITY, LoopMode.OPEN));
    }

    @Test
    void closed_wrapsModuloOne() {
        assertEquals(0.25, JourneyInterpolator.normalizePosition(1.25, LoopMode.CLOSED), EPS);
        assertEquals(0.75, JourneyInterpolator.normalizePosition(-0.25, LoopMode.CLOSED), EPS);
        assertEquals(0.0, JourneyInterpolator.normalizePosition(1.0, LoopMode.CLOSED), EPS);
        assertEquals(0.0, JourneyInterpolator.normalizePosition(3.0, LoopMode.CLOSED), EPS);
    }

    @Test
    void pingpong_reflectsEveryOtherCycle() {
        assertEquals(0.75, JourneyInterpolator.normalizePosition(1.25, LoopMode.PINGPONG), EPS);
        assertEquals(1.0, JourneyInterpolator.normalizePosition(1.0, LoopMode.PINGPONG), EPS);
        assertEquals(0.0, JourneyInterpolator.normalizePosition(2.0, LoopMode.PINGPONG), EPS);
        assertEquals(0.25, JourneyInterpolator.normalizePosition(-0.25, LoopMode.PINGPONG), EPS);
        assertEquals(0.4, JourneyInterpolator.normalizePosition(2.4, LoopMode.PINGPONG), EPS);
    }

    @Test
    void nanAndInfinity_foldToZero() {
        for (LoopMode mode : LoopMode.values()) {
            assertEquals(0.0, JourneyInterpolator.normalizePosition(Double.NaN, mode), mode.name());
        }
        assertEquals(0.0, JourneyInterpolator.normalizePosition(Double.POSITIVE_INFINITY, LoopMode.CLOSED));
        assertEquals(0.0, JourneyInterpolator.normalizePosition(Double.NEGATIVE_INFINITY, LoopMode.PINGPONG));
    }

    @Test
    void noWaypoints_returnsNeutralGray() {
        JourneyInterpolator interpolator = new JourneyInterpolator(List.of(), LoopMode.OPEN);
        assertEquals(JourneyInterpolator.NEUTRAL_GRAY, interpolator.sample(0.7));
    }

    @Test
    void singleWaypoint_isConstant() {
        LchColor only = new LchColor(0.4, 0.12, 2.0);
        JourneyInterpolator interpolator = new JourneyInterpolator(List.of(Waypoint.of(only)), LoopMode.OPEN);
        assertEquals(only, interpolator.sample(0.0));
        assertEquals(only, interpolator.sample(0.9));
    }

    @Test
    void endpointsAndSegmentBoundaries_hitWaypoints() {
        LchColor a = new LchColor(0.3, 0.05, 1.0);
        LchColor b = new LchColor(0.6, 0.15, 2.0);
        LchColor c = new LchColor(0.9, 0.10, 3.0);
        JourneyInterpolator interpolator = new JourneyInterpolator(
                List.of(Waypoint.of(a), Waypoint.of(b), Waypoint.of(c)), LoopMode.OPEN);

        assertEquals(a, interpolator.interpolate(0.0));
        assertEquals(b, interpolator.interpolate(0.5));
        LchColor end = interpolator.interpolate(1.0);
        assertEquals(c.L(), end.L(), 1e-9);
        assertEquals(c.C(), end.C(), 1e-9);
        assertEquals(c.h(), end.h(), 1e-9);
    }

    @Test
    void segmentMidpoint_isLinearMidpoint() {
        // smoothstep(0.5) == 0.5
        JourneyInterpolator interpolator = new JourneyInterpolator(List.of(
                Waypoint.of(new LchColor(0.2, 0.1, 1.0)),
                Waypoint.of(new LchColor(0.8, 0.3, 2.0))), LoopMode.OPEN);

        LchColor mid = interpolator.interpolate(0.5);
        assertEquals(0.5, mid.L(), EPS);
        assertEquals(0.2, mid.C(), EPS);
        assertEquals(1.5, mid.h(), EPS);
    }

    @Test
    void smoothstepEasing_slowsNearWaypoints() {
        JourneyInterpolator interpolator = new JourneyInterpolator(List.of(
                Waypoint.of(new LchColor(0.0, 0.1, 1.0)),
                Waypoint.of(new LchColor(1.0, 0.1, 1.0))), LoopMode.OPEN);

        // Linear would give 0.1
        assertEquals(0.028, interpolator.interpolate(0.1).L(), EPS);
    }

    @Test
    void hue_takesShortestArcAcrossZero() {
        JourneyInterpolator interpolator = new JourneyInterpolator(List.of(
                Waypoint.of(new LchColor(0.5, 0.1, 6.2)),
                Waypoint.of(new LchColor(0.5, 0.1, 0.2))), LoopMode.OPEN);

        double arc = 0.2 + ColorSpaceUtils.TWO_PI - 6.2;
        double previous = 0.0;
        for (int i = 0; i <= 50; i++) {
            double traveled = ColorSpaceUtils.shortestHueDelta(6.2, interpolator.interpolate(i / 50.0).h());
            assertTrue(traveled >= -EPS && traveled <= arc + EPS, "step " + i + " traveled " + traveled);
            assertTrue(traveled >= previous - EPS, "hue must move monotonically");
            previous = traveled;
        }
        assertTrue(arc <= 0.4);
    }

    @Test
    void blend_longWayRoundNeverTaken() {
        LchColor mid = JourneyInterpolator.blend(
                new LchColor(0.5, 0.1, 0.1),
                new LchColor(0.5, 0.1, ColorSpaceUtils.TWO_PI - 0.1),
                0.5);
        // Midpoint of the short arc through 0, not π
        assertEquals(0.0, ColorSpaceUtils.shortestHueDelta(0.0, mid.h()), 1e-9);
    }

    @Test
    void sample_foldsBeforeInterpolating() {
        JourneyInterpolator interpolator = new JourneyInterpolator(List.of(
                Waypoint.of(new LchColor(0.2, 0.1, 1.0)),
                Waypoint.of(new LchColor(0.8, 0.1, 1.0))), LoopMode.PINGPONG);

        assertEquals(interpolator.sample(0.25), interpolator.sample(1.75));
        assertEquals(LoopMode.PINGPONG, interpolator.loopMode());
        assertEquals(2, interpolator.waypoints().size());
    }
}

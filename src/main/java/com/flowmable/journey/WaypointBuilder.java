package com.flowmable.journey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds the ordered waypoint list a journey interpolates through.
 * <p>
 * A single anchor is expanded into a designed full-wheel tour: hue advances with
 * smoothstep pacing, chroma swells once toward the middle, lightness makes one gentle
 * oscillation. Two or more anchors are used as waypoints directly, in input order.
 */
public final class WaypointBuilder {

    private WaypointBuilder() {}

    public static final int MAX_WAYPOINTS = 16;

    static final int SINGLE_ANCHOR_WAYPOINTS = 8;
    private static final double CHROMA_ENVELOPE = 0.2;
    private static final double LIGHTNESS_ENVELOPE = 0.1;

    /**
     * @param anchors         Anchor colors in LCh, 1–8 entries
     * @param temperatureBias Hue rotation applied to every waypoint
     * @return Unmodifiable waypoint list
     */
    public static List<Waypoint> build(List<LchColor> anchors, TemperatureBias temperatureBias) {
        if (anchors.isEmpty() || anchors.size() > JourneyConfig.MAX_ANCHORS) {
            throw new IllegalArgumentException("Expected 1–" + JourneyConfig.MAX_ANCHORS
                    + " anchors, got " + anchors.size());
        }

        List<Waypoint> waypoints = anchors.size() == 1
                ? singleAnchorTour(anchors.get(0))
                : anchors.stream().map(Waypoint::of).toList();

        if (temperatureBias != TemperatureBias.NEUTRAL) {
            double shift = temperatureBias.hueShift();
            waypoints = waypoints.stream().map(w -> w.withHueShift(shift)).toList();
        }

        if (waypoints.size() > MAX_WAYPOINTS) {
            throw new IllegalStateException("Waypoint overflow: " + waypoints.size());
        }
        return waypoints;
    }

    private static List<Waypoint> singleAnchorTour(LchColor base) {
        List<Waypoint> tour = new ArrayList<>(SINGLE_ANCHOR_WAYPOINTS);
        for (int i = 0; i < SINGLE_ANCHOR_WAYPOINTS; i++) {
            double t = (double) i / (SINGLE_ANCHOR_WAYPOINTS - 1);

            // Non-linear pacing: slow at both ends of the revolution
            double hue = base.h() + ColorSpaceUtils.smoothstep(t) * ColorSpaceUtils.TWO_PI;
            double chroma = base.C() * (1.0 + CHROMA_ENVELOPE * Math.sin(t * Math.PI));
            double lightness = base.L() * (1.0 + LIGHTNESS_ENVELOPE * Math.sin(t * ColorSpaceUtils.TWO_PI));

            tour.add(Waypoint.of(new LchColor(lightness, chroma, hue)));
        }
        return Collections.unmodifiableList(tour);
    }
}

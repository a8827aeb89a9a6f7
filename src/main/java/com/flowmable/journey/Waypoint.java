package com.flowmable.journey;

/**
 * A designed control point the journey passes through.
 *
 * @param anchor Position of the waypoint in OKLab-LCh
 * @param weight Influence weight; always 1.0 for now, carried for future weighting
 */
public record Waypoint(LchColor anchor, double weight) {

    public static Waypoint of(LchColor anchor) {
        return new Waypoint(anchor, 1.0);
    }

    public Waypoint withHueShift(double radians) {
        return new Waypoint(anchor.withHue(anchor.h() + radians), weight);
    }
}

package com.flowmable.journey;

/**
 * One-time hue rotation applied to every waypoint.
 */
public enum TemperatureBias {
    NEUTRAL(0.0),
    /** +0.3 rad, toward reds and yellows. */
    WARM(0.3),
    /** −0.3 rad, toward blues and purples. */
    COOL(-0.3);

    private final double hueShift;

    TemperatureBias(double hueShift) {
        this.hueShift = hueShift;
    }

    public double hueShift() {
        return hueShift;
    }
}

package com.flowmable.journey;

/**
 * A color in OKLab, the Cartesian perceptual space all journey math runs in.
 *
 * @param L Perceptual lightness [0, 1]
 * @param a Green–red opponent axis, roughly [-0.4, 0.4]
 * @param b Blue–yellow opponent axis, roughly [-0.4, 0.4]
 */
public record LabColor(double L, double a, double b) {

    public LchColor toLch() {
        return ColorSpaceUtils.oklabToLch(this);
    }

    /** Linear RGB, possibly out of gamut. */
    public RgbColor toRgb() {
        return ColorSpaceUtils.oklabToRgb(this);
    }

    public double deltaE(LabColor other) {
        return ColorSpaceUtils.deltaE(this, other);
    }
}

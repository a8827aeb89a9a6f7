package com.flowmable.journey;

/**
 * Cylindrical form of OKLab.
 * <p>
 * The hue is normalized into [0, 2π) on construction, so every derived color
 * satisfies the range without callers having to remember it.
 *
 * @param L Perceptual lightness [0, 1]
 * @param C Chroma, non-negative (journeys keep it within [0, 0.4])
 * @param h Hue angle in radians, [0, 2π)
 */
public record LchColor(double L, double C, double h) {

    public LchColor {
        h = ColorSpaceUtils.normalizeHue(h);
    }

    public LchColor withLightness(double lightness) {
        return new LchColor(lightness, C, h);
    }

    public LchColor withChroma(double chroma) {
        return new LchColor(L, chroma, h);
    }

    public LchColor withHue(double hue) {
        return new LchColor(L, C, hue);
    }

    public LabColor toOklab() {
        return ColorSpaceUtils.lchToOklab(this);
    }
}

package com.flowmable.journey;

/**
 * A color in linear RGB.
 * <p>
 * Channels are nominally in [0, 1]. Intermediate results may leave that range;
 * anything handed back to a caller as final output goes through {@link #clamped()}.
 *
 * @param r Red channel (linear)
 * @param g Green channel (linear)
 * @param b Blue channel (linear)
 */
public record RgbColor(double r, double g, double b) {

    /** Returned by index accessors when there is nothing valid to return. */
    public static final RgbColor BLACK = new RgbColor(0.0, 0.0, 0.0);

    /**
     * Parse a gamma-encoded sRGB hex string ("#RRGGBB" or "RRGGBB") into linear RGB.
     */
    public static RgbColor fromSrgbHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("Hex color must not be null");
        }
        String digits = hex.startsWith("#") ? hex.substring(1) : hex;
        if (digits.length() != 6) {
            throw new IllegalArgumentException("Expected #RRGGBB, got: " + hex);
        }
        int rgb;
        try {
            rgb = Integer.parseInt(digits, 16);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected #RRGGBB, got: " + hex, e);
        }
        return new RgbColor(
                ColorSpaceUtils.srgbToLinear(((rgb >> 16) & 0xFF) / 255.0),
                ColorSpaceUtils.srgbToLinear(((rgb >> 8) & 0xFF) / 255.0),
                ColorSpaceUtils.srgbToLinear((rgb & 0xFF) / 255.0));
    }

    /**
     * Gamma-encode and format as "#RRGGBB". Out-of-gamut channels are clamped first.
     */
    public String toSrgbHex() {
        RgbColor c = clamped();
        return String.format("#%02X%02X%02X",
                toByte(ColorSpaceUtils.linearToSrgb(c.r)),
                toByte(ColorSpaceUtils.linearToSrgb(c.g)),
                toByte(ColorSpaceUtils.linearToSrgb(c.b)));
    }

    public RgbColor clamped() {
        return ColorSpaceUtils.clampRgb(this);
    }

    public boolean isInGamut() {
        return r >= 0.0 && r <= 1.0 && g >= 0.0 && g <= 1.0 && b >= 0.0 && b <= 1.0;
    }

    public LabColor toOklab() {
        return ColorSpaceUtils.rgbToOklab(this);
    }

    private static int toByte(double c) {
        return (int) Math.round(c * 255.0);
    }
}

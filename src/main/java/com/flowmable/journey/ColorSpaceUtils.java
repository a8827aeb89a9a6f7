package com.flowmable.journey;

/**
 * Color space conversion utilities and perceptual distance metrics.
 * <p>
 * Provides linear RGB ↔ OKLab ↔ OKLab-LCh conversion (Björn Ottosson, 2020)
 * and Euclidean OKLab ΔE. Cube roots use full double precision ({@link Math#cbrt}).
 */
public final class ColorSpaceUtils {

    private ColorSpaceUtils() {}

    public static final double TWO_PI = 2.0 * Math.PI;

    // Readable lightness band for text-on-color use
    private static final double READABLE_L_MIN = 0.2;
    private static final double READABLE_L_MAX = 0.95;

    /**
     * Convert linear RGB to OKLab.
     */
    public static LabColor rgbToOklab(RgbColor c) {
        // 1. Linear RGB → LMS cone response
        double l = 0.4122214708 * c.r() + 0.5363325363 * c.g() + 0.0514459929 * c.b();
        double m = 0.2119034982 * c.r() + 0.6806995451 * c.g() + 0.1073969566 * c.b();
        double s = 0.0883024619 * c.r() + 0.2817188376 * c.g() + 0.6299787005 * c.b();

        // 2. Non-linear compression
        double l_ = Math.cbrt(l);
        double m_ = Math.cbrt(m);
        double s_ = Math.cbrt(s);

        // 3. LMS' → Lab
        return new LabColor(
                0.2104542553 * l_ + 0.7936177850 * m_ - 0.0040720468 * s_,
                1.9779984951 * l_ - 2.4285922050 * m_ + 0.4505937099 * s_,
                0.0259040371 * l_ + 0.7827717662 * m_ - 0.8086757660 * s_
        );
    }

    /**
     * Convert OKLab to linear RGB. The result may be out of gamut; use
     * {@link #clampRgb(RgbColor)} before treating it as final output.
     */
    public static RgbColor oklabToRgb(LabColor c) {
        double l_ = c.L() + 0.3963377774 * c.a() + 0.2158037573 * c.b();
        double m_ = c.L() - 0.1055613458 * c.a() - 0.0638541728 * c.b();
        double s_ = c.L() - 0.0894841775 * c.a() - 1.2914855480 * c.b();

        double l = l_ * l_ * l_;
        double m = m_ * m_ * m_;
        double s = s_ * s_ * s_;

        return new RgbColor(
                +4.0767416621 * l - 3.3077115913 * m + 0.2309699292 * s,
                -1.2684380046 * l + 2.6097574011 * m - 0.3413193965 * s,
                -0.0041960863 * l - 0.7034186147 * m + 1.7076147010 * s
        );
    }

    public static LchColor oklabToLch(LabColor c) {
        double chroma = Math.sqrt(c.a() * c.a() + c.b() * c.b());
        return new LchColor(c.L(), chroma, Math.atan2(c.b(), c.a()));
    }

    public static LabColor lchToOklab(LchColor c) {
        return new LabColor(c.L(), c.C() * Math.cos(c.h()), c.C() * Math.sin(c.h()));
    }

    /**
     * Euclidean distance in OKLab.
     *
     * @return ΔE ≥ 0; 0 only for identical colors
     */
    public static double deltaE(LabColor x, LabColor y) {
        double dL = x.L() - y.L();
        double da = x.a() - y.a();
        double db = x.b() - y.b();
        return Math.sqrt(dL * dL + da * da + db * db);
    }

    public static RgbColor clampRgb(RgbColor c) {
        return new RgbColor(clamp(c.r(), 0.0, 1.0), clamp(c.g(), 0.0, 1.0), clamp(c.b(), 0.0, 1.0));
    }

    /**
     * True when lightness sits in the band where text on the color stays legible.
     */
    public static boolean isReadable(LabColor c) {
        return c.L() >= READABLE_L_MIN && c.L() <= READABLE_L_MAX;
    }

    /** sRGB transfer function, decoding direction. */
    public static double srgbToLinear(double c) {
        return c <= 0.04045 ? c / 12.92 : Math.pow((c + 0.055) / 1.055, 2.4);
    }

    /** sRGB transfer function, encoding direction. */
    public static double linearToSrgb(double c) {
        return c <= 0.0031308 ? c * 12.92 : 1.055 * Math.pow(c, 1.0 / 2.4) - 0.055;
    }

    /**
     * Wrap an angle into [0, 2π). Non-finite input maps to 0.
     */
    public static double normalizeHue(double h) {
        if (!Double.isFinite(h)) {
            return 0.0;
        }
        double r = h % TWO_PI;
        if (r < 0) r += TWO_PI;
        if (r >= TWO_PI) r -= TWO_PI;
        return r;
    }

    /**
     * Signed angular difference {@code to - from} wrapped into (−π, π].
     */
    public static double shortestHueDelta(double from, double to) {
        double d = to - from;
        if (d > Math.PI) d -= TWO_PI;
        if (d <= -Math.PI) d += TWO_PI;
        return d;
    }

    static double clamp(double x, double min, double max) {
        if (Double.isNaN(x)) return min;
        return x < min ? min : (x > max ? max : x);
    }

    static double lerp(double a, double b, double t) {
        return a + (b - a) * t;
    }

    /**
     * Cubic ease 3x² − 2x³ with the input clamped to [0, 1] first.
     */
    static double smoothstep(double t) {
        t = clamp(t, 0.0, 1.0);
        return t * t * (3.0 - 2.0 * t);
    }
}

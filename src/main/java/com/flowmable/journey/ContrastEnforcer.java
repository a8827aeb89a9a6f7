package com.flowmable.journey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;

/**
 * Pushes a color away from a reference until their OKLab ΔE reaches a threshold.
 * <p>
 * Each round first moves lightness away from the reference's side of mid-gray by half
 * the remaining shortfall, then, if that is not enough, rotates hue by a growing step
 * and raises chroma. The loop is bounded; when the threshold cannot be reached (for
 * example an extreme threshold against a near-achromatic reference) the furthest color
 * seen is returned. Falling short is not an error.
 */
public final class ContrastEnforcer {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private ContrastEnforcer() {}

    static final int MAX_ITERATIONS = 5;

    private static final double LIGHTNESS_SHARE = 0.5;
    private static final double HUE_STEP = 0.2; // ~11°, multiplied by the round index
    private static final double CHROMA_GAIN = 0.5;
    private static final double MIN_CHROMA = 1e-5;

    /**
     * @return {@code color} itself when already far enough, otherwise the adjusted color
     *         (best effort)
     */
    public static LabColor enforceMinimum(LabColor color, LabColor reference, double minDeltaE) {
        double deltaE = color.deltaE(reference);
        if (deltaE >= minDeltaE) {
            return color;
        }

        double direction = reference.L() < 0.5 ? 1.0 : -1.0;
        LabColor current = color;
        LabColor best = color;
        double bestDeltaE = deltaE;

        for (int iter = 0; iter < MAX_ITERATIONS; iter++) {
            // 1. Lightness nudge
            double shortfall = minDeltaE - current.deltaE(reference);
            current = new LabColor(
                    ColorSpaceUtils.clamp(current.L() + direction * shortfall * LIGHTNESS_SHARE, 0.0, 1.0),
                    current.a(),
                    current.b());
            deltaE = current.deltaE(reference);
            if (deltaE >= minDeltaE) {
                return current;
            }
            if (deltaE > bestDeltaE) {
                best = current;
                bestDeltaE = deltaE;
            }

            // 2. Hue rotation + chroma lift
            shortfall = minDeltaE - deltaE;
            LchColor lch = current.toLch();
            double chroma = lch.C();
            if (chroma > MIN_CHROMA) {
                chroma = Math.min(chroma * (1.0 + shortfall * CHROMA_GAIN), JourneyDynamics.MAX_CHROMA);
            }
            current = new LchColor(lch.L(), chroma, lch.h() + HUE_STEP * iter).toOklab();
            deltaE = current.deltaE(reference);
            if (deltaE >= minDeltaE) {
                return current;
            }
            if (deltaE > bestDeltaE) {
                best = current;
                bestDeltaE = deltaE;
            }
        }

        LOG.debug("Contrast target {} not reached after {} rounds, best ΔE {}",
                minDeltaE, MAX_ITERATIONS, bestDeltaE);
        return best;
    }

    /**
     * RGB form used by the palette generator: converts to OKLab, enforces, and returns a
     * gamut-clamped color. Returns {@code color} untouched when already far enough.
     * <p>
     * Clamping the adjusted color back into gamut can pull it toward the reference again.
     * When that leaves it closer than the (clamped) input was, the input is returned, so
     * the result is never worse than the input as measured on in-gamut colors.
     */
    public static RgbColor enforceMinimum(RgbColor color, RgbColor reference, double minDeltaE) {
        LabColor lab = color.toOklab();
        LabColor referenceLab = reference.toOklab();
        if (lab.deltaE(referenceLab) >= minDeltaE) {
            return color;
        }
        RgbColor adjusted = enforceMinimum(lab, referenceLab, minDeltaE).toRgb().clamped();
        RgbColor input = color.clamped();
        if (adjusted.toOklab().deltaE(referenceLab) < input.toOklab().deltaE(referenceLab)) {
            LOG.debug("Gamut clamp undid contrast adjustment, keeping input {}", input);
            return input;
        }
        return adjusted;
    }
}

package com.flowmable.journey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A constructed color journey, sampled continuously or discretely.
 * <p>
 * All derived state (anchor LCh values, waypoints, seed) is computed once in
 * {@link #create(JourneyConfig)} and never changes, so any number of threads may
 * sample the same journey concurrently and equal configs always give identical
 * output. {@link #close()} only marks the journey as released; afterwards the
 * accessors degrade to black or empty results instead of failing.
 *
 * <pre>
 * Journey journey = Journey.create(JourneyConfig.DEFAULT.withAnchors(new RgbColor(0.3, 0.5, 0.8)));
 * RgbColor mid = journey.sample(0.5);
 * List&lt;RgbColor&gt; palette = journey.discrete(8);
 * </pre>
 */
public final class Journey implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final JourneyConfig config;
    private final List<LchColor> anchors;
    private final List<Waypoint> waypoints;
    private final long seed;

    private final JourneyInterpolator interpolator;
    private final JourneyDynamics dynamics;
    private final VariationEngine variation;
    private final DiscretePaletteGenerator palettes;

    private volatile boolean closed;

    private Journey(JourneyConfig config) {
        this.config = config;
        this.anchors = config.anchors().stream()
                .map(rgb -> rgb.toOklab().toLch())
                .toList();
        this.waypoints = WaypointBuilder.build(anchors, config.temperatureBias());
        this.seed = config.effectiveSeed();

        this.interpolator = new JourneyInterpolator(waypoints, config.loopMode());
        this.dynamics = new JourneyDynamics(config);
        this.variation = new VariationEngine(config);
        this.palettes = new DiscretePaletteGenerator(this::sampleUnchecked, config.loopMode(), config.minDeltaE());
    }

    /**
     * Validate {@code config} and build a journey from it.
     *
     * @throws InvalidConfigException if the anchor count is outside [1, 8] or a numeric
     *                                field is out of range
     */
    public static Journey create(JourneyConfig config) {
        validate(config);
        Journey journey = new Journey(config);
        LOG.debug("Created journey: {} anchor(s), {} waypoints, loop {}, variation {}",
                journey.anchors.size(), journey.waypoints.size(), config.loopMode(),
                config.variationEnabled() ? "on" : "off");
        return journey;
    }

    /**
     * Continuous sample at t, gamut-clamped. t is folded per the loop mode.
     */
    public RgbColor sample(double t) {
        if (closed) {
            return RgbColor.BLACK;
        }
        return sampleUnchecked(t);
    }

    /**
     * Continuous sample at t before conversion to RGB.
     */
    public LchColor sampleLch(double t) {
        double position = interpolator.normalize(t);
        LchColor color = interpolator.interpolate(position);
        color = dynamics.apply(color, position);
        return variation.apply(color, position);
    }

    private RgbColor sampleUnchecked(double t) {
        return sampleLch(t).toOklab().toRgb().clamped();
    }

    /**
     * {@code stops} evenly spaced continuous samples from t = 0 to t = 1, for building
     * gradients. A single stop is the midpoint.
     */
    public List<RgbColor> gradient(int stops) {
        if (stops < 1) {
            throw new IllegalArgumentException("Gradient needs at least 1 stop, got " + stops);
        }
        if (closed) {
            return List.of();
        }
        if (stops == 1) {
            return List.of(sampleUnchecked(0.5));
        }
        List<RgbColor> colors = new ArrayList<>(stops);
        for (int i = 0; i < stops; i++) {
            colors.add(sampleUnchecked((double) i / (stops - 1)));
        }
        return Collections.unmodifiableList(colors);
    }

    /**
     * Contrast-enforced palette of {@code count} colors spread over the journey.
     *
     * @param count At least 1
     */
    public List<RgbColor> discrete(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("Palette count must be at least 1, got " + count);
        }
        if (closed) {
            return List.of();
        }
        return palettes.palette(count);
    }

    /**
     * Color at index {@code index} of the unbounded discrete stream; O(index).
     *
     * @return {@link RgbColor#BLACK} for a negative index or a closed journey
     */
    public RgbColor discreteAt(int index) {
        if (closed || index < 0) {
            return RgbColor.BLACK;
        }
        return palettes.colorAt(index);
    }

    /**
     * Stream colors {@code start .. start + count - 1}; equal to calling
     * {@link #discreteAt(int)} for each index.
     *
     * @return Empty list when {@code start < 0}, {@code count <= 0} or the journey is closed
     * @throws IllegalArgumentException if the range runs past index {@code Integer.MAX_VALUE - 1}
     */
    public List<RgbColor> discreteRange(int start, int count) {
        if (closed) {
            return List.of();
        }
        return palettes.range(start, count);
    }

    /**
     * Buffer form of {@link #discreteRange(int, int)}. Leaves {@code out} untouched when
     * {@code start < 0}, {@code count <= 0} or the journey is closed.
     */
    public void discreteRange(int start, int count, RgbColor[] out) {
        if (closed) {
            return;
        }
        palettes.range(start, count, out);
    }

    /**
     * Caller-owned iterator over the discrete stream from index 0.
     *
     * @throws IllegalStateException if the journey is closed
     */
    public DiscreteSequence discreteSequence() {
        if (closed) {
            throw new IllegalStateException("Journey is closed");
        }
        return palettes.sequence();
    }

    /**
     * Release the journey. Idempotent.
     */
    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public JourneyConfig config() {
        return config;
    }

    /** Anchors converted to OKLab-LCh, in input order. */
    public List<LchColor> anchors() {
        return anchors;
    }

    public List<Waypoint> waypoints() {
        return waypoints;
    }

    public int waypointCount() {
        return waypoints.size();
    }

    /** Effective variation seed (0 in the config already replaced by the default). */
    public long seed() {
        return seed;
    }

    public double minDeltaE() {
        return palettes.minDeltaE();
    }

    // --- Validation ---

    private static void validate(JourneyConfig config) {
        if (config == null) {
            throw new InvalidConfigException("config", "must not be null");
        }

        int count = config.anchorCount();
        if (count < 1 || count > JourneyConfig.MAX_ANCHORS) {
            throw new InvalidConfigException("anchors",
                    "expected 1–" + JourneyConfig.MAX_ANCHORS + " anchors, got " + count);
        }
        for (int i = 0; i < count; i++) {
            RgbColor anchor = config.anchors().get(i);
            if (anchor == null) {
                throw new InvalidConfigException("anchors", "anchor " + i + " is null");
            }
            if (!Double.isFinite(anchor.r()) || !Double.isFinite(anchor.g()) || !Double.isFinite(anchor.b())) {
                throw new InvalidConfigException("anchors", "anchor " + i + " is not finite: " + anchor);
            }
        }

        requireNonNull(config.lightnessBias(), "lightnessBias");
        requireNonNull(config.chromaBias(), "chromaBias");
        requireNonNull(config.contrastLevel(), "contrastLevel");
        requireNonNull(config.temperatureBias(), "temperatureBias");
        requireNonNull(config.loopMode(), "loopMode");
        requireNonNull(config.variationStrength(), "variationStrength");

        if (config.lightnessBias() == LightnessBias.CUSTOM) {
            requireInRange(config.lightnessCustomWeight(), -1.0, 1.0, "lightnessCustomWeight");
        }
        if (config.chromaBias() == ChromaBias.CUSTOM) {
            requireInRange(config.chromaCustomMultiplier(), 0.5, 2.0, "chromaCustomMultiplier");
        }
        if (config.contrastLevel() == ContrastLevel.CUSTOM) {
            requireNonNegative(config.contrastCustomThreshold(), "contrastCustomThreshold");
        }
        requireInRange(config.midJourneyVibrancy(), 0.0, 1.0, "midJourneyVibrancy");

        if ((config.variationDimensions() & ~VariationDimension.ALL) != 0) {
            throw new InvalidConfigException("variationDimensions",
                    "unknown bits in mask 0x" + Integer.toHexString(config.variationDimensions()));
        }
        if (config.variationEnabled() && config.variationStrength() == VariationStrength.CUSTOM) {
            requireNonNegative(config.variationCustomMagnitude(), "variationCustomMagnitude");
        }
    }

    private static void requireNonNull(Object value, String field) {
        if (value == null) {
            throw new InvalidConfigException(field, "must not be null");
        }
    }

    private static void requireNonNegative(double value, String field) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new InvalidConfigException(field, "expected a finite value >= 0, got " + value);
        }
    }

    private static void requireInRange(double value, double min, double max, String field) {
        // Also rejects NaN
        if (!(value >= min && value <= max)) {
            throw new InvalidConfigException(field, "expected [" + min + ", " + max + "], got " + value);
        }
    }
}

package com.pathfinder.common.model;

import java.util.List;
import java.util.Locale;

/**
 * Position of the latest close relative to the mean and standard deviation of its window,
 * bucketed into nine ordered z-score bands.
 *
 * <h3>Bands</h3>
 * <pre>
 * EXTREME_LOW   z &lt; -2.0
 * VERY_LOW      -2.0 ≤ z &lt; -1.0
 * LOW           -1.0 ≤ z &lt; -0.5
 * SLIGHT_LOW    -0.5 ≤ z &lt; -0.25
 * NEUTRAL       -0.25 ≤ z &lt; 0.25
 * SLIGHT_HIGH   0.25 ≤ z &lt; 0.5
 * HIGH          0.5 ≤ z &lt; 1.0
 * VERY_HIGH     1.0 ≤ z &lt; 2.0
 * EXTREME_HIGH  z ≥ 2.0
 * </pre>
 *
 * <p>Each state carries two fixed numbers: an integer {@link #level()} in −4…4, used to measure
 * how far a transition moves, and a {@link #signalValue()} in [−1, 1], used when a target state
 * is translated into the final signal.
 */
public enum MarketState {

    EXTREME_LOW(-4, -1.0),
    VERY_LOW(-3, -0.8),
    LOW(-2, -0.6),
    SLIGHT_LOW(-1, -0.3),
    NEUTRAL(0, 0.0),
    SLIGHT_HIGH(1, 0.3),
    HIGH(2, 0.6),
    VERY_HIGH(3, 0.8),
    EXTREME_HIGH(4, 1.0);

    /** Upper z-score edges of every band except the last, in state order. */
    private static final double[] BAND_EDGES = {-2.0, -1.0, -0.5, -0.25, 0.25, 0.5, 1.0, 2.0};

    /** Targets of the bullish search, in tie-break order. */
    public static final List<MarketState> BULLISH_TARGETS = List.of(HIGH, VERY_HIGH, EXTREME_HIGH);

    /** Targets of the bearish search, in tie-break order. */
    public static final List<MarketState> BEARISH_TARGETS = List.of(LOW, VERY_LOW, EXTREME_LOW);

    private static final MarketState[] VALUES = values();

    private final int level;
    private final double signalValue;

    MarketState(int level, double signalValue) {
        this.level = level;
        this.signalValue = signalValue;
    }

    public int level() {
        return level;
    }

    public double signalValue() {
        return signalValue;
    }

    /** Snake-case label, e.g. {@code "very_high"}. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isExtreme() {
        return this == EXTREME_LOW || this == EXTREME_HIGH;
    }

    public boolean isVery() {
        return this == VERY_LOW || this == VERY_HIGH;
    }

    /**
     * Maps a z-score to its band. NaN maps to {@link #NEUTRAL}.
     */
    public static MarketState fromZScore(double z) {
        if (Double.isNaN(z)) return NEUTRAL;
        for (int i = 0; i < BAND_EDGES.length; i++) {
            if (z < BAND_EDGES[i]) return VALUES[i];
        }
        return EXTREME_HIGH;
    }

    public static MarketState ofOrdinal(int ordinal) {
        return VALUES[ordinal];
    }

    public static int count() {
        return VALUES.length;
    }
}

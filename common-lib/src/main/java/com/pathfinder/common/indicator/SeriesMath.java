package com.pathfinder.common.indicator;

/**
 * Pure calculation utilities over primitive series.
 * Series are oldest-first; ranges are half-open {@code [from, to)}.
 */
public final class SeriesMath {

    private SeriesMath() {}

    // ── Moments ─────────────────────────────────────────────────────────────

    public static double mean(double[] values, int from, int to) {
        if (values == null || to <= from) return Double.NaN;
        double sum = 0;
        for (int i = from; i < to; i++) sum += values[i];
        return sum / (to - from);
    }

    public static double mean(double[] values) {
        return values == null ? Double.NaN : mean(values, 0, values.length);
    }

    /** Population standard deviation (divides by n). */
    public static double stdDev(double[] values, int from, int to) {
        double mean = mean(values, from, to);
        if (Double.isNaN(mean)) return Double.NaN;
        double variance = 0;
        for (int i = from; i < to; i++) {
            double diff = values[i] - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / (to - from));
    }

    public static double stdDev(double[] values) {
        return values == null ? Double.NaN : stdDev(values, 0, values.length);
    }

    // ── Range ───────────────────────────────────────────────────────────────

    public static double range(double[] values, int from, int to) {
        if (values == null || to <= from) return Double.NaN;
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        for (int i = from; i < to; i++) {
            max = Math.max(max, values[i]);
            min = Math.min(min, values[i]);
        }
        return max - min;
    }

    // ── Scalar helpers ──────────────────────────────────────────────────────

    public static double clip(double value, double min, double max) {
        return Math.min(max, Math.max(min, value));
    }

    /** Replaces NaN and infinities with {@code 0.0}. */
    public static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }

    /** Rounds to 4 decimals and folds {@code -0.0} into {@code 0.0}. */
    public static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0 + 0.0;
    }

    /** Sum of {@code signum} over the last {@code count} values (fewer if the series is shorter). */
    public static int signSum(double[] values, int count) {
        if (values == null) return 0;
        int sum = 0;
        for (int i = Math.max(0, values.length - count); i < values.length; i++) {
            double v = values[i];
            if (v > 0) sum++;
            else if (v < 0) sum--;
        }
        return sum;
    }
}

package com.pathfinder.common.decision;

import com.pathfinder.common.indicator.SeriesMath;
import com.pathfinder.common.model.MarketState;

/**
 * Flags consolidation regimes that tend to precede a breakout.
 *
 * <p>Four indicators are combined over the supplied close series:
 * <ol>
 *   <li><strong>Volatility compression</strong> (0.3) — 10-sample rolling volatility of returns
 *       fell more than 30% against the value 10 samples earlier.</li>
 *   <li><strong>Range narrowing</strong> (0.2) — high-low range of the latest 10-close window
 *       is more than 20% below the first one (windows step by 5).</li>
 *   <li><strong>Trend divergence</strong> (0.3) — mean of the last 10 returns and of the last 30
 *       have opposite signs; signed by the short-term direction.</li>
 *   <li><strong>State persistence</strong> (0.2) — current state sits at an extreme or very_* band.</li>
 * </ol>
 * The weighted sum is scaled by the sensitivity and clipped to [−1, 1].
 */
public final class DeadlockDetector {

    static final int MIN_CLOSES = 30;
    static final int VOLATILITY_WINDOW = 10;
    static final int VOLATILITY_LAG = 10;
    static final int RANGE_WINDOW = 10;
    static final int RANGE_STEP = 5;
    static final int SHORT_TREND = 10;
    static final int LONG_TREND = 30;

    private static final double VOLATILITY_DROP = -0.3;
    private static final double RANGE_DROP = -0.2;

    private static final double W_VOLATILITY = 0.3;
    private static final double W_RANGE = 0.2;
    private static final double W_DIVERGENCE = 0.3;
    private static final double W_PERSISTENCE = 0.2;

    private final double sensitivity;

    public DeadlockDetector(double sensitivity) {
        this.sensitivity = sensitivity;
    }

    public DeadlockReading detect(double[] closes, MarketState current) {
        if (closes == null || closes.length < MIN_CLOSES) {
            return DeadlockReading.NONE;
        }

        double[] returns = new double[closes.length - 1];
        for (int i = 1; i < closes.length; i++) {
            returns[i - 1] = (closes[i] - closes[i - 1]) / closes[i - 1];
        }

        double volatility = volatilityCompression(returns);
        double range = rangeNarrowing(closes);
        double divergence = trendDivergence(returns);
        double persistence = statePersistence(current);

        double combined = volatility * W_VOLATILITY
            + range * W_RANGE
            + divergence * W_DIVERGENCE
            + persistence * W_PERSISTENCE;

        double score = SeriesMath.clip(SeriesMath.finiteOrZero(combined * sensitivity), -1.0, 1.0);
        return new DeadlockReading(volatility, range, divergence, persistence, score);
    }

    // ── Indicators ──────────────────────────────────────────────────────────

    static double volatilityCompression(double[] returns) {
        int count = returns.length - VOLATILITY_WINDOW;
        if (count < VOLATILITY_LAG) return 0.0;

        // rolling[k] covers returns[k, k + window)
        double latest = SeriesMath.stdDev(returns, count - 1, count - 1 + VOLATILITY_WINDOW);
        double earlier = SeriesMath.stdDev(returns, count - VOLATILITY_LAG,
            count - VOLATILITY_LAG + VOLATILITY_WINDOW);
        double change = latest / earlier - 1;
        return Double.isFinite(change) && change < VOLATILITY_DROP ? -1.0 : 0.0;
    }

    static double rangeNarrowing(double[] closes) {
        double first = Double.NaN;
        double last = Double.NaN;
        int windows = 0;
        for (int end = RANGE_WINDOW; end < closes.length; end += RANGE_STEP) {
            double range = SeriesMath.range(closes, end - RANGE_WINDOW, end);
            if (windows == 0) first = range;
            last = range;
            windows++;
        }
        if (windows < 2) return 0.0;
        double change = last / first - 1;
        return Double.isFinite(change) && change < RANGE_DROP ? -1.0 : 0.0;
    }

    static double trendDivergence(double[] returns) {
        double shortTrend = returns.length >= SHORT_TREND
            ? SeriesMath.mean(returns, returns.length - SHORT_TREND, returns.length)
            : 0.0;
        double longTrend = returns.length >= LONG_TREND
            ? SeriesMath.mean(returns, returns.length - LONG_TREND, returns.length)
            : shortTrend;
        if (!Double.isFinite(shortTrend) || !Double.isFinite(longTrend)) return 0.0;
        return shortTrend * longTrend < 0 ? Math.signum(shortTrend) : 0.0;
    }

    static double statePersistence(MarketState current) {
        if (current == null) return 0.0;
        if (current.isExtreme()) return -0.5;
        if (current.isVery()) return -0.3;
        return 0.0;
    }
}

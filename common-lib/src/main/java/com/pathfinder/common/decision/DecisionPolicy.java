package com.pathfinder.common.decision;

import com.pathfinder.common.graph.Path;
import com.pathfinder.common.graph.ShortestPathSolver;
import com.pathfinder.common.graph.ShortestPaths;
import com.pathfinder.common.graph.StateGraph;
import com.pathfinder.common.indicator.SeriesMath;
import com.pathfinder.common.model.MarketState;

import java.util.List;
import java.util.Optional;

/**
 * Three-level structured decision tree. Levels are evaluated top-down; the first one that
 * qualifies wins.
 *
 * <pre>
 * Level 3  structureLevels ≥ 3 and a bullish or bearish path exists
 *          bullish: path ∧ (sem &gt; 0 ∧ trend &gt; 0  ∨  sem ≥ 3  ∨  trend &gt; threshold·sensitivity)
 *          bearish: path ∧ (sem &lt; 0 ∧ trend &lt; 0  ∨  sem ≤ -3 ∨  trend &lt; -threshold·sensitivity)
 *          target = reachable target with the lowest path score
 * Level 2  structureLevels ≥ 2 and |trend| &gt; threshold → SLIGHT_HIGH / SLIGHT_LOW
 * Level 1  NEUTRAL, confidence 0.3
 * </pre>
 *
 * <p>Pure function of its inputs. Never throws; missing inputs route straight to Level 1.
 */
public final class DecisionPolicy {

    static final double NEUTRAL_CONFIDENCE = 0.3;
    static final int TREND_WINDOW = 10;
    static final int STRONG_SEMAPHORE = 3;

    private static final double BASE_CONFIDENCE = 0.5;
    private static final double SEMAPHORE_CONFIDENCE = 0.1;
    private static final double TREND_CONFIDENCE = 0.2;
    private static final double FALLBACK_BASE_CONFIDENCE = 0.4;
    private static final double FALLBACK_MAX_CONFIDENCE = 0.7;

    private final ShortestPathSolver solver;
    private final int structureLevels;
    private final double stateThreshold;
    private final double deadlockSensitivity;

    public DecisionPolicy(ShortestPathSolver solver, int structureLevels,
                          double stateThreshold, double deadlockSensitivity) {
        this.solver = solver;
        this.structureLevels = structureLevels;
        this.stateThreshold = stateThreshold;
        this.deadlockSensitivity = deadlockSensitivity;
    }

    public Decision decide(StateGraph graph, MarketState current, double[] returns, int semaphore) {
        if (graph == null || graph.isEmpty() || current == null) {
            return Decision.neutral(0.0);
        }

        double trend = recentTrend(returns);

        // ── Level 3: path-backed structured decision ─────────────────────
        if (structureLevels >= 3) {
            ShortestPaths bullPaths = solver.solve(graph, current, MarketState.BULLISH_TARGETS);
            ShortestPaths bearPaths = solver.solve(graph, current, MarketState.BEARISH_TARGETS);
            boolean bullExists = bullPaths.hasPathToAny(MarketState.BULLISH_TARGETS);
            boolean bearExists = bearPaths.hasPathToAny(MarketState.BEARISH_TARGETS);

            if (bullExists && bullishConfirmed(semaphore, trend)) {
                Path best = bestPath(bullPaths, MarketState.BULLISH_TARGETS);
                if (best != null) {
                    double confidence = confidence(BASE_CONFIDENCE
                        + SEMAPHORE_CONFIDENCE * semaphore + TREND_CONFIDENCE * trend);
                    return new Decision(best.target(), confidence, DecisionLevel.STRUCTURED, best, trend);
                }
            } else if (bearExists && bearishConfirmed(semaphore, trend)) {
                Path best = bestPath(bearPaths, MarketState.BEARISH_TARGETS);
                if (best != null) {
                    double confidence = confidence(BASE_CONFIDENCE
                        - SEMAPHORE_CONFIDENCE * semaphore - TREND_CONFIDENCE * trend);
                    return new Decision(best.target(), confidence, DecisionLevel.STRUCTURED, best, trend);
                }
            }
        }

        // ── Level 2: trend fallback ──────────────────────────────────────
        if (structureLevels >= 2) {
            if (trend > stateThreshold) {
                return new Decision(MarketState.SLIGHT_HIGH,
                    confidence(Math.min(FALLBACK_MAX_CONFIDENCE, FALLBACK_BASE_CONFIDENCE + trend)),
                    DecisionLevel.TREND, null, trend);
            }
            if (trend < -stateThreshold) {
                return new Decision(MarketState.SLIGHT_LOW,
                    confidence(Math.min(FALLBACK_MAX_CONFIDENCE, FALLBACK_BASE_CONFIDENCE - trend)),
                    DecisionLevel.TREND, null, trend);
            }
        }

        // ── Level 1 ──────────────────────────────────────────────────────
        return Decision.neutral(trend);
    }

    /**
     * Mean of the last {@value #TREND_WINDOW} returns divided by their standard deviation;
     * 0 with fewer returns, zero dispersion or a non-finite result.
     */
    public static double recentTrend(double[] returns) {
        if (returns == null || returns.length < TREND_WINDOW) return 0.0;
        int from = returns.length - TREND_WINDOW;
        double volatility = SeriesMath.stdDev(returns, from, returns.length);
        if (!(volatility > 0)) return 0.0;
        return SeriesMath.finiteOrZero(SeriesMath.mean(returns, from, returns.length) / volatility);
    }

    private boolean bullishConfirmed(int semaphore, double trend) {
        return (semaphore > 0 && trend > 0)
            || semaphore >= STRONG_SEMAPHORE
            || trend > stateThreshold * deadlockSensitivity;
    }

    private boolean bearishConfirmed(int semaphore, double trend) {
        return (semaphore < 0 && trend < 0)
            || semaphore <= -STRONG_SEMAPHORE
            || trend < -stateThreshold * deadlockSensitivity;
    }

    /** Lowest-scoring reachable target, or {@code null}; earlier list entries win ties. */
    private static Path bestPath(ShortestPaths paths, List<MarketState> targets) {
        Path best = null;
        for (MarketState target : targets) {
            Optional<Path> path = paths.pathTo(target);
            if (path.isPresent() && (best == null || path.get().score() < best.score())) {
                best = path.get();
            }
        }
        return best;
    }

    private static double confidence(double raw) {
        return SeriesMath.clip(SeriesMath.finiteOrZero(raw), 0.0, 1.0);
    }
}

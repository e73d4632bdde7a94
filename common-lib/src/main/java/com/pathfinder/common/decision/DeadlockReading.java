package com.pathfinder.common.decision;

/**
 * Component indicators of one deadlock evaluation and their combined score.
 *
 * @param volatilityCompression −1 when rolling volatility fell sharply, else 0
 * @param rangeNarrowing        −1 when the sub-window price range narrowed sharply, else 0
 * @param trendDivergence       sign of the short-term trend when it opposes the long-term one, else 0
 * @param statePersistence      −0.5 at extreme states, −0.3 at very_* states, else 0
 * @param score                 weighted, sensitivity-scaled sum clipped to [−1, 1]
 */
public record DeadlockReading(
    double volatilityCompression,
    double rangeNarrowing,
    double trendDivergence,
    double statePersistence,
    double score
) {

    public static final DeadlockReading NONE = new DeadlockReading(0.0, 0.0, 0.0, 0.0, 0.0);

    public boolean detected() {
        return score != 0.0;
    }
}

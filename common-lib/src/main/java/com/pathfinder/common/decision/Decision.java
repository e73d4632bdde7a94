package com.pathfinder.common.decision;

import com.pathfinder.common.graph.Path;
import com.pathfinder.common.model.MarketState;

/**
 * Output of {@link DecisionPolicy}: the state to move towards and how sure the policy is.
 *
 * @param target     recommended target state
 * @param confidence confidence in [0, 1]
 * @param level      tier of the decision tree that fired
 * @param path       shortest path to {@code target}; {@code null} below {@link DecisionLevel#STRUCTURED}
 * @param trend      recent trend (mean / σ of the last 10 returns) the decision was based on
 */
public record Decision(
    MarketState target,
    double confidence,
    DecisionLevel level,
    Path path,
    double trend
) {

    static Decision neutral(double trend) {
        return new Decision(MarketState.NEUTRAL, DecisionPolicy.NEUTRAL_CONFIDENCE,
            DecisionLevel.NEUTRAL, null, trend);
    }
}

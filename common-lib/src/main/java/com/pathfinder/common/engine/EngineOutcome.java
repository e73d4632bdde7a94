package com.pathfinder.common.engine;

import com.pathfinder.common.decision.DeadlockReading;
import com.pathfinder.common.decision.DecisionLevel;
import com.pathfinder.common.model.MarketState;

/**
 * Result of one {@link PathfindingEngine#evaluate} call.
 *
 * <p>For non-fitted outcomes the signal is 0.0, the states are {@link MarketState#NEUTRAL},
 * the level is {@link DecisionLevel#NEUTRAL} and {@code semaphore} is the unchanged value.
 */
public record EngineOutcome(
    double signal,
    EvaluationStatus status,
    MarketState currentState,
    MarketState targetState,
    double confidence,
    DecisionLevel level,
    DeadlockReading deadlock,
    int semaphore,
    int graphNodes,
    int graphEdges
) {

    static EngineOutcome notFitted(EvaluationStatus status, int semaphore) {
        return new EngineOutcome(0.0, status, MarketState.NEUTRAL, MarketState.NEUTRAL, 0.0,
            DecisionLevel.NEUTRAL, DeadlockReading.NONE, semaphore, 0, 0);
    }

    public boolean fitted() {
        return status == EvaluationStatus.FITTED;
    }
}

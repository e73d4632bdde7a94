package com.pathfinder.common.graph;

import com.pathfinder.common.model.MarketState;

import java.util.List;

/**
 * Reconstructed route from the start state to a target, with the sum of its edge weights.
 */
public record Path(List<MarketState> states, double score) {

    public Path {
        states = List.copyOf(states);
    }

    public MarketState target() {
        return states.get(states.size() - 1);
    }

    /** Number of transitions along the path. */
    public int length() {
        return states.size() - 1;
    }
}

package com.pathfinder.common.graph;

import com.pathfinder.common.model.MarketState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Distances and predecessor links produced by one {@link ShortestPathSolver} run.
 *
 * <p>An unreachable state has distance {@code +∞} and no predecessor. The start state has
 * distance 0 and no predecessor, so {@link #hasPathTo} is false for it: a path needs at
 * least one transition.
 */
public final class ShortestPaths {

    private final StateGraph graph;
    private final MarketState start;
    private final double[] distances;
    private final MarketState[] predecessors;

    ShortestPaths(StateGraph graph, MarketState start, double[] distances, MarketState[] predecessors) {
        this.graph = graph;
        this.start = start;
        this.distances = distances;
        this.predecessors = predecessors;
    }

    public double distanceTo(MarketState state) {
        return distances[state.ordinal()];
    }

    /** Predecessor on the shortest path, or {@code null}. */
    public MarketState predecessorOf(MarketState state) {
        return predecessors[state.ordinal()];
    }

    public boolean hasPathTo(MarketState target) {
        return predecessors[target.ordinal()] != null;
    }

    public boolean hasPathToAny(List<MarketState> targets) {
        for (MarketState t : targets) {
            if (hasPathTo(t)) return true;
        }
        return false;
    }

    public Optional<Path> pathTo(MarketState target) {
        if (!hasPathTo(target)) return Optional.empty();

        List<MarketState> states = new ArrayList<>();
        MarketState current = target;
        // predecessor links form a tree rooted at start, so this walk is bounded by the node count
        while (current != null && current != start && states.size() <= MarketState.count()) {
            states.add(current);
            current = predecessors[current.ordinal()];
        }
        if (current != start) return Optional.empty();
        states.add(start);
        Collections.reverse(states);

        double score = 0.0;
        for (int i = 1; i < states.size(); i++) {
            double w = graph.weight(states.get(i - 1), states.get(i));
            if (!Double.isNaN(w)) score += w;
        }
        return Optional.of(new Path(states, score));
    }

    /** Score of the shortest path to {@code target}, or {@code +∞} if there is none. */
    public double scoreOf(MarketState target) {
        return pathTo(target).map(Path::score).orElse(Double.POSITIVE_INFINITY);
    }
}

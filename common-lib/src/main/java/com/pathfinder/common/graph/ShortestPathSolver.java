package com.pathfinder.common.graph;

import com.pathfinder.common.model.MarketState;

import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Dijkstra's algorithm over a {@link StateGraph}.
 *
 * <p>Queue entries are ordered by distance, then by insertion sequence, so entries with equal
 * distance pop first-in first-out and every run is reproducible. A state is final once popped;
 * edges into final states are not relaxed, which keeps the predecessor links a tree rooted at
 * the start even when weights are negative. The search stops as soon as every target has been
 * finalized or the queue runs dry.
 */
public final class ShortestPathSolver {

    private record QueueEntry(double distance, long sequence, MarketState state) {}

    private static final Comparator<QueueEntry> ORDER = Comparator
        .comparingDouble(QueueEntry::distance)
        .thenComparingLong(QueueEntry::sequence);

    public ShortestPaths solve(StateGraph graph, MarketState start, Collection<MarketState> targets) {
        int n = MarketState.count();
        double[] distances = new double[n];
        Arrays.fill(distances, Double.POSITIVE_INFINITY);
        MarketState[] predecessors = new MarketState[n];
        distances[start.ordinal()] = 0.0;

        Set<MarketState> pending = targets.isEmpty()
            ? EnumSet.noneOf(MarketState.class)
            : EnumSet.copyOf(targets);
        Set<MarketState> visited = EnumSet.noneOf(MarketState.class);

        PriorityQueue<QueueEntry> queue = new PriorityQueue<>(ORDER);
        long sequence = 0;
        queue.add(new QueueEntry(0.0, sequence++, start));

        while (!queue.isEmpty()) {
            QueueEntry entry = queue.poll();
            MarketState current = entry.state();
            if (!visited.add(current)) continue;

            pending.remove(current);
            if (pending.isEmpty()) break;

            for (MarketState next : graph.successors(current)) {
                if (visited.contains(next)) continue;
                double candidate = entry.distance() + graph.weight(current, next);
                if (candidate < distances[next.ordinal()]) {
                    distances[next.ordinal()] = candidate;
                    predecessors[next.ordinal()] = current;
                    queue.add(new QueueEntry(candidate, sequence++, next));
                }
            }
        }
        return new ShortestPaths(graph, start, distances, predecessors);
    }
}

package com.pathfinder.common.graph;

import com.pathfinder.common.model.MarketState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Directed weighted graph over the nine {@link MarketState}s, stored as a fixed 9×9
 * adjacency matrix indexed by ordinal.
 *
 * <p>An edge exists only for a transition that was actually observed. Lower weight means a
 * more attractive transition (higher reward, lower risk), so weights may be negative.
 * Every stored weight is finite. Instances are immutable.
 */
public final class StateGraph {

    private static final int SIZE = MarketState.count();
    private static final StateGraph EMPTY = new StateGraph(emptyMatrix());

    private final double[][] weights;

    private StateGraph(double[][] weights) {
        this.weights = weights;
    }

    public static StateGraph empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasEdge(MarketState from, MarketState to) {
        return !Double.isNaN(weights[from.ordinal()][to.ordinal()]);
    }

    /** Edge weight, or NaN when no such transition was observed. */
    public double weight(MarketState from, MarketState to) {
        return weights[from.ordinal()][to.ordinal()];
    }

    /** Targets of the outgoing edges of {@code from}, in state order. */
    public List<MarketState> successors(MarketState from) {
        List<MarketState> out = new ArrayList<>();
        double[] row = weights[from.ordinal()];
        for (int j = 0; j < SIZE; j++) {
            if (!Double.isNaN(row[j])) out.add(MarketState.ofOrdinal(j));
        }
        return out;
    }

    /** States that take part in at least one edge. */
    public Set<MarketState> nodes() {
        Set<MarketState> nodes = EnumSet.noneOf(MarketState.class);
        for (int i = 0; i < SIZE; i++) {
            for (int j = 0; j < SIZE; j++) {
                if (!Double.isNaN(weights[i][j])) {
                    nodes.add(MarketState.ofOrdinal(i));
                    nodes.add(MarketState.ofOrdinal(j));
                }
            }
        }
        return Collections.unmodifiableSet(nodes);
    }

    public int edgeCount() {
        int count = 0;
        for (double[] row : weights) {
            for (double w : row) {
                if (!Double.isNaN(w)) count++;
            }
        }
        return count;
    }

    public boolean isEmpty() {
        return edgeCount() == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateGraph other)) return false;
        return Arrays.deepEquals(weights, other.weights);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(weights);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("StateGraph{");
        boolean first = true;
        for (int i = 0; i < SIZE; i++) {
            for (int j = 0; j < SIZE; j++) {
                if (Double.isNaN(weights[i][j])) continue;
                if (!first) sb.append(", ");
                sb.append(MarketState.ofOrdinal(i).label()).append("->")
                  .append(MarketState.ofOrdinal(j).label()).append('=')
                  .append(String.format("%.6f", weights[i][j]));
                first = false;
            }
        }
        return sb.append('}').toString();
    }

    private static double[][] emptyMatrix() {
        double[][] m = new double[SIZE][SIZE];
        for (double[] row : m) Arrays.fill(row, Double.NaN);
        return m;
    }

    /**
     * Accumulates observed transitions; repeated observations of the same pair are averaged.
     * Non-finite weights are ignored.
     */
    public static final class Builder {

        private final double[][] sums = new double[SIZE][SIZE];
        private final int[][] counts = new int[SIZE][SIZE];

        private Builder() {}

        public Builder observe(MarketState from, MarketState to, double weight) {
            if (!Double.isFinite(weight)) return this;
            sums[from.ordinal()][to.ordinal()] += weight;
            counts[from.ordinal()][to.ordinal()]++;
            return this;
        }

        /** Alias of {@link #observe} for hand-built graphs. */
        public Builder edge(MarketState from, MarketState to, double weight) {
            return observe(from, to, weight);
        }

        public StateGraph build() {
            double[][] m = emptyMatrix();
            boolean any = false;
            for (int i = 0; i < SIZE; i++) {
                for (int j = 0; j < SIZE; j++) {
                    if (counts[i][j] > 0) {
                        m[i][j] = sums[i][j] / counts[i][j];
                        any = true;
                    }
                }
            }
            return any ? new StateGraph(m) : EMPTY;
        }
    }
}

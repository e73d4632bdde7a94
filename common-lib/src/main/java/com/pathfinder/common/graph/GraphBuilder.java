package com.pathfinder.common.graph;

import com.pathfinder.common.indicator.SeriesMath;
import com.pathfinder.common.model.MarketState;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Builds a {@link StateGraph} from the transitions observed in a {@link StateSequence}.
 *
 * <p>Each step {@code s[i-1] → s[i]} contributes one weight:
 * <pre>
 * change  = (p[i] - p[i-1]) / p[i-1]
 * vw      = 1 + 0.2 · clip(zVolume[i], -2.5, 2.5)      (1 without volume data)
 * reward  = change &gt; 0 ? -change · vw : 0
 * risk    = change &lt; 0 ? |change| · vw : 0
 * weight  = riskWeight · risk - (1 - riskWeight) · reward
 * </pre>
 * Repeated transitions between the same pair are averaged into one edge.
 */
public final class GraphBuilder {

    private static final double VOLUME_Z_CAP = 2.5;
    private static final double VOLUME_SENSITIVITY = 0.2;

    private final double riskWeight;

    public GraphBuilder(double riskWeight) {
        this.riskWeight = riskWeight;
    }

    /**
     * @return the transition graph, or empty when the sequence did not have enough samples
     */
    public Optional<StateGraph> build(StateSequence sequence) {
        if (sequence == null || sequence.insufficient()) {
            return Optional.empty();
        }
        if (sequence.degenerate() || sequence.size() < 2) {
            return Optional.of(StateGraph.empty());
        }

        double[] closes = sequence.closes();
        List<MarketState> states = sequence.states();
        double[] volumeWeights = volumeWeights(sequence.volumes(), closes.length);

        StateGraph.Builder graph = StateGraph.builder();
        for (int i = 1; i < states.size(); i++) {
            double change = (closes[i] - closes[i - 1]) / closes[i - 1];
            graph.observe(states.get(i - 1), states.get(i), edgeWeight(change, volumeWeights[i]));
        }
        return Optional.of(graph.build());
    }

    /** Weight of a single observed transition; lower is more attractive. */
    public double edgeWeight(double priceChange, double volumeWeight) {
        double reward = priceChange > 0 ? -priceChange * volumeWeight : 0.0;
        double risk = priceChange < 0 ? Math.abs(priceChange) * volumeWeight : 0.0;
        return riskWeight * risk - (1 - riskWeight) * reward;
    }

    public double riskWeight() {
        return riskWeight;
    }

    // ── Volume weighting ────────────────────────────────────────────────────

    static double[] volumeWeights(double[] volumes, int length) {
        double[] weights = new double[length];
        Arrays.fill(weights, 1.0);
        if (volumes == null || volumes.length != length) return weights;

        double mean = SeriesMath.mean(volumes);
        double std = SeriesMath.stdDev(volumes);
        if (!Double.isFinite(mean) || !Double.isFinite(std) || std <= 0) return weights;

        for (int i = 0; i < length; i++) {
            double z = (volumes[i] - mean) / std;
            if (Double.isFinite(z)) {
                weights[i] = 1.0 + VOLUME_SENSITIVITY * SeriesMath.clip(z, -VOLUME_Z_CAP, VOLUME_Z_CAP);
            }
        }
        return weights;
    }
}

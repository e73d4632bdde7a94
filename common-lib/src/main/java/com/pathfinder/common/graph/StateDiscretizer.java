package com.pathfinder.common.graph;

import com.pathfinder.common.indicator.SeriesMath;
import com.pathfinder.common.model.MarketState;
import com.pathfinder.common.model.PriceWindow;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Converts the tail of a {@link PriceWindow} into a sequence of {@link MarketState}s by
 * z-scoring every close against the mean and standard deviation of that tail.
 *
 * <p>A flat tail (no dispersion) maps every sample to {@link MarketState#NEUTRAL} and is
 * flagged degenerate instead of producing NaN z-scores.
 */
public final class StateDiscretizer {

    /** Relative dispersion below which a window is considered flat. */
    static final double FLAT_EPSILON = 1e-12;

    private final int lookback;

    public StateDiscretizer(int lookback) {
        this.lookback = lookback;
    }

    public StateSequence discretize(PriceWindow window) {
        if (window == null || lookback <= 0 || window.size() < lookback) {
            return StateSequence.insufficientData();
        }

        double[] all = window.closes();
        double[] closes = Arrays.copyOfRange(all, all.length - lookback, all.length);
        double[] allVolumes = window.volumes();
        double[] volumes = allVolumes == null
            ? null
            : Arrays.copyOfRange(allVolumes, allVolumes.length - lookback, allVolumes.length);

        double mean = SeriesMath.mean(closes);
        double std = SeriesMath.stdDev(closes);

        if (isFlat(mean, std)) {
            List<MarketState> neutral = Collections.nCopies(closes.length, MarketState.NEUTRAL);
            return new StateSequence(closes, volumes, neutral, mean, 0.0, true, false);
        }

        List<MarketState> states = new ArrayList<>(closes.length);
        for (double close : closes) {
            states.add(MarketState.fromZScore((close - mean) / std));
        }
        return new StateSequence(closes, volumes, List.copyOf(states), mean, std, false, false);
    }

    /** Current state of the window, i.e. the band of its latest close. */
    public MarketState currentState(PriceWindow window) {
        return discretize(window).current();
    }

    private static boolean isFlat(double mean, double std) {
        if (!Double.isFinite(mean) || !Double.isFinite(std)) return true;
        return std <= FLAT_EPSILON * Math.max(1.0, Math.abs(mean));
    }
}

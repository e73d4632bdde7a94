package com.pathfinder.common.graph;

import com.pathfinder.common.model.MarketState;

import java.util.List;

/**
 * Discretized view of the most recent {@code lookback} samples.
 *
 * <p>{@code closes}, {@code volumes} and {@code states} are parallel and oldest-first;
 * {@code volumes} is {@code null} when the window carried no volume data.
 *
 * @param closes       window closes
 * @param volumes      window volumes or {@code null}
 * @param states       one state per close
 * @param mean         population mean of the window closes
 * @param stdDev       population standard deviation of the window closes
 * @param degenerate   true when the window had no measurable dispersion (all states NEUTRAL)
 * @param insufficient true when fewer than {@code lookback} samples were supplied (all fields empty)
 */
public record StateSequence(
    double[] closes,
    double[] volumes,
    List<MarketState> states,
    double mean,
    double stdDev,
    boolean degenerate,
    boolean insufficient
) {

    static StateSequence insufficientData() {
        return new StateSequence(new double[0], null, List.of(), Double.NaN, Double.NaN, false, true);
    }

    public int size() {
        return states.size();
    }

    /** State of the latest close; {@link MarketState#NEUTRAL} for an insufficient sequence. */
    public MarketState current() {
        return states.isEmpty() ? MarketState.NEUTRAL : states.get(states.size() - 1);
    }
}

package com.pathfinder.common.model;

/**
 * Direction implied by a bounded signal.
 *
 * <ul>
 *   <li>LONG  — score &gt; 0, reported as BUY</li>
 *   <li>SHORT — score &lt; 0, reported as SELL</li>
 *   <li>FLAT  — score == 0, reported as HOLD</li>
 * </ul>
 */
public enum TradeDirection {

    LONG("BUY"),
    SHORT("SELL"),
    FLAT("HOLD");

    private final String signal;

    TradeDirection(String signal) {
        this.signal = signal;
    }

    public String signal() {
        return signal;
    }

    public static TradeDirection fromScore(double score) {
        if (score > 0) return LONG;
        if (score < 0) return SHORT;
        return FLAT;
    }
}

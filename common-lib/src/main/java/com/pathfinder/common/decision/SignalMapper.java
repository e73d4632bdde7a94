package com.pathfinder.common.decision;

import com.pathfinder.common.indicator.SeriesMath;
import com.pathfinder.common.model.MarketState;

/**
 * Translates a target state, its confidence and the deadlock score into the final signal.
 *
 * <pre>
 * signal = clip(target.signalValue · confidence, −1, 1)
 * if deadlock ≠ 0:  signal = clip(0.7 · signal + 0.3 · deadlock, −1, 1)
 * </pre>
 * Non-finite intermediate values collapse to 0; the result is rounded to 4 decimals.
 */
public final class SignalMapper {

    private static final double SIGNAL_SHARE = 0.7;
    private static final double DEADLOCK_SHARE = 0.3;

    public double map(MarketState target, double confidence, double deadlock) {
        if (target == null) return 0.0;

        double signal = SeriesMath.clip(
            SeriesMath.finiteOrZero(target.signalValue() * confidence), -1.0, 1.0);

        double d = SeriesMath.finiteOrZero(deadlock);
        if (d != 0.0) {
            signal = SeriesMath.clip(SIGNAL_SHARE * signal + DEADLOCK_SHARE * d, -1.0, 1.0);
        }
        return SeriesMath.round4(SeriesMath.finiteOrZero(signal));
    }

    public double map(Decision decision, DeadlockReading deadlock) {
        return map(decision.target(), decision.confidence(), deadlock.score());
    }
}

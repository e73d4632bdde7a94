package com.pathfinder.common.decision;

import com.pathfinder.common.indicator.SeriesMath;
import com.pathfinder.common.model.MarketState;

/**
 * Semaphore update rule that damps state-to-state switching.
 *
 * <p>The semaphore is a bounded integer in [{@value #MIN}, {@value #MAX}]: positive values
 * accumulate bullish conviction, negative values bearish conviction. This class is stateless;
 * the value itself is owned by the engine that calls {@link #next}.
 *
 * <pre>
 * direction = sign(target.level - current.level)
 * direction == 0              → decay one step toward 0
 * momentum agrees (last 5 r)  → move min(2, |Δlevel|) in direction
 * momentum disagrees / zero   → move 1 in direction
 * </pre>
 */
public final class HysteresisController {

    public static final int MIN = -5;
    public static final int MAX = 5;

    static final int MOMENTUM_WINDOW = 5;
    static final int MAX_STEP = 2;

    public int next(int semaphore, MarketState current, MarketState target, double[] returns) {
        int delta = target.level() - current.level();
        int direction = Integer.signum(delta);

        if (direction == 0) {
            return clamp(semaphore - Integer.signum(semaphore));
        }

        int momentum = SeriesMath.signSum(returns, MOMENTUM_WINDOW);
        boolean agrees = Integer.signum(momentum) == direction;
        int step = agrees ? Math.min(MAX_STEP, Math.abs(delta)) : 1;

        return clamp(semaphore + direction * step);
    }

    public static int clamp(int semaphore) {
        return Math.max(MIN, Math.min(MAX, semaphore));
    }
}

package com.pathfinder.common.graph;

import com.pathfinder.common.model.MarketState;
import com.pathfinder.common.model.PriceWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.pathfinder.common.model.MarketState.*;
import static org.junit.jupiter.api.Assertions.*;

class StateDiscretizerTest {

    @Test
    @DisplayName("linear window 1..10 → symmetric bands around the mean")
    void linearWindow() {
        StateSequence seq = new StateDiscretizer(10).discretize(PriceWindow.of(range(1, 10)));

        assertEquals(List.of(VERY_LOW, VERY_LOW, LOW, LOW, NEUTRAL, NEUTRAL, HIGH, HIGH, VERY_HIGH, VERY_HIGH),
            seq.states());
        assertEquals(5.5, seq.mean(), 1e-12);
        assertEquals(Math.sqrt(8.25), seq.stdDev(), 1e-12);
        assertEquals(VERY_HIGH, seq.current());
        assertFalse(seq.degenerate());
        assertFalse(seq.insufficient());
    }

    @Test
    @DisplayName("only the last lookback samples are used")
    void usesTail() {
        double[] closes = new double[15];
        for (int i = 0; i < 5; i++) closes[i] = 1_000.0;
        System.arraycopy(range(1, 10), 0, closes, 5, 10);

        StateSequence seq = new StateDiscretizer(10).discretize(PriceWindow.of(closes));
        assertEquals(10, seq.size());
        assertEquals(5.5, seq.mean(), 1e-12);
        assertEquals(VERY_LOW, seq.states().get(0));
    }

    @Test
    @DisplayName("flat window → all NEUTRAL, degenerate, no NaN")
    void flatWindow() {
        double[] closes = new double[12];
        java.util.Arrays.fill(closes, 100.0);
        StateSequence seq = new StateDiscretizer(12).discretize(PriceWindow.of(closes));

        assertTrue(seq.degenerate());
        assertTrue(seq.states().stream().allMatch(s -> s == NEUTRAL));
        assertEquals(0.0, seq.stdDev());
    }

    @Test
    @DisplayName("fewer samples than lookback → insufficient, current NEUTRAL")
    void insufficient() {
        StateSequence seq = new StateDiscretizer(10).discretize(PriceWindow.of(range(1, 9)));
        assertTrue(seq.insufficient());
        assertEquals(0, seq.size());
        assertEquals(NEUTRAL, seq.current());
    }

    @Test
    @DisplayName("currentState() matches the band of the last close")
    void currentState() {
        double[] closes = range(1, 10);
        closes[9] = 1.0;
        MarketState current = new StateDiscretizer(10).currentState(PriceWindow.of(closes));
        assertTrue(current.level() < 0, "last close is the minimum, got " + current);
    }

    static double[] range(int from, int to) {
        double[] out = new double[to - from + 1];
        for (int i = 0; i < out.length; i++) out[i] = from + i;
        return out;
    }
}

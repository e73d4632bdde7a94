package com.pathfinder.common.decision;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.pathfinder.common.model.MarketState.*;
import static org.junit.jupiter.api.Assertions.*;

class SignalMapperTest {

    private final SignalMapper mapper = new SignalMapper();

    @Test
    @DisplayName("signalValue · confidence without deadlock")
    void plain() {
        assertEquals(0.3, mapper.map(HIGH, 0.5, 0.0));
        assertEquals(-0.48, mapper.map(VERY_LOW, 0.6, 0.0));
        assertEquals(0.0, mapper.map(NEUTRAL, 1.0, 0.0));
    }

    @Test
    @DisplayName("deadlock blends 70/30")
    void deadlockBlend() {
        assertEquals(0.165, mapper.map(HIGH, 0.5, -0.15));
        assertEquals(0.3, mapper.map(NEUTRAL, 0.3, 1.0));
    }

    @Test
    @DisplayName("result stays within [-1, 1]")
    void clipped() {
        assertEquals(1.0, mapper.map(EXTREME_HIGH, 1.0, 1.0));
        assertEquals(-1.0, mapper.map(EXTREME_LOW, 3.0, -1.0));
    }

    @Test
    @DisplayName("rounded to 4 decimals")
    void rounded() {
        assertEquals(0.1, mapper.map(SLIGHT_HIGH, 0.33333, 0.0));
    }

    @Test
    @DisplayName("non-finite inputs collapse to 0")
    void nonFinite() {
        assertEquals(0.0, mapper.map(HIGH, Double.NaN, 0.0));
        assertEquals(0.0, mapper.map(HIGH, Double.NaN, Double.NaN));
        assertEquals(0.0, mapper.map(null, 0.5, 0.0));
        assertEquals(0.0, mapper.map(SLIGHT_LOW, 0.0, 0.0));
    }

    @Test
    @DisplayName("map(Decision, DeadlockReading) uses target, confidence and score")
    void fromDecision() {
        Decision decision = new Decision(VERY_HIGH, 0.9, DecisionLevel.STRUCTURED, null, 2.0);
        DeadlockReading reading = new DeadlockReading(0, 0, 0, -0.3, -0.09);
        assertEquals(0.477, mapper.map(decision, reading));
    }
}

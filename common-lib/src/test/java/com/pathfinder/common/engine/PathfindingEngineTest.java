package com.pathfinder.common.engine;

import com.pathfinder.common.decision.DecisionLevel;
import com.pathfinder.common.model.PriceWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.pathfinder.common.model.MarketState.*;
import static org.junit.jupiter.api.Assertions.*;

class PathfindingEngineTest {

    // ── Reference windows ─────────────────────────────────────────────────

    @Nested
    @DisplayName("steady uptrend (100 + 0.5·i, 52 samples)")
    class RisingTests {

        @Test
        @DisplayName("VERY_HIGH with no bullish path → trend fallback SLIGHT_HIGH")
        void firstEvaluation() {
            PathfindingEngine engine = new PathfindingEngine();
            EngineOutcome outcome = engine.evaluate(linear(52, 0.5));

            assertEquals(EvaluationStatus.FITTED, outcome.status());
            assertEquals(VERY_HIGH, outcome.currentState());
            assertEquals(SLIGHT_HIGH, outcome.targetState());
            assertEquals(DecisionLevel.TREND, outcome.level());
            assertEquals(0.7, outcome.confidence(), 1e-12);
            assertEquals(-0.09, outcome.deadlock().score(), 1e-12);
            assertEquals(-0.3, outcome.deadlock().statePersistence());
            assertEquals(0.12, outcome.signal());
            assertEquals(-1, outcome.semaphore());
            assertTrue(engine.isFitted());
        }

        @Test
        @DisplayName("repeated calls walk the semaphore down to -5 and hold it there")
        void semaphoreProgression() {
            PathfindingEngine engine = new PathfindingEngine();
            PriceWindow window = linear(52, 0.5);
            int[] expected = {-1, -2, -3, -4, -5, -5, -5};
            for (int e : expected) {
                assertEquals(0.12, engine.signal(window));
                assertEquals(e, engine.semaphore());
            }
        }
    }

    @Test
    @DisplayName("steady downtrend mirrors the uptrend")
    void falling() {
        PathfindingEngine engine = new PathfindingEngine();
        EngineOutcome outcome = engine.evaluate(linear(52, -0.5));

        assertEquals(VERY_LOW, outcome.currentState());
        assertEquals(SLIGHT_LOW, outcome.targetState());
        assertEquals(-0.174, outcome.signal());
        assertEquals(1, outcome.semaphore());
    }

    @Test
    @DisplayName("flat window → fitted, NEUTRAL, 0.0")
    void flat() {
        PathfindingEngine engine = new PathfindingEngine();
        EngineOutcome outcome = engine.evaluate(linear(52, 0.0));

        assertEquals(EvaluationStatus.FITTED, outcome.status());
        assertEquals(NEUTRAL, outcome.currentState());
        assertEquals(NEUTRAL, outcome.targetState());
        assertEquals(0.3, outcome.confidence());
        assertEquals(0.0, outcome.signal());
        assertEquals(0, outcome.graphEdges());
        assertEquals(0, outcome.semaphore());
    }

    // ── Insufficient data ─────────────────────────────────────────────────

    @Nested
    @DisplayName("insufficient data")
    class InsufficientTests {

        @Test
        @DisplayName("fewer samples than the lookback → 0.0 and semaphore untouched")
        void shortWindow() {
            PathfindingEngine engine = new PathfindingEngine();
            engine.evaluate(linear(52, 0.5));

            EngineOutcome outcome = engine.evaluate(linear(41, 0.5));
            assertEquals(EvaluationStatus.INSUFFICIENT_DATA, outcome.status());
            assertEquals(0.0, outcome.signal());
            assertEquals(-1, outcome.semaphore());
            assertEquals(-1, engine.semaphore());
            assertFalse(engine.isFitted());
        }

        @Test
        @DisplayName("null and empty windows")
        void nullAndEmpty() {
            PathfindingEngine engine = new PathfindingEngine();
            assertEquals(0.0, engine.signal(null));
            assertEquals(0.0, engine.signal(PriceWindow.empty()));
            assertEquals(0, engine.semaphore());
        }

        @Test
        @DisplayName("a single sample is never enough, even with lookback 1")
        void singleSample() {
            PathfindingEngine engine = new PathfindingEngine(EngineConfig.defaults().withLookbackWindow(1));
            EngineOutcome outcome = engine.evaluate(PriceWindow.of(new double[]{100.0}));
            assertEquals(EvaluationStatus.INSUFFICIENT_DATA, outcome.status());
        }

        @Test
        @DisplayName("a fresh engine reports not fitted")
        void fresh() {
            PathfindingEngine engine = new PathfindingEngine();
            assertFalse(engine.isFitted());
            assertEquals(0, engine.semaphore());
            assertEquals(EvaluationStatus.INSUFFICIENT_DATA, engine.lastOutcome().status());
        }
    }

    // ── Properties ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("properties")
    class PropertyTests {

        @Test
        @DisplayName("signal ∈ [-1, 1] and semaphore ∈ [-5, 5] over random walks")
        void bounded() {
            Random random = new Random(7);
            for (int trial = 0; trial < 40; trial++) {
                PathfindingEngine engine = new PathfindingEngine();
                boolean withVolumes = trial % 2 == 0;
                for (int step = 0; step < 15; step++) {
                    EngineOutcome outcome = engine.evaluate(randomWalk(random, 42 + random.nextInt(60), withVolumes));
                    assertTrue(Double.isFinite(outcome.signal()));
                    assertTrue(outcome.signal() >= -1.0 && outcome.signal() <= 1.0, "signal " + outcome.signal());
                    assertTrue(outcome.semaphore() >= -5 && outcome.semaphore() <= 5);
                    assertTrue(outcome.confidence() >= 0.0 && outcome.confidence() <= 1.0);
                    assertEquals(outcome.signal(), Math.round(outcome.signal() * 10_000.0) / 10_000.0);
                }
            }
        }

        @Test
        @DisplayName("same inputs in the same order → same outputs")
        void deterministic() {
            List<PriceWindow> windows = new ArrayList<>();
            Random random = new Random(99);
            for (int i = 0; i < 20; i++) windows.add(randomWalk(random, 60, true));

            PathfindingEngine first = new PathfindingEngine();
            PathfindingEngine second = new PathfindingEngine();
            for (PriceWindow window : windows) {
                assertEquals(first.evaluate(window), second.evaluate(window));
            }
        }

        @Test
        @DisplayName("semaphore changes by at most 2 per evaluation")
        void boundedStep() {
            Random random = new Random(5);
            PathfindingEngine engine = new PathfindingEngine();
            int previous = engine.semaphore();
            for (int i = 0; i < 200; i++) {
                engine.evaluate(randomWalk(random, 50, false));
                assertTrue(Math.abs(engine.semaphore() - previous) <= 2);
                previous = engine.semaphore();
            }
        }

        @Test
        @DisplayName("structureLevels = 1 always yields a neutral target")
        void levelOne() {
            PathfindingEngine engine = new PathfindingEngine(EngineConfig.defaults().withStructureLevels(1));
            EngineOutcome outcome = engine.evaluate(linear(52, 0.5));
            assertEquals(NEUTRAL, outcome.targetState());
            assertEquals(DecisionLevel.NEUTRAL, outcome.level());
            // NEUTRAL carries no signal, only the deadlock share remains
            assertEquals(-0.027, outcome.signal());
        }
    }

    // ── State management ──────────────────────────────────────────────────

    @Nested
    @DisplayName("state management")
    class StateTests {

        @Test
        void reset() {
            PathfindingEngine engine = new PathfindingEngine();
            PriceWindow window = linear(52, 0.5);
            engine.evaluate(window);
            engine.evaluate(window);
            assertEquals(-2, engine.semaphore());

            engine.reset();
            assertEquals(0, engine.semaphore());
            assertFalse(engine.isFitted());
            assertEquals(-1, engine.evaluate(window).semaphore());
        }

        @Test
        @DisplayName("concurrent evaluations never lose a semaphore update")
        void concurrentEvaluations() throws Exception {
            PathfindingEngine engine = new PathfindingEngine();
            PriceWindow falling = linear(52, -0.5);
            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                List<Future<EngineOutcome>> futures = new ArrayList<>();
                for (int i = 0; i < 3; i++) futures.add(pool.submit(() -> engine.evaluate(falling)));
                int[] seen = new int[3];
                for (int i = 0; i < futures.size(); i++) seen[i] = futures.get(i).get().semaphore();
                Arrays.sort(seen);
                assertArrayEquals(new int[]{1, 2, 3}, seen);
                assertEquals(3, engine.semaphore());
            } finally {
                pool.shutdown();
                assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
            }
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private static PriceWindow linear(int size, double step) {
        double[] closes = new double[size];
        for (int i = 0; i < size; i++) closes[i] = 100.0 + step * i;
        return PriceWindow.of(closes);
    }

    private static PriceWindow randomWalk(Random random, int size, boolean withVolumes) {
        double[] closes = new double[size];
        double[] volumes = new double[size];
        double price = 100.0;
        for (int i = 0; i < size; i++) {
            price *= 1 + random.nextGaussian() * 0.02;
            closes[i] = price;
            volumes[i] = 1_000 + random.nextInt(9_000);
        }
        return withVolumes ? PriceWindow.of(closes, volumes) : PriceWindow.of(closes);
    }
}

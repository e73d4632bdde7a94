package com.pathfinder.common.engine;

import com.pathfinder.common.decision.DeadlockDetector;
import com.pathfinder.common.decision.DeadlockReading;
import com.pathfinder.common.decision.Decision;
import com.pathfinder.common.decision.DecisionPolicy;
import com.pathfinder.common.decision.HysteresisController;
import com.pathfinder.common.decision.SignalMapper;
import com.pathfinder.common.graph.GraphBuilder;
import com.pathfinder.common.graph.ShortestPathSolver;
import com.pathfinder.common.graph.StateDiscretizer;
import com.pathfinder.common.graph.StateGraph;
import com.pathfinder.common.graph.StateSequence;
import com.pathfinder.common.model.MarketState;
import com.pathfinder.common.model.PriceWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shortest-path decision engine: turns a {@link PriceWindow} into one bounded signal.
 *
 * <h3>Pipeline</h3>
 * <pre>
 * closes → StateDiscretizer → GraphBuilder → DecisionPolicy (2× Dijkstra + semaphore)
 *        → HysteresisController → DeadlockDetector → SignalMapper → signal ∈ [−1, 1]
 * </pre>
 *
 * <h3>State</h3>
 * <p>The semaphore is the only value that survives a call. It starts at 0, is read by the
 * decision policy and replaced by the hysteresis update once per successful evaluation.
 * {@link #evaluate} holds the engine monitor for the whole read-then-write, so a shared engine
 * never loses an update. Use one engine per instrument.
 *
 * <p>Never throws: insufficient data and unexpected failures both yield a 0.0 signal with a
 * non-fitted {@link EvaluationStatus}.
 */
public class PathfindingEngine {

    private static final Logger log = LoggerFactory.getLogger(PathfindingEngine.class);

    private static final int MIN_SAMPLES = 2;

    private final EngineConfig config;
    private final StateDiscretizer discretizer;
    private final GraphBuilder graphBuilder;
    private final DecisionPolicy policy;
    private final HysteresisController hysteresis;
    private final DeadlockDetector deadlockDetector;
    private final SignalMapper signalMapper;

    private int semaphore;
    private EngineOutcome lastOutcome;

    public PathfindingEngine() {
        this(EngineConfig.defaults());
    }

    public PathfindingEngine(EngineConfig config) {
        this.config = config;
        this.discretizer = new StateDiscretizer(config.lookbackWindow());
        this.graphBuilder = new GraphBuilder(config.riskWeight());
        this.policy = new DecisionPolicy(new ShortestPathSolver(), config.structureLevels(),
            config.stateThreshold(), config.deadlockSensitivity());
        this.hysteresis = new HysteresisController();
        this.deadlockDetector = new DeadlockDetector(config.deadlockSensitivity());
        this.signalMapper = new SignalMapper();
        this.lastOutcome = EngineOutcome.notFitted(EvaluationStatus.INSUFFICIENT_DATA, 0);
    }

    /** Runs the full pipeline once and commits the new semaphore value on success. */
    public synchronized EngineOutcome evaluate(PriceWindow window) {
        EngineOutcome outcome;
        try {
            outcome = run(window);
        } catch (RuntimeException e) {
            log.error("Pathfinding evaluation failed window={} semaphore={}", window, semaphore, e);
            outcome = EngineOutcome.notFitted(EvaluationStatus.FAILED, semaphore);
        }
        semaphore = outcome.semaphore();
        lastOutcome = outcome;
        return outcome;
    }

    /** Scalar signal of {@link #evaluate}, rounded to 4 decimals. */
    public double signal(PriceWindow window) {
        return evaluate(window).signal();
    }

    public synchronized int semaphore() {
        return semaphore;
    }

    public synchronized EngineOutcome lastOutcome() {
        return lastOutcome;
    }

    public synchronized boolean isFitted() {
        return lastOutcome.fitted();
    }

    /** Forgets accumulated conviction. */
    public synchronized void reset() {
        semaphore = 0;
        lastOutcome = EngineOutcome.notFitted(EvaluationStatus.INSUFFICIENT_DATA, 0);
    }

    public EngineConfig config() {
        return config;
    }

    // ── Pipeline ────────────────────────────────────────────────────────────

    private EngineOutcome run(PriceWindow window) {
        if (window == null || window.size() < config.lookbackWindow() || window.size() < MIN_SAMPLES) {
            log.debug("Insufficient data size={} lookback={}",
                window == null ? 0 : window.size(), config.lookbackWindow());
            return EngineOutcome.notFitted(EvaluationStatus.INSUFFICIENT_DATA, semaphore);
        }

        double[] returns = window.returns();

        StateSequence sequence = discretizer.discretize(window);
        StateGraph graph = graphBuilder.build(sequence).orElse(StateGraph.empty());
        MarketState current = sequence.current();

        Decision decision = policy.decide(graph, current, returns, semaphore);
        int nextSemaphore = hysteresis.next(semaphore, current, decision.target(), returns);
        DeadlockReading deadlock = deadlockDetector.detect(window.closes(), current);
        double signal = signalMapper.map(decision, deadlock);

        log.debug("Evaluated current={} target={} level={} confidence={} semaphore={}->{} deadlock={} signal={}",
            current.label(), decision.target().label(), decision.level(), decision.confidence(),
            semaphore, nextSemaphore, deadlock.score(), signal);

        return new EngineOutcome(signal, EvaluationStatus.FITTED, current, decision.target(),
            decision.confidence(), decision.level(), deadlock, nextSemaphore,
            graph.nodes().size(), graph.edgeCount());
    }
}

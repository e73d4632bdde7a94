package com.pathfinder.analysis.agent;

import com.pathfinder.common.decision.DeadlockReading;
import com.pathfinder.common.engine.EngineConfig;
import com.pathfinder.common.engine.EngineOutcome;
import com.pathfinder.common.engine.PathfindingEngine;
import com.pathfinder.common.exception.AgentException;
import com.pathfinder.common.model.AnalysisResult;
import com.pathfinder.common.model.Context;
import com.pathfinder.common.model.PriceWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shortest-path agent: models recent price action as a graph of z-score states and follows
 * the cheapest route toward bullish or bearish territory.
 *
 * <p>Keeps one {@link PathfindingEngine} per symbol so the hysteresis semaphore of one
 * instrument never leaks into another.
 */
@Component
public class DijkstraAgent implements AnalysisAgent {

    private static final Logger log = LoggerFactory.getLogger(DijkstraAgent.class);

    private final EngineConfig config;
    private final Map<String, PathfindingEngine> engines = new ConcurrentHashMap<>();

    public DijkstraAgent(EngineConfig config) {
        this.config = config;
    }

    @Override
    public String agentName() { return "DijkstraAgent"; }

    @Override
    public AnalysisResult analyze(Context context) {
        if (context == null || context.symbol() == null || context.symbol().isBlank()) {
            throw new AgentException(agentName(), "No symbol in context");
        }
        String symbol = key(context.symbol());
        PriceWindow window = context.toPriceWindow();
        log.info("[DijkstraAgent] Analyzing symbol={} samples={}", symbol, window.size());

        PathfindingEngine engine = engines.computeIfAbsent(symbol, s -> new PathfindingEngine(config));
        EngineOutcome outcome = engine.evaluate(window);

        String summary = outcome.fitted()
            ? String.format(
                "Path: %s → %s (%s) | Confidence=%.2f | Semaphore=%d | Deadlock=%.4f → Signal: %.4f",
                outcome.currentState().label(), outcome.targetState().label(), outcome.level(),
                outcome.confidence(), outcome.semaphore(), outcome.deadlock().score(), outcome.signal())
            : String.format("Not fitted (%s) | Samples=%d | Lookback=%d → Signal: %.4f",
                outcome.status(), window.size(), config.lookbackWindow(), outcome.signal());

        return AnalysisResult.of(agentName(), summary, outcome.signal(), outcome.confidence(),
            metadata(outcome));
    }

    /** Snapshot of the engine kept for {@code symbol}, if it has been evaluated at least once. */
    public Optional<EngineSnapshot> snapshot(String symbol) {
        if (symbol == null || symbol.isBlank()) return Optional.empty();
        String key = key(symbol);
        PathfindingEngine engine = engines.get(key);
        if (engine == null) return Optional.empty();

        EngineOutcome last = engine.lastOutcome();
        return Optional.of(new EngineSnapshot(key, engine.semaphore(), last.fitted(),
            last.status().name(), last.signal(), last.currentState().label(),
            last.targetState().label(), last.level().name()));
    }

    /** Drops the engine of {@code symbol}; the next evaluation starts from semaphore 0. */
    public boolean reset(String symbol) {
        if (symbol == null || symbol.isBlank()) return false;
        boolean removed = engines.remove(key(symbol)) != null;
        if (removed) log.info("[DijkstraAgent] Engine reset symbol={}", key(symbol));
        return removed;
    }

    private Map<String, Object> metadata(EngineOutcome outcome) {
        DeadlockReading deadlock = outcome.deadlock();
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("status",                outcome.status().name());
        metadata.put("currentState",          outcome.currentState().label());
        metadata.put("targetState",           outcome.targetState().label());
        metadata.put("decisionLevel",         outcome.level().name());
        metadata.put("semaphore",             outcome.semaphore());
        metadata.put("deadlockScore",         deadlock.score());
        metadata.put("volatilityCompression", deadlock.volatilityCompression());
        metadata.put("rangeNarrowing",        deadlock.rangeNarrowing());
        metadata.put("trendDivergence",       deadlock.trendDivergence());
        metadata.put("statePersistence",      deadlock.statePersistence());
        metadata.put("graphNodes",            outcome.graphNodes());
        metadata.put("graphEdges",            outcome.graphEdges());
        metadata.put("lookbackWindow",        config.lookbackWindow());
        return metadata;
    }

    private static String key(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}

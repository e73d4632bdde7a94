package com.pathfinder.analysis.service;

import com.pathfinder.analysis.agent.AnalysisAgent;
import com.pathfinder.common.model.AnalysisResult;
import com.pathfinder.common.model.Context;
import com.pathfinder.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

@Service
public class AgentDispatchService {

    private static final Logger log = LoggerFactory.getLogger(AgentDispatchService.class);
    private final List<AnalysisAgent> agents;

    public AgentDispatchService(List<AnalysisAgent> agents) {
        this.agents = agents;
    }

    /**
     * Runs every registered agent on {@code boundedElastic} and collects one result per agent.
     * A failing agent contributes a neutral HOLD result instead of failing the dispatch.
     */
    public Mono<List<AnalysisResult>> dispatchAll(Context context) {
        String symbol = context.symbol();
        String traceId = context.traceId();
        TraceContextUtil.withMdc(traceId, () ->
            log.info("Dispatching {} agents in parallel for symbol={}", agents.size(), symbol));

        Mono<List<AnalysisResult>> dispatch = Flux.fromIterable(agents)
            .flatMap(agent -> Mono.fromCallable(() -> agent.analyze(context))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnSuccess(result -> TraceContextUtil.withMdc(traceId, () ->
                    log.info("Agent={} complete. signal={} score={} confidence={}",
                        agent.agentName(), result.signal(), result.score(), result.confidenceScore())))
                .onErrorResume(e -> {
                    TraceContextUtil.withMdc(traceId, () ->
                        log.error("Agent={} failed for symbol={}", agent.agentName(), symbol, e));
                    String reason = String.valueOf(e.getMessage());
                    return Mono.just(AnalysisResult.neutral(agent.agentName(),
                        "Agent failed: " + reason, Map.of("error", reason)));
                }))
            .collectList();

        return TraceContextUtil.withTraceId(dispatch, traceId);
    }
}

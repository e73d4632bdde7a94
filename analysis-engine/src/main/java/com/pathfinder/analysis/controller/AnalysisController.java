package com.pathfinder.analysis.controller;

import com.pathfinder.analysis.agent.DijkstraAgent;
import com.pathfinder.analysis.agent.EngineSnapshot;
import com.pathfinder.analysis.service.AgentDispatchService;
import com.pathfinder.common.model.AnalysisResult;
import com.pathfinder.common.model.Context;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/analyze")
public class AnalysisController {

    private final AgentDispatchService dispatchService;
    private final DijkstraAgent dijkstraAgent;

    public AnalysisController(AgentDispatchService dispatchService, DijkstraAgent dijkstraAgent) {
        this.dispatchService = dispatchService;
        this.dijkstraAgent = dijkstraAgent;
    }

    @PostMapping
    public Mono<ResponseEntity<List<AnalysisResult>>> analyze(@RequestBody Context context) {
        return dispatchService.dispatchAll(context)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/engines/{symbol}")
    public ResponseEntity<EngineSnapshot> engine(@PathVariable String symbol) {
        return dijkstraAgent.snapshot(symbol)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/engines/{symbol}")
    public ResponseEntity<Void> resetEngine(@PathVariable String symbol) {
        return dijkstraAgent.reset(symbol)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}

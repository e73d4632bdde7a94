package com.pathfinder.analysis.agent;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read-only view of one symbol's engine: the carried semaphore and the last evaluation.
 */
public record EngineSnapshot(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("semaphore") int semaphore,
    @JsonProperty("fitted") boolean fitted,
    @JsonProperty("status") String status,
    @JsonProperty("lastSignal") double lastSignal,
    @JsonProperty("currentState") String currentState,
    @JsonProperty("targetState") String targetState,
    @JsonProperty("decisionLevel") String decisionLevel
) {}

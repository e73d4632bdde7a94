package com.pathfinder.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

public record AnalysisResult(
    @JsonProperty("agentName") String agentName,
    @JsonProperty("summary") String summary,
    @JsonProperty("signal") String signal,              // BUY / SELL / HOLD
    @JsonProperty("score") double score,                // bounded signal, [-1, 1], 4 decimals
    @JsonProperty("confidenceScore") double confidenceScore,
    @JsonProperty("metadata") Map<String, Object> metadata
) {
    public static AnalysisResult of(String agentName, String summary, double score,
                                     double confidence, Map<String, Object> metadata) {
        return new AnalysisResult(agentName, summary, TradeDirection.fromScore(score).signal(),
            score, confidence, metadata);
    }

    public static AnalysisResult neutral(String agentName, String summary, Map<String, Object> metadata) {
        return new AnalysisResult(agentName, summary, TradeDirection.FLAT.signal(), 0.0, 0.0, metadata);
    }
}

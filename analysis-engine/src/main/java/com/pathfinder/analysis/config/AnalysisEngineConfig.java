package com.pathfinder.analysis.config;

import com.pathfinder.common.engine.EngineConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnalysisEngineConfig {

    @Value("${agents.dijkstra.lookback-window:42}")
    private int lookbackWindow;

    @Value("${agents.dijkstra.risk-weight:0.7}")
    private double riskWeight;

    @Value("${agents.dijkstra.state-threshold:0.25}")
    private double stateThreshold;

    @Value("${agents.dijkstra.structure-levels:3}")
    private int structureLevels;

    @Value("${agents.dijkstra.deadlock-sensitivity:1.5}")
    private double deadlockSensitivity;

    @Bean
    public EngineConfig dijkstraEngineConfig() {
        return new EngineConfig(lookbackWindow, riskWeight, stateThreshold,
            structureLevels, deadlockSensitivity);
    }
}

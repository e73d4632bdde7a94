package com.pathfinder.common.engine;

/**
 * Tuning parameters of a {@link PathfindingEngine}. Values are used as given; out-of-range
 * values change behaviour but are not rejected.
 *
 * @param lookbackWindow      samples used for discretization and graph construction
 * @param riskWeight          blend of risk vs. reward in edge weights, expected in [0, 1]
 * @param stateThreshold      trend magnitude considered significant
 * @param structureLevels     enabled decision-tree levels, expected in {1, 2, 3}
 * @param deadlockSensitivity scale applied to the deadlock score
 */
public record EngineConfig(
    int lookbackWindow,
    double riskWeight,
    double stateThreshold,
    int structureLevels,
    double deadlockSensitivity
) {

    public static final int DEFAULT_LOOKBACK_WINDOW = 42;
    public static final double DEFAULT_RISK_WEIGHT = 0.7;
    public static final double DEFAULT_STATE_THRESHOLD = 0.25;
    public static final int DEFAULT_STRUCTURE_LEVELS = 3;
    public static final double DEFAULT_DEADLOCK_SENSITIVITY = 1.5;

    public static EngineConfig defaults() {
        return new EngineConfig(DEFAULT_LOOKBACK_WINDOW, DEFAULT_RISK_WEIGHT,
            DEFAULT_STATE_THRESHOLD, DEFAULT_STRUCTURE_LEVELS, DEFAULT_DEADLOCK_SENSITIVITY);
    }

    public EngineConfig withLookbackWindow(int lookbackWindow) {
        return new EngineConfig(lookbackWindow, riskWeight, stateThreshold, structureLevels, deadlockSensitivity);
    }

    public EngineConfig withStructureLevels(int structureLevels) {
        return new EngineConfig(lookbackWindow, riskWeight, stateThreshold, structureLevels, deadlockSensitivity);
    }
}

package com.pathfinder.common.engine;

/**
 * How an engine evaluation ended. Only {@link #FITTED} carries a computed signal;
 * the other outcomes report a neutral 0.0.
 */
public enum EvaluationStatus {
    FITTED,
    INSUFFICIENT_DATA,
    FAILED
}

package com.pathfinder.common.decision;

/**
 * Which tier of the structured decision tree produced a {@link Decision}.
 */
public enum DecisionLevel {

    /** Level 3 — a reachable bullish/bearish target confirmed by semaphore and trend. */
    STRUCTURED,

    /** Level 2 — no qualifying path, but a significant recent trend. */
    TREND,

    /** Level 1 — nothing qualified; stay neutral. */
    NEUTRAL
}

package com.touchline.domain.enums;

/**
 * The signal a leaf condition reads from a match snapshot or its derived signals.
 *
 * <p>Raw signals (GOALS, SCORE_DIFFERENCE, TIME_ELAPSED) come straight from the
 * snapshot; the rest are computed by the MetricsCalculator each cycle.
 * TIME_ELAPSED is match-wide and ignores the leaf's target team.
 */
public enum SignalKind {
    /** Goals scored by the target team. */
    GOALS,
    /** Target team's goals minus the opponent's goals. Negative when trailing. */
    SCORE_DIFFERENCE,
    /** Elapsed match minutes. */
    TIME_ELAPSED,
    /** Expected goals of the target team. */
    XG,
    /** Momentum score of the target team. Unbounded. */
    MOMENTUM,
    /** Pressure index of the target team, 0 to 1. */
    PRESSURE,
    /** Win probability of the target team, 0.01 to 0.95. */
    WIN_PROBABILITY
}

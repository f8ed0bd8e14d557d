package com.touchline.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The six correlations the PatternDetector scans for. TIME_BASED covers both the
 * late-goals and the early-aggression variants.
 */
@Getter
@RequiredArgsConstructor
public enum PatternType {
    GOAL_SEQUENCE("goal_sequence"),
    CARD_SEQUENCE("card_sequence"),
    POSSESSION_SWING("possession_swing"),
    MOMENTUM_SHIFT("momentum_shift"),
    PRESSURE_BUILDUP("pressure_buildup"),
    TIME_BASED("time_based");

    /** Prefix of pattern ids. */
    private final String key;
}

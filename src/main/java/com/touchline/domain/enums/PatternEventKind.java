package com.touchline.domain.enums;

/**
 * Kinds of atomic observations recorded into a fixture's pattern buffer.
 */
public enum PatternEventKind {
    /** One goal scored since the previous snapshot. */
    GOAL,
    /** One yellow card shown since the previous snapshot. */
    YELLOW_CARD,
    /** One red card shown since the previous snapshot. */
    RED_CARD,
    /** Possession percentage sample, recorded every cycle. */
    POSSESSION_SAMPLE,
    /** Momentum score sample, recorded every cycle. */
    MOMENTUM_SAMPLE,
    /** Pressure index sample on a 0-100 scale, recorded every cycle. */
    PRESSURE_SAMPLE;

    public boolean isCard() {
        return this == YELLOW_CARD || this == RED_CARD;
    }
}

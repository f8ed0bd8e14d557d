package com.touchline.domain.model;

import com.touchline.domain.enums.TeamSide;
import lombok.Builder;
import lombok.Value;

/**
 * Analytical signals computed from one {@link MatchSnapshot}. Recomputed every
 * cycle, never persisted by the engine.
 */
@Value
@Builder
public class DerivedSignals {

    double homeXg;
    double awayXg;

    double homeMomentum;
    double awayMomentum;

    /** 0 to 1 after league weighting and clipping. */
    double homePressure;

    double awayPressure;

    // Sum to 1, each within [0.01, 0.95]
    double homeWinProbability;
    double awayWinProbability;
    double drawProbability;

    public double xg(TeamSide side) {
        return side == TeamSide.HOME ? homeXg : awayXg;
    }

    public double momentum(TeamSide side) {
        return side == TeamSide.HOME ? homeMomentum : awayMomentum;
    }

    public double pressure(TeamSide side) {
        return side == TeamSide.HOME ? homePressure : awayPressure;
    }

    public double winProbability(TeamSide side) {
        return side == TeamSide.HOME ? homeWinProbability : awayWinProbability;
    }
}

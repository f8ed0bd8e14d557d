package com.touchline.metrics;

import com.touchline.domain.enums.TeamSide;
import com.touchline.domain.model.DerivedSignals;
import com.touchline.domain.model.MatchSnapshot;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Derives expected goals, momentum, pressure and win/draw probabilities from a
 * single match snapshot.
 *
 * <p>The formulas are deterministic heuristics, not a statistical model. The class
 * holds no state: the same snapshot always yields bit-identical signals, and no
 * input makes it throw. Degenerate inputs (elapsed 0, missing statistics already
 * defaulted by the data layer) produce ordinary numbers.
 *
 * <p><b>Formulas:</b>
 * <ul>
 *   <li>xG = shotsOnTarget x 0.25 + (possession - 50) x 0.02, floored at 0</li>
 *   <li>momentum = [score x 10 + (possession - 50) x 0.5] x min(2, elapsed / 45),
 *       plus scoreDiff x 5 for the leading side only</li>
 *   <li>pressure = 0.8 when level; trailing 0.9 + 0.1 x min(1, elapsed / 90),
 *       leading 0.3 + 0.4 x min(1, elapsed / 90); times the league weight, clipped to 1</li>
 *   <li>win/draw: tiered base shifted by 0.1 x xG difference, blended with the current
 *       leader weighted by a time factor, clamped to [0.01, 0.95] and renormalised</li>
 * </ul>
 */
@Component
public class MetricsCalculator {

    public static final double MIN_PROBABILITY = 0.01;
    public static final double MAX_PROBABILITY = 0.95;

    private static final int REGULATION_MINUTES = 90;
    private static final int LATE_GAME_MINUTES_REMAINING = 10;
    private static final double LATE_TIME_FACTOR = 0.8;
    private static final double DEFAULT_TIME_FACTOR = 0.3;

    /** Competition importance multipliers for the pressure index. */
    private static final Map<String, Double> LEAGUE_WEIGHTS = Map.of(
            "premier league", 1.0,
            "la liga", 0.95,
            "bundesliga", 0.92,
            "serie a", 0.90,
            "ligue 1", 0.88,
            "champions league", 1.1,
            "europa league", 1.05);

    public DerivedSignals derive(MatchSnapshot snapshot) {
        double homeXg = expectedGoals(snapshot, TeamSide.HOME);
        double awayXg = expectedGoals(snapshot, TeamSide.AWAY);

        double[] probabilities = winProbabilities(snapshot, homeXg, awayXg);

        return DerivedSignals.builder()
                .homeXg(homeXg)
                .awayXg(awayXg)
                .homeMomentum(momentum(snapshot, TeamSide.HOME))
                .awayMomentum(momentum(snapshot, TeamSide.AWAY))
                .homePressure(pressure(snapshot, TeamSide.HOME))
                .awayPressure(pressure(snapshot, TeamSide.AWAY))
                .homeWinProbability(probabilities[0])
                .awayWinProbability(probabilities[1])
                .drawProbability(probabilities[2])
                .build();
    }

    public double expectedGoals(MatchSnapshot snapshot, TeamSide side) {
        double xg = snapshot.shotsOnTarget(side) * 0.25 + (snapshot.possession(side) - 50) * 0.02;
        return Math.max(0.0, xg);
    }

    public double momentum(MatchSnapshot snapshot, TeamSide side) {
        double timeWeight = Math.min(2.0, Math.max(0, snapshot.getElapsed()) / 45.0);
        double base = (snapshot.score(side) * 10 + (snapshot.possession(side) - 50) * 0.5) * timeWeight;

        int scoreDiff = snapshot.score(side) - snapshot.score(side.opponent());
        if (scoreDiff > 0) {
            base += scoreDiff * 5;
        }
        return base;
    }

    public double pressure(MatchSnapshot snapshot, TeamSide side) {
        double base = basePressure(snapshot, side);
        return Math.min(1.0, base * leagueWeight(snapshot.getLeague()));
    }

    /** Pressure before league weighting. */
    public double basePressure(MatchSnapshot snapshot, TeamSide side) {
        int own = snapshot.score(side);
        int other = snapshot.score(side.opponent());
        if (own == other) {
            return 0.8;
        }
        double progress = Math.min(1.0, Math.max(0, snapshot.getElapsed()) / (double) REGULATION_MINUTES);
        return own < other ? 0.9 + 0.1 * progress : 0.3 + 0.4 * progress;
    }

    public double leagueWeight(String league) {
        if (league == null) {
            return 1.0;
        }
        return LEAGUE_WEIGHTS.getOrDefault(league.trim().toLowerCase(Locale.ROOT), 1.0);
    }

    /**
     * Returns {home, away, draw}. Draw is what home and away leave over after
     * blending; all three are then clamped and renormalised together.
     */
    double[] winProbabilities(MatchSnapshot snapshot, double homeXg, double awayXg) {
        int homeScore = snapshot.getHomeScore();
        int awayScore = snapshot.getAwayScore();

        double homeBase;
        double awayBase;
        if (homeScore > awayScore) {
            homeBase = 0.7;
            awayBase = 0.1;
        } else if (homeScore < awayScore) {
            homeBase = 0.1;
            awayBase = 0.7;
        } else {
            homeBase = 0.3;
            awayBase = 0.3;
        }

        double xgShift = 0.1 * (homeXg - awayXg);
        homeBase += xgShift;
        awayBase -= xgShift;

        int remaining = Math.max(0, REGULATION_MINUTES - snapshot.getElapsed());
        double timeFactor = remaining <= LATE_GAME_MINUTES_REMAINING ? LATE_TIME_FACTOR : DEFAULT_TIME_FACTOR;

        double home = clamp(homeBase * (1 - timeFactor) + (homeScore > awayScore ? 1 : 0) * timeFactor);
        double away = clamp(awayBase * (1 - timeFactor) + (awayScore > homeScore ? 1 : 0) * timeFactor);
        double draw = 1 - home - away;

        return normalize(new double[] {home, away, draw});
    }

    /**
     * Clamps each value into [MIN_PROBABILITY, MAX_PROBABILITY] and spreads the
     * remaining difference from 1 over the values that can still move, until the
     * vector sums to 1. Converges in at most one pass per component.
     */
    static double[] normalize(double[] values) {
        double[] p = values.clone();
        for (int pass = 0; pass <= p.length; pass++) {
            for (int i = 0; i < p.length; i++) {
                p[i] = clamp(p[i]);
            }
            double total = 0;
            for (double v : p) {
                total += v;
            }
            double gap = 1.0 - total;
            if (Math.abs(gap) < 1e-12) {
                break;
            }

            double movable = 0;
            for (double v : p) {
                if (gap > 0 ? v < MAX_PROBABILITY : v > MIN_PROBABILITY) {
                    movable += gap > 0 ? MAX_PROBABILITY - v : v - MIN_PROBABILITY;
                }
            }
            if (movable <= 0) {
                break;
            }
            for (int i = 0; i < p.length; i++) {
                if (gap > 0 && p[i] < MAX_PROBABILITY) {
                    p[i] += gap * (MAX_PROBABILITY - p[i]) / movable;
                } else if (gap < 0 && p[i] > MIN_PROBABILITY) {
                    p[i] += gap * (p[i] - MIN_PROBABILITY) / movable;
                }
            }
        }
        return p;
    }

    private static double clamp(double value) {
        return Math.max(MIN_PROBABILITY, Math.min(MAX_PROBABILITY, value));
    }
}

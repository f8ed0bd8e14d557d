package com.touchline.domain.model;

import com.touchline.domain.enums.TeamSide;
import java.time.Instant;
import java.util.Locale;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable state of one fixture as seen by one polling cycle.
 *
 * <p>Built by the match data layer from the upstream fixture list and statistics
 * endpoints. Missing or malformed upstream fields are already resolved to defaults
 * (0 for counts, 50 for possession, empty string for names) by the time a snapshot
 * exists, so nothing downstream has to null-check individual statistics.
 *
 * <p>A snapshot is superseded by the next cycle's snapshot of the same fixture,
 * never updated. {@link #fetchedAt} orders snapshots of one fixture in logical time.
 */
@Value
@Builder(toBuilder = true)
public class MatchSnapshot {

    String fixtureId;
    String homeTeam;
    String awayTeam;
    String league;
    /** Upstream short status code, e.g. "1H", "HT", "FT". */
    String status;

    int homeScore;
    int awayScore;
    int elapsed;

    // Raw statistics
    int homeShots;
    int awayShots;
    int homeShotsOnTarget;
    int awayShotsOnTarget;

    @Builder.Default
    double homePossession = 50.0;

    @Builder.Default
    double awayPossession = 50.0;

    int homeCorners;
    int awayCorners;
    int homeFouls;
    int awayFouls;
    int homeYellowCards;
    int awayYellowCards;
    int homeRedCards;
    int awayRedCards;

    Instant fetchedAt;

    /** Statistics were estimated from the score because the upstream had none. */
    boolean estimated;

    /** Served from the fallback cache after the upstream fetch failed. */
    boolean stale;

    public int score(TeamSide side) {
        return side == TeamSide.HOME ? homeScore : awayScore;
    }

    public int shotsOnTarget(TeamSide side) {
        return side == TeamSide.HOME ? homeShotsOnTarget : awayShotsOnTarget;
    }

    public double possession(TeamSide side) {
        return side == TeamSide.HOME ? homePossession : awayPossession;
    }

    public int yellowCards(TeamSide side) {
        return side == TeamSide.HOME ? homeYellowCards : awayYellowCards;
    }

    public int redCards(TeamSide side) {
        return side == TeamSide.HOME ? homeRedCards : awayRedCards;
    }

    public String teamName(TeamSide side) {
        return side == TeamSide.HOME ? homeTeam : awayTeam;
    }

    /**
     * Resolves a free-text team reference to a side: HOME when the reference is a
     * case-insensitive substring of the home team's name, AWAY otherwise. A reference
     * matching neither name falls back to AWAY.
     */
    public TeamSide resolveSide(String team) {
        String reference = team == null ? "" : team.toLowerCase(Locale.ROOT);
        String home = homeTeam == null ? "" : homeTeam.toLowerCase(Locale.ROOT);
        return home.contains(reference) ? TeamSide.HOME : TeamSide.AWAY;
    }
}

package com.touchline.matchdata;

import com.fasterxml.jackson.databind.JsonNode;
import com.touchline.domain.model.MatchSnapshot;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns API-Football fixture and statistics JSON into {@link MatchSnapshot}s.
 *
 * <p>Malformed or missing fields never raise: counts default to 0, possession to 50
 * and names to the empty string. When a fixture has no statistics at all they are
 * estimated from the score and the snapshot is flagged {@code estimated}.
 */
@Component
public class SnapshotParser {

    private static final Logger log = LoggerFactory.getLogger(SnapshotParser.class);

    static final String SHOTS = "Total Shots";
    static final String SHOTS_ON_GOAL = "Shots on Goal";
    static final String POSSESSION = "Ball Possession";
    static final String CORNERS = "Corner Kicks";
    static final String FOULS = "Fouls";
    static final String YELLOW_CARDS = "Yellow Cards";
    static final String RED_CARDS = "Red Cards";

    private static final double DEFAULT_POSSESSION = 50.0;

    /** Fixture id as a string, or empty when the entry has none. */
    public String fixtureId(JsonNode fixture) {
        JsonNode id = fixture.path("fixture").path("id");
        return id.isMissingNode() || id.isNull() ? "" : id.asText();
    }

    /** Upstream short status code such as "1H" or "FT". */
    public String status(JsonNode fixture) {
        return text(fixture.path("fixture").path("status").path("short"));
    }

    /**
     * Builds a snapshot from one element of the live fixture list and, when available,
     * the statistics response of that fixture.
     *
     * @param statistics the statistics {@code response} array, or null when it could not be fetched
     */
    public MatchSnapshot parse(JsonNode fixture, JsonNode statistics, Instant fetchedAt) {
        String homeTeam = text(fixture.path("teams").path("home").path("name"));
        String awayTeam = text(fixture.path("teams").path("away").path("name"));
        int homeScore = integer(fixture.path("goals").path("home"));
        int awayScore = integer(fixture.path("goals").path("away"));

        MatchSnapshot.MatchSnapshotBuilder builder = MatchSnapshot.builder()
                .fixtureId(fixtureId(fixture))
                .homeTeam(homeTeam)
                .awayTeam(awayTeam)
                .league(text(fixture.path("league").path("name")))
                .status(status(fixture))
                .homeScore(homeScore)
                .awayScore(awayScore)
                .elapsed(integer(fixture.path("fixture").path("status").path("elapsed")))
                .fetchedAt(fetchedAt);

        JsonNode homeStats = teamStatistics(statistics, homeTeam, 0);
        JsonNode awayStats = teamStatistics(statistics, awayTeam, 1);
        if (homeStats == null || awayStats == null) {
            log.debug("No statistics for fixture {}, estimating from score", fixtureId(fixture));
            return builder.homeShots(homeScore * 4 + 2)
                    .awayShots(awayScore * 4 + 2)
                    .homeShotsOnTarget(homeScore * 2 + 1)
                    .awayShotsOnTarget(awayScore * 2 + 1)
                    .homePossession(DEFAULT_POSSESSION)
                    .awayPossession(DEFAULT_POSSESSION)
                    .estimated(true)
                    .build();
        }

        return builder.homeShots(stat(homeStats, SHOTS))
                .awayShots(stat(awayStats, SHOTS))
                .homeShotsOnTarget(stat(homeStats, SHOTS_ON_GOAL))
                .awayShotsOnTarget(stat(awayStats, SHOTS_ON_GOAL))
                .homePossession(possession(homeStats))
                .awayPossession(possession(awayStats))
                .homeCorners(stat(homeStats, CORNERS))
                .awayCorners(stat(awayStats, CORNERS))
                .homeFouls(stat(homeStats, FOULS))
                .awayFouls(stat(awayStats, FOULS))
                .homeYellowCards(stat(homeStats, YELLOW_CARDS))
                .awayYellowCards(stat(awayStats, YELLOW_CARDS))
                .homeRedCards(stat(homeStats, RED_CARDS))
                .awayRedCards(stat(awayStats, RED_CARDS))
                .build();
    }

    /**
     * Finds the statistics list for a team, by name first and by position second.
     * Returns null when the response has no usable entry.
     */
    private JsonNode teamStatistics(JsonNode statistics, String teamName, int fallbackIndex) {
        if (statistics == null || !statistics.isArray() || statistics.size() < 2) {
            return null;
        }
        for (JsonNode entry : statistics) {
            if (!teamName.isEmpty() && teamName.equals(text(entry.path("team").path("name")))) {
                return entry.path("statistics");
            }
        }
        JsonNode entry = statistics.get(fallbackIndex).path("statistics");
        return entry.isArray() ? entry : null;
    }

    private int stat(JsonNode teamStats, String type) {
        JsonNode value = find(teamStats, type);
        if (value == null || value.isNull()) {
            return 0;
        }
        if (value.isNumber()) {
            return value.asInt();
        }
        try {
            return (int) Double.parseDouble(value.asText().replace("%", "").trim());
        } catch (NumberFormatException e) {
            log.debug("Unreadable value '{}' for statistic {}", value.asText(), type);
            return 0;
        }
    }

    private double possession(JsonNode teamStats) {
        JsonNode value = find(teamStats, POSSESSION);
        if (value == null || value.isNull()) {
            return DEFAULT_POSSESSION;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        try {
            return Double.parseDouble(value.asText().replace("%", "").trim());
        } catch (NumberFormatException e) {
            log.debug("Unreadable possession value '{}'", value.asText());
            return DEFAULT_POSSESSION;
        }
    }

    private JsonNode find(JsonNode teamStats, String type) {
        for (JsonNode stat : teamStats) {
            if (type.equalsIgnoreCase(stat.path("type").asText())) {
                return stat.path("value");
            }
        }
        return null;
    }

    private static String text(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? "" : node.asText("");
    }

    private static int integer(JsonNode node) {
        if (node.isNumber()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }
}

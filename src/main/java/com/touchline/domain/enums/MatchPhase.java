package com.touchline.domain.enums;

import java.util.Locale;
import java.util.Set;

/**
 * Coarse match state derived from the upstream short status code. Drives the
 * cache TTL tier of fetched statistics.
 */
public enum MatchPhase {
    LIVE,
    FINISHED,
    SCHEDULED,
    UNKNOWN;

    private static final Set<String> LIVE_CODES = Set.of("1H", "HT", "2H", "ET", "P", "BT");
    private static final Set<String> FINISHED_CODES = Set.of("FT", "AET", "PEN");
    private static final Set<String> SCHEDULED_CODES = Set.of("NS", "TBD", "PST");

    public static MatchPhase fromStatus(String shortStatus) {
        if (shortStatus == null) {
            return UNKNOWN;
        }
        String code = shortStatus.trim().toUpperCase(Locale.ROOT);
        if (LIVE_CODES.contains(code)) {
            return LIVE;
        }
        if (FINISHED_CODES.contains(code)) {
            return FINISHED;
        }
        if (SCHEDULED_CODES.contains(code)) {
            return SCHEDULED;
        }
        return UNKNOWN;
    }
}

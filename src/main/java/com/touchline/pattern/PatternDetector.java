package com.touchline.pattern;

import com.touchline.domain.enums.PatternEventKind;
import com.touchline.domain.enums.PatternSeverity;
import com.touchline.domain.enums.PatternType;
import com.touchline.domain.enums.TeamSide;
import com.touchline.domain.model.DerivedSignals;
import com.touchline.domain.model.GamePattern;
import com.touchline.domain.model.MatchSnapshot;
import com.touchline.domain.model.PatternEvent;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Detects multi-event patterns in a fixture's rolling event buffer.
 *
 * <p>Each cycle {@link #detect} turns the snapshot into pattern events (one event per
 * goal or card added since the previous snapshot, plus possession, momentum and
 * pressure samples for both sides), appends them to the fixture's {@link PatternBook}
 * and runs six independent scans over the buffer:
 * <ul>
 *   <li><b>Goal sequence</b>: adjacent goals at most 300s apart; HIGH within 120s, else MEDIUM</li>
 *   <li><b>Card sequence</b>: three consecutive cards spanning at most 600s; MEDIUM</li>
 *   <li><b>Possession swing</b>: earliest vs latest of a side's last 4 samples differ by more than 20; MEDIUM</li>
 *   <li><b>Momentum shift</b>: the same window on momentum, more than 30; HIGH</li>
 *   <li><b>Pressure buildup</b>: a side's last 2 pressure samples both above 70; MEDIUM</li>
 *   <li><b>Time based</b>: 2+ goals from minute 80 (HIGH), 2+ cards up to minute 20 (MEDIUM)</li>
 * </ul>
 *
 * <p>Only patterns not already retained by the book are returned. Sample-window
 * patterns whose window overlaps the open episode of the same type and side are
 * treated as the same ongoing pattern. Retained patterns past the retention horizon
 * are purged at the end of each call.
 *
 * <p>Patterns never gate rule firing; they feed a separate notification path.
 */
@Component
@EnableConfigurationProperties(PatternRecognitionConfig.class)
public class PatternDetector {

    private static final Logger log = LoggerFactory.getLogger(PatternDetector.class);

    static final long GOAL_SEQUENCE_WINDOW_SECONDS = 300;
    static final long RAPID_GOAL_SECONDS = 120;
    static final long CARD_SEQUENCE_WINDOW_SECONDS = 600;
    static final int SAMPLE_WINDOW = 4;
    static final double POSSESSION_SWING_THRESHOLD = 20;
    static final double MOMENTUM_SHIFT_THRESHOLD = 30;
    static final double HIGH_PRESSURE_THRESHOLD = 70;
    static final int LATE_MINUTE = 80;
    static final int EARLY_MINUTE = 20;

    private static final String SIDE = "side";

    private final PatternRecognitionConfig patternRecognitionConfig;

    public PatternDetector(PatternRecognitionConfig patternRecognitionConfig) {
        this.patternRecognitionConfig = patternRecognitionConfig;
    }

    public PatternBook newBook() {
        return new PatternBook(patternRecognitionConfig.getBufferSize());
    }

    /**
     * Records the snapshot's events and returns the patterns found for the first time.
     *
     * @param now wall-clock time of the cycle, stamped on the new events
     */
    public List<GamePattern> detect(
            String fixtureId, MatchSnapshot snapshot, DerivedSignals signals, PatternBook book, Instant now) {
        for (PatternEvent event : toEvents(snapshot, signals, book, now)) {
            book.append(event);
        }

        List<GamePattern> fresh = new ArrayList<>();
        for (GamePattern candidate : scan(fixtureId, book.getEvents())) {
            String episode = episodeKey(candidate);
            if (episode != null && book.continuesEpisode(episode, candidate.getStartTime(), candidate.getEndTime())) {
                continue;
            }
            if (book.retain(candidate)) {
                if (episode != null) {
                    book.openEpisode(episode, candidate.getEndTime());
                }
                fresh.add(candidate);
                log.info("Pattern detected in fixture {}: {} ({}, confidence {})",
                        fixtureId, candidate.getName(), candidate.getSeverity(), candidate.getConfidence());
            }
        }

        int purged = book.purgeOlderThan(now.minus(Duration.ofHours(patternRecognitionConfig.getRetentionHours())));
        if (purged > 0) {
            log.debug("Purged {} expired patterns for fixture {}", purged, fixtureId);
        }
        return fresh;
    }

    /**
     * Converts a snapshot into pattern events. Goals and cards produce one event per
     * unit added since the previous snapshot; the first snapshot of a fixture only sets
     * the baseline. Samples are produced for both sides every time. Pressure samples
     * use a 0-100 scale.
     *
     * <p>An estimated snapshot carries a real score but placeholder statistics, so it
     * yields goal events only: card baselines are left as they were and no samples
     * are recorded.
     */
    public List<PatternEvent> toEvents(MatchSnapshot snapshot, DerivedSignals signals, PatternBook book, Instant now) {
        List<PatternEvent> events = new ArrayList<>();
        for (TeamSide side : TeamSide.values()) {
            int goals = snapshot.score(side);
            int newGoals = book.goalsAdded(side, goals);
            for (int i = newGoals - 1; i >= 0; i--) {
                events.add(event(PatternEventKind.GOAL, side, snapshot, goals - i, now));
            }
            if (snapshot.isEstimated()) {
                continue;
            }

            int yellows = snapshot.yellowCards(side);
            int newYellows = book.yellowCardsAdded(side, yellows);
            for (int i = newYellows - 1; i >= 0; i--) {
                events.add(event(PatternEventKind.YELLOW_CARD, side, snapshot, yellows - i, now));
            }

            int reds = snapshot.redCards(side);
            int newReds = book.redCardsAdded(side, reds);
            for (int i = newReds - 1; i >= 0; i--) {
                events.add(event(PatternEventKind.RED_CARD, side, snapshot, reds - i, now));
            }
        }
        if (snapshot.isEstimated()) {
            return events;
        }

        for (TeamSide side : TeamSide.values()) {
            events.add(event(PatternEventKind.POSSESSION_SAMPLE, side, snapshot, snapshot.possession(side), now));
            events.add(event(PatternEventKind.MOMENTUM_SAMPLE, side, snapshot, signals.momentum(side), now));
            events.add(event(PatternEventKind.PRESSURE_SAMPLE, side, snapshot, signals.pressure(side) * 100, now));
        }
        return events;
    }

    /**
     * Runs all six scans over a chronological event list. Pure: does not touch any book.
     */
    public List<GamePattern> scan(String fixtureId, List<PatternEvent> events) {
        List<GamePattern> patterns = new ArrayList<>();
        patterns.addAll(detectGoalSequences(fixtureId, events));
        patterns.addAll(detectCardSequences(fixtureId, events));
        patterns.addAll(detectSampleSwings(
                fixtureId, events, PatternEventKind.POSSESSION_SAMPLE, PatternType.POSSESSION_SWING,
                POSSESSION_SWING_THRESHOLD, PatternSeverity.MEDIUM, 0.7));
        patterns.addAll(detectSampleSwings(
                fixtureId, events, PatternEventKind.MOMENTUM_SAMPLE, PatternType.MOMENTUM_SHIFT,
                MOMENTUM_SHIFT_THRESHOLD, PatternSeverity.HIGH, 0.8));
        patterns.addAll(detectPressureBuildups(fixtureId, events));
        patterns.addAll(detectTimeBasedPatterns(fixtureId, events));
        return patterns;
    }

    // ==== Scans ====

    List<GamePattern> detectGoalSequences(String fixtureId, List<PatternEvent> events) {
        List<PatternEvent> goals = ofKind(events, PatternEventKind.GOAL);
        List<GamePattern> patterns = new ArrayList<>();
        for (int i = 1; i < goals.size(); i++) {
            PatternEvent first = goals.get(i - 1);
            PatternEvent second = goals.get(i);
            long gap = secondsBetween(first, second);
            if (gap > GOAL_SEQUENCE_WINDOW_SECONDS) {
                continue;
            }
            patterns.add(GamePattern.builder()
                    .patternId(PatternType.GOAL_SEQUENCE.getKey() + "_" + fixtureId + "_" + eventKey(first) + "_"
                            + eventKey(second))
                    .fixtureId(fixtureId)
                    .type(PatternType.GOAL_SEQUENCE)
                    .name("Rapid Goal Sequence")
                    .description(String.format(Locale.ROOT, "Two goals within %.1f minutes", gap / 60.0))
                    .severity(gap <= RAPID_GOAL_SECONDS ? PatternSeverity.HIGH : PatternSeverity.MEDIUM)
                    .confidence(0.9)
                    .event(first)
                    .event(second)
                    .startTime(first.getTimestamp())
                    .endTime(second.getTimestamp())
                    .meta("time_gap", gap)
                    .build());
        }
        return patterns;
    }

    List<GamePattern> detectCardSequences(String fixtureId, List<PatternEvent> events) {
        List<PatternEvent> cards =
                events.stream().filter(e -> e.getKind().isCard()).collect(Collectors.toList());
        List<GamePattern> patterns = new ArrayList<>();
        for (int i = 2; i < cards.size(); i++) {
            PatternEvent first = cards.get(i - 2);
            PatternEvent last = cards.get(i);
            long span = secondsBetween(first, last);
            if (span > CARD_SEQUENCE_WINDOW_SECONDS) {
                continue;
            }
            List<PatternEvent> window = cards.subList(i - 2, i + 1);
            patterns.add(GamePattern.builder()
                    .patternId(PatternType.CARD_SEQUENCE.getKey() + "_" + fixtureId + "_"
                            + window.stream().map(PatternDetector::eventKey).collect(Collectors.joining("_")))
                    .fixtureId(fixtureId)
                    .type(PatternType.CARD_SEQUENCE)
                    .name("Aggressive Play Pattern")
                    .description(String.format(Locale.ROOT, "Three cards within %.1f minutes", span / 60.0))
                    .severity(PatternSeverity.MEDIUM)
                    .confidence(0.8)
                    .events(window)
                    .startTime(first.getTimestamp())
                    .endTime(last.getTimestamp())
                    .meta("time_gap", span)
                    .build());
        }
        return patterns;
    }

    /**
     * Windowed comparison used by possession swings and momentum shifts: for each side,
     * the earliest and latest of its last {@value #SAMPLE_WINDOW} samples.
     */
    List<GamePattern> detectSampleSwings(
            String fixtureId,
            List<PatternEvent> events,
            PatternEventKind kind,
            PatternType type,
            double threshold,
            PatternSeverity severity,
            double confidence) {
        List<GamePattern> patterns = new ArrayList<>();
        for (TeamSide side : TeamSide.values()) {
            List<PatternEvent> window = lastSamples(events, kind, side, SAMPLE_WINDOW);
            if (window.size() < 2) {
                continue;
            }
            PatternEvent earliest = window.get(0);
            PatternEvent latest = window.get(window.size() - 1);
            double change = Math.abs(latest.getValue() - earliest.getValue());
            if (change <= threshold) {
                continue;
            }
            boolean possession = type == PatternType.POSSESSION_SWING;
            patterns.add(GamePattern.builder()
                    .patternId(type.getKey() + "_" + fixtureId + "_" + side.name().toLowerCase(Locale.ROOT) + "_"
                            + earliest.getTimestamp().toEpochMilli())
                    .fixtureId(fixtureId)
                    .type(type)
                    .name(possession ? "Significant Possession Swing" : "Momentum Shift")
                    .description(possession
                            ? String.format(Locale.ROOT, "Possession changed by %.1f%%", change)
                            : String.format(Locale.ROOT, "Momentum changed by %.1f points", change))
                    .severity(severity)
                    .confidence(confidence)
                    .events(window)
                    .startTime(earliest.getTimestamp())
                    .endTime(latest.getTimestamp())
                    .meta(SIDE, side)
                    .meta(possession ? "swing" : "shift", change)
                    .build());
        }
        return patterns;
    }

    List<GamePattern> detectPressureBuildups(String fixtureId, List<PatternEvent> events) {
        List<GamePattern> patterns = new ArrayList<>();
        for (TeamSide side : TeamSide.values()) {
            List<PatternEvent> lastTwo = lastSamples(events, PatternEventKind.PRESSURE_SAMPLE, side, 2);
            if (lastTwo.size() < 2
                    || lastTwo.stream().anyMatch(e -> e.getValue() <= HIGH_PRESSURE_THRESHOLD)) {
                continue;
            }
            PatternEvent first = lastTwo.get(0);
            PatternEvent last = lastTwo.get(1);
            patterns.add(GamePattern.builder()
                    .patternId(PatternType.PRESSURE_BUILDUP.getKey() + "_" + fixtureId + "_"
                            + side.name().toLowerCase(Locale.ROOT) + "_" + first.getTimestamp().toEpochMilli())
                    .fixtureId(fixtureId)
                    .type(PatternType.PRESSURE_BUILDUP)
                    .name("High Pressure Buildup")
                    .description("Sustained high pressure detected")
                    .severity(PatternSeverity.MEDIUM)
                    .confidence(0.7)
                    .events(lastTwo)
                    .startTime(first.getTimestamp())
                    .endTime(last.getTimestamp())
                    .meta(SIDE, side)
                    .build());
        }
        return patterns;
    }

    /** Event minutes are match elapsed minutes. */
    List<GamePattern> detectTimeBasedPatterns(String fixtureId, List<PatternEvent> events) {
        List<GamePattern> patterns = new ArrayList<>();

        List<PatternEvent> lateGoals = ofKind(events, PatternEventKind.GOAL).stream()
                .filter(e -> e.getMatchMinute() >= LATE_MINUTE)
                .collect(Collectors.toList());
        if (lateGoals.size() >= 2) {
            patterns.add(timeBased(
                    fixtureId, "late_goals", lateGoals, "Late Goal Pattern",
                    "Multiple goals in final 10 minutes", PatternSeverity.HIGH, 0.8, "late"));
        }

        List<PatternEvent> earlyCards = events.stream()
                .filter(e -> e.getKind().isCard())
                .filter(e -> e.getMatchMinute() <= EARLY_MINUTE)
                .collect(Collectors.toList());
        if (earlyCards.size() >= 2) {
            patterns.add(timeBased(
                    fixtureId, "early_cards", earlyCards, "Early Aggression Pattern",
                    "Multiple cards in first 20 minutes", PatternSeverity.MEDIUM, 0.7, "early"));
        }
        return patterns;
    }

    private GamePattern timeBased(
            String fixtureId,
            String variant,
            List<PatternEvent> matched,
            String name,
            String description,
            PatternSeverity severity,
            double confidence,
            String period) {
        return GamePattern.builder()
                .patternId(variant + "_" + fixtureId + "_" + matched.size())
                .fixtureId(fixtureId)
                .type(PatternType.TIME_BASED)
                .name(name)
                .description(description)
                .severity(severity)
                .confidence(confidence)
                .events(matched)
                .startTime(matched.get(0).getTimestamp())
                .endTime(matched.get(matched.size() - 1).getTimestamp())
                .meta("time_period", period)
                .meta("count", matched.size())
                .build();
    }

    // ==== Helpers ====

    /**
     * Sample-window patterns (those tagged with a side) belong to an episode per type
     * and side; a window overlapping the open episode is the same ongoing pattern.
     */
    private static String episodeKey(GamePattern pattern) {
        Object side = pattern.getMetadata().get(SIDE);
        return side == null ? null : pattern.getType().name() + ":" + side;
    }

    private static PatternEvent event(
            PatternEventKind kind, TeamSide side, MatchSnapshot snapshot, double value, Instant now) {
        return PatternEvent.builder()
                .kind(kind)
                .side(side)
                .team(snapshot.teamName(side))
                .value(value)
                .timestamp(now)
                .matchMinute(snapshot.getElapsed())
                .build();
    }

    private static List<PatternEvent> ofKind(List<PatternEvent> events, PatternEventKind kind) {
        return events.stream().filter(e -> e.getKind() == kind).collect(Collectors.toList());
    }

    private static List<PatternEvent> lastSamples(
            List<PatternEvent> events, PatternEventKind kind, TeamSide side, int count) {
        List<PatternEvent> samples = events.stream()
                .filter(e -> e.getKind() == kind && e.getSide() == side)
                .collect(Collectors.toList());
        return samples.subList(Math.max(0, samples.size() - count), samples.size());
    }

    private static long secondsBetween(PatternEvent first, PatternEvent second) {
        return Math.abs(Duration.between(first.getTimestamp(), second.getTimestamp()).getSeconds());
    }

    /** Goals and cards are identified by kind, side and the count they brought the side to. */
    private static String eventKey(PatternEvent event) {
        return event.getKind().name().charAt(0) + event.getSide().name().toLowerCase(Locale.ROOT)
                + (int) event.getValue();
    }
}

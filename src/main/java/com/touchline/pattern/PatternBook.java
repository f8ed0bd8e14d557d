package com.touchline.pattern;

import com.touchline.domain.enums.TeamSide;
import com.touchline.domain.model.GamePattern;
import com.touchline.domain.model.PatternEvent;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pattern state of one fixture: the bounded event ring, the patterns detected so
 * far, the open episodes of sustained patterns and the goal/card counts of the
 * previous snapshot.
 *
 * <p>Written only by the worker processing the fixture; reads from query paths are
 * served from copies. Methods synchronize on the book.
 */
public class PatternBook {

    private final int capacity;
    private final Deque<PatternEvent> events;
    private final Map<String, GamePattern> retained = new LinkedHashMap<>();

    // End of the current episode of each sustained pattern, keyed by type and side
    private final Map<String, Instant> episodeEnds = new HashMap<>();

    // Counts seen in the previous snapshot, absent until the first one
    private final Map<TeamSide, Integer> lastGoals = new EnumMap<>(TeamSide.class);
    private final Map<TeamSide, Integer> lastYellowCards = new EnumMap<>(TeamSide.class);
    private final Map<TeamSide, Integer> lastRedCards = new EnumMap<>(TeamSide.class);

    public PatternBook(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Pattern buffer capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.events = new ArrayDeque<>(capacity);
    }

    /** Appends an event, dropping the oldest when the ring is full. */
    public synchronized void append(PatternEvent event) {
        if (events.size() == capacity) {
            events.pollFirst();
        }
        events.addLast(event);
    }

    public synchronized List<PatternEvent> getEvents() {
        return new ArrayList<>(events);
    }

    public synchronized int getEventCount() {
        return events.size();
    }

    public int getCapacity() {
        return capacity;
    }

    /** Stores a pattern unless one with the same id is already retained. Returns true if stored. */
    public synchronized boolean retain(GamePattern pattern) {
        return retained.putIfAbsent(pattern.getPatternId(), pattern) == null;
    }

    public synchronized List<GamePattern> getPatterns() {
        return new ArrayList<>(retained.values());
    }

    /**
     * True when a window starting at {@code start} overlaps the open episode under
     * {@code episodeKey}; the episode is then extended to {@code end}.
     */
    public synchronized boolean continuesEpisode(String episodeKey, Instant start, Instant end) {
        Instant until = episodeEnds.get(episodeKey);
        if (until == null || until.isBefore(start)) {
            return false;
        }
        if (end.isAfter(until)) {
            episodeEnds.put(episodeKey, end);
        }
        return true;
    }

    public synchronized void openEpisode(String episodeKey, Instant end) {
        episodeEnds.put(episodeKey, end);
    }

    /** Removes patterns that started before the cutoff. Returns how many were removed. */
    public synchronized int purgeOlderThan(Instant cutoff) {
        episodeEnds.values().removeIf(end -> end.isBefore(cutoff));
        int before = retained.size();
        retained.values().removeIf(p -> p.getStartTime() != null && p.getStartTime().isBefore(cutoff));
        return before - retained.size();
    }

    /**
     * Records the current count for a side and returns how many were added since the
     * previous snapshot. The first observation only sets the baseline and returns 0.
     */
    public synchronized int goalsAdded(TeamSide side, int current) {
        return delta(lastGoals, side, current);
    }

    public synchronized int yellowCardsAdded(TeamSide side, int current) {
        return delta(lastYellowCards, side, current);
    }

    public synchronized int redCardsAdded(TeamSide side, int current) {
        return delta(lastRedCards, side, current);
    }

    private static int delta(Map<TeamSide, Integer> last, TeamSide side, int current) {
        Integer previous = last.put(side, current);
        if (previous == null) {
            return 0;
        }
        return Math.max(0, current - previous);
    }
}

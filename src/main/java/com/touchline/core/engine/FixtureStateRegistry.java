package com.touchline.core.engine;

import com.touchline.pattern.PatternDetector;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Keyed store of per-fixture engine state. Each fixture's state is handed to exactly
 * one worker per cycle, so fixtures never contend with each other.
 */
@Component
public class FixtureStateRegistry {

    private static final Logger log = LoggerFactory.getLogger(FixtureStateRegistry.class);

    private final Map<String, FixtureState> states = new ConcurrentHashMap<>();
    private final PatternDetector patternDetector;

    public FixtureStateRegistry(PatternDetector patternDetector) {
        this.patternDetector = patternDetector;
    }

    public FixtureState stateFor(String fixtureId) {
        return states.computeIfAbsent(fixtureId, id -> new FixtureState(id, patternDetector.newBook()));
    }

    public Optional<FixtureState> find(String fixtureId) {
        return Optional.ofNullable(states.get(fixtureId));
    }

    public List<FixtureState> all() {
        return new ArrayList<>(states.values());
    }

    public int size() {
        return states.size();
    }

    /** Drops fixtures not seen by any cycle within the retention period. */
    public int evictIdle(Instant now, Duration retention) {
        Instant cutoff = now.minus(retention);
        int before = states.size();
        states.values().removeIf(s -> s.getLastSeenAt() != null && s.getLastSeenAt().isBefore(cutoff));
        int evicted = before - states.size();
        if (evicted > 0) {
            log.info("Evicted state of {} idle fixtures", evicted);
        }
        return evicted;
    }
}

package com.touchline.core.engine;

import com.touchline.condition.SequenceBook;
import com.touchline.pattern.PatternBook;
import java.time.Instant;

/**
 * Everything the engine remembers about one fixture between cycles: sequence
 * progress, the pattern buffer and the time of the last snapshot processed.
 */
public class FixtureState {

    private final String fixtureId;
    private final SequenceBook sequenceBook = new SequenceBook();
    private final PatternBook patternBook;

    private Instant lastSnapshotAt;
    private Instant lastSeenAt;

    public FixtureState(String fixtureId, PatternBook patternBook) {
        this.fixtureId = fixtureId;
        this.patternBook = patternBook;
    }

    /**
     * Accepts a snapshot only if it is newer than the last one processed. Snapshots
     * without a fetch time are always accepted.
     */
    public synchronized boolean advanceTo(Instant snapshotAt, Instant now) {
        lastSeenAt = now;
        if (snapshotAt == null) {
            return true;
        }
        if (lastSnapshotAt != null && !snapshotAt.isAfter(lastSnapshotAt)) {
            return false;
        }
        lastSnapshotAt = snapshotAt;
        return true;
    }

    public String getFixtureId() {
        return fixtureId;
    }

    public SequenceBook getSequenceBook() {
        return sequenceBook;
    }

    public PatternBook getPatternBook() {
        return patternBook;
    }

    public synchronized Instant getLastSnapshotAt() {
        return lastSnapshotAt;
    }

    public synchronized Instant getLastSeenAt() {
        return lastSeenAt;
    }
}

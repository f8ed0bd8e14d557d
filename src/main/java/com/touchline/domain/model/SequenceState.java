package com.touchline.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Progress of one sequence rule for one fixture.
 *
 * <p>Lifecycle: IDLE (nothing observed) to ACCUMULATING to COMPLETE. When more than
 * the time limit has passed since {@link #getWindowStart()} the observed set is
 * cleared and the window restarts, from any state. COMPLETE therefore lasts until
 * the next expiry.
 *
 * <p>Owned by a single fixture's state and only touched by the worker processing
 * that fixture.
 */
public class SequenceState {

    public enum Status {
        IDLE,
        ACCUMULATING,
        COMPLETE
    }

    private final Set<String> observedKeys = new LinkedHashSet<>();
    private final int requiredCount;
    private Instant windowStart;

    public SequenceState(int requiredCount, Instant windowStart) {
        this.requiredCount = requiredCount;
        this.windowStart = windowStart;
    }

    /** Clears progress and restarts the window when the limit is exceeded. Returns true if it reset. */
    public boolean expireIfNeeded(Instant now, long timeLimitSeconds) {
        if (Duration.between(windowStart, now).getSeconds() > timeLimitSeconds) {
            observedKeys.clear();
            windowStart = now;
            return true;
        }
        return false;
    }

    /** Adds a key to the observed set. Idempotent. */
    public boolean observe(String key) {
        return observedKeys.add(key);
    }

    public boolean isComplete() {
        return requiredCount > 0 && observedKeys.size() >= requiredCount;
    }

    public Status getStatus() {
        if (isComplete()) {
            return Status.COMPLETE;
        }
        return observedKeys.isEmpty() ? Status.IDLE : Status.ACCUMULATING;
    }

    public Set<String> getObservedKeys() {
        return Collections.unmodifiableSet(observedKeys);
    }

    public Instant getWindowStart() {
        return windowStart;
    }

    public int getRequiredCount() {
        return requiredCount;
    }
}

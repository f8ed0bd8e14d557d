package com.touchline.core.engine;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Summary of one polling cycle, logged at the end of the cycle and used by tests.
 */
@Value
@Builder
public class CycleReport {

    Instant startedAt;
    int fixturesFetched;
    int fixturesEvaluated;
    int staleSkipped;
    int fixturesFailed;
    int rulesLoaded;
    int alertsFired;
    int dispatchFailures;
    int patternsDetected;
}

package com.touchline.domain.model;

import com.touchline.domain.enums.PatternSeverity;
import com.touchline.domain.enums.PatternType;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A correlation of several pattern events detected in one fixture.
 *
 * <p>{@code patternId} is derived from the type, the fixture and the timestamps of
 * the contributing events, so the same correlation found again on a later scan
 * carries the same id and is not reported twice.
 */
@Value
@Builder
public class GamePattern {

    String patternId;
    String fixtureId;
    PatternType type;
    String name;
    String description;
    PatternSeverity severity;
    double confidence;

    @Singular
    List<PatternEvent> events;

    Instant startTime;
    Instant endTime;

    @Singular("meta")
    Map<String, Object> metadata;
}

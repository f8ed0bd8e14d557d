package com.touchline.domain.model;

import com.touchline.domain.enums.PatternEventKind;
import com.touchline.domain.enums.TeamSide;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One timestamped observation in a fixture's pattern buffer.
 */
@Value
@Builder
public class PatternEvent {

    PatternEventKind kind;
    TeamSide side;
    String team;

    /** Count after the event for goals and cards, the sample for the *_SAMPLE kinds. */
    double value;

    /** Wall-clock time the snapshot carrying this event was fetched. */
    Instant timestamp;

    /** Elapsed match minute at the time of the snapshot. */
    int matchMinute;
}

package com.touchline.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Inclusive range of match minutes in which a rule may be evaluated.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TimeWindow {

    private int startMinute;
    private int endMinute;
    private String description;

    public boolean contains(int elapsedMinute) {
        return elapsedMinute >= startMinute && elapsedMinute <= endMinute;
    }
}

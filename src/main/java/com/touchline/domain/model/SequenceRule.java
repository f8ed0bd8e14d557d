package com.touchline.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Ordered set of trigger conditions that must each be observed true at least once
 * inside a rolling window of {@code timeLimitSeconds}.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SequenceRule {

    @Builder.Default
    private List<LeafCondition> events = new ArrayList<>();

    private long timeLimitSeconds;
    private String description;

    /** Number of distinct trigger conditions needed for completion. */
    @JsonIgnore
    public int getDistinctTriggerCount() {
        Set<String> keys = new LinkedHashSet<>();
        for (LeafCondition event : events) {
            keys.add(event.getIdentityKey());
        }
        return keys.size();
    }
}

package com.touchline.event;

import com.touchline.domain.model.GamePattern;
import com.touchline.domain.model.MatchSnapshot;
import org.springframework.context.ApplicationEvent;

/**
 * Published once for every newly detected pattern. The notification path decides
 * whether it is broadcast; rule evaluation does not consume it.
 */
public class PatternDetectedEvent extends ApplicationEvent {

    private final GamePattern pattern;
    private final MatchSnapshot snapshot;

    public PatternDetectedEvent(Object source, GamePattern pattern, MatchSnapshot snapshot) {
        super(source);
        this.pattern = pattern;
        this.snapshot = snapshot;
    }

    public GamePattern getPattern() {
        return pattern;
    }

    public MatchSnapshot getSnapshot() {
        return snapshot;
    }
}

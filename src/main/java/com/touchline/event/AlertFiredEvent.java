package com.touchline.event;

import com.touchline.domain.enums.DispatchStatus;
import com.touchline.domain.model.AlertRule;
import com.touchline.domain.model.MatchSnapshot;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a rule fired for a match and its dispatch was attempted.
 *
 * <p>Consumed by:
 * <ul>
 *   <li>{@code CustomMetricsService} -- fire and dispatch-failure counters</li>
 * </ul>
 */
public class AlertFiredEvent extends ApplicationEvent {

    private final AlertRule rule;
    private final MatchSnapshot snapshot;
    private final String message;
    private final DispatchStatus dispatchStatus;
    private final LocalDateTime firedAt;

    public AlertFiredEvent(
            Object source, AlertRule rule, MatchSnapshot snapshot, String message, DispatchStatus dispatchStatus) {
        super(source);
        this.rule = rule;
        this.snapshot = snapshot;
        this.message = message;
        this.dispatchStatus = dispatchStatus;
        this.firedAt = LocalDateTime.now();
    }

    public AlertRule getRule() {
        return rule;
    }

    public MatchSnapshot getSnapshot() {
        return snapshot;
    }

    public String getMessage() {
        return message;
    }

    public DispatchStatus getDispatchStatus() {
        return dispatchStatus;
    }

    public LocalDateTime getFiredAt() {
        return firedAt;
    }
}

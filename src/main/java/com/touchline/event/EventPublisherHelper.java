package com.touchline.event;

import com.touchline.domain.enums.DispatchStatus;
import com.touchline.domain.model.AlertRule;
import com.touchline.domain.model.GamePattern;
import com.touchline.domain.model.MatchSnapshot;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed wrapper around Spring's {@link ApplicationEventPublisher} for the engine's events.
 *
 * <p>All methods are non-blocking unless a listener is synchronous. Listeners that
 * do I/O are annotated {@code @Async("eventExecutor")}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Alerts ----

    public void publishAlertFired(
            Object source, AlertRule rule, MatchSnapshot snapshot, String message, DispatchStatus status) {
        applicationEventPublisher.publishEvent(new AlertFiredEvent(source, rule, snapshot, message, status));
    }

    // ---- Patterns ----

    public void publishPatternDetected(Object source, GamePattern pattern, MatchSnapshot snapshot) {
        applicationEventPublisher.publishEvent(new PatternDetectedEvent(source, pattern, snapshot));
    }
}

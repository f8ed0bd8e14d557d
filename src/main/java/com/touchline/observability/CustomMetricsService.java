package com.touchline.observability;

import com.touchline.core.engine.FixtureStateRegistry;
import com.touchline.domain.enums.DispatchStatus;
import com.touchline.event.AlertFiredEvent;
import com.touchline.event.PatternDetectedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the engine's Micrometer meters.
 *
 * <ul>
 *   <li><b>alerts.fired</b> (counter): rules fired, one per (rule, match)</li>
 *   <li><b>alerts.dispatch.failed</b> (counter): fired alerts no channel accepted</li>
 *   <li><b>patterns.detected</b> (counter, tag {@code type}): newly detected patterns</li>
 *   <li><b>alert.cycles.failed</b> (counter): cycles aborted by an error</li>
 *   <li><b>alert.cycle.duration</b> (timer): wall time of successful cycles</li>
 *   <li><b>fixtures.tracked</b> (gauge): fixtures with engine state</li>
 * </ul>
 *
 * <p>Counters follow Spring ApplicationEvents; cycle meters are recorded by the
 * polling loop directly.
 */
@Service
public class CustomMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter alertsFiredCounter;
    private final Counter dispatchFailedCounter;
    private final Counter cyclesFailedCounter;
    private final Timer cycleDurationTimer;

    public CustomMetricsService(MeterRegistry meterRegistry, FixtureStateRegistry fixtureStateRegistry) {
        this.meterRegistry = meterRegistry;

        this.alertsFiredCounter = Counter.builder("alerts.fired")
                .description("Rules fired for a match")
                .register(meterRegistry);

        this.dispatchFailedCounter = Counter.builder("alerts.dispatch.failed")
                .description("Fired alerts that no notification channel accepted")
                .register(meterRegistry);

        this.cyclesFailedCounter = Counter.builder("alert.cycles.failed")
                .description("Polling cycles aborted by an error")
                .register(meterRegistry);

        this.cycleDurationTimer = Timer.builder("alert.cycle.duration")
                .description("Wall time of a successful polling cycle")
                .publishPercentiles(0.5, 0.95)
                .maximumExpectedValue(Duration.ofMinutes(2))
                .register(meterRegistry);

        meterRegistry.gauge("fixtures.tracked", fixtureStateRegistry, FixtureStateRegistry::size);
    }

    @EventListener
    @Order(20)
    public void onAlertFired(AlertFiredEvent event) {
        alertsFiredCounter.increment();
        if (event.getDispatchStatus() == DispatchStatus.FAILED) {
            dispatchFailedCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onPatternDetected(PatternDetectedEvent event) {
        Counter.builder("patterns.detected")
                .description("Patterns detected for the first time")
                .tag("type", event.getPattern().getType().name())
                .register(meterRegistry)
                .increment();
    }

    public void recordCycle(Duration duration) {
        cycleDurationTimer.record(duration);
    }

    public void recordCycleFailure() {
        cyclesFailedCounter.increment();
    }
}

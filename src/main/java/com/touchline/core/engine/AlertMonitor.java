package com.touchline.core.engine;

import com.touchline.exception.BaseException;
import com.touchline.observability.CustomMetricsService;
import com.touchline.store.FireHistoryStore;
import com.touchline.store.RuleStore;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * The long-lived polling loop around {@link AlertOrchestrator}.
 *
 * <p>Each cycle schedules the next one: after a successful cycle the pause is
 * {@code pollIntervalMs}, after a failed one the shorter {@code errorBackoffMs}. A
 * cycle failure is logged and counted but never ends the loop.
 *
 * <p>On start both stores are probed once. If either is unreachable the exception
 * propagates and the application context fails to start. On stop no new cycle is
 * scheduled; a cycle already running is allowed to finish.
 */
@Component
public class AlertMonitor implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(AlertMonitor.class);

    private final AlertOrchestrator alertOrchestrator;
    private final RuleStore ruleStore;
    private final FireHistoryStore fireHistoryStore;
    private final AlertEngineConfig alertEngineConfig;
    private final CustomMetricsService customMetricsService;
    private final TaskScheduler taskScheduler;

    private volatile boolean running;
    private ScheduledFuture<?> nextCycle;

    public AlertMonitor(
            AlertOrchestrator alertOrchestrator,
            RuleStore ruleStore,
            FireHistoryStore fireHistoryStore,
            AlertEngineConfig alertEngineConfig,
            CustomMetricsService customMetricsService,
            @Qualifier("alertPollScheduler") TaskScheduler taskScheduler) {
        this.alertOrchestrator = alertOrchestrator;
        this.ruleStore = ruleStore;
        this.fireHistoryStore = fireHistoryStore;
        this.alertEngineConfig = alertEngineConfig;
        this.customMetricsService = customMetricsService;
        this.taskScheduler = taskScheduler;
    }

    @Override
    public void start() {
        if (!alertEngineConfig.isEnabled()) {
            log.info("Alert engine disabled, polling loop not started");
            return;
        }
        ruleStore.verifyAvailable();
        fireHistoryStore.verifyAvailable();

        running = true;
        log.info("Alert engine started: poll interval {}ms, error backoff {}ms",
                alertEngineConfig.getPollIntervalMs(), alertEngineConfig.getErrorBackoffMs());
        scheduleNext(Duration.ZERO);
    }

    @Override
    public synchronized void stop() {
        running = false;
        if (nextCycle != null) {
            nextCycle.cancel(false);
            nextCycle = null;
        }
        log.info("Alert engine stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Runs one cycle and returns how long to wait before the next. Never throws.
     */
    Duration executeCycle() {
        long startNanos = System.nanoTime();
        try {
            alertOrchestrator.runCycle(Instant.now());
            customMetricsService.recordCycle(Duration.ofNanos(System.nanoTime() - startNanos));
            return Duration.ofMillis(alertEngineConfig.getPollIntervalMs());
        } catch (Exception e) {
            customMetricsService.recordCycleFailure();
            if (e instanceof BaseException be && be.isTransientFailure()) {
                log.warn("Alert cycle failed, retrying in {}ms: {}", alertEngineConfig.getErrorBackoffMs(), e.getMessage());
            } else {
                log.error("Alert cycle failed, retrying in {}ms: {}", alertEngineConfig.getErrorBackoffMs(), e.getMessage(), e);
            }
            return Duration.ofMillis(alertEngineConfig.getErrorBackoffMs());
        }
    }

    private void runAndReschedule() {
        if (!running) {
            return;
        }
        scheduleNext(executeCycle());
    }

    private synchronized void scheduleNext(Duration delay) {
        if (!running) {
            return;
        }
        nextCycle = taskScheduler.schedule(this::runAndReschedule, Instant.now().plus(delay));
    }
}

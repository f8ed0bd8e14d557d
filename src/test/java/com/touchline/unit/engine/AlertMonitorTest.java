package com.touchline.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.touchline.core.engine.AlertEngineConfig;
import com.touchline.core.engine.AlertMonitor;
import com.touchline.core.engine.AlertOrchestrator;
import com.touchline.core.engine.CycleReport;
import com.touchline.exception.StoreUnavailableException;
import com.touchline.observability.CustomMetricsService;
import com.touchline.store.FireHistoryStore;
import com.touchline.store.RuleStore;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.TaskScheduler;

/**
 * Unit tests for AlertMonitor.
 *
 * <p>The scheduler is mocked; each scheduled task is captured and run by hand so
 * the delay chosen for the next cycle can be checked.
 */
@ExtendWith(MockitoExtension.class)
class AlertMonitorTest {

    @Mock
    private AlertOrchestrator alertOrchestrator;

    @Mock
    private RuleStore ruleStore;

    @Mock
    private FireHistoryStore fireHistoryStore;

    @Mock
    private CustomMetricsService customMetricsService;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<?> scheduledFuture;

    private AlertEngineConfig alertEngineConfig;
    private AlertMonitor alertMonitor;

    @BeforeEach
    void setUp() {
        alertEngineConfig = new AlertEngineConfig();
        alertEngineConfig.setPollIntervalMs(60000);
        alertEngineConfig.setErrorBackoffMs(30000);
        alertMonitor = new AlertMonitor(
                alertOrchestrator, ruleStore, fireHistoryStore, alertEngineConfig, customMetricsService, taskScheduler);
    }

    private ArgumentCaptor<Runnable> startAndCaptureFirstTask() {
        doReturn(scheduledFuture).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
        alertMonitor.start();
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(task.capture(), any(Instant.class));
        return task;
    }

    private Instant lastScheduledAt() {
        ArgumentCaptor<Instant> at = ArgumentCaptor.forClass(Instant.class);
        verify(taskScheduler, times(2)).schedule(any(Runnable.class), at.capture());
        return at.getValue();
    }

    @Test
    void start_probesStoresAndSchedulesImmediately() {
        startAndCaptureFirstTask();

        verify(ruleStore).verifyAvailable();
        verify(fireHistoryStore).verifyAvailable();
        assertThat(alertMonitor.isRunning()).isTrue();
    }

    @Test
    void start_storeUnreachable_failsStartup() {
        doThrow(
                        new StoreUnavailableException("alert_rules", new DataAccessResourceFailureException("down")))
                .when(ruleStore).verifyAvailable();

        assertThatThrownBy(() -> alertMonitor.start()).isInstanceOf(StoreUnavailableException.class);
        assertThat(alertMonitor.isRunning()).isFalse();
        verify(taskScheduler, never()).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    void start_disabled_doesNotSchedule() {
        alertEngineConfig.setEnabled(false);

        alertMonitor.start();

        assertThat(alertMonitor.isRunning()).isFalse();
        verify(ruleStore, never()).verifyAvailable();
    }

    @Test
    void successfulCycle_reschedulesAfterPollInterval() {
        when(alertOrchestrator.runCycle(any(Instant.class))).thenReturn(CycleReport.builder().build());
        ArgumentCaptor<Runnable> task = startAndCaptureFirstTask();

        Instant before = Instant.now();
        task.getValue().run();

        verify(customMetricsService).recordCycle(any(Duration.class));
        assertThat(lastScheduledAt()).isAfterOrEqualTo(before.plusMillis(60000));
    }

    @Test
    void failedCycle_reschedulesAfterBackoff() {
        when(alertOrchestrator.runCycle(any(Instant.class))).thenThrow(
                new StoreUnavailableException("alert_history", new DataAccessResourceFailureException("down")));
        ArgumentCaptor<Runnable> task = startAndCaptureFirstTask();

        Instant before = Instant.now();
        task.getValue().run();

        verify(customMetricsService).recordCycleFailure();
        Instant next = lastScheduledAt();
        assertThat(next).isAfterOrEqualTo(before.plusMillis(30000));
        assertThat(next).isBefore(before.plusMillis(60000));
        assertThat(alertMonitor.isRunning()).isTrue();
    }

    @Test
    void stop_cancelsPendingCycleAndSkipsQueuedRun() {
        ArgumentCaptor<Runnable> task = startAndCaptureFirstTask();

        alertMonitor.stop();
        task.getValue().run();

        verify(scheduledFuture).cancel(false);
        verify(alertOrchestrator, never()).runCycle(any(Instant.class));
        assertThat(alertMonitor.isRunning()).isFalse();
    }
}

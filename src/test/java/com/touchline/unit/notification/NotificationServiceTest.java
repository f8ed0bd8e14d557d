package com.touchline.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.touchline.domain.enums.DispatchStatus;
import com.touchline.domain.enums.NotificationChannel;
import com.touchline.domain.enums.NotificationType;
import com.touchline.domain.enums.PatternSeverity;
import com.touchline.domain.enums.PatternType;
import com.touchline.domain.model.AlertRule;
import com.touchline.domain.model.GamePattern;
import com.touchline.domain.model.MatchSnapshot;
import com.touchline.event.PatternDetectedEvent;
import com.touchline.notification.DispatchOutcome;
import com.touchline.notification.Notification;
import com.touchline.notification.NotificationRouter;
import com.touchline.notification.NotificationService;
import com.touchline.notification.NotificationTemplateEngine;
import com.touchline.notification.SmsNotifier;
import com.touchline.notification.SmsResult;
import com.touchline.notification.WebSocketNotifier;
import com.touchline.pattern.PatternAlertPolicy;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Tests for NotificationService: per-channel delivery, outcome aggregation, pattern
 * broadcasts gated by the alert policy, and the recent-notification buffer.
 */
@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    @Mock
    private NotificationRouter notificationRouter;

    @Mock
    private SmsNotifier smsNotifier;

    @Mock
    private WebSocketNotifier webSocketNotifier;

    @Mock
    private NotificationTemplateEngine notificationTemplateEngine;

    @Mock
    private PatternAlertPolicy patternAlertPolicy;

    private NotificationService notificationService;

    private AlertRule rule;
    private MatchSnapshot snapshot;

    @BeforeEach
    void setUp() {
        notificationService = new NotificationService(
                notificationRouter, smsNotifier, webSocketNotifier, notificationTemplateEngine, patternAlertPolicy);

        rule = AlertRule.builder()
                .id(7L)
                .name("Arsenal dominance")
                .userId("user-1")
                .userPhone("+447700900123")
                .build();
        snapshot = MatchSnapshot.builder()
                .fixtureId("1001")
                .homeTeam("Arsenal")
                .awayTeam("Chelsea")
                .league("Premier League")
                .homeScore(2)
                .awayScore(1)
                .elapsed(67)
                .build();
    }

    private Notification notification(String userId, LocalDateTime timestamp) {
        return Notification.builder()
                .type(NotificationType.ALERT_TRIGGERED)
                .title("Alert Triggered: Arsenal dominance")
                .userId(userId)
                .timestamp(timestamp)
                .build();
    }

    @Nested
    @DisplayName("Alert dispatch")
    class Dispatch {

        @Test
        @DisplayName("Both channels delivered: SENT with the SMS message id")
        void bothChannels() {
            when(notificationRouter.resolveChannels(rule))
                    .thenReturn(EnumSet.of(NotificationChannel.SMS, NotificationChannel.WEBSOCKET));
            when(notificationTemplateEngine.renderAlertSms(rule, snapshot, "msg")).thenReturn("sms body");
            when(smsNotifier.sendSms("+447700900123", "sms body")).thenReturn(SmsResult.sent("SM123", "queued"));
            Notification payload = notification("user-1", LocalDateTime.now());
            when(notificationTemplateEngine.renderAlertNotification(rule, snapshot, "msg")).thenReturn(payload);
            when(webSocketNotifier.publish("user-1", payload)).thenReturn(true);

            DispatchOutcome outcome = notificationService.dispatchAlert(rule, snapshot, "msg");

            assertThat(outcome.getStatus()).isEqualTo(DispatchStatus.SENT);
            assertThat(outcome.getDeliveredVia())
                    .containsExactlyInAnyOrder(NotificationChannel.SMS, NotificationChannel.WEBSOCKET);
            assertThat(outcome.getSmsMessageId()).isEqualTo("SM123");
            assertThat(outcome.primaryChannel()).isEqualTo(NotificationChannel.SMS);
            assertThat(outcome.getError()).isNull();
        }

        @Test
        @DisplayName("A failing SMS does not stop the WebSocket delivery")
        void smsFailureIsIsolated() {
            when(notificationRouter.resolveChannels(rule))
                    .thenReturn(EnumSet.of(NotificationChannel.SMS, NotificationChannel.WEBSOCKET));
            when(notificationTemplateEngine.renderAlertSms(rule, snapshot, "msg")).thenReturn("sms body");
            when(smsNotifier.sendSms(anyString(), anyString())).thenThrow(new IllegalStateException("boom"));
            Notification payload = notification("user-1", LocalDateTime.now());
            when(notificationTemplateEngine.renderAlertNotification(rule, snapshot, "msg")).thenReturn(payload);
            when(webSocketNotifier.publish("user-1", payload)).thenReturn(true);

            DispatchOutcome outcome = notificationService.dispatchAlert(rule, snapshot, "msg");

            assertThat(outcome.getStatus()).isEqualTo(DispatchStatus.SENT);
            assertThat(outcome.getDeliveredVia()).containsExactly(NotificationChannel.WEBSOCKET);
            assertThat(outcome.getError()).contains("SMS").contains("boom");
        }

        @Test
        @DisplayName("No channel delivered: FAILED with every error")
        void allChannelsFail() {
            when(notificationRouter.resolveChannels(rule))
                    .thenReturn(EnumSet.of(NotificationChannel.SMS, NotificationChannel.WEBSOCKET));
            when(notificationTemplateEngine.renderAlertSms(rule, snapshot, "msg")).thenReturn("sms body");
            when(smsNotifier.sendSms(anyString(), anyString())).thenReturn(SmsResult.failed("SMS rate limit reached"));
            Notification payload = notification("user-1", LocalDateTime.now());
            when(notificationTemplateEngine.renderAlertNotification(rule, snapshot, "msg")).thenReturn(payload);
            when(webSocketNotifier.publish("user-1", payload)).thenReturn(false);

            DispatchOutcome outcome = notificationService.dispatchAlert(rule, snapshot, "msg");

            assertThat(outcome.getStatus()).isEqualTo(DispatchStatus.FAILED);
            assertThat(outcome.getDeliveredVia()).isEmpty();
            assertThat(outcome.primaryChannel()).isNull();
            assertThat(outcome.getError()).contains("SMS rate limit reached").contains("WEBSOCKET");
        }

        @Test
        @DisplayName("WebSocket-only rule never touches the SMS notifier")
        void websocketOnly() {
            when(notificationRouter.resolveChannels(rule)).thenReturn(EnumSet.of(NotificationChannel.WEBSOCKET));
            Notification payload = notification("user-1", LocalDateTime.now());
            when(notificationTemplateEngine.renderAlertNotification(rule, snapshot, "msg")).thenReturn(payload);
            when(webSocketNotifier.publish("user-1", payload)).thenReturn(true);

            notificationService.dispatchAlert(rule, snapshot, "msg");

            verify(smsNotifier, never()).sendSms(anyString(), anyString());
            assertThat(notificationService.getRecentNotifications("user-1")).containsExactly(payload);
        }
    }

    @Nested
    @DisplayName("Pattern broadcasts")
    class Patterns {

        private GamePattern pattern(PatternSeverity severity) {
            return GamePattern.builder()
                    .patternId("goal_sequence_1001_Ghome1_Ghome2")
                    .fixtureId("1001")
                    .type(PatternType.GOAL_SEQUENCE)
                    .name("Rapid Goal Sequence")
                    .description("Two goals within 1.5 minutes")
                    .severity(severity)
                    .confidence(0.9)
                    .startTime(Instant.now())
                    .endTime(Instant.now())
                    .build();
        }

        @Test
        @DisplayName("Pattern passing the policy is broadcast and remembered")
        void broadcastsAllowedPattern() {
            GamePattern pattern = pattern(PatternSeverity.HIGH);
            Notification payload = notification(null, LocalDateTime.now());
            when(patternAlertPolicy.shouldAlert(pattern)).thenReturn(true);
            when(notificationTemplateEngine.renderPatternNotification(pattern, snapshot)).thenReturn(payload);

            notificationService.onPatternDetected(new PatternDetectedEvent(this, pattern, snapshot));

            verify(webSocketNotifier).broadcast(payload);
            assertThat(notificationService.getRecentNotifications("anyone")).containsExactly(payload);
        }

        @Test
        @DisplayName("Pattern below the threshold is dropped")
        void dropsFilteredPattern() {
            GamePattern pattern = pattern(PatternSeverity.LOW);
            when(patternAlertPolicy.shouldAlert(pattern)).thenReturn(false);

            notificationService.onPatternDetected(new PatternDetectedEvent(this, pattern, snapshot));

            verify(webSocketNotifier, never()).broadcast(any());
            verify(notificationTemplateEngine, never()).renderPatternNotification(any(), eq(snapshot));
        }
    }

    @Test
    @DisplayName("Recent notifications merge user and broadcast entries, newest first")
    void recentNotificationsNewestFirst() {
        when(notificationRouter.resolveChannels(rule)).thenReturn(EnumSet.of(NotificationChannel.WEBSOCKET));
        LocalDateTime base = LocalDateTime.of(2026, 10, 18, 15, 0);
        Notification older = notification("user-1", base);
        Notification newer = notification("user-1", base.plusMinutes(5));
        when(notificationTemplateEngine.renderAlertNotification(any(), any(), anyString()))
                .thenReturn(older, newer);
        when(webSocketNotifier.publish(eq("user-1"), any())).thenReturn(true);

        notificationService.dispatchAlert(rule, snapshot, "first");
        notificationService.dispatchAlert(rule, snapshot, "second");

        List<Notification> recent = notificationService.getRecentNotifications("user-1");
        assertThat(recent).containsExactly(newer, older);
        assertThat(notificationService.getRecentNotifications("user-2")).isEmpty();
    }
}

package com.touchline.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;

import com.touchline.domain.enums.NotificationPriority;
import com.touchline.domain.enums.NotificationType;
import com.touchline.domain.enums.PatternSeverity;
import com.touchline.domain.enums.PatternType;
import com.touchline.domain.enums.TeamSide;
import com.touchline.domain.model.AlertRule;
import com.touchline.domain.model.GamePattern;
import com.touchline.domain.model.MatchSnapshot;
import com.touchline.notification.Notification;
import com.touchline.notification.NotificationTemplateEngine;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for NotificationTemplateEngine.
 */
class NotificationTemplateEngineTest {

    private NotificationTemplateEngine notificationTemplateEngine;
    private AlertRule rule;
    private MatchSnapshot snapshot;

    @BeforeEach
    void setUp() {
        notificationTemplateEngine = new NotificationTemplateEngine();
        rule = AlertRule.builder().id(7L).name("Arsenal dominance").userId("user-1").build();
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

    @Test
    void renderAlertSms_containsMatchAndCondition() {
        String sms = notificationTemplateEngine.renderAlertSms(rule, snapshot, "Arsenal xG: 1.66 > 1.5");

        assertThat(sms.split("\n")).hasSize(5);
        assertThat(sms)
                .contains("TouchLine Alert: Arsenal dominance")
                .contains("Premier League")
                .contains("Arsenal 2 - 1 Chelsea")
                .contains("Arsenal xG: 1.66 > 1.5")
                .endsWith("67 min");
    }

    @Test
    void renderAlertNotification_targetsRuleUser() {
        Notification notification =
                notificationTemplateEngine.renderAlertNotification(rule, snapshot, "Arsenal goals: 2 >= 2");

        assertThat(notification.getType()).isEqualTo(NotificationType.ALERT_TRIGGERED);
        assertThat(notification.getPriority()).isEqualTo(NotificationPriority.HIGH);
        assertThat(notification.getTitle()).isEqualTo("Alert Triggered: Arsenal dominance");
        assertThat(notification.getMessage()).isEqualTo("Arsenal goals: 2 >= 2");
        assertThat(notification.getUserId()).isEqualTo("user-1");
        assertThat(notification.getData())
                .containsEntry("ruleId", 7L)
                .containsEntry("fixtureId", "1001")
                .containsEntry("homeScore", 2)
                .containsEntry("elapsed", 67);
        assertThat(notification.getId()).isNotBlank();
    }

    @Test
    void renderPatternNotification_mapsSeverityAndMetadata() {
        GamePattern pattern = GamePattern.builder()
                .patternId("momentum_shift_1001_home_0")
                .fixtureId("1001")
                .type(PatternType.MOMENTUM_SHIFT)
                .name("Momentum Shift")
                .description("Momentum changed by 35.0 points")
                .severity(PatternSeverity.HIGH)
                .confidence(0.8)
                .startTime(Instant.now())
                .endTime(Instant.now())
                .meta("side", TeamSide.HOME)
                .build();

        Notification notification = notificationTemplateEngine.renderPatternNotification(pattern, snapshot);

        assertThat(notification.getType()).isEqualTo(NotificationType.PATTERN_DETECTED);
        assertThat(notification.getPriority()).isEqualTo(NotificationPriority.HIGH);
        assertThat(notification.getTitle()).isEqualTo("Momentum Shift");
        assertThat(notification.getUserId()).isNull();
        assertThat(notification.getData())
                .containsEntry("patternType", PatternType.MOMENTUM_SHIFT)
                .containsEntry("side", TeamSide.HOME)
                .containsEntry("match", "Arsenal 2 - 1 Chelsea")
                .containsEntry("confidence", 0.8);
    }
}

package com.touchline.notification;

import com.touchline.domain.enums.NotificationPriority;
import com.touchline.domain.enums.NotificationType;
import com.touchline.domain.model.AlertRule;
import com.touchline.domain.model.GamePattern;
import com.touchline.domain.model.MatchSnapshot;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Renders SMS bodies and WebSocket payloads for fired alerts and detected patterns.
 *
 * <p>SMS bodies are plain text with one fact per line so they read well on a phone
 * lock screen.
 */
@Component
public class NotificationTemplateEngine {

    public String renderAlertSms(AlertRule rule, MatchSnapshot snapshot, String conditionMessage) {
        return String.format(
                "\u26BD TouchLine Alert: %s\n" // soccer ball
                        + "\uD83C\uDFC6 %s\n" // trophy
                        + "\uD83D\uDCCA %s %d - %d %s\n" // bar chart
                        + "\uD83C\uDFAF %s\n" // direct hit
                        + "\u23F0 %d min", // alarm clock
                rule.getName(),
                snapshot.getLeague(),
                snapshot.getHomeTeam(),
                snapshot.getHomeScore(),
                snapshot.getAwayScore(),
                snapshot.getAwayTeam(),
                conditionMessage,
                snapshot.getElapsed());
    }

    public Notification renderAlertNotification(AlertRule rule, MatchSnapshot snapshot, String conditionMessage) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("ruleId", rule.getId());
        data.put("fixtureId", snapshot.getFixtureId());
        data.put("homeTeam", snapshot.getHomeTeam());
        data.put("awayTeam", snapshot.getAwayTeam());
        data.put("homeScore", snapshot.getHomeScore());
        data.put("awayScore", snapshot.getAwayScore());
        data.put("elapsed", snapshot.getElapsed());
        data.put("league", snapshot.getLeague());

        return Notification.builder()
                .type(NotificationType.ALERT_TRIGGERED)
                .priority(NotificationPriority.HIGH)
                .title("Alert Triggered: " + rule.getName())
                .message(conditionMessage)
                .data(data)
                .userId(rule.getUserId())
                .build();
    }

    public Notification renderPatternNotification(GamePattern pattern, MatchSnapshot snapshot) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("patternId", pattern.getPatternId());
        data.put("patternType", pattern.getType());
        data.put("fixtureId", pattern.getFixtureId());
        data.put("confidence", pattern.getConfidence());
        data.putAll(pattern.getMetadata());
        if (snapshot != null) {
            data.put("match", snapshot.getHomeTeam() + " " + snapshot.getHomeScore() + " - "
                    + snapshot.getAwayScore() + " " + snapshot.getAwayTeam());
            data.put("elapsed", snapshot.getElapsed());
        }

        return Notification.builder()
                .type(NotificationType.PATTERN_DETECTED)
                .priority(NotificationPriority.valueOf(pattern.getSeverity().name()))
                .title(pattern.getName())
                .message(pattern.getDescription())
                .data(data)
                .build();
    }
}

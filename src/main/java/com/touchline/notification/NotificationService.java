package com.touchline.notification;

import com.touchline.domain.enums.DispatchStatus;
import com.touchline.domain.enums.NotificationChannel;
import com.touchline.domain.model.AlertRule;
import com.touchline.domain.model.GamePattern;
import com.touchline.domain.model.MatchSnapshot;
import com.touchline.event.PatternDetectedEvent;
import com.touchline.pattern.PatternAlertPolicy;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Delivers fired alerts and detected patterns to users.
 *
 * <p>Fired alerts are dispatched synchronously by the orchestrator through
 * {@link #dispatchAlert} so the outcome can be recorded in the fire history. Each
 * channel is attempted independently; a failing channel is logged and never stops
 * the others. Nothing is retried.
 *
 * <p>Pattern notifications arrive as {@link PatternDetectedEvent}s and are handled
 * on the {@code eventExecutor} so a slow broker never holds up the polling cycle.
 *
 * <p>The last {@value #MAX_RECENT_PER_USER} notifications per user are kept in memory
 * for clients that reconnect.
 */
@Service
public class NotificationService {

    static final int MAX_RECENT_PER_USER = 100;

    private static final String BROADCAST_KEY = "*";

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final NotificationRouter notificationRouter;
    private final SmsNotifier smsNotifier;
    private final WebSocketNotifier webSocketNotifier;
    private final NotificationTemplateEngine notificationTemplateEngine;
    private final PatternAlertPolicy patternAlertPolicy;

    private final Map<String, Deque<Notification>> recentByUser = new ConcurrentHashMap<>();

    public NotificationService(
            NotificationRouter notificationRouter,
            SmsNotifier smsNotifier,
            WebSocketNotifier webSocketNotifier,
            NotificationTemplateEngine notificationTemplateEngine,
            PatternAlertPolicy patternAlertPolicy) {
        this.notificationRouter = notificationRouter;
        this.smsNotifier = smsNotifier;
        this.webSocketNotifier = webSocketNotifier;
        this.notificationTemplateEngine = notificationTemplateEngine;
        this.patternAlertPolicy = patternAlertPolicy;
    }

    /**
     * Sends a fired alert over every resolved channel. The outcome is SENT when at
     * least one channel accepted it.
     */
    public DispatchOutcome dispatchAlert(AlertRule rule, MatchSnapshot snapshot, String conditionMessage) {
        Set<NotificationChannel> channels = notificationRouter.resolveChannels(rule);
        Set<NotificationChannel> delivered = EnumSet.noneOf(NotificationChannel.class);
        String smsMessageId = null;
        List<String> errors = new ArrayList<>();

        for (NotificationChannel channel : channels) {
            try {
                switch (channel) {
                    case SMS -> {
                        SmsResult result = smsNotifier.sendSms(
                                rule.getUserPhone(),
                                notificationTemplateEngine.renderAlertSms(rule, snapshot, conditionMessage));
                        if (result.isSuccess()) {
                            delivered.add(channel);
                            smsMessageId = result.getMessageId();
                        } else {
                            errors.add("SMS: " + result.getError());
                        }
                    }
                    case WEBSOCKET -> {
                        Notification notification =
                                notificationTemplateEngine.renderAlertNotification(rule, snapshot, conditionMessage);
                        remember(notification);
                        if (webSocketNotifier.publish(rule.getUserId(), notification)) {
                            delivered.add(channel);
                        } else {
                            errors.add("WEBSOCKET: publish failed");
                        }
                    }
                }
            } catch (Exception e) {
                log.error("Failed to send notification via {}: {}", channel, e.getMessage());
                errors.add(channel + ": " + e.getMessage());
            }
        }

        DispatchStatus status = delivered.isEmpty() ? DispatchStatus.FAILED : DispatchStatus.SENT;
        if (status == DispatchStatus.FAILED) {
            log.warn("Alert '{}' for fixture {} could not be delivered: {}",
                    rule.getName(), snapshot.getFixtureId(), errors);
        } else {
            log.info("Alert '{}' for fixture {} delivered via {}", rule.getName(), snapshot.getFixtureId(), delivered);
        }

        return DispatchOutcome.builder()
                .status(status)
                .deliveredVia(delivered)
                .smsMessageId(smsMessageId)
                .error(errors.isEmpty() ? null : String.join("; ", errors))
                .build();
    }

    /**
     * Broadcasts newly detected patterns that pass the alert policy.
     */
    @Async("eventExecutor")
    @EventListener
    @Order(15)
    public void onPatternDetected(PatternDetectedEvent event) {
        GamePattern pattern = event.getPattern();
        if (!patternAlertPolicy.shouldAlert(pattern)) {
            log.debug("Pattern {} below alert threshold, not broadcast", pattern.getPatternId());
            return;
        }
        Notification notification = notificationTemplateEngine.renderPatternNotification(pattern, event.getSnapshot());
        remember(notification);
        webSocketNotifier.broadcast(notification);
    }

    /** Most recent notifications for a user, newest first, including broadcasts. */
    public List<Notification> getRecentNotifications(String userId) {
        List<Notification> result = new ArrayList<>();
        for (String key : new String[] {userId, BROADCAST_KEY}) {
            Deque<Notification> recent = key == null ? null : recentByUser.get(key);
            if (recent != null) {
                synchronized (recent) {
                    result.addAll(recent);
                }
            }
        }
        result.sort((a, b) -> b.getTimestamp().compareTo(a.getTimestamp()));
        return result;
    }

    private void remember(Notification notification) {
        String key = notification.getUserId() == null ? BROADCAST_KEY : notification.getUserId();
        Deque<Notification> recent = recentByUser.computeIfAbsent(key, k -> new ArrayDeque<>());
        synchronized (recent) {
            recent.addFirst(notification);
            while (recent.size() > MAX_RECENT_PER_USER) {
                recent.removeLast();
            }
        }
    }
}

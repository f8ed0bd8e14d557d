package com.touchline.notification;

import com.touchline.domain.enums.NotificationChannel;
import com.touchline.domain.model.AlertRule;
import java.util.EnumSet;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Determines which channels a fired rule is delivered through.
 *
 * <ul>
 *   <li>SMS: when the rule carries a phone number and SMS is configured</li>
 *   <li>WebSocket: always, to the rule's user (or broadcast when it has none)</li>
 * </ul>
 */
@Component
public class NotificationRouter {

    private final SmsConfig smsConfig;

    public NotificationRouter(SmsConfig smsConfig) {
        this.smsConfig = smsConfig;
    }

    public Set<NotificationChannel> resolveChannels(AlertRule rule) {
        Set<NotificationChannel> channels = EnumSet.of(NotificationChannel.WEBSOCKET);
        if (rule.getUserPhone() != null && !rule.getUserPhone().isBlank() && smsConfig.isConfigured()) {
            channels.add(NotificationChannel.SMS);
        }
        return channels;
    }
}

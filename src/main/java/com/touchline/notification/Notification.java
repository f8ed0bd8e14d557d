package com.touchline.notification;

import com.touchline.domain.enums.NotificationPriority;
import com.touchline.domain.enums.NotificationType;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;
import lombok.Builder;
import lombok.Data;

/**
 * Payload published to WebSocket subscribers for fired alerts and detected patterns.
 */
@Data
@Builder
public class Notification {

    @Builder.Default
    private String id = UUID.randomUUID().toString();

    private NotificationType type;
    private NotificationPriority priority;
    private String title;
    private String message;
    private Map<String, Object> data;

    /** Target user, null for broadcasts. */
    private String userId;

    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();
}

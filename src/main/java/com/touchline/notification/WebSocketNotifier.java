package com.touchline.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes notifications to STOMP subscribers.
 *
 * <p>Broadcasts go to {@code /topic/alerts}; user-targeted notifications go to the
 * user's {@code /queue/alerts}. Both report success instead of throwing.
 */
@Component
public class WebSocketNotifier {

    static final String BROADCAST_DESTINATION = "/topic/alerts";
    static final String USER_DESTINATION = "/queue/alerts";

    private static final Logger log = LoggerFactory.getLogger(WebSocketNotifier.class);

    private final SimpMessagingTemplate simpMessagingTemplate;

    public WebSocketNotifier(SimpMessagingTemplate simpMessagingTemplate) {
        this.simpMessagingTemplate = simpMessagingTemplate;
    }

    /**
     * Sends to one user, or broadcasts when {@code userId} is null.
     */
    public boolean publish(String userId, Notification notification) {
        try {
            if (userId == null || userId.isBlank()) {
                simpMessagingTemplate.convertAndSend(BROADCAST_DESTINATION, notification);
            } else {
                simpMessagingTemplate.convertAndSendToUser(userId, USER_DESTINATION, notification);
            }
            log.debug("WebSocket notification sent: {}", notification.getTitle());
            return true;
        } catch (Exception e) {
            log.error("Failed to send WebSocket notification: {}", e.getMessage());
            return false;
        }
    }

    public boolean broadcast(Notification notification) {
        return publish(null, notification);
    }
}

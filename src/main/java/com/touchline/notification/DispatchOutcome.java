package com.touchline.notification;

import com.touchline.domain.enums.DispatchStatus;
import com.touchline.domain.enums.NotificationChannel;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Result of delivering one fired alert over its resolved channels.
 */
@Value
@Builder
public class DispatchOutcome {

    DispatchStatus status;

    /** Channels that accepted the notification. */
    Set<NotificationChannel> deliveredVia;

    String smsMessageId;
    String error;

    public static DispatchOutcome failed(String error) {
        return DispatchOutcome.builder()
                .status(DispatchStatus.FAILED)
                .deliveredVia(Set.of())
                .error(error)
                .build();
    }

    /** Preferred channel to record: SMS when it went through, otherwise WebSocket. */
    public NotificationChannel primaryChannel() {
        if (deliveredVia == null || deliveredVia.isEmpty()) {
            return null;
        }
        return deliveredVia.contains(NotificationChannel.SMS) ? NotificationChannel.SMS : NotificationChannel.WEBSOCKET;
    }
}

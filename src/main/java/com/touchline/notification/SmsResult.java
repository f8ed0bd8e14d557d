package com.touchline.notification;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one SMS send attempt. {@code messageId} is the provider's message SID.
 */
@Value
@Builder
public class SmsResult {

    boolean success;
    String messageId;
    String status;
    String error;

    public static SmsResult sent(String messageId, String status) {
        return SmsResult.builder().success(true).messageId(messageId).status(status).build();
    }

    public static SmsResult failed(String error) {
        return SmsResult.builder().success(false).error(error).build();
    }
}

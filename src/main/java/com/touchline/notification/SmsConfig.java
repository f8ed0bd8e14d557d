package com.touchline.notification;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration for the Twilio SMS integration.
 *
 * <p>Reads from application.yml:
 * <pre>
 * notifications.sms.enabled=false
 * notifications.sms.account-sid=${TWILIO_ACCOUNT_SID:}
 * notifications.sms.auth-token=${TWILIO_AUTH_TOKEN:}
 * notifications.sms.from-number=${TWILIO_PHONE_NUMBER:}
 * notifications.sms.max-messages-per-minute=60
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "notifications.sms")
public class SmsConfig {

    private boolean enabled = false;
    private String accountSid;
    private String authToken;
    private String fromNumber;
    private String baseUrl = "https://api.twilio.com";
    private int maxMessagesPerMinute = 60;

    /** True when enabled and every credential needed to call Twilio is present. */
    public boolean isConfigured() {
        return enabled && hasText(accountSid) && hasText(authToken) && hasText(fromNumber);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

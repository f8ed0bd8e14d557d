package com.touchline.notification;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Sends text messages through the Twilio REST API with a per-minute rate limit.
 *
 * <p>Never throws: an unconfigured service, an exhausted rate limit and provider
 * errors all come back as a failed {@link SmsResult} so the caller can record the
 * outcome. Sends are not retried here.
 */
@Component
public class SmsNotifier {

    private static final Logger log = LoggerFactory.getLogger(SmsNotifier.class);

    private static final String MESSAGES_PATH = "/2010-04-01/Accounts/%s/Messages.json";

    private final SmsConfig smsConfig;
    private final RestTemplate restTemplate;

    // One permit per message, each released a minute after use
    private final Semaphore rateLimiter;

    public SmsNotifier(SmsConfig smsConfig, @Qualifier("smsRestTemplate") RestTemplate restTemplate) {
        this.smsConfig = smsConfig;
        this.restTemplate = restTemplate;
        this.rateLimiter = new Semaphore(smsConfig.getMaxMessagesPerMinute());
    }

    public SmsResult sendSms(String phoneNumber, String message) {
        if (!smsConfig.isConfigured()) {
            log.debug("SMS service not configured, skipping message to {}", mask(phoneNumber));
            return SmsResult.failed("SMS service not configured");
        }
        if (phoneNumber == null || phoneNumber.isBlank()) {
            return SmsResult.failed("No phone number");
        }
        if (!rateLimiter.tryAcquire()) {
            log.warn("SMS rate limit of {}/min reached, message to {} dropped",
                    smsConfig.getMaxMessagesPerMinute(), mask(phoneNumber));
            return SmsResult.failed("SMS rate limit reached");
        }
        scheduleRateLimiterRelease();

        try {
            String url = smsConfig.getBaseUrl() + String.format(MESSAGES_PATH, smsConfig.getAccountSid());

            MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
            form.add("To", phoneNumber);
            form.add("From", smsConfig.getFromNumber());
            form.add("Body", message);

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
            headers.setBasicAuth(smsConfig.getAccountSid(), smsConfig.getAuthToken());

            ResponseEntity<JsonNode> response =
                    restTemplate.postForEntity(url, new HttpEntity<>(form, headers), JsonNode.class);
            JsonNode body = response.getBody();
            String sid = body != null ? body.path("sid").asText(null) : null;
            String status = body != null ? body.path("status").asText("queued") : "queued";

            log.info("SMS sent to {}: {}", mask(phoneNumber), sid);
            return SmsResult.sent(sid, status);
        } catch (RestClientException e) {
            log.error("Failed to send SMS to {}: {}", mask(phoneNumber), e.getMessage());
            return SmsResult.failed(e.getMessage());
        }
    }

    private void scheduleRateLimiterRelease() {
        CompletableFuture.delayedExecutor(1, TimeUnit.MINUTES).execute(rateLimiter::release);
    }

    private static String mask(String phoneNumber) {
        if (phoneNumber == null || phoneNumber.length() <= 4) {
            return "****";
        }
        return "****" + phoneNumber.substring(phoneNumber.length() - 4);
    }

    /** Visible for testing: returns available rate limiter permits. */
    public int getAvailablePermits() {
        return rateLimiter.availablePermits();
    }

    /** Visible for testing: drains all available permits so the next send is refused. */
    public void drainPermits() {
        rateLimiter.drainPermits();
    }
}

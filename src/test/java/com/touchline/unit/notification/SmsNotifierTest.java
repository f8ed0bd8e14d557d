package com.touchline.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.touchline.notification.SmsConfig;
import com.touchline.notification.SmsNotifier;
import com.touchline.notification.SmsResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Unit tests for SmsNotifier.
 *
 * <p>Verifies: unconfigured service and missing phone are refused without an HTTP
 * call, a successful send returns the provider SID and consumes a permit, provider
 * errors become failed results, and an exhausted rate limiter drops the message.
 */
@ExtendWith(MockitoExtension.class)
class SmsNotifierTest {

    @Mock
    private RestTemplate restTemplate;

    private SmsConfig smsConfig;
    private SmsNotifier smsNotifier;

    @BeforeEach
    void setUp() {
        smsConfig = new SmsConfig();
        smsConfig.setEnabled(true);
        smsConfig.setAccountSid("AC123");
        smsConfig.setAuthToken("secret");
        smsConfig.setFromNumber("+15005550006");
        smsNotifier = new SmsNotifier(smsConfig, restTemplate);
    }

    @Test
    void sendSms_notConfigured_skipsCall() {
        smsConfig.setEnabled(false);

        SmsResult result = smsNotifier.sendSms("+447700900123", "hello");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("SMS service not configured");
        verify(restTemplate, never()).postForEntity(anyString(), any(), eq(JsonNode.class));
    }

    @Test
    void sendSms_blankPhone_fails() {
        SmsResult result = smsNotifier.sendSms(" ", "hello");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("No phone number");
    }

    @Test
    @SuppressWarnings("unchecked")
    void sendSms_success_returnsSidAndConsumesPermit() {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("sid", "SM42");
        body.put("status", "queued");
        when(restTemplate.postForEntity(anyString(), any(), eq(JsonNode.class))).thenReturn(ResponseEntity.ok(body));
        int permitsBefore = smsNotifier.getAvailablePermits();

        SmsResult result = smsNotifier.sendSms("+447700900123", "Arsenal 2 - 1 Chelsea");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessageId()).isEqualTo("SM42");
        assertThat(result.getStatus()).isEqualTo("queued");
        assertThat(smsNotifier.getAvailablePermits()).isEqualTo(permitsBefore - 1);

        ArgumentCaptor<String> url = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<HttpEntity<?>> request = ArgumentCaptor.forClass(HttpEntity.class);
        verify(restTemplate).postForEntity(url.capture(), request.capture(), eq(JsonNode.class));
        assertThat(url.getValue()).isEqualTo("https://api.twilio.com/2010-04-01/Accounts/AC123/Messages.json");
        assertThat(request.getValue().getHeaders().getFirst("Authorization")).startsWith("Basic ");
    }

    @Test
    void sendSms_providerError_returnsFailure() {
        when(restTemplate.postForEntity(anyString(), any(), eq(JsonNode.class)))
                .thenThrow(new ResourceAccessException("connect timed out"));

        SmsResult result = smsNotifier.sendSms("+447700900123", "hello");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("connect timed out");
    }

    @Test
    void sendSms_rateLimitExhausted_dropsMessage() {
        smsNotifier.drainPermits();

        SmsResult result = smsNotifier.sendSms("+447700900123", "hello");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("SMS rate limit reached");
        verify(restTemplate, never()).postForEntity(anyString(), any(), eq(JsonNode.class));
    }
}

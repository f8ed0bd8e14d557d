package com.touchline.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketTransportRegistration;

/**
 * STOMP broker for alert delivery.
 *
 * <p>Clients connect on {@code /ws}, subscribe to {@code /topic/alerts} for broadcasts
 * and to {@code /user/queue/alerts} for their own rules. Nothing is sent client to
 * server, so no application destinations are mapped.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    private static final long HEARTBEAT_MS = 20_000;
    private static final int MAX_MESSAGE_BYTES = 16 * 1024;
    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_BYTES = 256 * 1024;

    private final String allowedOrigin;
    private final TaskScheduler heartbeatScheduler;

    public WebSocketConfig(
            @Value("${touchline.cors.allowed-origin}") String allowedOrigin,
            @Qualifier("webSocketHeartbeatScheduler") TaskScheduler heartbeatScheduler) {
        this.allowedOrigin = allowedOrigin;
        this.heartbeatScheduler = heartbeatScheduler;
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws").setAllowedOriginPatterns(allowedOrigin.split(","));
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic", "/queue")
                .setHeartbeatValue(new long[] {HEARTBEAT_MS, HEARTBEAT_MS})
                .setTaskScheduler(heartbeatScheduler);
        registry.setUserDestinationPrefix("/user");
    }

    @Override
    public void configureWebSocketTransport(WebSocketTransportRegistration registration) {
        // alert payloads are small; a slow subscriber must not hold broadcasts back
        registration.setMessageSizeLimit(MAX_MESSAGE_BYTES)
                .setSendTimeLimit(SEND_TIME_LIMIT_MS)
                .setSendBufferSizeLimit(SEND_BUFFER_BYTES);
    }
}

package com.touchline.domain.enums;

/**
 * Delivery channels for alert and pattern notifications.
 */
public enum NotificationChannel {

    /** Text message via the Twilio REST API. */
    SMS,

    /** STOMP publish to connected browser clients. */
    WEBSOCKET
}

package com.touchline.domain.enums;

public enum NotificationType {
    ALERT_TRIGGERED,
    PATTERN_DETECTED,
    MATCH_UPDATE,
    SYSTEM
}

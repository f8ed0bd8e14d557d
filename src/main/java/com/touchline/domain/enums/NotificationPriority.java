package com.touchline.domain.enums;

/**
 * Priority carried on published notifications. Pattern notifications map their
 * severity one-to-one onto this scale; rule alerts are always HIGH.
 */
public enum NotificationPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}

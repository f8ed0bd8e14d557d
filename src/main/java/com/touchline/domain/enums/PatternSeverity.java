package com.touchline.domain.enums;

/**
 * Severity of a detected pattern. Declaration order is significant: alert
 * thresholds compare ordinals, so a pattern passes when its severity is at or
 * above the configured one.
 */
public enum PatternSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(PatternSeverity threshold) {
        return ordinal() >= threshold.ordinal();
    }
}

package com.touchline.domain.enums;

/**
 * Delivery state of a fire record. The fire decision itself is final as soon as the
 * record exists; this only tracks what happened to the notification.
 */
public enum DispatchStatus {
    /** Claimed, dispatch not yet attempted or still running. */
    PENDING,
    /** At least one channel accepted the notification. */
    SENT,
    /** Every channel failed. The rule does not fire again for this match. */
    FAILED
}

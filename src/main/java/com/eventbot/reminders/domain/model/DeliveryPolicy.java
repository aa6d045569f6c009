package com.eventbot.reminders.domain.model;

import java.time.Duration;

/**
 * Bounds applied to reminder delivery: how long one send may take and how many transient
 * failures a reminder tolerates before it is abandoned.
 */
public record DeliveryPolicy(
        int maxAttempts,
        Duration sendTimeout
) {
    public DeliveryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (sendTimeout == null || sendTimeout.isNegative() || sendTimeout.isZero()) {
            throw new IllegalArgumentException("sendTimeout must be positive");
        }
    }
}

package com.eventbot.reminders.domain.model;

import java.time.Instant;

/**
 * Outcome of one scan-dispatch-transition cycle of the delivery loop.
 */
public record DeliveryRunSummary(
        Instant startedAt,
        int scanned,
        int delivered,
        int unreachable,
        int retrying,
        int abandoned,
        boolean skipped
) {
    public static DeliveryRunSummary skipped(Instant startedAt) {
        return new DeliveryRunSummary(startedAt, 0, 0, 0, 0, 0, true);
    }
}

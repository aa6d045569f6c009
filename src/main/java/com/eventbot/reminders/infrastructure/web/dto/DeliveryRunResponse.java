package com.eventbot.reminders.infrastructure.web.dto;

import com.eventbot.reminders.domain.model.DeliveryRunSummary;
import java.time.Instant;

public record DeliveryRunResponse(
        Instant started_at,
        int scanned,
        int delivered,
        int unreachable,
        int retrying,
        int abandoned,
        boolean skipped
) {
    public static DeliveryRunResponse fromSummary(DeliveryRunSummary summary) {
        return new DeliveryRunResponse(
                summary.startedAt(),
                summary.scanned(),
                summary.delivered(),
                summary.unreachable(),
                summary.retrying(),
                summary.abandoned(),
                summary.skipped());
    }
}

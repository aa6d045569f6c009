package com.eventbot.reminders.infrastructure.web.dto;

import com.eventbot.reminders.domain.model.DeliveryRunSummary;
import java.util.Optional;

public record DeliveryStatusResponse(
        String status,
        DeliveryRunResponse last_run
) {
    public static DeliveryStatusResponse of(String status, Optional<DeliveryRunSummary> lastRun) {
        return new DeliveryStatusResponse(status, lastRun.map(DeliveryRunResponse::fromSummary).orElse(null));
    }
}

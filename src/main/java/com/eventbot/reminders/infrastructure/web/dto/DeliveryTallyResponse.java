package com.eventbot.reminders.infrastructure.web.dto;

import com.eventbot.reminders.domain.model.DeliveryTally;

public record DeliveryTallyResponse(
        int delivered,
        int unreachable,
        int failed
) {
    public static DeliveryTallyResponse fromTally(DeliveryTally tally) {
        return new DeliveryTallyResponse(tally.delivered(), tally.unreachable(), tally.failed());
    }
}

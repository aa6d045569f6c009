package com.eventbot.reminders.infrastructure.web.dto;

import com.eventbot.reminders.application.EventCancellation;

public record CancelEventResponse(
        EventResponse event,
        boolean already_cancelled,
        DeliveryTallyResponse notified
) {
    public static CancelEventResponse fromCancellation(EventCancellation cancellation) {
        return new CancelEventResponse(
                EventResponse.fromEvent(cancellation.event()),
                cancellation.alreadyCancelled(),
                DeliveryTallyResponse.fromTally(cancellation.notified()));
    }
}

package com.eventbot.reminders.infrastructure.web.dto;

import com.eventbot.reminders.application.EventPublication;

public record PublishEventResponse(
        EventResponse event,
        DeliveryTallyResponse announcement
) {
    public static PublishEventResponse fromPublication(EventPublication publication) {
        return new PublishEventResponse(
                EventResponse.fromEvent(publication.event()),
                DeliveryTallyResponse.fromTally(publication.announcement()));
    }
}

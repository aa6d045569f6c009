package com.eventbot.reminders.infrastructure.web.dto;

import com.eventbot.reminders.domain.model.Event;
import com.eventbot.reminders.domain.model.EventCategory;
import com.eventbot.reminders.domain.model.EventFormat;
import com.eventbot.reminders.infrastructure.web.CalendarLinks;
import java.time.Instant;
import java.util.List;

public record EventResponse(
        long id,
        String title,
        EventCategory category,
        EventFormat format,
        Instant starts_at,
        String location,
        String description,
        String organizer_contact,
        boolean cancelled,
        Instant created_at,
        String calendar_url
) {
    public static EventResponse fromEvent(Event event) {
        return new EventResponse(
                event.id(),
                event.title(),
                event.category(),
                event.format(),
                event.startsAt(),
                event.location(),
                event.description(),
                event.organizerContact(),
                event.cancelled(),
                event.createdAt(),
                CalendarLinks.google(event)
        );
    }

    public static List<EventResponse> fromEvents(List<Event> events) {
        return events.stream()
                .map(EventResponse::fromEvent)
                .toList();
    }
}

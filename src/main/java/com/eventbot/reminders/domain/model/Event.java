package com.eventbot.reminders.domain.model;

import java.time.Instant;

public record Event(
        long id,
        String title,
        EventCategory category,
        EventFormat format,
        Instant startsAt,
        String location,
        String description,
        String organizerContact,
        Long createdBy,
        boolean cancelled,
        Instant createdAt
) {
    public boolean hasStartedAt(Instant now) {
        return !startsAt.isAfter(now);
    }
}

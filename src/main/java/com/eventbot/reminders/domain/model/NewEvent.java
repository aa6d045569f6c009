package com.eventbot.reminders.domain.model;

import java.time.Instant;

/**
 * Fully populated event creation payload, as collected by the creation form.
 */
public record NewEvent(
        String title,
        EventCategory category,
        EventFormat format,
        Instant startsAt,
        String location,
        String description,
        String organizerContact,
        Long createdBy
) {
}

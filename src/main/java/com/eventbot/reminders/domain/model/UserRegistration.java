package com.eventbot.reminders.domain.model;

import java.time.Instant;

/**
 * A user's registration joined with the event it points at.
 */
public record UserRegistration(
        long registrationId,
        RegistrationStatus status,
        Instant registeredAt,
        Event event
) {
}

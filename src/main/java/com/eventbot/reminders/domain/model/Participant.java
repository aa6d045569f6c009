package com.eventbot.reminders.domain.model;

import java.time.Instant;

/**
 * A registration of an event joined with the registrant's names.
 */
public record Participant(
        long registrationId,
        long userId,
        String firstName,
        String username,
        RegistrationStatus status,
        Instant registeredAt
) {
}

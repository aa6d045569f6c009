package com.eventbot.reminders.domain.model;

import java.time.Instant;

public record Registration(
        long id,
        long userId,
        long eventId,
        RegistrationStatus status,
        Instant createdAt
) {
    public boolean isActive() {
        return status == RegistrationStatus.ACTIVE;
    }
}

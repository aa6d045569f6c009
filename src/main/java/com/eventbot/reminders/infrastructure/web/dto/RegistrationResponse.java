package com.eventbot.reminders.infrastructure.web.dto;

import com.eventbot.reminders.domain.model.Registration;
import com.eventbot.reminders.domain.model.RegistrationStatus;
import java.time.Instant;

public record RegistrationResponse(
        long id,
        long user_id,
        long event_id,
        RegistrationStatus status,
        Instant created_at
) {
    public static RegistrationResponse fromRegistration(Registration registration) {
        return new RegistrationResponse(
                registration.id(),
                registration.userId(),
                registration.eventId(),
                registration.status(),
                registration.createdAt());
    }
}

package com.eventbot.reminders.infrastructure.web.dto;

import com.eventbot.reminders.domain.model.RegistrationStatus;
import com.eventbot.reminders.domain.model.UserRegistration;
import java.time.Instant;
import java.util.List;

public record UserRegistrationResponse(
        long registration_id,
        RegistrationStatus status,
        Instant registered_at,
        EventResponse event
) {
    public static List<UserRegistrationResponse> fromRegistrations(List<UserRegistration> registrations) {
        return registrations.stream()
                .map(r -> new UserRegistrationResponse(
                        r.registrationId(), r.status(), r.registeredAt(), EventResponse.fromEvent(r.event())))
                .toList();
    }
}

package com.eventbot.reminders.infrastructure.web.dto;

import com.eventbot.reminders.domain.model.Participant;
import com.eventbot.reminders.domain.model.RegistrationStatus;
import java.time.Instant;
import java.util.List;

public record ParticipantResponse(
        long registration_id,
        long user_id,
        String first_name,
        String username,
        RegistrationStatus status,
        Instant registered_at
) {
    public static List<ParticipantResponse> fromParticipants(List<Participant> participants) {
        return participants.stream()
                .map(p -> new ParticipantResponse(
                        p.registrationId(), p.userId(), p.firstName(), p.username(), p.status(), p.registeredAt()))
                .toList();
    }
}

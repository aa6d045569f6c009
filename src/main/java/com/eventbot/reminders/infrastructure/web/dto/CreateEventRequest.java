package com.eventbot.reminders.infrastructure.web.dto;

import com.eventbot.reminders.domain.model.EventCategory;
import com.eventbot.reminders.domain.model.EventFormat;
import com.eventbot.reminders.domain.model.NewEvent;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;

public record CreateEventRequest(
        @NotBlank @Size(max = 255) String title,
        @NotNull EventCategory category,
        @NotNull EventFormat format,
        @NotNull Instant starts_at,
        @NotBlank @Size(min = 3) String location,
        String description,
        @NotBlank String organizer_contact,
        Long created_by
) {
    public NewEvent toNewEvent() {
        return new NewEvent(
                title.strip(),
                category,
                format,
                starts_at,
                location.strip(),
                description,
                organizer_contact.strip(),
                created_by
        );
    }
}

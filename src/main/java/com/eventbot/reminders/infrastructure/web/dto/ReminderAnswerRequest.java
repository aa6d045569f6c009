package com.eventbot.reminders.infrastructure.web.dto;

import jakarta.validation.constraints.NotNull;

public record ReminderAnswerRequest(
        @NotNull Boolean attending
) {}

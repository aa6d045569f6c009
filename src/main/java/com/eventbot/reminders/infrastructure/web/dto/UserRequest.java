package com.eventbot.reminders.infrastructure.web.dto;

import jakarta.validation.constraints.NotBlank;

public record UserRequest(
        @NotBlank String first_name,
        String username
) {}

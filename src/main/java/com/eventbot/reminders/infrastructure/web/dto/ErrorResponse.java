package com.eventbot.reminders.infrastructure.web.dto;

public record ErrorResponse(
        String error,
        String message
) {}

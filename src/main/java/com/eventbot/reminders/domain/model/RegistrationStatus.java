package com.eventbot.reminders.domain.model;

public enum RegistrationStatus {
    ACTIVE,
    CANCELLED
}

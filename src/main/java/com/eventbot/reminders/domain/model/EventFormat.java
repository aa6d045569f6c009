package com.eventbot.reminders.domain.model;

public enum EventFormat {
    ONLINE,
    OFFLINE
}

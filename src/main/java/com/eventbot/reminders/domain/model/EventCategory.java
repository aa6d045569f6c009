package com.eventbot.reminders.domain.model;

import java.util.Arrays;

public enum EventCategory {
    IT,
    SPORT,
    BOOKS;

    public static EventCategory fromCode(String code) {
        return Arrays.stream(values())
                .filter(category -> category.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown event category: " + code));
    }
}

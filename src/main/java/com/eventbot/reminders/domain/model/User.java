package com.eventbot.reminders.domain.model;

import java.time.Instant;

public record User(
        long id,
        String firstName,
        String username,
        boolean notifyIt,
        boolean notifySport,
        boolean notifyBooks,
        Instant createdAt
) {
    public boolean isSubscribedTo(EventCategory category) {
        return switch (category) {
            case IT -> notifyIt;
            case SPORT -> notifySport;
            case BOOKS -> notifyBooks;
        };
    }
}

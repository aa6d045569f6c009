package com.eventbot.reminders.domain.model;

import java.time.Instant;

public record ScheduledReminder(
        long id,
        long registrationId,
        Instant remindAt,
        ReminderType type,
        boolean sent,
        int attempts,
        boolean abandoned,
        Instant sentAt
) {
}

package com.eventbot.reminders.domain.model;

import java.time.Instant;

/**
 * A reminder ready to fire, with everything needed to render and address it.
 */
public record DueReminder(
        long reminderId,
        long registrationId,
        ReminderType type,
        Instant remindAt,
        int attempts,
        long userId,
        String firstName,
        Event event
) {
}

package com.eventbot.reminders.infrastructure.web.dto;

import com.eventbot.reminders.domain.model.NotificationPreferences;

/**
 * Omitted flags are left unchanged.
 */
public record NotificationPreferencesRequest(
        Boolean notify_it,
        Boolean notify_sport,
        Boolean notify_books
) {
    public NotificationPreferences toPreferences() {
        return new NotificationPreferences(notify_it, notify_sport, notify_books);
    }
}

package com.eventbot.reminders.domain.model;

/**
 * Partial update of a user's category subscriptions. A null flag leaves the stored value untouched.
 */
public record NotificationPreferences(
        Boolean notifyIt,
        Boolean notifySport,
        Boolean notifyBooks
) {
    public static NotificationPreferences only(EventCategory category, boolean enabled) {
        return switch (category) {
            case IT -> new NotificationPreferences(enabled, null, null);
            case SPORT -> new NotificationPreferences(null, enabled, null);
            case BOOKS -> new NotificationPreferences(null, null, enabled);
        };
    }

    public boolean isEmpty() {
        return notifyIt == null && notifySport == null && notifyBooks == null;
    }
}

package com.eventbot.reminders.domain.model;

/**
 * An interactive button attached to a message; the callback data is echoed back when pressed.
 */
public record MessageAction(
        String label,
        String callbackData
) {
}

package com.eventbot.reminders.domain.model;

public enum DeliveryOutcome {
    DELIVERED,
    /** The recipient blocked or deactivated their account; never retried. */
    RECIPIENT_UNREACHABLE,
    TRANSIENT_FAILURE;

    public boolean isTerminal() {
        return this != TRANSIENT_FAILURE;
    }
}

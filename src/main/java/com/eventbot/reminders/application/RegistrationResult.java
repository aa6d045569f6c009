package com.eventbot.reminders.application;

import com.eventbot.reminders.domain.model.Registration;
import com.eventbot.reminders.domain.model.ScheduledReminder;
import java.util.List;

public record RegistrationResult(
        Status status,
        Registration registration,
        List<ScheduledReminder> reminders
) {
    public enum Status {
        REGISTERED,
        ALREADY_REGISTERED,
        USER_NOT_FOUND,
        EVENT_NOT_FOUND,
        EVENT_CANCELLED,
        EVENT_ALREADY_STARTED
    }

    public static RegistrationResult rejected(Status status) {
        return new RegistrationResult(status, null, List.of());
    }

    public boolean isRegistered() {
        return status == Status.REGISTERED || status == Status.ALREADY_REGISTERED;
    }
}

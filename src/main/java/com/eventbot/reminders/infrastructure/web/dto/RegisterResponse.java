package com.eventbot.reminders.infrastructure.web.dto;

import com.eventbot.reminders.application.RegistrationResult;
import com.eventbot.reminders.domain.model.ScheduledReminder;
import java.time.Instant;
import java.util.List;

public record RegisterResponse(
        RegistrationResult.Status result,
        RegistrationResponse registration,
        List<ReminderDto> reminders
) {
    public static RegisterResponse fromResult(RegistrationResult result) {
        return new RegisterResponse(
                result.status(),
                result.registration() != null ? RegistrationResponse.fromRegistration(result.registration()) : null,
                result.reminders().stream().map(ReminderDto::fromReminder).toList());
    }

    public record ReminderDto(
            long id,
            String type,
            Instant remind_at
    ) {
        public static ReminderDto fromReminder(ScheduledReminder reminder) {
            return new ReminderDto(reminder.id(), reminder.type().code(), reminder.remindAt());
        }
    }
}

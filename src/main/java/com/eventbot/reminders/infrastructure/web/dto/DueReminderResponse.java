package com.eventbot.reminders.infrastructure.web.dto;

import com.eventbot.reminders.domain.model.DueReminder;
import java.time.Instant;
import java.util.List;

public record DueReminderResponse(
        long reminder_id,
        long registration_id,
        String type,
        Instant remind_at,
        int attempts,
        long user_id,
        long event_id,
        String event_title
) {
    public static List<DueReminderResponse> fromReminders(List<DueReminder> reminders) {
        return reminders.stream()
                .map(r -> new DueReminderResponse(
                        r.reminderId(),
                        r.registrationId(),
                        r.type().code(),
                        r.remindAt(),
                        r.attempts(),
                        r.userId(),
                        r.event().id(),
                        r.event().title()))
                .toList();
    }
}

package com.eventbot.reminders.application;

import com.eventbot.reminders.domain.model.ReminderType;
import com.eventbot.reminders.domain.model.ScheduledReminder;
import com.eventbot.reminders.domain.port.out.ReminderRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a registration into its reminder rows. Fire times that are not strictly in the future are skipped.
 */
@Component
public class ReminderDerivation {

    private static final Logger logger = LoggerFactory.getLogger(ReminderDerivation.class);

    private final ReminderRepository reminderRepository;
    private final Clock clock;

    public ReminderDerivation(ReminderRepository reminderRepository, Clock clock) {
        this.reminderRepository = reminderRepository;
        this.clock = clock;
    }

    public List<ScheduledReminder> deriveAndPersist(long registrationId, Instant eventStartsAt) {
        Instant now = clock.instant();
        List<ScheduledReminder> created = new ArrayList<>();

        for (ReminderType type : ReminderType.values()) {
            Instant remindAt = type.fireTimeFor(eventStartsAt);
            if (!remindAt.isAfter(now)) {
                logger.debug("Skipping {} reminder for registration {}: {} is not in the future",
                        type.code(), registrationId, remindAt);
                continue;
            }
            reminderRepository.insert(registrationId, remindAt, type).ifPresent(created::add);
        }

        logger.info("Scheduled {} reminder(s) for registration {}", created.size(), registrationId);
        return created;
    }
}

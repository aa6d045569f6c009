package com.eventbot.reminders.domain.port.out;

import com.eventbot.reminders.domain.model.DueReminder;
import com.eventbot.reminders.domain.model.ReminderType;
import com.eventbot.reminders.domain.model.ScheduledReminder;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository port for scheduled reminders
 */
public interface ReminderRepository {

    /**
     * Empty when an unsent reminder of the same type already exists for the registration
     */
    Optional<ScheduledReminder> insert(long registrationId, Instant remindAt, ReminderType type);

    /**
     * Unsent reminders due at {@code now} whose registration is active and whose event is not cancelled,
     * oldest first
     */
    List<DueReminder> findDue(Instant now);

    List<ScheduledReminder> findByRegistration(long registrationId);

    /**
     * Still unsent, its registration still active and its event not cancelled
     */
    boolean isDeliverable(long reminderId);

    /**
     * @return false when the reminder was already sent
     */
    boolean markSent(long reminderId, Instant sentAt);

    /**
     * @return attempts recorded so far, including this one
     */
    int recordFailedAttempt(long reminderId);

    /**
     * Stop retrying: the reminder is marked sent and flagged abandoned
     */
    boolean markAbandoned(long reminderId, Instant at);

    /**
     * Sent reminders are history and stay
     */
    int deleteUnsent(long registrationId);

    /**
     * Suppress every reminder of every registration of the event
     */
    int markAllSentForEvent(long eventId, Instant at);
}

package com.eventbot.reminders.application;

import com.eventbot.reminders.domain.model.Event;
import com.eventbot.reminders.domain.model.Registration;
import com.eventbot.reminders.domain.port.out.EventRepository;
import com.eventbot.reminders.domain.port.out.RegistrationRepository;
import com.eventbot.reminders.domain.port.out.ReminderRepository;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Keeps reminder rows consistent with the registration and event they belong to.
 * Both steps of each cascade are idempotent, so re-running after a crash is harmless.
 */
@Component
public class CancellationCascade {

    private static final Logger logger = LoggerFactory.getLogger(CancellationCascade.class);

    private final RegistrationRepository registrationRepository;
    private final EventRepository eventRepository;
    private final ReminderRepository reminderRepository;
    private final Clock clock;

    public CancellationCascade(RegistrationRepository registrationRepository,
                               EventRepository eventRepository,
                               ReminderRepository reminderRepository,
                               Clock clock) {
        this.registrationRepository = registrationRepository;
        this.eventRepository = eventRepository;
        this.reminderRepository = reminderRepository;
        this.clock = clock;
    }

    /**
     * Drops the registration's unsent reminders, then cancels it.
     * Empty when there was no active registration to cancel.
     */
    @Transactional
    public Optional<Registration> onRegistrationCancelled(long userId, long eventId) {
        Optional<Registration> registration = registrationRepository.find(userId, eventId);
        if (registration.isEmpty()) {
            return Optional.empty();
        }

        int removed = reminderRepository.deleteUnsent(registration.get().id());
        Optional<Registration> cancelled = registrationRepository.cancel(userId, eventId);

        logger.info("Registration {} of user {} for event {} cancelled, {} pending reminder(s) removed",
                registration.get().id(), userId, eventId, removed);
        return cancelled;
    }

    /**
     * Marks every reminder of the event as sent, then flips the cancelled flag.
     * Empty when the event is missing or already cancelled.
     */
    @Transactional
    public Optional<Event> onEventCancelled(long eventId) {
        int suppressed = reminderRepository.markAllSentForEvent(eventId, clock.instant());
        Optional<Event> cancelled = eventRepository.cancel(eventId);

        logger.info("Event {} cancelled, {} reminder(s) suppressed", eventId, suppressed);
        return cancelled;
    }
}

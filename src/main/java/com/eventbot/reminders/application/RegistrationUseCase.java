package com.eventbot.reminders.application;

import com.eventbot.reminders.application.RegistrationResult.Status;
import com.eventbot.reminders.domain.model.Event;
import com.eventbot.reminders.domain.model.Participant;
import com.eventbot.reminders.domain.model.Registration;
import com.eventbot.reminders.domain.model.ScheduledReminder;
import com.eventbot.reminders.domain.model.UserRegistration;
import com.eventbot.reminders.domain.port.out.EventRepository;
import com.eventbot.reminders.domain.port.out.RegistrationRepository;
import com.eventbot.reminders.domain.port.out.UserRepository;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class RegistrationUseCase implements ManageRegistrations {

    private static final Logger logger = LoggerFactory.getLogger(RegistrationUseCase.class);

    private final UserRepository userRepository;
    private final EventRepository eventRepository;
    private final RegistrationRepository registrationRepository;
    private final ReminderDerivation reminderDerivation;
    private final CancellationCascade cancellationCascade;
    private final Clock clock;

    public RegistrationUseCase(UserRepository userRepository,
                               EventRepository eventRepository,
                               RegistrationRepository registrationRepository,
                               ReminderDerivation reminderDerivation,
                               CancellationCascade cancellationCascade,
                               Clock clock) {
        this.userRepository = userRepository;
        this.eventRepository = eventRepository;
        this.registrationRepository = registrationRepository;
        this.reminderDerivation = reminderDerivation;
        this.cancellationCascade = cancellationCascade;
        this.clock = clock;
    }

    /**
     * The registration row and its reminders are written in one transaction. A repeated registration
     * fills in any reminder that is missing; pending ones are never duplicated.
     */
    @Override
    @Transactional
    public RegistrationResult register(long userId, long eventId) {
        if (userRepository.findById(userId).isEmpty()) {
            logger.warn("Registration refused, user {} not found", userId);
            return RegistrationResult.rejected(Status.USER_NOT_FOUND);
        }

        Optional<Event> found = eventRepository.findById(eventId);
        if (found.isEmpty()) {
            logger.warn("Registration refused, event {} not found", eventId);
            return RegistrationResult.rejected(Status.EVENT_NOT_FOUND);
        }
        Event event = found.get();
        if (event.cancelled()) {
            return RegistrationResult.rejected(Status.EVENT_CANCELLED);
        }
        if (event.hasStartedAt(clock.instant())) {
            return RegistrationResult.rejected(Status.EVENT_ALREADY_STARTED);
        }

        Optional<Registration> existing = registrationRepository.find(userId, eventId);
        if (existing.isPresent() && existing.get().isActive()) {
            List<ScheduledReminder> restored =
                    reminderDerivation.deriveAndPersist(existing.get().id(), event.startsAt());
            if (!restored.isEmpty()) {
                logger.warn("Restored {} missing reminder(s) for registration {}", restored.size(), existing.get().id());
            }
            return new RegistrationResult(Status.ALREADY_REGISTERED, existing.get(), restored);
        }

        Registration registration = registrationRepository.upsertActive(userId, eventId);
        List<ScheduledReminder> reminders = reminderDerivation.deriveAndPersist(registration.id(), event.startsAt());

        logger.info("User {} registered for event {} (registration {})", userId, eventId, registration.id());
        return new RegistrationResult(Status.REGISTERED, registration, reminders);
    }

    @Override
    public Optional<Registration> cancel(long userId, long eventId) {
        return cancellationCascade.onRegistrationCancelled(userId, eventId);
    }

    @Override
    public Optional<Registration> respondToReminder(long registrationId, boolean attending) {
        Optional<Registration> registration = registrationRepository.findById(registrationId);
        if (registration.isEmpty()) {
            logger.warn("Reminder response for unknown registration {}", registrationId);
            return Optional.empty();
        }

        Registration current = registration.get();
        if (attending) {
            logger.info("User {} confirmed attendance of event {}", current.userId(), current.eventId());
            return registration;
        }
        if (!current.isActive()) {
            return registration;
        }

        logger.info("User {} declined event {} from reminder", current.userId(), current.eventId());
        return cancellationCascade.onRegistrationCancelled(current.userId(), current.eventId());
    }

    @Override
    public Optional<Registration> findRegistration(long userId, long eventId) {
        return registrationRepository.find(userId, eventId);
    }

    @Override
    public List<Participant> listForEvent(long eventId, boolean activeOnly) {
        return registrationRepository.findByEvent(eventId, activeOnly);
    }

    @Override
    public List<UserRegistration> listForUser(long userId, boolean activeOnly) {
        return registrationRepository.findByUser(userId, activeOnly);
    }

    @Override
    public int countActive(long eventId) {
        return registrationRepository.countActive(eventId);
    }
}

package com.eventbot.reminders.domain.port.out;

import com.eventbot.reminders.domain.model.Participant;
import com.eventbot.reminders.domain.model.Registration;
import com.eventbot.reminders.domain.model.UserRegistration;
import java.util.List;
import java.util.Optional;

/**
 * Repository port for registrations. At most one row exists per (user, event) pair.
 */
public interface RegistrationRepository {

    /**
     * Insert the registration, or reactivate the existing row for the same pair
     */
    Registration upsertActive(long userId, long eventId);

    /**
     * Set status to cancelled. Empty when there is no active registration for the pair.
     */
    Optional<Registration> cancel(long userId, long eventId);

    Optional<Registration> find(long userId, long eventId);

    Optional<Registration> findById(long id);

    List<Participant> findByEvent(long eventId, boolean activeOnly);

    /**
     * Registrations of a user with their events. Active-only also hides cancelled events.
     */
    List<UserRegistration> findByUser(long userId, boolean activeOnly);

    int countActive(long eventId);
}

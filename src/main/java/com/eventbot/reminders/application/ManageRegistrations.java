package com.eventbot.reminders.application;

import com.eventbot.reminders.domain.model.Participant;
import com.eventbot.reminders.domain.model.Registration;
import com.eventbot.reminders.domain.model.UserRegistration;
import java.util.List;
import java.util.Optional;

/**
 * Interface for registering users to events and cancelling those registrations.
 */
public interface ManageRegistrations {

    /**
     * Creates or reactivates the registration of a user to an event and schedules its reminders.
     *
     * @return the outcome; rejections carry no registration
     */
    RegistrationResult register(long userId, long eventId);

    /**
     * Cancels an active registration and drops its pending reminders.
     *
     * @return the cancelled registration, or empty when there was nothing active to cancel
     */
    Optional<Registration> cancel(long userId, long eventId);

    /**
     * Handles the answer to a 24-hour reminder. Declining cancels the registration.
     *
     * @return the registration in its resulting state, or empty when it does not exist
     */
    Optional<Registration> respondToReminder(long registrationId, boolean attending);

    Optional<Registration> findRegistration(long userId, long eventId);

    List<Participant> listForEvent(long eventId, boolean activeOnly);

    List<UserRegistration> listForUser(long userId, boolean activeOnly);

    int countActive(long eventId);
}

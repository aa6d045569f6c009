package com.eventbot.reminders.application;

import com.eventbot.reminders.domain.model.DeliveryTally;
import com.eventbot.reminders.domain.model.Event;
import com.eventbot.reminders.domain.model.EventCategory;
import com.eventbot.reminders.domain.model.NewEvent;
import com.eventbot.reminders.domain.model.Participant;
import java.util.List;
import java.util.Optional;

/**
 * Interface for the organizer side of the event lifecycle.
 */
public interface ManageEvents {

    /**
     * Validates and stores a new event, then announces it to the subscribers of its category.
     *
     * @throws com.eventbot.reminders.domain.model.InvalidEventException when the payload is rejected
     */
    EventPublication publishEvent(NewEvent event);

    Optional<Event> findEvent(long id);

    /**
     * @param category optional category filter
     * @param limit maximum number of events; null means the default page size
     */
    List<Event> listUpcoming(Optional<EventCategory> category, Integer limit);

    List<Event> listAll(boolean includeCancelled);

    /**
     * Cancels the event, suppresses its reminders and notifies its active participants.
     *
     * @return empty when the event does not exist
     */
    Optional<EventCancellation> cancelEvent(long id);

    /**
     * Sends a free-text message to the active participants of the event.
     *
     * @return empty when the event does not exist
     */
    Optional<DeliveryTally> broadcastToParticipants(long id, String text);

    List<Participant> listParticipants(long id, boolean activeOnly);

    int countActiveRegistrations(long id);
}

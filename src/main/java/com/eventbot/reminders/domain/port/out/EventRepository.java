package com.eventbot.reminders.domain.port.out;

import com.eventbot.reminders.domain.model.Event;
import com.eventbot.reminders.domain.model.EventCategory;
import com.eventbot.reminders.domain.model.NewEvent;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository port for the Event aggregate
 */
public interface EventRepository {

    /**
     * Persist a new event and return it with its assigned id
     */
    Event create(NewEvent event);

    Optional<Event> findById(long id);

    /**
     * Non-cancelled events starting after {@code now}, earliest first
     */
    List<Event> findUpcoming(Optional<EventCategory> category, int limit, Instant now);

    /**
     * Flip the cancelled flag. Empty when the event is missing or was already cancelled.
     */
    Optional<Event> cancel(long id);

    /**
     * All events, latest start first
     */
    List<Event> findAll(boolean includeCancelled);
}

package com.eventbot.reminders.application;

import com.eventbot.reminders.domain.model.DeliveryTally;
import com.eventbot.reminders.domain.model.Event;

/**
 * Result of cancelling an event. When the event was already cancelled nobody is notified.
 */
public record EventCancellation(
        Event event,
        boolean alreadyCancelled,
        DeliveryTally notified
) {
}

package com.eventbot.reminders.domain.port.out;

import com.eventbot.reminders.domain.model.DueReminder;
import com.eventbot.reminders.domain.model.Event;
import com.eventbot.reminders.domain.model.OutboundMessage;

/**
 * Renders records into message bodies. Implementations must be side-effect free.
 */
public interface MessageFormatter {

    OutboundMessage reminder(DueReminder reminder);

    OutboundMessage newEventAnnouncement(Event event);

    OutboundMessage cancellationNotice(Event event);

    OutboundMessage organizerBroadcast(Event event, String text);
}

package com.eventbot.reminders.application;

import com.eventbot.reminders.domain.model.DeliveryTally;
import com.eventbot.reminders.domain.model.Event;

public record EventPublication(
        Event event,
        DeliveryTally announcement
) {
}

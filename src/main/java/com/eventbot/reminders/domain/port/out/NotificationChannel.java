package com.eventbot.reminders.domain.port.out;

import com.eventbot.reminders.domain.model.DeliveryOutcome;
import com.eventbot.reminders.domain.model.OutboundMessage;
import java.util.concurrent.CompletableFuture;

/**
 * Outbound messaging platform.
 * Implementations classify the platform response instead of failing the future where they can.
 */
public interface NotificationChannel {

    /**
     * Sends a message to a single recipient.
     *
     * @param recipientId platform id of the recipient
     * @param message text and optional interactive actions
     * @return the classified outcome of the send
     */
    CompletableFuture<DeliveryOutcome> send(long recipientId, OutboundMessage message);
}

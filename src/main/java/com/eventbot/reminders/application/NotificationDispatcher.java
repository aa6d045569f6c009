package com.eventbot.reminders.application;

import com.eventbot.reminders.domain.model.DeliveryOutcome;
import com.eventbot.reminders.domain.model.DeliveryPolicy;
import com.eventbot.reminders.domain.model.DeliveryTally;
import com.eventbot.reminders.domain.model.OutboundMessage;
import com.eventbot.reminders.domain.port.out.NotificationChannel;
import java.util.Collection;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sends through the notification channel and turns every failure into a classified outcome.
 * Nothing thrown by the channel escapes this class.
 */
@Component
public class NotificationDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final NotificationChannel channel;
    private final DeliveryPolicy policy;

    public NotificationDispatcher(NotificationChannel channel, DeliveryPolicy policy) {
        this.channel = channel;
        this.policy = policy;
    }

    public DeliveryOutcome send(long recipientId, OutboundMessage message) {
        CompletableFuture<DeliveryOutcome> pending = null;
        try {
            pending = channel.send(recipientId, message);
            DeliveryOutcome outcome = pending.get(policy.sendTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (outcome == null) {
                logger.warn("Channel returned no outcome for recipient {}", recipientId);
                return DeliveryOutcome.TRANSIENT_FAILURE;
            }
            return outcome;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while sending to recipient {}", recipientId);
            return DeliveryOutcome.TRANSIENT_FAILURE;
        } catch (TimeoutException e) {
            pending.cancel(true);
            logger.warn("Send to recipient {} timed out after {}", recipientId, policy.sendTimeout());
            return DeliveryOutcome.TRANSIENT_FAILURE;
        } catch (ExecutionException | RuntimeException e) {
            logger.warn("Send to recipient {} failed: {}", recipientId, e.getMessage());
            return DeliveryOutcome.TRANSIENT_FAILURE;
        }
    }

    /**
     * Sends the same message to every recipient in turn. A failed recipient never stops the batch.
     */
    public DeliveryTally sendToAll(Collection<Long> recipientIds, OutboundMessage message) {
        DeliveryTally tally = DeliveryTally.empty();
        for (Long recipientId : recipientIds) {
            tally = tally.plus(send(recipientId, message));
        }
        logger.info("Batch send finished: {} delivered, {} unreachable, {} failed",
                tally.delivered(), tally.unreachable(), tally.failed());
        return tally;
    }
}

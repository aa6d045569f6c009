package com.eventbot.reminders.infrastructure.cron;

import com.eventbot.reminders.application.DeliverReminders;
import com.eventbot.reminders.domain.model.DeliveryRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Drives the delivery cycle on a fixed delay. Ticks are ignored outside of start/stop,
 * so no cycle begins while the context is shutting down.
 */
@Service
@ConditionalOnProperty(prefix = "eventbot.delivery", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ScheduledReminderDelivery implements SmartLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(ScheduledReminderDelivery.class);

    private final DeliverReminders deliverReminders;
    private volatile boolean running;

    public ScheduledReminderDelivery(DeliverReminders deliverReminders) {
        this.deliverReminders = deliverReminders;
    }

    @Scheduled(
            fixedDelayString = "${eventbot.delivery.interval-ms:60000}",
            initialDelayString = "${eventbot.delivery.initial-delay-ms:10000}")
    public void deliver() {
        if (!running) {
            logger.debug("Reminder delivery is stopped, ignoring tick");
            return;
        }
        try {
            DeliveryRunSummary summary = deliverReminders.deliverDueReminders();
            logger.debug("Scheduled delivery run done: {}", summary);
        } catch (Exception e) {
            logger.error("Scheduled reminder delivery failed", e);
        }
    }

    @Override
    public void start() {
        running = true;
        logger.info("Reminder delivery started");
    }

    @Override
    public void stop() {
        running = false;
        logger.info("Reminder delivery stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}

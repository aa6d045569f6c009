package com.eventbot.reminders.application;

import com.eventbot.reminders.domain.model.DeliveryOutcome;
import com.eventbot.reminders.domain.model.DeliveryPolicy;
import com.eventbot.reminders.domain.model.DeliveryRunSummary;
import com.eventbot.reminders.domain.model.DueReminder;
import com.eventbot.reminders.domain.port.out.DeliveryMetadataService;
import com.eventbot.reminders.domain.port.out.MessageFormatter;
import com.eventbot.reminders.domain.port.out.ReminderRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ReminderDeliveryUseCase implements DeliverReminders {

    private static final Logger logger = LoggerFactory.getLogger(ReminderDeliveryUseCase.class);

    static final String STATUS_RUNNING = "RUNNING";
    static final String STATUS_COMPLETED = "COMPLETED";
    static final String STATUS_FAILED = "FAILED";

    private enum Transition { DELIVERED, UNREACHABLE, RETRYING, ABANDONED, WITHDRAWN }

    private final ReminderRepository reminderRepository;
    private final NotificationDispatcher dispatcher;
    private final MessageFormatter formatter;
    private final DeliveryMetadataService metadataService;
    private final DeliveryPolicy policy;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public ReminderDeliveryUseCase(ReminderRepository reminderRepository,
                                   NotificationDispatcher dispatcher,
                                   MessageFormatter formatter,
                                   DeliveryMetadataService metadataService,
                                   DeliveryPolicy policy,
                                   Clock clock) {
        this.reminderRepository = reminderRepository;
        this.dispatcher = dispatcher;
        this.formatter = formatter;
        this.metadataService = metadataService;
        this.policy = policy;
        this.clock = clock;
    }

    @Override
    public DeliveryRunSummary deliverDueReminders() {
        Instant startedAt = clock.instant();
        if (!running.compareAndSet(false, true)) {
            logger.warn("Previous delivery run still in progress, skipping this one");
            return DeliveryRunSummary.skipped(startedAt);
        }

        try {
            metadataService.updateRunStatus(STATUS_RUNNING);

            List<DueReminder> due;
            try {
                due = reminderRepository.findDue(startedAt);
            } catch (RuntimeException e) {
                logger.error("Could not scan for due reminders, will retry on next run", e);
                metadataService.updateRunStatus(STATUS_FAILED);
                return new DeliveryRunSummary(startedAt, 0, 0, 0, 0, 0, false);
            }
            logger.debug("Found {} due reminder(s)", due.size());

            int delivered = 0;
            int unreachable = 0;
            int retrying = 0;
            int abandoned = 0;
            for (DueReminder reminder : due) {
                switch (process(reminder)) {
                    case DELIVERED -> delivered++;
                    case UNREACHABLE -> unreachable++;
                    case RETRYING -> retrying++;
                    case ABANDONED -> abandoned++;
                    case WITHDRAWN -> { }
                }
            }

            DeliveryRunSummary summary = new DeliveryRunSummary(
                    startedAt, due.size(), delivered, unreachable, retrying, abandoned, false);
            if (!due.isEmpty()) {
                logger.info("Delivery run finished: {} due, {} delivered, {} unreachable, {} retrying, {} abandoned",
                        due.size(), delivered, unreachable, retrying, abandoned);
            }
            metadataService.recordRun(summary);
            metadataService.updateRunStatus(STATUS_COMPLETED);
            return summary;
        } finally {
            running.set(false);
        }
    }

    @Override
    public List<DueReminder> findDueReminders() {
        return reminderRepository.findDue(clock.instant());
    }

    private Transition process(DueReminder reminder) {
        try {
            // The registration or event may have been cancelled since the scan
            if (!reminderRepository.isDeliverable(reminder.reminderId())) {
                logger.info("Reminder {} withdrawn before dispatch, skipping", reminder.reminderId());
                return Transition.WITHDRAWN;
            }
            DeliveryOutcome outcome = dispatcher.send(reminder.userId(), formatter.reminder(reminder));

            if (outcome.isTerminal()) {
                if (!reminderRepository.markSent(reminder.reminderId(), clock.instant())) {
                    logger.warn("Reminder {} was already marked sent while being dispatched", reminder.reminderId());
                }
                if (outcome == DeliveryOutcome.RECIPIENT_UNREACHABLE) {
                    logger.info("User {} is unreachable, reminder {} will not be retried",
                            reminder.userId(), reminder.reminderId());
                    return Transition.UNREACHABLE;
                }
                return Transition.DELIVERED;
            }
            return recordFailure(reminder);
        } catch (RuntimeException e) {
            logger.error("Failed to process reminder {}", reminder.reminderId(), e);
            return Transition.RETRYING;
        }
    }

    private Transition recordFailure(DueReminder reminder) {
        int attempts = reminderRepository.recordFailedAttempt(reminder.reminderId());
        if (attempts >= policy.maxAttempts()) {
            reminderRepository.markAbandoned(reminder.reminderId(), clock.instant());
            logger.warn("Reminder {} abandoned after {} failed attempt(s)", reminder.reminderId(), attempts);
            return Transition.ABANDONED;
        }
        logger.warn("Reminder {} not delivered (attempt {} of {}), will retry",
                reminder.reminderId(), attempts, policy.maxAttempts());
        return Transition.RETRYING;
    }
}

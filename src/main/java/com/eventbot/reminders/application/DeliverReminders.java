package com.eventbot.reminders.application;

import com.eventbot.reminders.domain.model.DeliveryRunSummary;
import com.eventbot.reminders.domain.model.DueReminder;
import java.util.List;

/**
 * Interface for the reminder delivery cycle.
 */
public interface DeliverReminders {

    /**
     * Runs one scan, dispatch and transition cycle over the reminders due now.
     * A call made while another cycle is still running returns a skipped summary.
     *
     * @return counts of what happened during the cycle
     */
    DeliveryRunSummary deliverDueReminders();

    List<DueReminder> findDueReminders();
}

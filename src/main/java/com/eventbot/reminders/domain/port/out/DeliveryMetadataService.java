package com.eventbot.reminders.domain.port.out;

import com.eventbot.reminders.domain.model.DeliveryRunSummary;
import java.util.Optional;

/**
 * Bookkeeping about delivery loop runs. Not a source of truth for reminder state.
 */
public interface DeliveryMetadataService {

    void updateRunStatus(String status);

    void recordRun(DeliveryRunSummary summary);

    String getRunStatus();

    /**
     * Empty when no run was recorded within the retention window or the store is unavailable
     */
    Optional<DeliveryRunSummary> getLastRun();
}

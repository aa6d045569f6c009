package com.eventbot.reminders.infrastructure.cron;

import com.eventbot.reminders.application.DeliverReminders;
import com.eventbot.reminders.domain.model.DeliveryRunSummary;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.test.context.TestPropertySource;

import java.time.Duration;
import java.time.Instant;

import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.*;

/**
 * Verifies that the scheduler drives the delivery cycle
 */
@SpringBootTest(classes = {
        ScheduledReminderDelivery.class,
        ScheduledReminderDeliveryIntegrationTest.TestSchedulingConfig.class
})
@TestPropertySource(properties = {
        "eventbot.delivery.enabled=true",
        "eventbot.delivery.interval-ms=100",
        "eventbot.delivery.initial-delay-ms=0"
})
class ScheduledReminderDeliveryIntegrationTest {

    @MockBean
    private DeliverReminders deliverReminders;

    @Configuration
    @EnableScheduling
    static class TestSchedulingConfig {
    }

    @Test
    void shouldRunDeliveryCycleRepeatedly() {
        // Given
        when(deliverReminders.deliverDueReminders()).thenReturn(DeliveryRunSummary.skipped(Instant.now()));

        // When & Then
        await()
                .atMost(Duration.ofSeconds(2))
                .untilAsserted(() -> verify(deliverReminders, atLeast(3)).deliverDueReminders());
    }

    @Test
    void shouldKeepRunningAfterCycleThrows() {
        // Given
        when(deliverReminders.deliverDueReminders())
                .thenThrow(new IllegalStateException("boom"))
                .thenReturn(DeliveryRunSummary.skipped(Instant.now()));

        // When & Then
        await()
                .atMost(Duration.ofSeconds(2))
                .untilAsserted(() -> verify(deliverReminders, atLeast(2)).deliverDueReminders());
    }
}

/**
 * The scheduler bean is not created when delivery is disabled
 */
@SpringBootTest(classes = {
        ScheduledReminderDelivery.class,
        ScheduledReminderDeliveryDisabledTest.TestSchedulingConfig.class
})
@TestPropertySource(properties = {
        "eventbot.delivery.enabled=false",
        "eventbot.delivery.interval-ms=100",
        "eventbot.delivery.initial-delay-ms=0"
})
class ScheduledReminderDeliveryDisabledTest {

    @MockBean
    private DeliverReminders deliverReminders;

    @Configuration
    @EnableScheduling
    static class TestSchedulingConfig {
    }

    @Test
    void shouldNotDeliverWhenDisabled() throws Exception {
        // When
        Thread.sleep(500);

        // Then
        verify(deliverReminders, never()).deliverDueReminders();
    }
}

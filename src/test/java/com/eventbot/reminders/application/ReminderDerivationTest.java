package com.eventbot.reminders.application;

import com.eventbot.reminders.domain.model.ReminderType;
import com.eventbot.reminders.domain.model.ScheduledReminder;
import com.eventbot.reminders.domain.port.out.ReminderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReminderDerivationTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private ReminderRepository reminderRepository;

    private ReminderDerivation derivation;

    @BeforeEach
    void setUp() {
        derivation = new ReminderDerivation(reminderRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldScheduleBothRemindersForEventMoreThanADayAhead() {
        // Given
        Instant start = NOW.plus(Duration.ofHours(25));
        when(reminderRepository.insert(eq(5L), any(), any())).thenAnswer(invocation -> Optional.of(
                reminder(invocation.getArgument(1), invocation.getArgument(2))));

        // When
        List<ScheduledReminder> created = derivation.deriveAndPersist(5L, start);

        // Then
        verify(reminderRepository).insert(5L, NOW.plus(Duration.ofHours(1)), ReminderType.TWENTY_FOUR_HOURS);
        verify(reminderRepository).insert(5L, start.minus(Duration.ofMinutes(15)), ReminderType.FIFTEEN_MINUTES);
        assertThat(created).hasSize(2);
    }

    @Test
    void shouldSkipPastReminderTimes() {
        // When
        List<ScheduledReminder> created = derivation.deriveAndPersist(5L, NOW.plus(Duration.ofMinutes(10)));

        // Then
        assertThat(created).isEmpty();
        verify(reminderRepository, never()).insert(anyLong(), any(), any());
    }

    @Test
    void shouldSkipReminderFallingExactlyOnNow() {
        // Given
        Instant start = NOW.plus(Duration.ofMinutes(15));

        // When
        List<ScheduledReminder> created = derivation.deriveAndPersist(5L, start);

        // Then
        assertThat(created).isEmpty();
        verifyNoInteractions(reminderRepository);
    }

    @Test
    void shouldNotReportReminderAlreadyPendingForRegistration() {
        // Given
        Instant start = NOW.plus(Duration.ofHours(2));
        when(reminderRepository.insert(5L, start.minus(Duration.ofMinutes(15)), ReminderType.FIFTEEN_MINUTES))
                .thenReturn(Optional.empty());

        // When
        List<ScheduledReminder> created = derivation.deriveAndPersist(5L, start);

        // Then
        assertThat(created).isEmpty();
    }

    private ScheduledReminder reminder(Instant remindAt, ReminderType type) {
        return new ScheduledReminder(1L, 5L, remindAt, type, false, 0, false, null);
    }
}

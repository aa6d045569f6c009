package com.eventbot.reminders.application;

import com.eventbot.reminders.domain.model.EventCategory;
import com.eventbot.reminders.domain.model.NotificationPreferences;
import com.eventbot.reminders.domain.model.User;
import com.eventbot.reminders.domain.port.out.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserUseCaseTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private UserRepository userRepository;

    private UserUseCase useCase;

    @BeforeEach
    void setUp() {
        useCase = new UserUseCase(userRepository);
    }

    @Test
    void shouldUpsertUserWithTrimmedName() {
        // Given
        User stored = new User(1L, "Alice", "alice", true, true, true, NOW);
        when(userRepository.upsert(1L, "Alice", "alice")).thenReturn(stored);

        // When & Then
        assertThat(useCase.registerUser(1L, " Alice ", "alice")).isEqualTo(stored);
    }

    @Test
    void shouldRejectBlankName() {
        assertThatThrownBy(() -> useCase.registerUser(1L, "  ", null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(userRepository);
    }

    @Test
    void shouldUpdateOnlySuppliedFlags() {
        // Given
        NotificationPreferences preferences = NotificationPreferences.only(EventCategory.SPORT, false);
        User updated = new User(1L, "Alice", "alice", true, false, true, NOW);
        when(userRepository.updatePreferences(1L, preferences)).thenReturn(Optional.of(updated));

        // When
        Optional<User> result = useCase.updateNotificationPreferences(1L, preferences);

        // Then
        assertThat(result).contains(updated);
        assertThat(preferences.notifyIt()).isNull();
        assertThat(preferences.notifyBooks()).isNull();
    }

    @Test
    void shouldSkipUpdateWhenNoFlagIsSupplied() {
        // Given
        User user = new User(1L, "Alice", "alice", true, true, true, NOW);
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));

        // When
        Optional<User> result = useCase.updateNotificationPreferences(1L, new NotificationPreferences(null, null, null));

        // Then
        assertThat(result).contains(user);
        verify(userRepository, never()).updatePreferences(anyLong(), any());
    }

    @Test
    void shouldReturnEmptyForUnknownUser() {
        // Given
        NotificationPreferences preferences = new NotificationPreferences(false, null, null);
        when(userRepository.updatePreferences(9L, preferences)).thenReturn(Optional.empty());

        // When & Then
        assertThat(useCase.updateNotificationPreferences(9L, preferences)).isEmpty();
    }
}

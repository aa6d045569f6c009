package com.eventbot.reminders.infrastructure.persistence;

import com.eventbot.reminders.domain.model.DueReminder;
import com.eventbot.reminders.domain.model.Event;
import com.eventbot.reminders.domain.model.EventCategory;
import com.eventbot.reminders.domain.model.EventFormat;
import com.eventbot.reminders.domain.model.NewEvent;
import com.eventbot.reminders.domain.model.NotificationPreferences;
import com.eventbot.reminders.domain.model.Registration;
import com.eventbot.reminders.domain.model.RegistrationStatus;
import com.eventbot.reminders.domain.model.ReminderType;
import com.eventbot.reminders.domain.model.ScheduledReminder;
import com.eventbot.reminders.domain.model.User;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Testcontainers(disabledWithoutDocker = true)
class DatabaseRepositoriesIntegrationTest {

    @Container
    private static final PostgreSQLContainer<?> postgres =
            new PostgreSQLContainer<>("postgres:15-alpine")
                    .withDatabaseName("eventbot_test")
                    .withUsername("test")
                    .withPassword("test");

    private static HikariDataSource dataSource;
    private static JdbcTemplate jdbcTemplate;

    private static DatabaseUserRepository users;
    private static DatabaseEventRepository events;
    private static DatabaseRegistrationRepository registrations;
    private static DatabaseReminderRepository reminders;

    private Instant now;

    @BeforeAll
    static void setup() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(postgres.getJdbcUrl());
        config.setUsername(postgres.getUsername());
        config.setPassword(postgres.getPassword());
        dataSource = new HikariDataSource(config);

        Flyway.configure().dataSource(dataSource).load().migrate();

        jdbcTemplate = new JdbcTemplate(dataSource);
        users = new DatabaseUserRepository(jdbcTemplate);
        events = new DatabaseEventRepository(jdbcTemplate);
        registrations = new DatabaseRegistrationRepository(jdbcTemplate);
        reminders = new DatabaseReminderRepository(jdbcTemplate);
    }

    @AfterAll
    static void closeDataSource() {
        dataSource.close();
    }

    @BeforeEach
    void cleanup() {
        jdbcTemplate.execute("DELETE FROM scheduled_reminders");
        jdbcTemplate.execute("DELETE FROM registrations");
        jdbcTemplate.execute("DELETE FROM events");
        jdbcTemplate.execute("DELETE FROM users");
        now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
    }

    @Test
    void shouldKeepSubscriptionFlagsWhenUserIsRefreshed() {
        // Given
        users.upsert(501L, "Alice", "alice");
        users.updatePreferences(501L, NotificationPreferences.only(EventCategory.SPORT, false));

        // When
        User refreshed = users.upsert(501L, "Alice B.", null);

        // Then
        assertThat(refreshed.firstName()).isEqualTo("Alice B.");
        assertThat(refreshed.notifySport()).isFalse();
        assertThat(refreshed.notifyIt()).isTrue();
    }

    @Test
    void shouldUpdateOnlySuppliedPreferenceFlags() {
        // Given
        users.upsert(501L, "Alice", "alice");

        // When
        Optional<User> updated = users.updatePreferences(501L, new NotificationPreferences(false, null, false));

        // Then
        assertThat(updated).hasValueSatisfying(user -> {
            assertThat(user.notifyIt()).isFalse();
            assertThat(user.notifySport()).isTrue();
            assertThat(user.notifyBooks()).isFalse();
        });
        assertThat(users.updatePreferences(999L, new NotificationPreferences(true, null, null))).isEmpty();
        assertThat(users.findSubscribers(EventCategory.SPORT)).extracting(User::id).containsExactly(501L);
        assertThat(users.findSubscribers(EventCategory.IT)).isEmpty();
    }

    @Test
    void shouldListUpcomingEventsInStartOrder() {
        // Given
        Event later = events.create(newEvent("Later", now.plus(Duration.ofDays(3))));
        Event sooner = events.create(newEvent("Sooner", now.plus(Duration.ofDays(1))));
        events.create(newEvent("Past", now.minus(Duration.ofDays(1))));
        Event cancelled = events.create(newEvent("Cancelled", now.plus(Duration.ofDays(2))));
        events.cancel(cancelled.id());

        // When
        List<Event> upcoming = events.findUpcoming(Optional.of(EventCategory.IT), 10, now);

        // Then
        assertThat(upcoming).extracting(Event::id).containsExactly(sooner.id(), later.id());
        assertThat(events.findUpcoming(Optional.of(EventCategory.BOOKS), 10, now)).isEmpty();
        assertThat(events.findUpcoming(Optional.empty(), 1, now)).hasSize(1);
    }

    @Test
    void shouldCancelEventOnlyOnce() {
        // Given
        Event event = events.create(newEvent("Meetup", now.plus(Duration.ofDays(1))));

        // When & Then
        assertThat(events.cancel(event.id())).hasValueSatisfying(e -> assertThat(e.cancelled()).isTrue());
        assertThat(events.cancel(event.id())).isEmpty();
        assertThat(events.cancel(424242L)).isEmpty();
    }

    @Test
    void shouldReactivateSameRegistrationRow() {
        // Given
        users.upsert(501L, "Alice", "alice");
        Event event = events.create(newEvent("Meetup", now.plus(Duration.ofDays(2))));
        Registration first = registrations.upsertActive(501L, event.id());

        // When
        registrations.cancel(501L, event.id());
        Registration second = registrations.upsertActive(501L, event.id());

        // Then
        assertThat(second.id()).isEqualTo(first.id());
        assertThat(second.status()).isEqualTo(RegistrationStatus.ACTIVE);
        assertThat(registrations.countActive(event.id())).isEqualTo(1);
        assertThat(registrations.cancel(777L, event.id())).isEmpty();
    }

    @Test
    void shouldRefuseSecondPendingReminderOfSameType() {
        // Given
        Registration registration = registeredAlice(now.plus(Duration.ofDays(2)));
        Instant remindAt = now.plus(Duration.ofDays(1));

        // When
        Optional<ScheduledReminder> first = reminders.insert(registration.id(), remindAt, ReminderType.TWENTY_FOUR_HOURS);
        Optional<ScheduledReminder> duplicate = reminders.insert(registration.id(), remindAt, ReminderType.TWENTY_FOUR_HOURS);

        // Then
        assertThat(first).isPresent();
        assertThat(duplicate).isEmpty();

        // A sent reminder no longer blocks a new pending one
        reminders.markSent(first.get().id(), now);
        assertThat(reminders.insert(registration.id(), remindAt, ReminderType.TWENTY_FOUR_HOURS)).isPresent();
    }

    @Test
    void shouldRejectUnknownReminderType() {
        // Given
        Registration registration = registeredAlice(now.plus(Duration.ofDays(2)));

        // When & Then
        assertThatThrownBy(() -> jdbcTemplate.update(
                "INSERT INTO scheduled_reminders (registration_id, remind_at, reminder_type) VALUES (?, NOW(), '1h')",
                registration.id()))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void shouldFindOnlyDueRemindersOfActiveRegistrations() {
        // Given
        Registration registration = registeredAlice(now.plus(Duration.ofMinutes(10)));
        reminders.insert(registration.id(), now.minus(Duration.ofMinutes(5)), ReminderType.FIFTEEN_MINUTES);
        reminders.insert(registration.id(), now.plus(Duration.ofHours(1)), ReminderType.TWENTY_FOUR_HOURS);

        // When
        List<DueReminder> due = reminders.findDue(now);

        // Then
        assertThat(due).hasSize(1);
        assertThat(due.get(0).type()).isEqualTo(ReminderType.FIFTEEN_MINUTES);
        assertThat(due.get(0).userId()).isEqualTo(501L);
        assertThat(due.get(0).firstName()).isEqualTo("Alice");
        assertThat(due.get(0).event().title()).isEqualTo("Meetup");

        // Cancelled registration hides its reminders
        registrations.cancel(501L, registration.eventId());
        assertThat(reminders.findDue(now)).isEmpty();
    }

    @Test
    void shouldReportReminderUndeliverableOnceRegistrationOrEventIsCancelled() {
        // Given
        Registration alice = registeredAlice(now.plus(Duration.ofMinutes(10)));
        users.upsert(502L, "Bob", null);
        Registration bob = registrations.upsertActive(502L, alice.eventId());
        ScheduledReminder aliceReminder =
                reminders.insert(alice.id(), now, ReminderType.FIFTEEN_MINUTES).orElseThrow();
        ScheduledReminder bobReminder =
                reminders.insert(bob.id(), now, ReminderType.FIFTEEN_MINUTES).orElseThrow();

        // When & Then
        assertThat(reminders.isDeliverable(aliceReminder.id())).isTrue();
        registrations.cancel(501L, alice.eventId());
        assertThat(reminders.isDeliverable(aliceReminder.id())).isFalse();

        assertThat(reminders.isDeliverable(bobReminder.id())).isTrue();
        events.cancel(alice.eventId());
        assertThat(reminders.isDeliverable(bobReminder.id())).isFalse();
        assertThat(reminders.isDeliverable(424242L)).isFalse();
    }

    @Test
    void shouldMarkSentAtMostOnce() {
        // Given
        Registration registration = registeredAlice(now.plus(Duration.ofMinutes(10)));
        ScheduledReminder reminder = reminders.insert(registration.id(), now, ReminderType.FIFTEEN_MINUTES).orElseThrow();

        // When & Then
        assertThat(reminders.markSent(reminder.id(), now)).isTrue();
        assertThat(reminders.markSent(reminder.id(), now)).isFalse();
        assertThat(reminders.markAbandoned(reminder.id(), now)).isFalse();
    }

    @Test
    void shouldCountAttemptsAndAbandon() {
        // Given
        Registration registration = registeredAlice(now.plus(Duration.ofMinutes(10)));
        ScheduledReminder reminder = reminders.insert(registration.id(), now, ReminderType.FIFTEEN_MINUTES).orElseThrow();

        // When
        reminders.recordFailedAttempt(reminder.id());
        int attempts = reminders.recordFailedAttempt(reminder.id());
        reminders.markAbandoned(reminder.id(), now);

        // Then
        assertThat(attempts).isEqualTo(2);
        ScheduledReminder stored = reminders.findByRegistration(registration.id()).get(0);
        assertThat(stored.sent()).isTrue();
        assertThat(stored.abandoned()).isTrue();
        assertThat(stored.attempts()).isEqualTo(2);
        assertThat(reminders.findDue(now)).isEmpty();
    }

    @Test
    void shouldDeleteOnlyUnsentRemindersOfRegistration() {
        // Given
        Registration registration = registeredAlice(now.plus(Duration.ofDays(2)));
        ScheduledReminder sent = reminders.insert(registration.id(), now.minus(Duration.ofHours(1)),
                ReminderType.TWENTY_FOUR_HOURS).orElseThrow();
        reminders.markSent(sent.id(), now);
        reminders.insert(registration.id(), now.plus(Duration.ofDays(1)), ReminderType.FIFTEEN_MINUTES);

        // When
        int deleted = reminders.deleteUnsent(registration.id());

        // Then
        assertThat(deleted).isEqualTo(1);
        assertThat(reminders.findByRegistration(registration.id())).extracting(ScheduledReminder::id)
                .containsExactly(sent.id());
    }

    @Test
    void shouldSuppressAllRemindersOfEvent() {
        // Given
        Registration alice = registeredAlice(now.plus(Duration.ofDays(2)));
        users.upsert(502L, "Bob", null);
        Registration bob = registrations.upsertActive(502L, alice.eventId());
        reminders.insert(alice.id(), now.plus(Duration.ofDays(1)), ReminderType.TWENTY_FOUR_HOURS);
        reminders.insert(bob.id(), now.plus(Duration.ofDays(1)), ReminderType.TWENTY_FOUR_HOURS);

        // When
        int suppressed = reminders.markAllSentForEvent(alice.eventId(), now);

        // Then
        assertThat(suppressed).isEqualTo(2);
        assertThat(reminders.findDue(now.plus(Duration.ofDays(3)))).isEmpty();
        assertThat(registrations.findByEvent(alice.eventId(), true)).extracting(p -> p.firstName())
                .containsExactly("Alice", "Bob");
    }

    private Registration registeredAlice(Instant eventStart) {
        users.upsert(501L, "Alice", "alice");
        Event event = events.create(newEvent("Meetup", eventStart));
        return registrations.upsertActive(501L, event.id());
    }

    private NewEvent newEvent(String title, Instant startsAt) {
        return new NewEvent(title, EventCategory.IT, EventFormat.OFFLINE, startsAt, "Main hall", null, "@host", null);
    }
}

package com.eventbot.reminders.infrastructure.persistence;

import com.eventbot.reminders.domain.model.DueReminder;
import com.eventbot.reminders.domain.model.ReminderType;
import com.eventbot.reminders.domain.model.ScheduledReminder;
import com.eventbot.reminders.domain.port.out.ReminderRepository;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Database implementation of ReminderRepository.
 * Every state transition is guarded by {@code sent = FALSE}, so a reminder is flipped to sent at most once.
 */
@Repository
public class DatabaseReminderRepository implements ReminderRepository {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseReminderRepository.class);

    private static final String COLUMNS =
            "id, registration_id, remind_at, reminder_type, sent, attempts, abandoned, sent_at";

    private static final RowMapper<ScheduledReminder> REMINDER_MAPPER = (rs, rowNum) -> new ScheduledReminder(
            rs.getLong("id"),
            rs.getLong("registration_id"),
            EventRowMapper.instant(rs, "remind_at"),
            ReminderType.fromCode(rs.getString("reminder_type")),
            rs.getBoolean("sent"),
            rs.getInt("attempts"),
            rs.getBoolean("abandoned"),
            EventRowMapper.instant(rs, "sent_at")
    );

    private static final RowMapper<DueReminder> DUE_MAPPER = (rs, rowNum) -> new DueReminder(
            rs.getLong("reminder_id"),
            rs.getLong("registration_id"),
            ReminderType.fromCode(rs.getString("reminder_type")),
            EventRowMapper.instant(rs, "remind_at"),
            rs.getInt("attempts"),
            rs.getLong("user_id"),
            rs.getString("first_name"),
            EventRowMapper.map(rs, "event_")
    );

    private final JdbcTemplate jdbcTemplate;

    public DatabaseReminderRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<ScheduledReminder> insert(long registrationId, Instant remindAt, ReminderType type) {
        String sql = """
            INSERT INTO scheduled_reminders (registration_id, remind_at, reminder_type)
            VALUES (?, ?, ?)
            ON CONFLICT (registration_id, reminder_type) WHERE sent = FALSE DO NOTHING
            RETURNING %s
            """.formatted(COLUMNS);

        try {
            return jdbcTemplate.query(sql, REMINDER_MAPPER, registrationId, Timestamp.from(remindAt), type.code())
                    .stream()
                    .findFirst();
        } catch (DataAccessException e) {
            logger.error("Error scheduling {} reminder for registration {}", type.code(), registrationId, e);
            throw e;
        }
    }

    @Override
    public List<DueReminder> findDue(Instant now) {
        String sql = """
            SELECT sr.id AS reminder_id, sr.registration_id, sr.reminder_type, sr.remind_at, sr.attempts,
                   u.telegram_id AS user_id, u.first_name, %s
            FROM scheduled_reminders sr
            JOIN registrations r ON r.id = sr.registration_id
            JOIN events e ON e.id = r.event_id
            JOIN users u ON u.telegram_id = r.user_id
            WHERE sr.remind_at <= ?
              AND sr.sent = FALSE
              AND r.status = 'ACTIVE'
              AND e.is_cancelled = FALSE
            ORDER BY sr.remind_at, sr.id
            """.formatted(EventRowMapper.columns("e", "event_"));

        return jdbcTemplate.query(sql, DUE_MAPPER, Timestamp.from(now));
    }

    @Override
    public List<ScheduledReminder> findByRegistration(long registrationId) {
        String sql = "SELECT " + COLUMNS + " FROM scheduled_reminders WHERE registration_id = ? ORDER BY remind_at";
        return jdbcTemplate.query(sql, REMINDER_MAPPER, registrationId);
    }

    @Override
    public boolean isDeliverable(long reminderId) {
        String sql = """
            SELECT EXISTS (
                SELECT 1
                FROM scheduled_reminders sr
                JOIN registrations r ON r.id = sr.registration_id
                JOIN events e ON e.id = r.event_id
                WHERE sr.id = ?
                  AND sr.sent = FALSE
                  AND r.status = 'ACTIVE'
                  AND e.is_cancelled = FALSE
            )
            """;
        return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, Boolean.class, reminderId));
    }

    @Override
    public boolean markSent(long reminderId, Instant sentAt) {
        int updated = jdbcTemplate.update(
                "UPDATE scheduled_reminders SET sent = TRUE, sent_at = ? WHERE id = ? AND sent = FALSE",
                Timestamp.from(sentAt), reminderId);
        return updated > 0;
    }

    @Override
    public int recordFailedAttempt(long reminderId) {
        return jdbcTemplate.query(
                        "UPDATE scheduled_reminders SET attempts = attempts + 1 WHERE id = ? RETURNING attempts",
                        (rs, rowNum) -> rs.getInt("attempts"),
                        reminderId)
                .stream()
                .findFirst()
                .orElse(0);
    }

    @Override
    public boolean markAbandoned(long reminderId, Instant at) {
        int updated = jdbcTemplate.update("""
                UPDATE scheduled_reminders
                   SET sent = TRUE, abandoned = TRUE, sent_at = ?
                 WHERE id = ?
                   AND sent = FALSE
                """, Timestamp.from(at), reminderId);
        return updated > 0;
    }

    @Override
    public int deleteUnsent(long registrationId) {
        return jdbcTemplate.update(
                "DELETE FROM scheduled_reminders WHERE registration_id = ? AND sent = FALSE",
                registrationId);
    }

    @Override
    public int markAllSentForEvent(long eventId, Instant at) {
        String sql = """
            UPDATE scheduled_reminders
               SET sent = TRUE, sent_at = ?
             WHERE sent = FALSE
               AND registration_id IN (SELECT id FROM registrations WHERE event_id = ?)
            """;

        try {
            return jdbcTemplate.update(sql, Timestamp.from(at), eventId);
        } catch (DataAccessException e) {
            logger.error("Error suppressing reminders of event {}", eventId, e);
            throw e;
        }
    }
}

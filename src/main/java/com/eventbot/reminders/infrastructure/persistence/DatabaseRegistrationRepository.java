package com.eventbot.reminders.infrastructure.persistence;

import com.eventbot.reminders.domain.model.Participant;
import com.eventbot.reminders.domain.model.Registration;
import com.eventbot.reminders.domain.model.RegistrationStatus;
import com.eventbot.reminders.domain.model.UserRegistration;
import com.eventbot.reminders.domain.port.out.RegistrationRepository;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
public class DatabaseRegistrationRepository implements RegistrationRepository {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseRegistrationRepository.class);

    private static final String COLUMNS = "id, user_id, event_id, status, created_at";

    private static final RowMapper<Registration> REGISTRATION_MAPPER = (rs, rowNum) -> new Registration(
            rs.getLong("id"),
            rs.getLong("user_id"),
            rs.getLong("event_id"),
            RegistrationStatus.valueOf(rs.getString("status")),
            EventRowMapper.instant(rs, "created_at")
    );

    private static final RowMapper<Participant> PARTICIPANT_MAPPER = (rs, rowNum) -> new Participant(
            rs.getLong("id"),
            rs.getLong("user_id"),
            rs.getString("first_name"),
            rs.getString("username"),
            RegistrationStatus.valueOf(rs.getString("status")),
            EventRowMapper.instant(rs, "created_at")
    );

    private static final RowMapper<UserRegistration> USER_REGISTRATION_MAPPER = (rs, rowNum) -> new UserRegistration(
            rs.getLong("registration_id"),
            RegistrationStatus.valueOf(rs.getString("registration_status")),
            EventRowMapper.instant(rs, "registered_at"),
            EventRowMapper.map(rs, "event_")
    );

    private final JdbcTemplate jdbcTemplate;

    public DatabaseRegistrationRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Registration upsertActive(long userId, long eventId) {
        // Re-registering after a cancellation reactivates the same row
        String sql = """
            INSERT INTO registrations (user_id, event_id, status)
            VALUES (?, ?, 'ACTIVE')
            ON CONFLICT (user_id, event_id) DO UPDATE
                SET status = 'ACTIVE'
            RETURNING %s
            """.formatted(COLUMNS);

        try {
            return jdbcTemplate.queryForObject(sql, REGISTRATION_MAPPER, userId, eventId);
        } catch (DataAccessException e) {
            logger.error("Error registering user {} for event {}", userId, eventId, e);
            throw e;
        }
    }

    @Override
    public Optional<Registration> cancel(long userId, long eventId) {
        String sql = """
            UPDATE registrations
               SET status = 'CANCELLED'
             WHERE user_id = ?
               AND event_id = ?
               AND status = 'ACTIVE'
            RETURNING %s
            """.formatted(COLUMNS);

        return jdbcTemplate.query(sql, REGISTRATION_MAPPER, userId, eventId).stream().findFirst();
    }

    @Override
    public Optional<Registration> find(long userId, long eventId) {
        String sql = "SELECT " + COLUMNS + " FROM registrations WHERE user_id = ? AND event_id = ?";
        return jdbcTemplate.query(sql, REGISTRATION_MAPPER, userId, eventId).stream().findFirst();
    }

    @Override
    public Optional<Registration> findById(long id) {
        String sql = "SELECT " + COLUMNS + " FROM registrations WHERE id = ?";
        return jdbcTemplate.query(sql, REGISTRATION_MAPPER, id).stream().findFirst();
    }

    @Override
    public List<Participant> findByEvent(long eventId, boolean activeOnly) {
        String sql = """
            SELECT r.id, r.user_id, r.status, r.created_at, u.first_name, u.username
            FROM registrations r
            JOIN users u ON u.telegram_id = r.user_id
            WHERE r.event_id = ?
              %s
            ORDER BY r.created_at, r.id
            """.formatted(activeOnly ? "AND r.status = 'ACTIVE'" : "");
        return jdbcTemplate.query(sql, PARTICIPANT_MAPPER, eventId);
    }

    @Override
    public List<UserRegistration> findByUser(long userId, boolean activeOnly) {
        String sql = """
            SELECT r.id AS registration_id, r.status AS registration_status, r.created_at AS registered_at, %s
            FROM registrations r
            JOIN events e ON e.id = r.event_id
            WHERE r.user_id = ?
              %s
            ORDER BY e.starts_at
            """.formatted(
                EventRowMapper.columns("e", "event_"),
                activeOnly ? "AND r.status = 'ACTIVE' AND e.is_cancelled = FALSE" : "");
        return jdbcTemplate.query(sql, USER_REGISTRATION_MAPPER, userId);
    }

    @Override
    public int countActive(long eventId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM registrations WHERE event_id = ? AND status = 'ACTIVE'",
                Integer.class, eventId);
        return count != null ? count : 0;
    }
}

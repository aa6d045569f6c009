package com.eventbot.reminders.infrastructure.persistence;

import com.eventbot.reminders.domain.model.Event;
import com.eventbot.reminders.domain.model.EventCategory;
import com.eventbot.reminders.domain.model.NewEvent;
import com.eventbot.reminders.domain.port.out.EventRepository;
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
 * Database implementation of EventRepository.
 * Cancellation is a conditional update, so concurrent cancels resolve to a single winner.
 */
@Repository
public class DatabaseEventRepository implements EventRepository {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseEventRepository.class);

    private static final String COLUMNS = EventRowMapper.columns("e", "");
    private static final RowMapper<Event> EVENT_MAPPER = (rs, rowNum) -> EventRowMapper.map(rs, "");

    private final JdbcTemplate jdbcTemplate;

    public DatabaseEventRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Event create(NewEvent event) {
        String sql = """
            INSERT INTO events AS e (
                title, category, format, starts_at, location,
                description, organizer_contact, created_by
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            RETURNING %s
            """.formatted(COLUMNS);

        try {
            return jdbcTemplate.queryForObject(sql, EVENT_MAPPER,
                    event.title(),
                    event.category().name(),
                    event.format().name(),
                    Timestamp.from(event.startsAt()),
                    event.location(),
                    event.description(),
                    event.organizerContact(),
                    event.createdBy());
        } catch (DataAccessException e) {
            logger.error("Error creating event '{}'", event.title(), e);
            throw e;
        }
    }

    @Override
    public Optional<Event> findById(long id) {
        String sql = "SELECT " + COLUMNS + " FROM events e WHERE e.id = ?";
        return jdbcTemplate.query(sql, EVENT_MAPPER, id).stream().findFirst();
    }

    @Override
    public List<Event> findUpcoming(Optional<EventCategory> category, int limit, Instant now) {
        String sql = """
            SELECT %s
            FROM events e
            WHERE e.starts_at > ?
              AND e.is_cancelled = FALSE
              %s
            ORDER BY e.starts_at ASC
            LIMIT ?
            """.formatted(COLUMNS, category.isPresent() ? "AND e.category = ?" : "");

        if (category.isPresent()) {
            return jdbcTemplate.query(sql, EVENT_MAPPER, Timestamp.from(now), category.get().name(), limit);
        }
        return jdbcTemplate.query(sql, EVENT_MAPPER, Timestamp.from(now), limit);
    }

    @Override
    public Optional<Event> cancel(long id) {
        String sql = """
            UPDATE events AS e
               SET is_cancelled = TRUE
             WHERE e.id = ?
               AND e.is_cancelled = FALSE
            RETURNING %s
            """.formatted(COLUMNS);

        try {
            return jdbcTemplate.query(sql, EVENT_MAPPER, id).stream().findFirst();
        } catch (DataAccessException e) {
            logger.error("Error cancelling event {}", id, e);
            throw e;
        }
    }

    @Override
    public List<Event> findAll(boolean includeCancelled) {
        String sql = """
            SELECT %s
            FROM events e
            %s
            ORDER BY e.starts_at DESC
            """.formatted(COLUMNS, includeCancelled ? "" : "WHERE e.is_cancelled = FALSE");
        return jdbcTemplate.query(sql, EVENT_MAPPER);
    }
}

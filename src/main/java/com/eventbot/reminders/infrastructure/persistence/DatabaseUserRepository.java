package com.eventbot.reminders.infrastructure.persistence;

import com.eventbot.reminders.domain.model.EventCategory;
import com.eventbot.reminders.domain.model.NotificationPreferences;
import com.eventbot.reminders.domain.model.User;
import com.eventbot.reminders.domain.port.out.UserRepository;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
public class DatabaseUserRepository implements UserRepository {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseUserRepository.class);

    private static final String COLUMNS =
            "telegram_id, username, first_name, notify_it, notify_sport, notify_books, created_at";

    private static final RowMapper<User> USER_MAPPER = (rs, rowNum) -> new User(
            rs.getLong("telegram_id"),
            rs.getString("first_name"),
            rs.getString("username"),
            rs.getBoolean("notify_it"),
            rs.getBoolean("notify_sport"),
            rs.getBoolean("notify_books"),
            EventRowMapper.instant(rs, "created_at")
    );

    private final JdbcTemplate jdbcTemplate;

    public DatabaseUserRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public User upsert(long id, String firstName, String username) {
        String sql = """
            INSERT INTO users (telegram_id, first_name, username)
            VALUES (?, ?, ?)
            ON CONFLICT (telegram_id) DO UPDATE
                SET first_name = EXCLUDED.first_name,
                    username = EXCLUDED.username
            RETURNING %s
            """.formatted(COLUMNS);

        try {
            return jdbcTemplate.queryForObject(sql, USER_MAPPER, id, firstName, username);
        } catch (DataAccessException e) {
            logger.error("Database error while storing user {}", id, e);
            throw e;
        }
    }

    @Override
    public Optional<User> findById(long id) {
        String sql = "SELECT " + COLUMNS + " FROM users WHERE telegram_id = ?";
        return jdbcTemplate.query(sql, USER_MAPPER, id).stream().findFirst();
    }

    @Override
    public Optional<User> updatePreferences(long id, NotificationPreferences preferences) {
        // Absent flags bind as NULL and keep the stored value
        String sql = """
            UPDATE users
               SET notify_it = COALESCE(CAST(? AS BOOLEAN), notify_it),
                   notify_sport = COALESCE(CAST(? AS BOOLEAN), notify_sport),
                   notify_books = COALESCE(CAST(? AS BOOLEAN), notify_books)
             WHERE telegram_id = ?
            RETURNING %s
            """.formatted(COLUMNS);

        return jdbcTemplate.query(sql, USER_MAPPER,
                        preferences.notifyIt(),
                        preferences.notifySport(),
                        preferences.notifyBooks(),
                        id)
                .stream()
                .findFirst();
    }

    @Override
    public List<User> findSubscribers(EventCategory category) {
        String flag = switch (category) {
            case IT -> "notify_it";
            case SPORT -> "notify_sport";
            case BOOKS -> "notify_books";
        };
        String sql = "SELECT " + COLUMNS + " FROM users WHERE " + flag + " = TRUE ORDER BY telegram_id";
        return jdbcTemplate.query(sql, USER_MAPPER);
    }
}

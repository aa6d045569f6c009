package com.eventbot.reminders.infrastructure.persistence;

import com.eventbot.reminders.domain.model.Event;
import com.eventbot.reminders.domain.model.EventCategory;
import com.eventbot.reminders.domain.model.EventFormat;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps event columns, optionally read from a join where they carry a prefix.
 */
final class EventRowMapper {

    private static final List<String> COLUMNS = List.of(
            "id", "title", "category", "format", "starts_at", "location",
            "description", "organizer_contact", "created_by", "is_cancelled", "created_at");

    private EventRowMapper() {
    }

    /**
     * Select list for the events table under {@code alias}, each column renamed to {@code prefix + column}
     */
    static String columns(String alias, String prefix) {
        return COLUMNS.stream()
                .map(column -> alias + "." + column + " AS " + prefix + column)
                .collect(Collectors.joining(", "));
    }

    static Event map(ResultSet rs, String prefix) throws SQLException {
        long createdBy = rs.getLong(prefix + "created_by");
        Long creator = rs.wasNull() ? null : createdBy;

        return new Event(
                rs.getLong(prefix + "id"),
                rs.getString(prefix + "title"),
                EventCategory.valueOf(rs.getString(prefix + "category")),
                EventFormat.valueOf(rs.getString(prefix + "format")),
                instant(rs, prefix + "starts_at"),
                rs.getString(prefix + "location"),
                rs.getString(prefix + "description"),
                rs.getString(prefix + "organizer_contact"),
                creator,
                rs.getBoolean(prefix + "is_cancelled"),
                instant(rs, prefix + "created_at")
        );
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp != null ? timestamp.toInstant() : null;
    }
}

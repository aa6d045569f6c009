package com.eventbot.reminders.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

/**
 * Fixed offsets before an event start for which a reminder is scheduled.
 */
public enum ReminderType {
    TWENTY_FOUR_HOURS("24h", Duration.ofHours(24)),
    FIFTEEN_MINUTES("15min", Duration.ofMinutes(15));

    private final String code;
    private final Duration offset;

    ReminderType(String code, Duration offset) {
        this.code = code;
        this.offset = offset;
    }

    public String code() {
        return code;
    }

    public Duration offset() {
        return offset;
    }

    public Instant fireTimeFor(Instant eventStartsAt) {
        return eventStartsAt.minus(offset);
    }

    public static ReminderType fromCode(String code) {
        return Arrays.stream(values())
                .filter(type -> type.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown reminder type: " + code));
    }
}

package com.eventbot.reminders.infrastructure.web;

import com.eventbot.reminders.domain.model.Event;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * "Add to calendar" links surfaced next to events. Events have no end time, so a default duration is assumed.
 */
public final class CalendarLinks {

    static final Duration DEFAULT_DURATION = Duration.ofHours(2);

    private static final DateTimeFormatter GOOGLE_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private CalendarLinks() {
    }

    public static String google(Event event) {
        String dates = GOOGLE_FORMAT.format(event.startsAt())
                + "/" + GOOGLE_FORMAT.format(event.startsAt().plus(DEFAULT_DURATION));

        return UriComponentsBuilder.fromHttpUrl("https://calendar.google.com/calendar/render")
                .queryParam("action", "TEMPLATE")
                .queryParam("text", event.title())
                .queryParam("dates", dates)
                .queryParam("location", event.location())
                .queryParam("details", event.description() != null ? event.description() : "")
                .encode()
                .build()
                .toUriString();
    }
}

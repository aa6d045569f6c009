package com.eventbot.reminders.infrastructure.adapter.telegram;

import com.eventbot.reminders.domain.model.DueReminder;
import com.eventbot.reminders.domain.model.Event;
import com.eventbot.reminders.domain.model.EventFormat;
import com.eventbot.reminders.domain.model.MessageAction;
import com.eventbot.reminders.domain.model.OutboundMessage;
import com.eventbot.reminders.domain.port.out.MessageFormatter;
import com.eventbot.reminders.infrastructure.config.TelegramProperties;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Renders messages in Telegram's HTML parse mode. User-provided text is always escaped.
 */
@Component
public class TelegramMessageFormatter implements MessageFormatter {

    static final String CONFIRM_PREFIX = "reminder:confirm:";
    static final String DECLINE_PREFIX = "reminder:decline:";
    static final String REGISTER_PREFIX = "register:";

    private final DateTimeFormatter dateTimeFormatter;

    public TelegramMessageFormatter(TelegramProperties properties) {
        this.dateTimeFormatter = DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm", Locale.ENGLISH)
                .withZone(ZoneId.of(properties.getTimeZone()));
    }

    @Override
    public OutboundMessage reminder(DueReminder reminder) {
        Event event = reminder.event();
        return switch (reminder.type()) {
            case TWENTY_FOUR_HOURS -> new OutboundMessage(
                    "⏰ <b>Reminder: the event is tomorrow</b>\n\n"
                            + "<b>" + escape(event.title()) + "</b>\n"
                            + "📅 " + dateTimeFormatter.format(event.startsAt()) + "\n"
                            + "📍 " + escape(event.location()) + "\n\n"
                            + "Are you still planning to attend?",
                    List.of(
                            new MessageAction("✅ I'll be there", CONFIRM_PREFIX + reminder.registrationId()),
                            new MessageAction("❌ Can't make it", DECLINE_PREFIX + reminder.registrationId())));
            case FIFTEEN_MINUTES -> OutboundMessage.plain(
                    "🔔 <b>" + escape(event.title()) + "</b> starts in 15 minutes!\n\n"
                            + "📍 " + escape(event.location()));
        };
    }

    @Override
    public OutboundMessage newEventAnnouncement(Event event) {
        StringBuilder text = new StringBuilder()
                .append("🆕 <b>New event: ").append(escape(event.title())).append("</b>\n\n")
                .append("🏷 ").append(event.category().name()).append(" · ").append(formatLabel(event.format())).append('\n')
                .append("📅 ").append(dateTimeFormatter.format(event.startsAt())).append('\n')
                .append("📍 ").append(escape(event.location())).append('\n');
        if (event.description() != null && !event.description().isBlank()) {
            text.append('\n').append(escape(event.description())).append('\n');
        }
        text.append("\nOrganizer: ").append(escape(event.organizerContact()));

        return new OutboundMessage(text.toString(),
                List.of(new MessageAction("📝 Register", REGISTER_PREFIX + event.id())));
    }

    @Override
    public OutboundMessage cancellationNotice(Event event) {
        return OutboundMessage.plain(
                "❌ <b>Event cancelled</b>\n\n"
                        + "<b>" + escape(event.title()) + "</b> scheduled for "
                        + dateTimeFormatter.format(event.startsAt()) + " has been cancelled by the organizer.\n"
                        + "Reminders for this event have been stopped.");
    }

    @Override
    public OutboundMessage organizerBroadcast(Event event, String text) {
        return OutboundMessage.plain(
                "📢 <b>Message from the organizer of " + escape(event.title()) + "</b>\n\n" + escape(text));
    }

    private static String formatLabel(EventFormat format) {
        return format == EventFormat.ONLINE ? "Online" : "Offline";
    }

    private static String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value, "UTF-8");
    }
}

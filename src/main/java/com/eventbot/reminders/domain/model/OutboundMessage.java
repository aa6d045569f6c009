package com.eventbot.reminders.domain.model;

import java.util.List;

public record OutboundMessage(
        String text,
        List<MessageAction> actions
) {
    public OutboundMessage {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public static OutboundMessage plain(String text) {
        return new OutboundMessage(text, List.of());
    }
}

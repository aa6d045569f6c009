package com.eventbot.reminders.infrastructure.adapter.telegram.json;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record InlineKeyboardMarkup(
        @JsonProperty("inline_keyboard")
        List<List<InlineKeyboardButton>> inlineKeyboard
) {}

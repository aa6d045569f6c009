package com.eventbot.reminders.infrastructure.adapter.telegram.json;

import com.fasterxml.jackson.annotation.JsonProperty;

public record InlineKeyboardButton(
        @JsonProperty("text")
        String text,

        @JsonProperty("callback_data")
        String callbackData
) {}

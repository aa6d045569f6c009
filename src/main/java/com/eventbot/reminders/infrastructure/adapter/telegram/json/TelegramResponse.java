package com.eventbot.reminders.infrastructure.adapter.telegram.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Envelope of every Bot API reply. The message payload itself is not needed and is ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TelegramResponse(
        @JsonProperty("ok")
        boolean ok,

        @JsonProperty("error_code")
        Integer errorCode,

        @JsonProperty("description")
        String description
) {}

package com.eventbot.reminders.infrastructure.adapter.telegram;

import com.eventbot.reminders.domain.model.DeliveryOutcome;
import com.eventbot.reminders.domain.model.MessageAction;
import com.eventbot.reminders.domain.model.OutboundMessage;
import com.eventbot.reminders.domain.port.out.NotificationChannel;
import com.eventbot.reminders.infrastructure.adapter.telegram.json.InlineKeyboardButton;
import com.eventbot.reminders.infrastructure.adapter.telegram.json.InlineKeyboardMarkup;
import com.eventbot.reminders.infrastructure.adapter.telegram.json.SendMessageRequest;
import com.eventbot.reminders.infrastructure.adapter.telegram.json.TelegramResponse;
import com.eventbot.reminders.infrastructure.config.TelegramProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import retrofit2.Response;

@Component
public class TelegramNotificationChannel implements NotificationChannel {

    private static final Logger logger = LoggerFactory.getLogger(TelegramNotificationChannel.class);

    static final String PARSE_MODE = "HTML";
    private static final int FORBIDDEN = 403;

    private static final ObjectMapper ERROR_READER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final TelegramBotApi botApi;
    private final TelegramProperties properties;

    public TelegramNotificationChannel(TelegramBotApi botApi, TelegramProperties properties) {
        this.botApi = botApi;
        this.properties = properties;
    }

    @Override
    @CircuitBreaker(name = "notification-channel", fallbackMethod = "fallbackSend")
    @TimeLimiter(name = "notification-channel")
    public CompletableFuture<DeliveryOutcome> send(long recipientId, OutboundMessage message) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                Response<TelegramResponse> response =
                        botApi.sendMessage(properties.getToken(), toRequest(recipientId, message)).execute();

                if (response.isSuccessful() && response.body() != null && response.body().ok()) {
                    return DeliveryOutcome.DELIVERED;
                }

                String description = describeFailure(response);
                DeliveryOutcome outcome = classify(response.code(), description);
                logger.warn("Telegram refused message to {}: HTTP {} {} -> {}",
                        recipientId, response.code(), description, outcome);
                return outcome;
            } catch (IOException e) {
                logger.error("I/O error sending message to {}: {}", recipientId, e.getMessage());
                throw new UncheckedIOException("Failed to reach Telegram", e);
            }
        });
    }

    public CompletableFuture<DeliveryOutcome> fallbackSend(long recipientId, OutboundMessage message, Throwable ex) {
        logger.warn("Fallback triggered for notification channel, recipient {}: {}", recipientId, ex.getMessage());
        return CompletableFuture.completedFuture(DeliveryOutcome.TRANSIENT_FAILURE);
    }

    /**
     * 403 and the blocked/deactivated descriptions mean the user will never receive anything from the bot.
     */
    static DeliveryOutcome classify(int httpCode, String description) {
        String reason = description == null ? "" : description.toLowerCase(Locale.ROOT);
        if (httpCode == FORBIDDEN || reason.contains("blocked") || reason.contains("deactivated")) {
            return DeliveryOutcome.RECIPIENT_UNREACHABLE;
        }
        return DeliveryOutcome.TRANSIENT_FAILURE;
    }

    static SendMessageRequest toRequest(long recipientId, OutboundMessage message) {
        InlineKeyboardMarkup markup = null;
        if (!message.actions().isEmpty()) {
            List<List<InlineKeyboardButton>> rows = List.of(message.actions().stream()
                    .map(TelegramNotificationChannel::toButton)
                    .toList());
            markup = new InlineKeyboardMarkup(rows);
        }
        return new SendMessageRequest(recipientId, message.text(), PARSE_MODE, Boolean.TRUE, markup);
    }

    private static InlineKeyboardButton toButton(MessageAction action) {
        return new InlineKeyboardButton(action.label(), action.callbackData());
    }

    private static String describeFailure(Response<TelegramResponse> response) {
        if (response.body() != null) {
            return response.body().description();
        }
        try (ResponseBody errorBody = response.errorBody()) {
            if (errorBody == null) {
                return response.message();
            }
            String raw = errorBody.string();
            try {
                TelegramResponse parsed = ERROR_READER.readValue(raw, TelegramResponse.class);
                return parsed.description();
            } catch (IOException e) {
                return raw;
            }
        } catch (IOException e) {
            logger.debug("Could not read error body: {}", e.getMessage());
            return response.message();
        }
    }
}

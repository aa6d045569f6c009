package com.eventbot.reminders.infrastructure.adapter.telegram;

import com.eventbot.reminders.infrastructure.adapter.telegram.json.SendMessageRequest;
import com.eventbot.reminders.infrastructure.adapter.telegram.json.TelegramResponse;
import retrofit2.Call;
import retrofit2.http.Body;
import retrofit2.http.POST;
import retrofit2.http.Path;

/**
 * Retrofit binding of the Telegram Bot API methods used for notifications.
 */
public interface TelegramBotApi {

    /**
     * Sends a text message to a chat.
     *
     * @param token bot token, part of the path
     * @param request chat id, text and optional inline keyboard
     * @return a `Call` whose body is the Bot API envelope
     */
    @POST("bot{token}/sendMessage")
    Call<TelegramResponse> sendMessage(@Path(value = "token", encoded = true) String token,
                                       @Body SendMessageRequest request);
}

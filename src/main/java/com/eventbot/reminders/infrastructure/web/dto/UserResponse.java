package com.eventbot.reminders.infrastructure.web.dto;

import com.eventbot.reminders.domain.model.User;
import java.time.Instant;

public record UserResponse(
        long id,
        String first_name,
        String username,
        boolean notify_it,
        boolean notify_sport,
        boolean notify_books,
        Instant created_at
) {
    public static UserResponse fromUser(User user) {
        return new UserResponse(
                user.id(),
                user.firstName(),
                user.username(),
                user.notifyIt(),
                user.notifySport(),
                user.notifyBooks(),
                user.createdAt());
    }
}

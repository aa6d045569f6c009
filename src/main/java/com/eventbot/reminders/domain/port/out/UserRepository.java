package com.eventbot.reminders.domain.port.out;

import com.eventbot.reminders.domain.model.EventCategory;
import com.eventbot.reminders.domain.model.NotificationPreferences;
import com.eventbot.reminders.domain.model.User;
import java.util.List;
import java.util.Optional;

/**
 * Repository port for users of the bot
 */
public interface UserRepository {

    /**
     * Create the user or refresh its names; subscription flags are kept on refresh.
     */
    User upsert(long id, String firstName, String username);

    Optional<User> findById(long id);

    /**
     * Apply only the flags present in the preferences in one conditional update.
     * Empty when the user does not exist.
     */
    Optional<User> updatePreferences(long id, NotificationPreferences preferences);

    List<User> findSubscribers(EventCategory category);
}

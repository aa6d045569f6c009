package com.eventbot.reminders.application;

import com.eventbot.reminders.domain.model.NotificationPreferences;
import com.eventbot.reminders.domain.model.User;
import java.util.Optional;

/**
 * Interface for creating users and managing their category subscriptions.
 */
public interface ManageUsers {

    /**
     * Creates the user on first interaction or refreshes its names on later ones.
     *
     * @param id platform-assigned user id
     * @param firstName display name
     * @param username optional handle, may be null
     * @return the stored user
     */
    User registerUser(long id, String firstName, String username);

    Optional<User> findUser(long id);

    /**
     * Applies the flags present in {@code preferences}, leaving absent ones untouched.
     *
     * @return the updated user, or empty when the user is unknown
     */
    Optional<User> updateNotificationPreferences(long id, NotificationPreferences preferences);
}

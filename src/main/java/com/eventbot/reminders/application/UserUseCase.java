package com.eventbot.reminders.application;

import com.eventbot.reminders.domain.model.NotificationPreferences;
import com.eventbot.reminders.domain.model.User;
import com.eventbot.reminders.domain.port.out.UserRepository;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class UserUseCase implements ManageUsers {

    private static final Logger logger = LoggerFactory.getLogger(UserUseCase.class);

    private final UserRepository userRepository;

    public UserUseCase(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Override
    public User registerUser(long id, String firstName, String username) {
        if (firstName == null || firstName.isBlank()) {
            throw new IllegalArgumentException("First name is required");
        }
        User user = userRepository.upsert(id, firstName.strip(), username);
        logger.debug("User {} stored", id);
        return user;
    }

    @Override
    public Optional<User> findUser(long id) {
        return userRepository.findById(id);
    }

    @Override
    public Optional<User> updateNotificationPreferences(long id, NotificationPreferences preferences) {
        if (preferences.isEmpty()) {
            return userRepository.findById(id);
        }
        Optional<User> updated = userRepository.updatePreferences(id, preferences);
        updated.ifPresentOrElse(
                user -> logger.info("Notification preferences of user {} updated: it={}, sport={}, books={}",
                        id, user.notifyIt(), user.notifySport(), user.notifyBooks()),
                () -> logger.warn("Cannot update notification preferences, user {} not found", id));
        return updated;
    }
}

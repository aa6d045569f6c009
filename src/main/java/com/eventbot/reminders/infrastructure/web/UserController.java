package com.eventbot.reminders.infrastructure.web;

import com.eventbot.reminders.application.ManageRegistrations;
import com.eventbot.reminders.application.ManageUsers;
import com.eventbot.reminders.infrastructure.web.dto.NotificationPreferencesRequest;
import com.eventbot.reminders.infrastructure.web.dto.UserRegistrationResponse;
import com.eventbot.reminders.infrastructure.web.dto.UserRequest;
import com.eventbot.reminders.infrastructure.web.dto.UserResponse;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users")
public class UserController {

    private final ManageUsers manageUsers;
    private final ManageRegistrations manageRegistrations;

    public UserController(ManageUsers manageUsers, ManageRegistrations manageRegistrations) {
        this.manageUsers = manageUsers;
        this.manageRegistrations = manageRegistrations;
    }

    @PutMapping("/{id}")
    public ResponseEntity<UserResponse> upsert(@PathVariable long id, @Valid @RequestBody UserRequest request) {
        var user = manageUsers.registerUser(id, request.first_name(), request.username());
        return ResponseEntity.ok(UserResponse.fromUser(user));
    }

    @GetMapping("/{id}")
    public ResponseEntity<UserResponse> get(@PathVariable long id) {
        return manageUsers.findUser(id)
                .map(UserResponse::fromUser)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PatchMapping("/{id}/notifications")
    public ResponseEntity<UserResponse> updateNotifications(@PathVariable long id,
                                                            @RequestBody NotificationPreferencesRequest request) {
        return manageUsers.updateNotificationPreferences(id, request.toPreferences())
                .map(UserResponse::fromUser)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/registrations")
    public ResponseEntity<List<UserRegistrationResponse>> registrations(
            @PathVariable long id,
            @RequestParam(value = "activeOnly", defaultValue = "true") boolean activeOnly
    ) {
        return ResponseEntity.ok(UserRegistrationResponse.fromRegistrations(
                manageRegistrations.listForUser(id, activeOnly)));
    }
}

package com.eventbot.reminders.infrastructure.web;

import com.eventbot.reminders.application.ManageRegistrations;
import com.eventbot.reminders.application.RegistrationResult;
import com.eventbot.reminders.infrastructure.web.dto.RegisterResponse;
import com.eventbot.reminders.infrastructure.web.dto.RegistrationResponse;
import com.eventbot.reminders.infrastructure.web.dto.ReminderAnswerRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RegistrationController {

    private static final Logger logger = LoggerFactory.getLogger(RegistrationController.class);

    private final ManageRegistrations manageRegistrations;

    public RegistrationController(ManageRegistrations manageRegistrations) {
        this.manageRegistrations = manageRegistrations;
    }

    @PostMapping("/events/{eventId}/registrations/{userId}")
    public ResponseEntity<RegisterResponse> register(@PathVariable long eventId, @PathVariable long userId) {
        RegistrationResult result = manageRegistrations.register(userId, eventId);
        logger.info("Registration of user {} for event {}: {}", userId, eventId, result.status());

        HttpStatus status = switch (result.status()) {
            case REGISTERED -> HttpStatus.CREATED;
            case ALREADY_REGISTERED -> HttpStatus.OK;
            case USER_NOT_FOUND, EVENT_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case EVENT_CANCELLED, EVENT_ALREADY_STARTED -> HttpStatus.CONFLICT;
        };
        return ResponseEntity.status(status).body(RegisterResponse.fromResult(result));
    }

    @DeleteMapping("/events/{eventId}/registrations/{userId}")
    public ResponseEntity<RegistrationResponse> cancel(@PathVariable long eventId, @PathVariable long userId) {
        return manageRegistrations.cancel(userId, eventId)
                .map(RegistrationResponse::fromRegistration)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/events/{eventId}/registrations/{userId}")
    public ResponseEntity<RegistrationResponse> get(@PathVariable long eventId, @PathVariable long userId) {
        return manageRegistrations.findRegistration(userId, eventId)
                .map(RegistrationResponse::fromRegistration)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/registrations/{id}/reminder-response")
    public ResponseEntity<RegistrationResponse> answerReminder(@PathVariable long id,
                                                               @Valid @RequestBody ReminderAnswerRequest request) {
        return manageRegistrations.respondToReminder(id, request.attending())
                .map(RegistrationResponse::fromRegistration)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}

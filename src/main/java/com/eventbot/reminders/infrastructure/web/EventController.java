package com.eventbot.reminders.infrastructure.web;

import com.eventbot.reminders.application.EventPublication;
import com.eventbot.reminders.application.ManageEvents;
import com.eventbot.reminders.domain.model.EventCategory;
import com.eventbot.reminders.infrastructure.web.dto.BroadcastRequest;
import com.eventbot.reminders.infrastructure.web.dto.CancelEventResponse;
import com.eventbot.reminders.infrastructure.web.dto.CreateEventRequest;
import com.eventbot.reminders.infrastructure.web.dto.DeliveryTallyResponse;
import com.eventbot.reminders.infrastructure.web.dto.EventListResponse;
import com.eventbot.reminders.infrastructure.web.dto.EventResponse;
import com.eventbot.reminders.infrastructure.web.dto.ParticipantResponse;
import com.eventbot.reminders.infrastructure.web.dto.PublishEventResponse;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/events")
public class EventController {

    private static final Logger logger = LoggerFactory.getLogger(EventController.class);

    private final ManageEvents manageEvents;
    private final ParticipantCsvExporter csvExporter;

    public EventController(ManageEvents manageEvents, ParticipantCsvExporter csvExporter) {
        this.manageEvents = manageEvents;
        this.csvExporter = csvExporter;
    }

    @PostMapping
    public ResponseEntity<PublishEventResponse> publish(@Valid @RequestBody CreateEventRequest request) {
        logger.info("Publishing event '{}'", request.title());
        EventPublication publication = manageEvents.publishEvent(request.toNewEvent());
        return ResponseEntity.status(HttpStatus.CREATED).body(PublishEventResponse.fromPublication(publication));
    }

    @GetMapping("/{id}")
    public ResponseEntity<EventResponse> get(@PathVariable long id) {
        return manageEvents.findEvent(id)
                .map(EventResponse::fromEvent)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/upcoming")
    public ResponseEntity<EventListResponse> upcoming(
            @RequestParam(value = "category", required = false) EventCategory category,
            @RequestParam(value = "limit", required = false) Integer limit
    ) {
        var events = manageEvents.listUpcoming(Optional.ofNullable(category), limit);
        return ResponseEntity.ok(EventListResponse.fromEvents(events));
    }

    @GetMapping
    public ResponseEntity<EventListResponse> all(
            @RequestParam(value = "includeCancelled", defaultValue = "false") boolean includeCancelled
    ) {
        return ResponseEntity.ok(EventListResponse.fromEvents(manageEvents.listAll(includeCancelled)));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<CancelEventResponse> cancel(@PathVariable long id) {
        logger.info("Cancelling event {}", id);
        return manageEvents.cancelEvent(id)
                .map(CancelEventResponse::fromCancellation)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/broadcast")
    public ResponseEntity<DeliveryTallyResponse> broadcast(@PathVariable long id,
                                                           @Valid @RequestBody BroadcastRequest request) {
        return manageEvents.broadcastToParticipants(id, request.text())
                .map(DeliveryTallyResponse::fromTally)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/participants")
    public ResponseEntity<List<ParticipantResponse>> participants(
            @PathVariable long id,
            @RequestParam(value = "activeOnly", defaultValue = "true") boolean activeOnly
    ) {
        if (manageEvents.findEvent(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(ParticipantResponse.fromParticipants(manageEvents.listParticipants(id, activeOnly)));
    }

    @GetMapping(value = "/{id}/participants.csv")
    public ResponseEntity<String> exportParticipants(
            @PathVariable long id,
            @RequestParam(value = "activeOnly", defaultValue = "true") boolean activeOnly
    ) {
        if (manageEvents.findEvent(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }

        String csv = csvExporter.export(manageEvents.listParticipants(id, activeOnly));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.parseMediaType("text/csv"));
        headers.setContentDispositionFormData("attachment", "participants_event_" + id + ".csv");

        logger.info("Exported participants of event {}", id);
        return ResponseEntity.ok().headers(headers).body(csv);
    }

    @GetMapping("/{id}/registrations/count")
    public ResponseEntity<Map<String, Object>> countRegistrations(@PathVariable long id) {
        return ResponseEntity.ok(Map.<String, Object>of(
                "event_id", id,
                "active_registrations", manageEvents.countActiveRegistrations(id)));
    }
}

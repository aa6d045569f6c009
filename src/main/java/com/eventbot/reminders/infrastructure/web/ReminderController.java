package com.eventbot.reminders.infrastructure.web;

import com.eventbot.reminders.application.DeliverReminders;
import com.eventbot.reminders.domain.port.out.DeliveryMetadataService;
import com.eventbot.reminders.infrastructure.web.dto.DeliveryRunResponse;
import com.eventbot.reminders.infrastructure.web.dto.DeliveryStatusResponse;
import com.eventbot.reminders.infrastructure.web.dto.DueReminderResponse;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/reminders")
public class ReminderController {

    private static final Logger logger = LoggerFactory.getLogger(ReminderController.class);

    private final DeliverReminders deliverReminders;
    private final DeliveryMetadataService metadataService;

    public ReminderController(DeliverReminders deliverReminders, DeliveryMetadataService metadataService) {
        this.deliverReminders = deliverReminders;
        this.metadataService = metadataService;
    }

    @GetMapping("/due")
    public ResponseEntity<List<DueReminderResponse>> due() {
        return ResponseEntity.ok(DueReminderResponse.fromReminders(deliverReminders.findDueReminders()));
    }

    @PostMapping("/deliver")
    public ResponseEntity<DeliveryRunResponse> deliver() {
        logger.info("Manual reminder delivery requested");
        return ResponseEntity.ok(DeliveryRunResponse.fromSummary(deliverReminders.deliverDueReminders()));
    }

    @GetMapping("/status")
    public ResponseEntity<DeliveryStatusResponse> status() {
        return ResponseEntity.ok(DeliveryStatusResponse.of(
                metadataService.getRunStatus(), metadataService.getLastRun()));
    }
}

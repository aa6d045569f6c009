package com.eventbot.reminders.application;

import com.eventbot.reminders.domain.model.DeliveryTally;
import com.eventbot.reminders.domain.model.Event;
import com.eventbot.reminders.domain.model.EventCategory;
import com.eventbot.reminders.domain.model.InvalidEventException;
import com.eventbot.reminders.domain.model.NewEvent;
import com.eventbot.reminders.domain.model.Participant;
import com.eventbot.reminders.domain.model.User;
import com.eventbot.reminders.domain.port.out.EventRepository;
import com.eventbot.reminders.domain.port.out.MessageFormatter;
import com.eventbot.reminders.domain.port.out.RegistrationRepository;
import com.eventbot.reminders.domain.port.out.UserRepository;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class EventUseCase implements ManageEvents {

    private static final Logger logger = LoggerFactory.getLogger(EventUseCase.class);

    static final int DEFAULT_UPCOMING_LIMIT = 10;
    static final int MAX_UPCOMING_LIMIT = 50;
    private static final int MAX_TITLE_LENGTH = 255;
    private static final int MIN_TEXT_LENGTH = 3;
    private static final Pattern ORGANIZER_CONTACT =
            Pattern.compile("^(@[A-Za-z0-9_]{3,}|tg://user\\?id=\\d+)$");

    private final EventRepository eventRepository;
    private final RegistrationRepository registrationRepository;
    private final UserRepository userRepository;
    private final CancellationCascade cancellationCascade;
    private final NotificationDispatcher dispatcher;
    private final MessageFormatter formatter;
    private final Clock clock;

    public EventUseCase(EventRepository eventRepository,
                        RegistrationRepository registrationRepository,
                        UserRepository userRepository,
                        CancellationCascade cancellationCascade,
                        NotificationDispatcher dispatcher,
                        MessageFormatter formatter,
                        Clock clock) {
        this.eventRepository = eventRepository;
        this.registrationRepository = registrationRepository;
        this.userRepository = userRepository;
        this.cancellationCascade = cancellationCascade;
        this.dispatcher = dispatcher;
        this.formatter = formatter;
        this.clock = clock;
    }

    @Override
    public EventPublication publishEvent(NewEvent newEvent) {
        validate(newEvent);

        Event event = eventRepository.create(newEvent);
        logger.info("Event {} '{}' published in category {}", event.id(), event.title(), event.category());

        List<Long> subscribers = userRepository.findSubscribers(event.category()).stream()
                .map(User::id)
                .filter(id -> !Objects.equals(id, event.createdBy()))
                .toList();
        DeliveryTally tally = dispatcher.sendToAll(subscribers, formatter.newEventAnnouncement(event));

        return new EventPublication(event, tally);
    }

    @Override
    public Optional<Event> findEvent(long id) {
        return eventRepository.findById(id);
    }

    @Override
    public List<Event> listUpcoming(Optional<EventCategory> category, Integer limit) {
        int effectiveLimit = limit == null ? DEFAULT_UPCOMING_LIMIT : Math.min(Math.max(limit, 1), MAX_UPCOMING_LIMIT);
        return eventRepository.findUpcoming(category, effectiveLimit, clock.instant());
    }

    @Override
    public List<Event> listAll(boolean includeCancelled) {
        return eventRepository.findAll(includeCancelled);
    }

    @Override
    public Optional<EventCancellation> cancelEvent(long id) {
        Optional<Event> found = eventRepository.findById(id);
        if (found.isEmpty()) {
            logger.warn("Cannot cancel event {}: not found", id);
            return Optional.empty();
        }
        if (found.get().cancelled()) {
            return Optional.of(new EventCancellation(found.get(), true, DeliveryTally.empty()));
        }

        // Participants must be read before the cascade runs
        List<Long> participants = activeParticipantIds(id);

        Optional<Event> cancelled = cancellationCascade.onEventCancelled(id);
        if (cancelled.isEmpty()) {
            logger.info("Event {} was cancelled concurrently, skipping notices", id);
            return Optional.of(new EventCancellation(found.get(), true, DeliveryTally.empty()));
        }

        DeliveryTally tally = dispatcher.sendToAll(participants, formatter.cancellationNotice(cancelled.get()));
        logger.info("Cancellation of event {} sent to {} participant(s)", id, participants.size());
        return Optional.of(new EventCancellation(cancelled.get(), false, tally));
    }

    @Override
    public Optional<DeliveryTally> broadcastToParticipants(long id, String text) {
        if (text == null || text.strip().length() < MIN_TEXT_LENGTH) {
            throw new IllegalArgumentException("Broadcast text must have at least " + MIN_TEXT_LENGTH + " characters");
        }

        Optional<Event> event = eventRepository.findById(id);
        if (event.isEmpty()) {
            return Optional.empty();
        }

        List<Long> participants = activeParticipantIds(id);
        logger.info("Broadcasting to {} participant(s) of event {}", participants.size(), id);
        return Optional.of(dispatcher.sendToAll(participants, formatter.organizerBroadcast(event.get(), text.strip())));
    }

    @Override
    public List<Participant> listParticipants(long id, boolean activeOnly) {
        return registrationRepository.findByEvent(id, activeOnly);
    }

    @Override
    public int countActiveRegistrations(long id) {
        return registrationRepository.countActive(id);
    }

    private List<Long> activeParticipantIds(long eventId) {
        return registrationRepository.findByEvent(eventId, true).stream()
                .map(Participant::userId)
                .toList();
    }

    private void validate(NewEvent event) {
        if (event.title() == null || event.title().isBlank()) {
            throw new InvalidEventException("Title is required");
        }
        if (event.title().length() > MAX_TITLE_LENGTH) {
            throw new InvalidEventException("Title must not exceed " + MAX_TITLE_LENGTH + " characters");
        }
        if (event.category() == null || event.format() == null) {
            throw new InvalidEventException("Category and format are required");
        }
        if (event.startsAt() == null || !event.startsAt().isAfter(clock.instant())) {
            throw new InvalidEventException("Event must start in the future");
        }
        if (event.location() == null || event.location().strip().length() < MIN_TEXT_LENGTH) {
            throw new InvalidEventException("Location must have at least " + MIN_TEXT_LENGTH + " characters");
        }
        if (event.organizerContact() == null || !ORGANIZER_CONTACT.matcher(event.organizerContact().strip()).matches()) {
            throw new InvalidEventException("Organizer contact must be @username or tg://user?id=<id>");
        }
    }
}

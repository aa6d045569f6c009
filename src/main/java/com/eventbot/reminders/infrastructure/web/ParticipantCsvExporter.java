package com.eventbot.reminders.infrastructure.web;

import com.eventbot.reminders.domain.model.Participant;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.IntStream;
import org.springframework.stereotype.Component;

@Component
public class ParticipantCsvExporter {

    private static final DateTimeFormatter REGISTERED_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    private final CsvMapper csvMapper = new CsvMapper();
    private final CsvSchema schema = csvMapper.schemaFor(Row.class).withHeader();

    public String export(List<Participant> participants) {
        List<Row> rows = IntStream.range(0, participants.size())
                .mapToObj(i -> Row.from(i + 1, participants.get(i)))
                .toList();
        try {
            return csvMapper.writer(schema).writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write participants CSV", e);
        }
    }

    @JsonPropertyOrder({"number", "name", "username", "telegram_id", "status", "registered_at"})
    record Row(
            @JsonProperty("number") int number,
            @JsonProperty("name") String name,
            @JsonProperty("username") String username,
            @JsonProperty("telegram_id") long telegramId,
            @JsonProperty("status") String status,
            @JsonProperty("registered_at") String registeredAt
    ) {
        static Row from(int number, Participant participant) {
            return new Row(
                    number,
                    participant.firstName(),
                    participant.username() != null ? "@" + participant.username() : "",
                    participant.userId(),
                    participant.status().name(),
                    participant.registeredAt() != null ? REGISTERED_FORMAT.format(participant.registeredAt()) : "");
        }
    }
}

package com.eventbot.reminders.infrastructure.adapter;

import com.eventbot.reminders.domain.model.DeliveryRunSummary;
import com.eventbot.reminders.domain.port.out.DeliveryMetadataService;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Keeps the status and the full tally of the latest delivery run in Redis.
 * The tally lives in one hash so a reader never sees counts from two different runs.
 * Failures are logged and never reach the loop.
 */
@Repository
public class RedisDeliveryMetadataRepository implements DeliveryMetadataService {

    private static final Logger logger = LoggerFactory.getLogger(RedisDeliveryMetadataRepository.class);

    static final String RUN_STATUS_KEY = "eventbot:delivery:status";
    static final String LAST_RUN_KEY = "eventbot:delivery:last_run";

    static final String FIELD_STARTED_AT = "started_at";
    static final String FIELD_SCANNED = "scanned";
    static final String FIELD_DELIVERED = "delivered";
    static final String FIELD_UNREACHABLE = "unreachable";
    static final String FIELD_RETRYING = "retrying";
    static final String FIELD_ABANDONED = "abandoned";

    private static final long METADATA_TTL_HOURS = 24;

    private final StringRedisTemplate redisTemplate;

    public RedisDeliveryMetadataRepository(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public void updateRunStatus(String status) {
        try {
            redisTemplate.opsForValue().set(RUN_STATUS_KEY, status, METADATA_TTL_HOURS, TimeUnit.HOURS);
            logger.debug("Updated delivery status: {}", status);
        } catch (Exception e) {
            logger.error("Failed to update delivery status", e);
        }
    }

    @Override
    public void recordRun(DeliveryRunSummary summary) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(FIELD_STARTED_AT, summary.startedAt().toString());
        fields.put(FIELD_SCANNED, String.valueOf(summary.scanned()));
        fields.put(FIELD_DELIVERED, String.valueOf(summary.delivered()));
        fields.put(FIELD_UNREACHABLE, String.valueOf(summary.unreachable()));
        fields.put(FIELD_RETRYING, String.valueOf(summary.retrying()));
        fields.put(FIELD_ABANDONED, String.valueOf(summary.abandoned()));

        try {
            redisTemplate.opsForHash().putAll(LAST_RUN_KEY, fields);
            redisTemplate.expire(LAST_RUN_KEY, METADATA_TTL_HOURS, TimeUnit.HOURS);
            logger.debug("Recorded delivery run started at {}", summary.startedAt());
        } catch (Exception e) {
            logger.error("Failed to record delivery run", e);
        }
    }

    @Override
    public String getRunStatus() {
        try {
            String status = redisTemplate.opsForValue().get(RUN_STATUS_KEY);
            return status != null ? status : "UNKNOWN";
        } catch (Exception e) {
            logger.error("Failed to get delivery status", e);
            return "ERROR";
        }
    }

    @Override
    public Optional<DeliveryRunSummary> getLastRun() {
        try {
            Map<Object, Object> fields = redisTemplate.opsForHash().entries(LAST_RUN_KEY);
            if (fields == null || !fields.containsKey(FIELD_STARTED_AT)) {
                return Optional.empty();
            }
            return Optional.of(new DeliveryRunSummary(
                    Instant.parse(fields.get(FIELD_STARTED_AT).toString()),
                    count(fields, FIELD_SCANNED),
                    count(fields, FIELD_DELIVERED),
                    count(fields, FIELD_UNREACHABLE),
                    count(fields, FIELD_RETRYING),
                    count(fields, FIELD_ABANDONED),
                    false));
        } catch (Exception e) {
            logger.error("Failed to get last delivery run", e);
            return Optional.empty();
        }
    }

    private static int count(Map<Object, Object> fields, String field) {
        Object value = fields.get(field);
        return value != null ? Integer.parseInt(value.toString()) : 0;
    }
}

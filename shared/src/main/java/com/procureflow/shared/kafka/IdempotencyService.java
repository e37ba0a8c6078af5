package com.procureflow.shared.kafka;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Idempotency Guard: Redis-backed message deduplication.
 *
 * Kafka delivers at least once, so an approver action can arrive twice.
 * Before processing, the consumer claims the message id with Redis SET NX;
 * a second claim for the same id reports a duplicate.
 *
 * Key format:  idempotency:{topic}:{eventId}
 * TTL:         24 hours
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotencyService {

    private static final String KEY_PREFIX = "idempotency:";
    private static final Duration DEFAULT_TTL = Duration.ofHours(24);

    private final StringRedisTemplate redisTemplate;

    /**
     * Claim an event id. Atomic (SET NX).
     *
     * @return true if the id was already claimed (duplicate), false if this call claimed it
     */
    public boolean isDuplicate(String eventId, String topic) {
        Boolean isNew = redisTemplate.opsForValue().setIfAbsent(buildKey(topic, eventId), "1", DEFAULT_TTL);

        if (Boolean.FALSE.equals(isNew)) {
            log.debug("Duplicate event detected and skipped: eventId={}, topic={}", eventId, topic);
            return true;
        }
        return false;
    }

    /**
     * Drop a claim so a redelivery of the same message is processed again.
     * Called when processing failed after the id was claimed.
     */
    public void release(String eventId, String topic) {
        redisTemplate.delete(buildKey(topic, eventId));
    }

    private String buildKey(String topic, String eventId) {
        return KEY_PREFIX + topic + ":" + eventId;
    }
}

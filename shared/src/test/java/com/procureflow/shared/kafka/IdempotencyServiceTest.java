package com.procureflow.shared.kafka;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IdempotencyServiceTest {

    @Mock StringRedisTemplate redisTemplate;
    @Mock ValueOperations<String, String> valueOperations;

    IdempotencyService idempotencyService;

    @BeforeEach
    void setUp() {
        idempotencyService = new IdempotencyService(redisTemplate);
    }

    @Test
    @DisplayName("First claim of an event id is not a duplicate")
    void firstClaim() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(eq("idempotency:approvals.actions:evt-1"), eq("1"), any(Duration.class)))
                .thenReturn(true);

        assertThat(idempotencyService.isDuplicate("evt-1", "approvals.actions")).isFalse();
    }

    @Test
    @DisplayName("Second claim of the same event id is a duplicate")
    void secondClaim() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(false);

        assertThat(idempotencyService.isDuplicate("evt-1", "approvals.actions")).isTrue();
    }

    @Test
    @DisplayName("release deletes the claim key")
    void release() {
        idempotencyService.release("evt-1", "approvals.actions");

        verify(redisTemplate).delete("idempotency:approvals.actions:evt-1");
    }
}

package com.libraryindex.agent.resilience;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IdempotencyServiceTest {

    @Mock StringRedisTemplate redisTemplate;
    @Mock ValueOperations<String, String> valueOps;

    private IdempotencyService service;

    @BeforeEach
    void setUp() {
        service = new IdempotencyService(redisTemplate);
    }

    @Test
    void getCachedResponse_storedResponse_isReturned() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get("library-index:idempotency:key-1")).thenReturn("{\"sessionId\":\"s\"}");

        assertThat(service.getCachedResponse("key-1")).contains("{\"sessionId\":\"s\"}");
    }

    @Test
    void getCachedResponse_inFlight_isEmpty() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get(anyString())).thenReturn("__IN_FLIGHT__");

        assertThat(service.getCachedResponse("key-1")).isEmpty();
    }

    @Test
    void claimKey_usesSetIfAbsentWithTtl() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent("library-index:idempotency:key-1", "__IN_FLIGHT__", Duration.ofHours(24)))
                .thenReturn(true, false);

        assertThat(service.claimKey("key-1")).isTrue();
        assertThat(service.claimKey("key-1")).isFalse();
    }

    @Test
    void releaseKey_deletesKey() {
        service.releaseKey("key-1");

        verify(redisTemplate).delete("library-index:idempotency:key-1");
    }
}

package com.libraryindex.agent.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisAnalysisCacheTest {

    private static final String PREFIX = "library-index:analysis:";

    @Mock StringRedisTemplate redisTemplate;
    @Mock ValueOperations<String, String> valueOps;

    private RedisAnalysisCache cache;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        cache = new RedisAnalysisCache(redisTemplate, PREFIX, Duration.ofDays(30));
    }

    @Test
    void lookup_hit_returnsStoredAnalysis() {
        when(valueOps.get(PREFIX + "2101.00001")).thenReturn("analysis");

        assertThat(cache.lookup("2101.00001")).contains("analysis");
    }

    @Test
    void lookup_blankValue_isMiss() {
        when(valueOps.get(anyString())).thenReturn(" ");

        assertThat(cache.lookup("2101.00001")).isEmpty();
    }

    @Test
    void lookup_redisDown_degradesToMiss() {
        when(valueOps.get(anyString())).thenThrow(new RedisConnectionFailureException("refused"));

        assertThat(cache.lookup("2101.00001")).isEmpty();
    }

    @Test
    void store_writesWithPrefixAndTtl() {
        cache.store("2101.00001", "analysis");

        verify(valueOps).set(PREFIX + "2101.00001", "analysis", Duration.ofDays(30));
    }

    @Test
    void store_redisDown_doesNotThrow() {
        doThrow(new RedisConnectionFailureException("refused"))
                .when(valueOps).set(anyString(), anyString(), any(Duration.class));

        cache.store("2101.00001", "analysis");
    }

    @Test
    void healthCheck_writeReadDeleteRoundTrips_isHealthy() {
        AtomicReference<String> stored = new AtomicReference<>();
        doAnswer(inv -> {
            stored.set(inv.getArgument(1));
            return null;
        }).when(valueOps).set(startsWith(PREFIX + "__health__:"), anyString(), any(Duration.class));
        when(valueOps.get(anyString())).thenAnswer(inv -> stored.get());

        assertThat(cache.healthCheck()).isTrue();
        verify(redisTemplate).delete(startsWith(PREFIX + "__health__:"));
    }

    @Test
    void healthCheck_redisDown_isUnhealthy() {
        doThrow(new RedisConnectionFailureException("refused"))
                .when(valueOps).set(anyString(), anyString(), any(Duration.class));

        assertThat(cache.healthCheck()).isFalse();
    }
}

package com.libraryindex.agent.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis-backed analysis cache.
 *
 * Key pattern: {keyPrefix}{paperId}, plain string value, TTL reset on every write.
 */
@Slf4j
public class RedisAnalysisCache implements AnalysisCache {

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;
    private final Duration ttl;

    public RedisAnalysisCache(StringRedisTemplate redisTemplate, String keyPrefix, Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
        this.ttl = ttl;
    }

    @Override
    public Optional<String> lookup(String paperId) {
        try {
            String value = redisTemplate.opsForValue().get(buildKey(paperId));
            if (value == null || value.isBlank()) {
                return Optional.empty();
            }
            log.debug("Analysis cache hit: {}", paperId);
            return Optional.of(value);
        } catch (RuntimeException e) {
            // a broken read degrades to a miss; the paper is analyzed again
            log.warn("Analysis cache read failed for {}: {}", paperId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void store(String paperId, String analysis) {
        try {
            redisTemplate.opsForValue().set(buildKey(paperId), analysis, ttl);
            log.debug("Analysis cached: {} (TTL {})", paperId, ttl);
        } catch (RuntimeException e) {
            log.warn("Analysis cache write failed for {}: {}", paperId, e.getMessage());
        }
    }

    @Override
    public boolean healthCheck() {
        String key = keyPrefix + "__health__:" + UUID.randomUUID();
        String marker = "ok-" + System.nanoTime();
        try {
            redisTemplate.opsForValue().set(key, marker, Duration.ofSeconds(30));
            String read = redisTemplate.opsForValue().get(key);
            redisTemplate.delete(key);
            return marker.equals(read);
        } catch (RuntimeException e) {
            log.error("Redis analysis cache health check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String describe() {
        return "redis(" + keyPrefix + "*)";
    }

    private String buildKey(String paperId) {
        return keyPrefix + paperId;
    }
}

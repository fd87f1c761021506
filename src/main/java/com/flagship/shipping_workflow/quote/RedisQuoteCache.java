package com.flagship.shipping_workflow.quote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.shipping_workflow.config.WorkflowProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Redis-backed quote cache.
 *
 * Key pattern: {@code quotes:<fingerprint>}, value: JSON array, expiry: Redis TTL.
 *
 * Redis being unavailable is not an error for callers: reads degrade to a miss
 * and writes are skipped, so quotes are simply fetched again.
 */
@Component
@ConditionalOnProperty(name = "workflow.quotes.cache", havingValue = "redis", matchIfMissing = true)
@Slf4j
public class RedisQuoteCache implements QuoteCache {

    private static final TypeReference<List<Quote>> QUOTE_LIST = new TypeReference<>() {};

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public RedisQuoteCache(StringRedisTemplate redisTemplate,
                           ObjectMapper objectMapper,
                           WorkflowProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = properties.getQuotes().getKeyPrefix();
    }

    @Override
    public Optional<List<Quote>> get(String fingerprint) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(key(fingerprint));
        } catch (Exception e) {
            log.warn("Redis lookup failed for quotes, treating as miss: fingerprint={}, error={}",
                    fingerprint, e.getMessage());
            return Optional.empty();
        }

        if (json == null) {
            return Optional.empty();
        }

        try {
            return Optional.of(objectMapper.readValue(json, QUOTE_LIST));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cached quotes: fingerprint={}, error={}",
                    fingerprint, e.getOriginalMessage());
            delete(fingerprint);
            return Optional.empty();
        }
    }

    @Override
    public void set(String fingerprint, List<Quote> quotes, Duration ttl) {
        String json;
        try {
            json = objectMapper.writeValueAsString(quotes);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize quotes", e);
        }

        try {
            redisTemplate.opsForValue().set(key(fingerprint), json, ttl);
            log.debug("Cached quotes: fingerprint={}, count={}, ttl={}", fingerprint, quotes.size(), ttl);
        } catch (Exception e) {
            log.warn("Failed to cache quotes in Redis: fingerprint={}, error={}", fingerprint, e.getMessage());
        }
    }

    @Override
    public void delete(String fingerprint) {
        try {
            Boolean deleted = redisTemplate.delete(key(fingerprint));
            log.debug("Deleted cached quotes: fingerprint={}, existed={}", fingerprint, deleted);
        } catch (Exception e) {
            log.warn("Failed to delete cached quotes from Redis: fingerprint={}, error={}",
                    fingerprint, e.getMessage());
        }
    }

    private String key(String fingerprint) {
        return keyPrefix + fingerprint;
    }
}

package com.flagship.shipping_workflow.observability;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

public class HealthIndicators {

    static final String DEGRADED = "DEGRADED";

    /**
     * Completion requests that cannot reach Kafka mean paid users never get
     * a label. Reads the snapshot kept by {@link BacklogMetrics}.
     */
    @Component("completionOutboxHealth")
    public static class CompletionOutboxHealthIndicator implements HealthIndicator {

        static final long STALE_AFTER_SECONDS = 300;
        static final long BACKLOG_LIMIT = 10_000;

        private final BacklogMetrics backlog;

        public CompletionOutboxHealthIndicator(BacklogMetrics backlog) {
            this.backlog = backlog;
        }

        @Override
        public Health health() {
            long pending = backlog.unpublishedCount();
            long ageSeconds = backlog.oldestUnpublishedAgeSeconds();
            long dead = backlog.deadLetterCount();

            Health.Builder builder;
            if (pending >= BACKLOG_LIMIT) {
                builder = Health.down();
            } else if (ageSeconds >= STALE_AFTER_SECONDS || dead > 0) {
                builder = Health.status(DEGRADED);
            } else {
                builder = Health.up();
            }
            return builder
                    .withDetail("unpublished", pending)
                    .withDetail("oldestAgeSeconds", ageSeconds)
                    .withDetail("deadLetters", dead)
                    .build();
        }
    }

    /**
     * Redis only holds cached quotes. Without it every confirmation asks the
     * rate provider again, so an outage is DEGRADED, never DOWN.
     */
    @Component("quoteCacheHealth")
    @ConditionalOnProperty(name = "workflow.quotes.cache", havingValue = "redis", matchIfMissing = true)
    public static class QuoteCacheHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public QuoteCacheHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                String reply = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
                if ("PONG".equalsIgnoreCase(reply)) {
                    return Health.up().build();
                }
                return degraded("unexpected ping reply: " + reply);
            } catch (RuntimeException e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private static Health degraded(String reason) {
            return Health.status(DEGRADED)
                    .withDetail("error", reason)
                    .withDetail("impact", "quotes are fetched from the rate provider on every confirmation")
                    .build();
        }
    }
}

package com.flagship.tip_ledger.observability;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Readiness checks specific to the tip engine.
 */
public class HealthIndicators {

    /**
     * Down once the outbox backlog says the publisher has stopped draining.
     */
    @Component("tipOutboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1_000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10_000;

        private final OutboxMetrics outboxMetrics;

        public OutboxHealthIndicator(OutboxMetrics outboxMetrics) {
            this.outboxMetrics = outboxMetrics;
        }

        @Override
        public Health health() {
            long backlog = outboxMetrics.backlog();
            Health.Builder builder = backlog < BACKLOG_WARNING_THRESHOLD
                ? Health.up()
                : backlog < BACKLOG_CRITICAL_THRESHOLD ? Health.status("WARNING") : Health.down();
            return builder
                .withDetail("backlogSize", backlog)
                .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                .build();
        }
    }

    /**
     * Redis only backs the payment idempotency fast path; without it lookups
     * fall back to the database, so an outage is reported as degraded.
     */
    @Component("idempotencyCacheHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Idempotency lookups fall back to the database";

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            RedisConnectionFactory connectionFactory = redisTemplate.getConnectionFactory();
            if (connectionFactory == null) {
                return Health.status("DEGRADED")
                    .withDetail("error", "No connection factory configured")
                    .withDetail("note", FALLBACK_NOTE)
                    .build();
            }
            try (RedisConnection connection = connectionFactory.getConnection()) {
                String response = connection.ping();
                return "PONG".equals(response)
                    ? Health.up().withDetail("response", response).build()
                    : Health.status("DEGRADED").withDetail("response", String.valueOf(response)).build();
            } catch (Exception e) {
                return Health.status("DEGRADED")
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .withDetail("note", FALLBACK_NOTE)
                    .build();
            }
        }
    }
}

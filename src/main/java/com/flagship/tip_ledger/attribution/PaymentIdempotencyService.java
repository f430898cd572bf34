package com.flagship.tip_ledger.attribution;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Remembers which payments were already attributed.
 *
 * Redis answers first when it is reachable; the {@code tip_transactions}
 * unique constraint on {@code payment_id} stays the source of truth, so a
 * Redis outage only costs a database read.
 */
@Service
@Slf4j
public class PaymentIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "tip-payment:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final TipTransactionRepository transactionRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public PaymentIdempotencyService(TipTransactionRepository transactionRepository,
                                     Optional<RedisTemplate<String, String>> redisTemplate) {
        this.transactionRepository = transactionRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the tip transaction already recorded for {@code paymentId}
     */
    public Optional<UUID> findAttributed(String paymentId) {
        if (paymentId == null || paymentId.isBlank()) {
            throw new IllegalArgumentException("Payment id cannot be null or blank");
        }

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + paymentId);
                if (cached != null) {
                    log.debug("Payment {} found in Redis", paymentId);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for payment {}, falling back to database: {}", paymentId, e.getMessage());
            }
        }

        Optional<UUID> stored = transactionRepository.findByPaymentId(paymentId).map(TipTransaction::getId);
        stored.ifPresent(id -> {
            log.debug("Payment {} found in database", paymentId);
            cache(paymentId, id);
        });
        return stored;
    }

    public void remember(String paymentId, UUID tipTransactionId) {
        cache(paymentId, tipTransactionId);
    }

    private void cache(String paymentId, UUID tipTransactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + paymentId, tipTransactionId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache payment {} in Redis: {}", paymentId, e.getMessage());
        }
    }
}

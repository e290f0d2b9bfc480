package com.subscription.billing.core;

import com.subscription.billing.persistence.repository.SubscriptionHistoryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.SerializationException;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Detects events that were already written to the ledger.
 * Redis answers the common replay quickly; the ledger's unique idempotency key is the source of truth.
 * If Redis is down we fall back to the database. If the database is down the check fails and the
 * caller rejects the event, so a provider retry delivers it again later.
 */
@Slf4j
@Service
public class IdempotencyService {

    private static final String KEY_PREFIX = "subscription:event:";

    private final RedisTemplate<String, ProcessedEventMarker> redisTemplate;
    private final SubscriptionHistoryRepository historyRepository;
    private final Duration ttl;

    public IdempotencyService(RedisTemplate<String, ProcessedEventMarker> redisTemplate,
                              SubscriptionHistoryRepository historyRepository,
                              @Value("${billing.idempotency.ttl-hours:72}") long ttlHours) {
        this.redisTemplate = redisTemplate;
        this.historyRepository = historyRepository;
        this.ttl = Duration.ofHours(ttlHours);
    }

    /**
     * Whether an event with this key has already been recorded.
     */
    public boolean isProcessed(String idempotencyKey) {
        return isCached(idempotencyKey) || historyRepository.existsByIdempotencyKey(idempotencyKey);
    }

    /**
     * Best effort; the ledger row already guarantees exactly-once.
     */
    public void markProcessed(ProcessedEventMarker marker) {
        try {
            redisTemplate.opsForValue().set(KEY_PREFIX + marker.getIdempotencyKey(), marker, ttl);
        } catch (DataAccessException | SerializationException e) {
            log.warn("Could not cache processed marker for {} ({} -> {}): {}", marker.getIdempotencyKey(),
                    marker.getOutcome(), marker.getNewStatus(), e.getMessage());
        }
    }

    private boolean isCached(String idempotencyKey) {
        String key = KEY_PREFIX + idempotencyKey;
        try {
            return redisTemplate.opsForValue().get(key) != null;
        } catch (SerializationException e) {
            log.error("Unreadable processed marker for {}, evicting and checking the ledger", idempotencyKey, e);
            evict(key);
        } catch (DataAccessException e) {
            log.warn("Redis unavailable checking {}, checking the ledger: {}", idempotencyKey, e.getMessage());
        }
        return false;
    }

    private void evict(String key) {
        try {
            redisTemplate.delete(key);
        } catch (DataAccessException e) {
            log.warn("Could not evict {}: {}", key, e.getMessage());
        }
    }
}

package com.flagship.wager_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis fast path for artifact reference → wager id lookups.
 *
 * The database stays the source of truth: every failure here is logged and treated as a
 * cache miss so settlement keeps working while Redis is down.
 */
@Component
@Slf4j
public class ArtifactRefIndex {

    private static final String REDIS_KEY_PREFIX = "artifact:";
    private static final Duration REDIS_TTL = Duration.ofDays(30);

    private final Optional<RedisTemplate<String, String>> redisTemplate;
    private final boolean enabled;

    public ArtifactRefIndex(Optional<RedisTemplate<String, String>> redisTemplate,
                            @Value("${ledger.artifact-cache.enabled:true}") boolean enabled) {
        this.redisTemplate = redisTemplate;
        this.enabled = enabled;
    }

    public Optional<UUID> lookup(String artifactRef) {
        if (!enabled || redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String wagerId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + artifactRef);
            if (wagerId != null) {
                log.debug("Artifact ref found in Redis: {}", artifactRef);
                return Optional.of(UUID.fromString(wagerId));
            }
        } catch (Exception e) {
            log.warn("Redis lookup failed for artifact ref: {}. Falling back to database. Error: {}",
                    artifactRef, e.getMessage());
        }
        return Optional.empty();
    }

    public void store(String artifactRef, UUID wagerId) {
        if (!enabled || redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + artifactRef, wagerId.toString(), REDIS_TTL);
            log.debug("Stored artifact ref in Redis: {} -> {}", artifactRef, wagerId);
        } catch (Exception e) {
            log.warn("Failed to store artifact ref in Redis: {}. Error: {}", artifactRef, e.getMessage());
        }
    }
}

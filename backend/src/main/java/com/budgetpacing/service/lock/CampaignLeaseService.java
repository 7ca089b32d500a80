package com.budgetpacing.service.lock;

import java.time.Duration;
import java.util.Collections;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

/**
 * Time-bounded per-campaign lease in Redis. Serializes evaluation and adjustment of one campaign
 * across scheduler threads and instances. The lease expires on its own if the holder dies.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CampaignLeaseService {

    static final String KEY_PREFIX = "pacing:lease:";

    /** Deletes the key only while it still holds the caller's token */
    private static final RedisScript<Long> RELEASE_SCRIPT =
            new DefaultRedisScript<>(
                    "if redis.call('get', KEYS[1]) == ARGV[1] then "
                            + "return redis.call('del', KEYS[1]) else return 0 end",
                    Long.class);

    private final StringRedisTemplate redisTemplate;

    /** @return the owner token when the lease was taken, empty when another owner holds it */
    public Optional<String> tryAcquire(String campaignId, Duration ttl) {
        String token = UUID.randomUUID().toString();
        Boolean acquired = redisTemplate.opsForValue().setIfAbsent(key(campaignId), token, ttl);
        if (Boolean.TRUE.equals(acquired)) {
            log.debug("Lease acquired: campaignId={}, ttl={}", campaignId, ttl);
            return Optional.of(token);
        }
        log.debug("Lease held elsewhere: campaignId={}", campaignId);
        return Optional.empty();
    }

    public boolean release(String campaignId, String token) {
        Long deleted =
                redisTemplate.execute(
                        RELEASE_SCRIPT, Collections.singletonList(key(campaignId)), token);
        boolean released = deleted != null && deleted > 0;
        if (!released) {
            log.warn(
                    "Lease expired before release, evaluation overran its TTL: campaignId={}",
                    campaignId);
        }
        return released;
    }

    private static String key(String campaignId) {
        return KEY_PREFIX + campaignId;
    }
}

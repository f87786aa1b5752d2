package com.autopilot.lock;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Блокировка в Redis с владельцем: снять ее может только тот, кто ее взял,
 * поэтому задача, пережившая TTL, не снимет чужую блокировку.
 * Ключи: scheduler:&lt;задача&gt; для срабатываний, agent:&lt;агент&gt;:&lt;тенант&gt; для запусков агента.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DistributedLockService {

    private static final String LOCK_PREFIX = "lock:";

    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final RedisTemplate<String, String> redisTemplate;

    /**
     * @return токен владельца или пусто, если блокировка занята или Redis недоступен
     */
    public Optional<String> tryLock(String lockKey, Duration ttl) {
        String token = UUID.randomUUID().toString();
        try {
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(
                    LOCK_PREFIX + lockKey,
                    token,
                    ttl.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            if (Boolean.TRUE.equals(acquired)) {
                log.debug("Блокировка получена: {}", lockKey);
                return Optional.of(token);
            }
            log.debug("Блокировка уже занята: {}", lockKey);
            return Optional.empty();
        } catch (Exception e) {
            log.error("Ошибка получения блокировки {}: {}", lockKey, e.getMessage(), e);
            return Optional.empty();
        }
    }

    public void releaseLock(String lockKey, String token) {
        try {
            Long released = redisTemplate.execute(RELEASE_SCRIPT, List.of(LOCK_PREFIX + lockKey), token);
            if (released != null && released > 0) {
                log.debug("Блокировка освобождена: {}", lockKey);
            } else {
                log.warn("Блокировка {} уже истекла или принадлежит другому владельцу", lockKey);
            }
        } catch (Exception e) {
            log.error("Ошибка освобождения блокировки {}: {}", lockKey, e.getMessage(), e);
        }
    }
}

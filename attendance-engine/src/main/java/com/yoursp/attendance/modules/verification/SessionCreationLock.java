package com.yoursp.attendance.modules.verification;

import com.yoursp.attendance.config.AttendanceProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-(user, clock event) mutex around session creation, held in Redis.
 * <ul>
 * <li>Acquire is SET NX with a TTL that bounds the critical section only</li>
 * <li>Release is an atomic compare-and-delete so only the owner can release</li>
 * </ul>
 */
@SuppressWarnings("null")
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionCreationLock {

    private static final String KEY_PREFIX = "verification_session_lock:";

    /** Deletes the key only while it still holds the caller's token. */
    private static final String RELEASE_LUA_SCRIPT = "if redis.call('GET', KEYS[1]) == ARGV[1] then " +
            "return redis.call('DEL', KEYS[1]) else return 0 end";

    private static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(RELEASE_LUA_SCRIPT,
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final AttendanceProperties properties;

    /**
     * @return the owner token if the lock was taken, empty if someone else holds it
     */
    public Optional<String> tryAcquire(UUID userId, UUID attendanceEventId) {
        String key = key(userId, attendanceEventId);
        String token = UUID.randomUUID().toString();
        Boolean acquired = redisTemplate.opsForValue()
                .setIfAbsent(key, token, properties.getVerification().getCreationLockTtl());
        if (Boolean.TRUE.equals(acquired)) {
            log.debug("Session creation lock acquired: {}", key);
            return Optional.of(token);
        }
        log.debug("Session creation lock busy: {}", key);
        return Optional.empty();
    }

    /**
     * @return true if the lock was still owned by {@code token} and has been removed
     */
    public boolean release(UUID userId, UUID attendanceEventId, String token) {
        String key = key(userId, attendanceEventId);
        Long removed = redisTemplate.execute(RELEASE_SCRIPT, Collections.singletonList(key), token);
        if (removed == null || removed == 0L) {
            // TTL elapsed and another caller may hold it now
            log.warn("Session creation lock {} was no longer owned at release", key);
            return false;
        }
        return true;
    }

    static String key(UUID userId, UUID attendanceEventId) {
        return KEY_PREFIX + userId + ":" + attendanceEventId;
    }
}

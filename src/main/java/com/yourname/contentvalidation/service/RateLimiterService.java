package com.yourname.contentvalidation.service;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Fixed-window request counters per client, one per minute and one per day, kept in Redis.
 * Validation calls are expensive (four LLM calls each), so both windows apply.
 */
@Service
public class RateLimiterService {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterService.class);

    static final String KEY_PREFIX = "content_validation:rate:";

    private final RedisTemplate<String, String> redisTemplate;
    private final int maxRequestsPerMinute;
    private final long windowMinuteSeconds;
    private final int maxRequestsPerDay;
    private final long windowDaySeconds;

    public RateLimiterService(
        RedisTemplate<String, String> redisTemplate,
        @Value("${rate-limit.max-requests-per-minute:5}") int maxRequestsPerMinute,
        @Value("${rate-limit.window-minute-seconds:60}") long windowMinuteSeconds,
        @Value("${rate-limit.max-requests-per-day:200}") int maxRequestsPerDay,
        @Value("${rate-limit.window-day-seconds:86400}") long windowDaySeconds
    ) {
        this.redisTemplate = redisTemplate;
        this.maxRequestsPerMinute = maxRequestsPerMinute;
        this.windowMinuteSeconds = windowMinuteSeconds;
        this.maxRequestsPerDay = maxRequestsPerDay;
        this.windowDaySeconds = windowDaySeconds;
    }

    public RateLimitStatus consume(String clientId) {
        WindowStatus minute = consumeWindow(KEY_PREFIX + "minute:" + clientId, maxRequestsPerMinute, windowMinuteSeconds);
        WindowStatus day = consumeWindow(KEY_PREFIX + "day:" + clientId, maxRequestsPerDay, windowDaySeconds);

        WindowStatus primary = tighter(minute, day);
        return new RateLimitStatus(
            minute.allowed() && day.allowed(),
            primary.limit(),
            primary.remaining(),
            primary.resetSeconds(),
            minute,
            day
        );
    }

    private WindowStatus consumeWindow(String key, int limit, long windowSeconds) {
        Long count;
        try {
            count = redisTemplate.execute((RedisCallback<Long>) connection ->
                connection.stringCommands().incr(key.getBytes(StandardCharsets.UTF_8))
            );
        } catch (DataAccessException ex) {
            // Fail open if Redis is temporarily unavailable.
            log.warn("Rate limit store unavailable, allowing request: {}", ex.getMessage());
            return new WindowStatus(true, limit, limit, windowSeconds);
        }

        if (count == null) {
            return new WindowStatus(true, limit, limit, windowSeconds);
        }

        if (count == 1) {
            redisTemplate.expire(key, Duration.ofSeconds(windowSeconds));
        }

        Long ttl = redisTemplate.getExpire(key, TimeUnit.SECONDS);
        long resetSeconds = ttl != null && ttl > 0 ? ttl : windowSeconds;
        long remaining = Math.max(0, limit - count);

        return new WindowStatus(count <= limit, limit, remaining, resetSeconds);
    }

    /** The window closest to blocking; ties go to the one that resets first. */
    private WindowStatus tighter(WindowStatus a, WindowStatus b) {
        if (b.remaining() < a.remaining()) return b;
        if (b.remaining() == a.remaining() && b.resetSeconds() < a.resetSeconds()) return b;
        return a;
    }

    public record RateLimitStatus(
        boolean allowed,
        long limit,
        long remaining,
        long resetSeconds,
        WindowStatus minute,
        WindowStatus day
    ) {}

    public record WindowStatus(
        boolean allowed,
        long limit,
        long remaining,
        long resetSeconds
    ) {}
}

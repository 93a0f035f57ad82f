package com.fintech.marketsync.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Redis implementation of {@link CandleCache} on {@link StringRedisTemplate}.
 */
@Component
public class RedisCandleCache implements CandleCache {

    private static final Logger log = LoggerFactory.getLogger(RedisCandleCache.class);

    private static final String COMPARE_AND_DELETE =
        "if redis.call('get', KEYS[1]) == ARGV[1] then " +
        "  return redis.call('del', KEYS[1]) " +
        "else " +
        "  return 0 " +
        "end";

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<Long> compareAndDelete;

    public RedisCandleCache(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        this.compareAndDelete = new DefaultRedisScript<>(COMPARE_AND_DELETE, Long.class);
    }

    @Override
    public List<String> range(String key) {
        List<String> values = redisTemplate.opsForList().range(key, 0, -1);
        return values != null ? values : List.of();
    }

    @Override
    public void replaceList(String key, List<String> values) {
        redisTemplate.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ops.multi();
                ops.delete(key);
                if (!values.isEmpty()) {
                    ops.opsForList().rightPushAll(key, values);
                }
                return ops.exec();
            }
        });
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    public void set(String key, String value) {
        redisTemplate.opsForValue().set(key, value);
    }

    @Override
    public void setAll(Map<String, String> values) {
        if (!values.isEmpty()) {
            redisTemplate.opsForValue().multiSet(values);
        }
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(key);
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, value, ttl));
    }

    @Override
    public boolean deleteIfEquals(String key, String expected) {
        Long deleted = redisTemplate.execute(compareAndDelete, List.of(key), expected);
        return deleted != null && deleted > 0;
    }

    @Override
    public Set<String> scan(String pattern) {
        Set<String> keys = new TreeSet<>();
        ScanOptions options = ScanOptions.scanOptions().match(pattern).count(500).build();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            cursor.forEachRemaining(keys::add);
        }
        return keys;
    }

    @Override
    public void putHash(String key, Map<String, String> fields) {
        redisTemplate.opsForHash().putAll(key, fields);
    }

    @Override
    public Map<String, String> getHash(String key) {
        Map<String, String> result = new HashMap<>();
        redisTemplate.opsForHash().entries(key)
            .forEach((field, value) -> result.put(String.valueOf(field), String.valueOf(value)));
        return result;
    }

    @Override
    public boolean ping() {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(pong);
        } catch (Exception e) {
            log.error("Redis health check failed: {}", e.getMessage());
            return false;
        }
    }
}

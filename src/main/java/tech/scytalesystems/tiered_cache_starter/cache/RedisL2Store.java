package tech.scytalesystems.tiered_cache_starter.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.data.redis.serializer.SerializationException;
import tech.scytalesystems.tiered_cache_starter.exception.CacheSerializationException;
import tech.scytalesystems.tiered_cache_starter.exception.StoreUnavailableException;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1020h
 * <p>Redis implementation of {@link L2Store}.
 *
 * <p>Layout, with the configured prefix (default {@code "cache:"}):
 * <p>- value:     {@code <prefix><key>} (JSON with type info, native TTL)
 * <p>- tag index: {@code <prefix>tag:<tag>} (Redis SET of logical keys)
 *
 * <p>Tag sets are only ever touched with SADD / SREM / EXPIRE so concurrent writers on other
 * instances never overwrite each other's members. The add-and-extend step runs as one Lua
 * script: the set's TTL is raised to the entry TTL but never lowered, so a set always outlives
 * its longest-lived member and stale members disappear on their own.
 */
public class RedisL2Store implements L2Store {
    private static final Logger log = LoggerFactory.getLogger(RedisL2Store.class);

    static final String TAG_SEGMENT = "tag:";

    static final RedisScript<Long> ADD_TO_TAG_SCRIPT = new DefaultRedisScript<>(
            "redis.call('SADD', KEYS[1], ARGV[1]) " +
            "local ttl = redis.call('TTL', KEYS[1]) " +
            "if ttl < tonumber(ARGV[2]) then redis.call('EXPIRE', KEYS[1], ARGV[2]) end " +
            "return ttl",
            Long.class);

    private final RedisTemplate<String, Object> valueTemplate;
    private final StringRedisTemplate indexTemplate;
    private final String keyPrefix;

    public RedisL2Store(RedisTemplate<String, Object> valueTemplate, StringRedisTemplate indexTemplate, String keyPrefix) {
        this.valueTemplate = valueTemplate;
        this.indexTemplate = indexTemplate;
        this.keyPrefix = keyPrefix != null ? keyPrefix : "";
    }

    @Override
    public Optional<Object> get(String key) {
        return execute("get", key, () -> Optional.ofNullable(valueTemplate.opsForValue().get(dataKey(key))));
    }

    @Override
    public void setWithTtl(String key, Object value, long ttlSeconds, Set<String> tags) {
        execute("set", key, () -> {
            valueTemplate.opsForValue().set(dataKey(key), value, Duration.ofSeconds(ttlSeconds));

            for (String tag : tags) {
                indexTemplate.execute(ADD_TO_TAG_SCRIPT, List.of(tagKey(tag)), key, String.valueOf(ttlSeconds));
            }
            return null;
        });

        log.trace("L2 set: key={}, ttl={}s, tags={}", key, ttlSeconds, tags);
    }

    @Override
    public void delete(String key) {
        execute("delete", key, () -> valueTemplate.delete(dataKey(key)));
    }

    @Override
    public Set<String> keysWithTag(String tag) {
        Set<String> members = execute("keysWithTag", tag, () -> indexTemplate.opsForSet().members(tagKey(tag)));

        return members != null ? members : Set.of();
    }

    @Override
    public void removeFromTagIndex(String tag, Collection<String> keys) {
        if (keys.isEmpty()) return;

        execute("removeFromTagIndex", tag, () -> indexTemplate.opsForSet().remove(tagKey(tag), keys.toArray()));
    }

    @Override
    public Duration ping() {
        long start = System.nanoTime();
        execute("ping", "-", () -> indexTemplate.execute((RedisCallback<String>) RedisConnection::ping));

        return Duration.ofNanos(System.nanoTime() - start);
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    String dataKey(String key) {
        return keyPrefix + key;
    }

    String tagKey(String tag) {
        return keyPrefix + TAG_SEGMENT + tag;
    }

    private <R> R execute(String operation, String key, Supplier<R> action) {
        try {
            return action.get();
        } catch (SerializationException e) {
            throw new CacheSerializationException("L2 " + operation + " could not (de)serialize value for key: " + key, e);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("L2 " + operation + " failed for key: " + key, e);
        }
    }
}

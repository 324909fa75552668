package me.go_gradually.callflow.infrastructure.store.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.callflow.application.shared.port.MetricsPort;
import me.go_gradually.callflow.application.store.model.SessionCounter;
import me.go_gradually.callflow.application.store.model.SessionDescriptor;
import me.go_gradually.callflow.application.store.model.SessionFlag;
import me.go_gradually.callflow.application.store.port.SharedSessionStorePort;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Shared call state in Redis so that any worker can pick up a call.
 * Read failures degrade to "absent" and are counted; they never break a live call.
 */
public class RedisSharedSessionStore implements SharedSessionStorePort {
    private static final Logger log = Logger.getLogger(RedisSharedSessionStore.class.getName());
    private static final String FLAG_VALUE = "1";
    static final RedisScript<Long> DECREMENT_FLOOR = new DefaultRedisScript<>(
            "local value = redis.call('DECR', KEYS[1]) "
                    + "if value < 0 then redis.call('SET', KEYS[1], '0', 'KEEPTTL') return 0 end "
                    + "return value",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final ValueOperations<String, String> valueOperations;
    private final SetOperations<String, String> setOperations;
    private final ObjectMapper objectMapper;
    private final Duration sessionTtl;
    private final MetricsPort metrics;

    public RedisSharedSessionStore(StringRedisTemplate redisTemplate,
                                   ObjectMapper objectMapper,
                                   Duration sessionTtl,
                                   MetricsPort metrics) {
        this.redisTemplate = redisTemplate;
        this.valueOperations = redisTemplate.opsForValue();
        this.setOperations = redisTemplate.opsForSet();
        this.objectMapper = objectMapper;
        this.sessionTtl = sessionTtl;
        this.metrics = metrics;
    }

    static String callKey(String callId) {
        return "call:" + callId;
    }

    static String counterKey(String callId, SessionCounter counter) {
        return "counter:" + callId + ":" + counter.code();
    }

    static String flagKey(String callId, SessionFlag flag) {
        return "flag:" + callId + ":" + flag.code();
    }

    static String playbacksKey(String callId) {
        return "playbacks:" + callId;
    }

    static String eventKey(String eventId) {
        return "event:" + eventId;
    }

    @Override
    public Optional<SessionDescriptor> get(String callId) {
        try {
            String json = valueOperations.get(callKey(callId));
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, SessionDescriptor.class));
        } catch (JsonProcessingException e) {
            failed("get", callId, e);
            return Optional.empty();
        } catch (RuntimeException e) {
            failed("get", callId, e);
            return Optional.empty();
        }
    }

    @Override
    public void set(String callId, SessionDescriptor descriptor, Duration ttl) {
        try {
            valueOperations.set(callKey(callId), objectMapper.writeValueAsString(descriptor), ttl);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session " + callId, e);
        } catch (RuntimeException e) {
            failed("set", callId, e);
        }
    }

    @Override
    public long increment(String callId, SessionCounter counter) {
        String key = counterKey(callId, counter);
        try {
            Long value = valueOperations.increment(key);
            redisTemplate.expire(key, sessionTtl);
            return value == null ? 0L : value;
        } catch (RuntimeException e) {
            failed("increment", callId, e);
            return 0L;
        }
    }

    @Override
    public long decrement(String callId, SessionCounter counter) {
        try {
            Long value = redisTemplate.execute(DECREMENT_FLOOR, List.of(counterKey(callId, counter)));
            return value == null ? 0L : value;
        } catch (RuntimeException e) {
            failed("decrement", callId, e);
            return 0L;
        }
    }

    @Override
    public long counter(String callId, SessionCounter counter) {
        try {
            String value = valueOperations.get(counterKey(callId, counter));
            return value == null || value.isBlank() ? 0L : Math.max(0L, Long.parseLong(value.trim()));
        } catch (RuntimeException e) {
            failed("counter", callId, e);
            return 0L;
        }
    }

    @Override
    public void resetCounter(String callId, SessionCounter counter) {
        try {
            redisTemplate.delete(counterKey(callId, counter));
        } catch (RuntimeException e) {
            failed("resetCounter", callId, e);
        }
    }

    @Override
    public void setFlag(String callId, SessionFlag flag, Duration ttl) {
        try {
            valueOperations.set(flagKey(callId, flag), FLAG_VALUE, ttl);
        } catch (RuntimeException e) {
            failed("setFlag", callId, e);
        }
    }

    @Override
    public boolean setFlagIfAbsent(String callId, SessionFlag flag, Duration ttl) {
        try {
            return Boolean.TRUE.equals(valueOperations.setIfAbsent(flagKey(callId, flag), FLAG_VALUE, ttl));
        } catch (RuntimeException e) {
            failed("setFlagIfAbsent", callId, e);
            return true;
        }
    }

    @Override
    public boolean getFlag(String callId, SessionFlag flag) {
        try {
            return FLAG_VALUE.equals(valueOperations.get(flagKey(callId, flag)));
        } catch (RuntimeException e) {
            failed("getFlag", callId, e);
            return false;
        }
    }

    @Override
    public void clearFlag(String callId, SessionFlag flag) {
        try {
            redisTemplate.delete(flagKey(callId, flag));
        } catch (RuntimeException e) {
            failed("clearFlag", callId, e);
        }
    }

    @Override
    public boolean addPlayback(String callId, String playbackId, Duration ttl) {
        String key = playbacksKey(callId);
        try {
            Long added = setOperations.add(key, playbackId);
            redisTemplate.expire(key, ttl);
            return added != null && added > 0;
        } catch (RuntimeException e) {
            failed("addPlayback", callId, e);
            return false;
        }
    }

    @Override
    public boolean removePlayback(String callId, String playbackId) {
        try {
            Long removed = setOperations.remove(playbacksKey(callId), playbackId);
            return removed != null && removed > 0;
        } catch (RuntimeException e) {
            failed("removePlayback", callId, e);
            return false;
        }
    }

    @Override
    public Set<String> playbackIds(String callId) {
        try {
            Set<String> members = setOperations.members(playbacksKey(callId));
            return members == null ? Set.of() : Set.copyOf(members);
        } catch (RuntimeException e) {
            failed("playbackIds", callId, e);
            return Set.of();
        }
    }

    @Override
    public void clearPlaybacks(String callId) {
        try {
            redisTemplate.delete(playbacksKey(callId));
        } catch (RuntimeException e) {
            failed("clearPlaybacks", callId, e);
        }
    }

    @Override
    public boolean markEventProcessed(String eventId, Duration ttl) {
        try {
            return Boolean.TRUE.equals(valueOperations.setIfAbsent(eventKey(eventId), FLAG_VALUE, ttl));
        } catch (RuntimeException e) {
            failed("markEventProcessed", eventId, e);
            return true;
        }
    }

    @Override
    public void expire(String callId) {
        List<String> keys = new ArrayList<>();
        keys.add(callKey(callId));
        keys.add(playbacksKey(callId));
        for (SessionCounter counter : SessionCounter.values()) {
            keys.add(counterKey(callId, counter));
        }
        for (SessionFlag flag : SessionFlag.values()) {
            keys.add(flagKey(callId, flag));
        }
        try {
            redisTemplate.delete(keys);
        } catch (RuntimeException e) {
            failed("expire", callId, e);
        }
    }

    private void failed(String operation, String id, Exception e) {
        metrics.incrementStoreError();
        log.warning(() -> "store.redis.failed op=" + operation + " id=" + id + " error=" + e.getMessage());
    }
}

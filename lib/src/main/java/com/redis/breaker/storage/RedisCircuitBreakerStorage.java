package com.redis.breaker.storage;

import com.redis.breaker.config.RedisStorageConfig;
import com.redis.breaker.model.CircuitState;
import io.lettuce.core.RedisException;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps breaker state in Redis so that several processes share one breaker.
 * 
 * <p>Keys are {@code {baseNamespace}:{namespace}:state}, {@code ...:fail_counter} and
 * {@code ...:opened_at}. The connection may be shared with other breakers; only
 * single-key atomic commands are used.</p>
 * 
 * <p>Opened-at is stored as integer epoch seconds. Values read back are truncated to the
 * second, so the open window can be up to one second shorter than the configured reset
 * timeout; reset timeouts under two seconds are not meaningful with this backend.</p>
 * 
 * <p>Redis failures never escape: reads return the configured fallback state (or a zero
 * counter / no opened-at) and writes are logged and dropped.</p>
 */
public class RedisCircuitBreakerStorage implements CircuitBreakerStorage {
    
    private static final Logger logger = LoggerFactory.getLogger(RedisCircuitBreakerStorage.class);
    
    static final String STATE_FIELD = "state";
    static final String FAIL_COUNTER_FIELD = "fail_counter";
    static final String OPENED_AT_FIELD = "opened_at";
    
    // Writes ARGV[1] only when the key is missing or holds a smaller epoch second.
    static final String SET_IF_NEWER_SCRIPT =
        "local current = redis.call('get', KEYS[1]) " +
        "if not current or tonumber(ARGV[1]) > tonumber(current) then " +
        "redis.call('set', KEYS[1], ARGV[1]) return 1 end " +
        "return 0";
    
    private final StatefulRedisConnection<String, String> connection;
    private final RedisStorageConfig config;
    private final String stateKey;
    private final String failCounterKey;
    private final String openedAtKey;
    
    public RedisCircuitBreakerStorage(StatefulRedisConnection<String, String> connection, RedisStorageConfig config) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.config = Objects.requireNonNull(config, "config");
        this.stateKey = key(STATE_FIELD);
        this.failCounterKey = key(FAIL_COUNTER_FIELD);
        this.openedAtKey = key(OPENED_AT_FIELD);
    }
    
    /**
     * Creates the storage and seeds the counter and initial state if this breaker
     * does not exist in Redis yet. An existing shared breaker is left untouched.
     */
    public static RedisCircuitBreakerStorage create(StatefulRedisConnection<String, String> connection,
                                                    RedisStorageConfig config) {
        RedisCircuitBreakerStorage storage = new RedisCircuitBreakerStorage(connection, config);
        storage.initialize();
        return storage;
    }
    
    /**
     * Seeds {@code fail_counter} and {@code state} with SETNX.
     */
    public void initialize() {
        try {
            RedisCommands<String, String> commands = commands();
            commands.setnx(failCounterKey, "0");
            boolean created = Boolean.TRUE.equals(commands.setnx(stateKey, config.getInitialState().getValue()));
            logger.debug("Initialized breaker storage {} (created={})", stateKey, created);
        } catch (RedisException e) {
            logger.error("RedisError: failed to initialize breaker storage {}", stateKey, e);
        }
    }
    
    @Override
    public String getName() {
        return "redis";
    }
    
    @Override
    public CircuitState getState() {
        try {
            String value = commands().get(stateKey);
            return value == null ? CircuitState.CLOSED : CircuitState.fromValue(value);
        } catch (RedisException | IllegalArgumentException e) {
            logger.error("RedisError: falling back to {} circuit state for {}", config.getFallbackState(), stateKey, e);
            return config.getFallbackState();
        }
    }
    
    @Override
    public void setState(CircuitState state) {
        try {
            commands().set(stateKey, state.getValue());
        } catch (RedisException e) {
            logger.error("RedisError: failed to set state {} on {}", state, stateKey, e);
        }
    }
    
    @Override
    public long getCounter() {
        try {
            String value = commands().get(failCounterKey);
            return value == null ? 0L : Long.parseLong(value);
        } catch (RedisException | NumberFormatException e) {
            logger.error("RedisError: assuming no failures for {}", failCounterKey, e);
            return 0L;
        }
    }
    
    @Override
    public void incrementCounter() {
        try {
            commands().incr(failCounterKey);
        } catch (RedisException e) {
            logger.error("RedisError: failed to increment {}", failCounterKey, e);
        }
    }
    
    @Override
    public void resetCounter() {
        if (getCounter() <= 0) {
            return;
        }
        try {
            commands().set(failCounterKey, "0");
        } catch (RedisException e) {
            logger.error("RedisError: failed to reset {}", failCounterKey, e);
        }
    }
    
    @Override
    public Optional<Instant> getOpenedAt() {
        try {
            String value = commands().get(openedAtKey);
            return value == null ? Optional.empty() : Optional.of(Instant.ofEpochSecond(Long.parseLong(value)));
        } catch (RedisException | NumberFormatException e) {
            logger.error("RedisError: failed to read {}", openedAtKey, e);
            return Optional.empty();
        }
    }
    
    @Override
    public void setOpenedAt(Instant openedAt) {
        String epochSeconds = String.valueOf(openedAt.getEpochSecond());
        try {
            Long written = commands().eval(SET_IF_NEWER_SCRIPT, ScriptOutputType.INTEGER,
                new String[]{openedAtKey}, epochSeconds);
            if (written != null && written == 0L) {
                logger.debug("Kept newer opened_at on {} (offered {})", openedAtKey, epochSeconds);
            }
        } catch (RedisException e) {
            logger.error("RedisError: failed to set {}", openedAtKey, e);
        }
    }
    
    public RedisStorageConfig getConfig() {
        return config;
    }
    
    /**
     * Full Redis key for one of this breaker's fields.
     */
    public String key(String field) {
        StringBuilder key = new StringBuilder(config.getBaseNamespace()).append(':');
        if (config.getNamespace() != null && !config.getNamespace().isEmpty()) {
            key.append(config.getNamespace()).append(':');
        }
        return key.append(field).toString();
    }
    
    private RedisCommands<String, String> commands() {
        return connection.sync();
    }
}

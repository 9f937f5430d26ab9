package com.redis.breaker.storage;

import com.redis.breaker.config.RedisStorageConfig;
import io.lettuce.core.api.StatefulRedisConnection;

/**
 * Creates the storage for a breaker identified by a namespace.
 */
@FunctionalInterface
public interface StorageFactory {
    
    /**
     * @param namespace the namespace of the breaker
     * @return a storage scoped to that namespace
     */
    CircuitBreakerStorage create(String namespace);
    
    /**
     * Independent in-memory storage per breaker.
     */
    static StorageFactory memory() {
        return namespace -> new MemoryCircuitBreakerStorage();
    }
    
    /**
     * Redis storage per breaker over one shared connection.
     * 
     * @param connection connection shared by all breakers
     * @param template base settings; the namespace is replaced per breaker
     */
    static StorageFactory redis(StatefulRedisConnection<String, String> connection, RedisStorageConfig template) {
        return namespace -> RedisCircuitBreakerStorage.create(connection,
            template.toBuilder().namespace(namespace).build());
    }
}

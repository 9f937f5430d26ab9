package com.redis.breaker;

import com.redis.breaker.config.CircuitBreakerConfig;
import com.redis.breaker.impl.DefaultCircuitBreaker;
import com.redis.breaker.model.CircuitBreakerListener;
import com.redis.breaker.storage.CircuitBreakerStorage;
import com.redis.breaker.storage.MemoryCircuitBreakerStorage;

import java.util.Arrays;

/**
 * Factory methods for CircuitBreaker instances.
 */
public class CircuitBreakerBuilder {
    
    /**
     * Create a breaker keeping its state in local memory.
     * 
     * @param configuration the breaker configuration
     * @return A new CircuitBreaker instance
     */
    public static CircuitBreaker create(CircuitBreakerConfig configuration) {
        return create(configuration, new MemoryCircuitBreakerStorage());
    }
    
    /**
     * Create a breaker over the given storage. Its initial state is read from the storage.
     * 
     * @param configuration the breaker configuration
     * @param storage the state storage
     * @param listeners listeners to register, in order
     * @return A new CircuitBreaker instance
     */
    public static CircuitBreaker create(CircuitBreakerConfig configuration,
                                        CircuitBreakerStorage storage,
                                        CircuitBreakerListener... listeners) {
        return new DefaultCircuitBreaker(configuration, storage, Arrays.asList(listeners));
    }
    
    /**
     * Start building a new breaker configuration.
     * 
     * @return A new configuration builder
     */
    public static CircuitBreakerConfig.Builder builder() {
        return CircuitBreakerConfig.builder();
    }
}

package com.redis.breaker.storage;

import com.redis.breaker.model.CircuitState;

import java.time.Instant;
import java.util.Optional;

/**
 * Holds the canonical state, failure counter and opened-at timestamp of one breaker.
 * Implementations never throw on backend failures: reads fall back to a default
 * and writes are dropped.
 */
public interface CircuitBreakerStorage {
    
    /**
     * Human friendly name of the backend, e.g. {@code "memory"} or {@code "redis"}.
     */
    String getName();
    
    /**
     * Get the canonical breaker state.
     * @return the stored state, {@link CircuitState#CLOSED} when none is stored
     */
    CircuitState getState();
    
    /**
     * Set the canonical breaker state.
     * @param state the new state
     */
    void setState(CircuitState state);
    
    /**
     * Get the current number of counted failures.
     * @return the failure counter, never negative
     */
    long getCounter();
    
    /**
     * Atomically add one to the failure counter.
     */
    void incrementCounter();
    
    /**
     * Set the failure counter to zero.
     */
    void resetCounter();
    
    /**
     * Get the most recent time the circuit was opened.
     * @return the opened-at instant, empty if the circuit was never opened
     */
    Optional<Instant> getOpenedAt();
    
    /**
     * Record the time the circuit was opened. The stored value only moves forward:
     * an instant older than the stored one is ignored.
     * @param openedAt the opening instant (UTC)
     */
    void setOpenedAt(Instant openedAt);
}

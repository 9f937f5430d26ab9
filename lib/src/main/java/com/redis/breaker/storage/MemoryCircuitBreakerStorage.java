package com.redis.breaker.storage;

import com.redis.breaker.model.CircuitState;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps breaker state in local memory. Opened-at keeps full {@link Instant} precision.
 */
public class MemoryCircuitBreakerStorage implements CircuitBreakerStorage {
    
    private final AtomicReference<CircuitState> state;
    private final AtomicLong failCounter = new AtomicLong();
    private final AtomicReference<Instant> openedAt = new AtomicReference<>();
    
    public MemoryCircuitBreakerStorage() {
        this(CircuitState.CLOSED);
    }
    
    public MemoryCircuitBreakerStorage(CircuitState initialState) {
        this.state = new AtomicReference<>(Objects.requireNonNull(initialState, "initialState"));
    }
    
    @Override
    public String getName() {
        return "memory";
    }
    
    @Override
    public CircuitState getState() {
        return state.get();
    }
    
    @Override
    public void setState(CircuitState state) {
        this.state.set(Objects.requireNonNull(state, "state"));
    }
    
    @Override
    public long getCounter() {
        return failCounter.get();
    }
    
    @Override
    public void incrementCounter() {
        failCounter.incrementAndGet();
    }
    
    @Override
    public void resetCounter() {
        failCounter.set(0);
    }
    
    @Override
    public Optional<Instant> getOpenedAt() {
        return Optional.ofNullable(openedAt.get());
    }
    
    @Override
    public void setOpenedAt(Instant instant) {
        Objects.requireNonNull(instant, "openedAt");
        openedAt.accumulateAndGet(instant,
            (current, next) -> current == null || next.isAfter(current) ? next : current);
    }
}

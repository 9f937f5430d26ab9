package com.redis.breaker;

import com.redis.breaker.model.CircuitBreakerListener;
import com.redis.breaker.model.CircuitState;
import com.redis.breaker.operations.ReactiveCallOperations;
import com.redis.breaker.operations.SyncCallOperations;
import com.redis.breaker.storage.CircuitBreakerStorage;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * Circuit breaker guarding calls to a fallible dependency.
 * Provides blocking and reactive calling conventions over one state machine whose
 * canonical state lives in a {@link CircuitBreakerStorage}.
 */
public interface CircuitBreaker {
    
    /**
     * Name of this breaker, used in logs, metrics and exceptions.
     */
    String getName();
    
    /**
     * Get blocking call operations.
     * @return SyncCallOperations executing on the caller's thread
     */
    SyncCallOperations sync();
    
    /**
     * Get reactive call operations.
     * @return ReactiveCallOperations for Mono and CompletionStage based calls
     */
    ReactiveCallOperations reactive();
    
    /**
     * Get the current state, reconciled against storage first.
     * @return the canonical state
     */
    CircuitState getCurrentState();
    
    /**
     * Get the number of counted failures held in storage.
     */
    long getFailCounter();
    
    /**
     * Force the circuit open; following calls fail fast until the reset timeout elapses.
     */
    void open();
    
    /**
     * Force the circuit closed and reset the failure counter.
     */
    void close();
    
    /**
     * Force the circuit half-open; the next call is the trial that decides the next state.
     */
    void halfOpen();
    
    int getFailMax();
    
    void setFailMax(int failMax);
    
    Duration getResetTimeout();
    
    void setResetTimeout(Duration resetTimeout);
    
    /**
     * Exception types (and their subclasses) that are not counted as failures.
     */
    List<Class<? extends Throwable>> getExcludedExceptions();
    
    void addExcludedException(Class<? extends Throwable> exception);
    
    void addExcludedExceptions(Collection<? extends Class<? extends Throwable>> exceptions);
    
    boolean removeExcludedException(Class<? extends Throwable> exception);
    
    /**
     * Whether the given exception signals a malfunction of the dependency.
     * @return false if the exception is an instance of an excluded type
     */
    boolean isSystemError(Throwable error);
    
    /**
     * Registered listeners, in registration order.
     */
    List<CircuitBreakerListener> getListeners();
    
    void addListener(CircuitBreakerListener listener);
    
    void addListeners(CircuitBreakerListener... listeners);
    
    boolean removeListener(CircuitBreakerListener listener);
    
    CircuitBreakerStorage getStorage();
}

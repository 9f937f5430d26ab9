package com.redis.breaker.model;

import com.redis.breaker.CircuitBreaker;

/**
 * Callback interface for circuit breaker events.
 * All methods default to no-ops so implementations only override the events they need.
 * Listeners are invoked synchronously, in registration order.
 */
public interface CircuitBreakerListener {
    
    /**
     * Called once when the listener is attached to a breaker, after the breaker's
     * initial state is known.
     * 
     * @param breaker the circuit breaker
     */
    default void onRegistered(CircuitBreaker breaker) {
    }
    
    /**
     * Called before the breaker executes an admitted call.
     * 
     * @param breaker the circuit breaker
     */
    default void beforeCall(CircuitBreaker breaker) {
    }
    
    /**
     * Called when an admitted call succeeds, or fails with an excluded exception.
     * 
     * @param breaker the circuit breaker
     */
    default void onSuccess(CircuitBreaker breaker) {
    }
    
    /**
     * Called when an admitted call fails with a qualifying exception.
     * 
     * @param breaker the circuit breaker
     * @param error the exception raised by the protected operation
     */
    default void onFailure(CircuitBreaker breaker, Throwable error) {
    }
    
    /**
     * Called once per state transition.
     * 
     * @param breaker the circuit breaker
     * @param from the previous state
     * @param to the new state
     */
    default void onStateChange(CircuitBreaker breaker, CircuitState from, CircuitState to) {
    }
}

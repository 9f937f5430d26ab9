package com.redis.breaker;

import com.redis.breaker.model.CircuitState;

/**
 * Exception thrown when a call is short-circuited by an open breaker,
 * or when the call that trips the breaker (or a failed half-open trial) fails.
 * In the latter case the operation's own exception is kept as the cause.
 */
public class CircuitOpenException extends RuntimeException {
    
    private final String breakerName;
    private final CircuitState state;
    
    public CircuitOpenException(String breakerName, CircuitState state, String message) {
        this(breakerName, state, message, null);
    }
    
    public CircuitOpenException(String breakerName, CircuitState state, String message, Throwable cause) {
        super(String.format("Circuit breaker '%s' (%s): %s", breakerName, state, message), cause);
        this.breakerName = breakerName;
        this.state = state;
    }
    
    public String getBreakerName() {
        return breakerName;
    }
    
    /**
     * The state the breaker was in when the call was rejected.
     */
    public CircuitState getState() {
        return state;
    }
}

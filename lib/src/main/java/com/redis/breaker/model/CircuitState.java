package com.redis.breaker.model;

/**
 * Circuit breaker state. The canonical value lives in the breaker's storage.
 */
public enum CircuitState {
    
    /**
     * Circuit is closed - calls are executed and failures are counted.
     */
    CLOSED("closed"),
    
    /**
     * Circuit is open - calls fail fast without executing the protected operation.
     */
    OPEN("open"),
    
    /**
     * Circuit is half-open - a single trial call decides the next transition.
     */
    HALF_OPEN("half-open");
    
    private final String value;
    
    CircuitState(String value) {
        this.value = value;
    }
    
    /**
     * Returns the string stored for this state, e.g. {@code "half-open"}.
     */
    public String getValue() {
        return value;
    }
    
    /**
     * Resolves a stored state string.
     *
     * @param value the stored value
     * @return the matching state
     * @throws IllegalArgumentException if the value names no known state
     */
    public static CircuitState fromValue(String value) {
        for (CircuitState state : values()) {
            if (state.value.equals(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown circuit state '" + value + "', valid states: closed, open, half-open");
    }
    
    @Override
    public String toString() {
        return value;
    }
}

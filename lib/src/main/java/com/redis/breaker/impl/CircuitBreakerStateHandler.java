package com.redis.breaker.impl;

import com.redis.breaker.model.CircuitState;

/**
 * Call gating and transition triggers of one breaker state.
 * All methods are invoked with the breaker's lock held.
 */
abstract class CircuitBreakerStateHandler {
    
    protected final DefaultCircuitBreaker breaker;
    
    CircuitBreakerStateHandler(DefaultCircuitBreaker breaker) {
        this.breaker = breaker;
    }
    
    abstract CircuitState getState();
    
    /**
     * Entry side effects, run whenever a handler for this state is created.
     */
    void onEnter() {
    }
    
    /**
     * Admit a call or throw {@link com.redis.breaker.CircuitOpenException}.
     */
    abstract CallPermit acquirePermission();
    
    /**
     * Book-keeping for a qualifying failure, before failure listeners run.
     */
    void recordFailure() {
    }
    
    /**
     * Transition triggers for a qualifying failure.
     * @return the exception to raise to the caller
     */
    Throwable onFailure(Throwable error) {
        return error;
    }
    
    void onSuccess() {
        breaker.getStorage().resetCounter();
    }
    
    /**
     * An excluded exception counts as a healthy call but never changes the state.
     */
    void onExcludedError() {
        breaker.getStorage().resetCounter();
    }
    
    /**
     * The admitted call was cancelled before producing an outcome.
     */
    void onCancel() {
    }
    
    @Override
    public String toString() {
        return getState().getValue();
    }
}

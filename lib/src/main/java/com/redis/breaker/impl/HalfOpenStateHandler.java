package com.redis.breaker.impl;

import com.redis.breaker.CircuitOpenException;
import com.redis.breaker.model.CircuitState;

/**
 * Half-open: exactly one trial call runs. Success closes the circuit, a qualifying
 * failure opens it again. Callers arriving while the trial is in flight are rejected.
 */
class HalfOpenStateHandler extends CircuitBreakerStateHandler {
    
    private boolean trialInFlight;
    
    HalfOpenStateHandler(DefaultCircuitBreaker breaker) {
        super(breaker);
    }
    
    @Override
    CircuitState getState() {
        return CircuitState.HALF_OPEN;
    }
    
    @Override
    CallPermit acquirePermission() {
        if (trialInFlight) {
            throw new CircuitOpenException(breaker.getName(), CircuitState.HALF_OPEN,
                "Trial call already in progress, circuit breaker half-open");
        }
        trialInFlight = true;
        return new CallPermit(this);
    }
    
    @Override
    Throwable onFailure(Throwable error) {
        trialInFlight = false;
        breaker.transitionTo(CircuitState.OPEN);
        return new CircuitOpenException(breaker.getName(), CircuitState.OPEN,
            "Trial call failed, circuit breaker opened", error);
    }
    
    @Override
    void onSuccess() {
        trialInFlight = false;
        breaker.transitionTo(CircuitState.CLOSED);
    }
    
    @Override
    void onExcludedError() {
        trialInFlight = false;
        super.onExcludedError();
    }
    
    @Override
    void onCancel() {
        trialInFlight = false;
    }
    
    boolean isTrialInFlight() {
        return trialInFlight;
    }
}

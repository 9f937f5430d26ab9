package com.redis.breaker.impl;

import com.redis.breaker.CircuitOpenException;
import com.redis.breaker.model.CircuitState;

/**
 * Closed: calls execute as usual. Qualifying failures are counted and the circuit
 * opens once the counter reaches failMax.
 */
class ClosedStateHandler extends CircuitBreakerStateHandler {
    
    ClosedStateHandler(DefaultCircuitBreaker breaker) {
        super(breaker);
    }
    
    @Override
    CircuitState getState() {
        return CircuitState.CLOSED;
    }
    
    @Override
    void onEnter() {
        breaker.getStorage().resetCounter();
    }
    
    @Override
    CallPermit acquirePermission() {
        return new CallPermit(this);
    }
    
    @Override
    void recordFailure() {
        breaker.getStorage().incrementCounter();
    }
    
    @Override
    Throwable onFailure(Throwable error) {
        long failures = breaker.getStorage().getCounter();
        if (failures < breaker.getFailMax()) {
            return error;
        }
        breaker.transitionTo(CircuitState.OPEN);
        return new CircuitOpenException(breaker.getName(), CircuitState.OPEN,
            "Failures threshold reached, circuit breaker opened", error);
    }
}

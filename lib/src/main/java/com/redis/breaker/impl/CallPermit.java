package com.redis.breaker.impl;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Admission of one call by a state handler. The outcome of the call is reported
 * back to the handler that admitted it, at most once.
 */
final class CallPermit {
    
    private final CircuitBreakerStateHandler handler;
    private final AtomicBoolean settled = new AtomicBoolean();
    
    CallPermit(CircuitBreakerStateHandler handler) {
        this.handler = handler;
    }
    
    CircuitBreakerStateHandler getHandler() {
        return handler;
    }
    
    /**
     * @return true the first time it is called
     */
    boolean settle() {
        return settled.compareAndSet(false, true);
    }
}

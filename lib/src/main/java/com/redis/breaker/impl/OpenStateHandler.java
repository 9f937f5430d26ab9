package com.redis.breaker.impl;

import com.redis.breaker.CircuitOpenException;
import com.redis.breaker.model.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * Open: calls fail immediately without touching the protected operation. Once the
 * reset timeout has elapsed since opened-at, the circuit goes half-open and the
 * triggering call becomes the trial.
 */
class OpenStateHandler extends CircuitBreakerStateHandler {
    
    private static final Logger logger = LoggerFactory.getLogger(OpenStateHandler.class);
    
    OpenStateHandler(DefaultCircuitBreaker breaker) {
        super(breaker);
    }
    
    @Override
    CircuitState getState() {
        return CircuitState.OPEN;
    }
    
    @Override
    void onEnter() {
        breaker.getStorage().setOpenedAt(breaker.getClock().instant());
    }
    
    @Override
    CallPermit acquirePermission() {
        Optional<Instant> openedAt = breaker.getStorage().getOpenedAt();
        Instant now = breaker.getClock().instant();
        if (openedAt.isEmpty()) {
            // unreadable or lost: restart the open window
            logger.warn("Circuit breaker {} has no opened-at timestamp, recording {}", breaker.getName(), now);
            breaker.getStorage().setOpenedAt(now);
            throw reject(now);
        }
        if (now.isBefore(openedAt.get().plus(breaker.getResetTimeout()))) {
            throw reject(openedAt.get());
        }
        breaker.transitionTo(CircuitState.HALF_OPEN);
        return breaker.currentHandler().acquirePermission();
    }
    
    private CircuitOpenException reject(Instant openedAt) {
        if (breaker.isCountRejectedCalls()) {
            breaker.getStorage().incrementCounter();
        }
        logger.debug("Circuit breaker {} call not permitted, open since {}", breaker.getName(), openedAt);
        return new CircuitOpenException(breaker.getName(), CircuitState.OPEN,
            "Timeout not elapsed yet, circuit breaker still open");
    }
}

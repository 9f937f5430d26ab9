package com.redis.breaker.observability;

import com.redis.breaker.CircuitBreaker;
import com.redis.breaker.model.CircuitBreakerListener;
import com.redis.breaker.model.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs circuit breaker events. Transitions into OPEN are logged at WARN,
 * other transitions at INFO, call events at DEBUG.
 */
public class LoggingListener implements CircuitBreakerListener {
    
    private static final Logger logger = LoggerFactory.getLogger(LoggingListener.class);
    
    @Override
    public void beforeCall(CircuitBreaker breaker) {
        logger.debug("Circuit breaker {} executing call", breaker.getName());
    }
    
    @Override
    public void onSuccess(CircuitBreaker breaker) {
        logger.debug("Circuit breaker {} call succeeded", breaker.getName());
    }
    
    @Override
    public void onFailure(CircuitBreaker breaker, Throwable error) {
        logger.debug("Circuit breaker {} call failed: {}", breaker.getName(), error.toString());
    }
    
    @Override
    public void onStateChange(CircuitBreaker breaker, CircuitState from, CircuitState to) {
        if (to == CircuitState.OPEN) {
            logger.warn("Circuit breaker {} opened (was {})", breaker.getName(), from);
        } else {
            logger.info("Circuit breaker {} moved from {} to {}", breaker.getName(), from, to);
        }
    }
}

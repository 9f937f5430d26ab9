package com.redis.breaker.resilience;

import com.redis.breaker.CircuitBreaker;
import com.redis.breaker.CircuitOpenException;
import com.redis.breaker.model.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Runs calls to named dependencies through their registry breakers.
 * A call made with {@link CallOptions#skipBreaker()} runs directly and leaves the
 * breaker untouched.
 */
public class GuardedCallExecutor {
    
    private static final Logger logger = LoggerFactory.getLogger(GuardedCallExecutor.class);
    
    private final CircuitBreakerRegistry registry;
    
    public GuardedCallExecutor(CircuitBreakerRegistry registry) {
        this.registry = registry;
    }
    
    public <T> T execute(String dependency, Callable<T> operation) throws Exception {
        return execute(dependency, operation, CallOptions.defaults());
    }
    
    public <T> T execute(String dependency, Callable<T> operation, CallOptions options) throws Exception {
        if (options.isSkipBreaker()) {
            return operation.call();
        }
        try {
            return registry.circuitBreaker(dependency).sync().call(operation);
        } catch (CircuitOpenException e) {
            logger.error("[{}] {}", registry.namespaceOf(dependency), e.getMessage());
            throw e;
        }
    }
    
    public <T> Mono<T> executeReactive(String dependency, Supplier<? extends Mono<T>> operation) {
        return executeReactive(dependency, operation, CallOptions.defaults());
    }
    
    public <T> Mono<T> executeReactive(String dependency, Supplier<? extends Mono<T>> operation, CallOptions options) {
        if (options.isSkipBreaker()) {
            return Mono.defer(operation);
        }
        return registry.circuitBreaker(dependency).reactive().call(operation)
            .doOnError(CircuitOpenException.class,
                e -> logger.error("[{}] {}", registry.namespaceOf(dependency), e.getMessage()));
    }
    
    /**
     * Put every known breaker that is currently open into half-open, so the next call
     * probes the dependency instead of waiting out the reset timeout. Intended for
     * process start-up.
     * 
     * @return the number of breakers moved to half-open
     */
    public int probeOpenBreakers() {
        int probed = 0;
        for (CircuitBreaker breaker : registry.getAll()) {
            if (breaker.getCurrentState() == CircuitState.OPEN) {
                breaker.halfOpen();
                probed++;
            }
        }
        logger.info("Moved {} open circuit breakers to half-open", probed);
        return probed;
    }
    
    /**
     * Get the breaker for a dependency and probe it if open.
     */
    public CircuitState probe(String dependency) {
        CircuitBreaker breaker = registry.circuitBreaker(dependency);
        if (breaker.getCurrentState() == CircuitState.OPEN) {
            breaker.halfOpen();
        }
        return breaker.getCurrentState();
    }
    
    public CircuitBreakerRegistry getRegistry() {
        return registry;
    }
}

package com.redis.breaker.observability;

import com.redis.breaker.CircuitBreaker;
import com.redis.breaker.model.CircuitBreakerListener;
import com.redis.breaker.model.CircuitState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Records circuit breaker events as Micrometer metrics. One instance can be shared
 * by many breakers; meters are tagged with the breaker name.
 * 
 * <ul>
 *   <li>{@code circuitbreaker.calls} - counter tagged {@code outcome=success|failure}</li>
 *   <li>{@code circuitbreaker.state.transitions} - counter tagged {@code from}, {@code to}</li>
 *   <li>{@code circuitbreaker.state} - gauge, 0 closed, 1 open, 2 half-open</li>
 * </ul>
 */
public class MetricsListener implements CircuitBreakerListener {
    
    private static final Logger logger = LoggerFactory.getLogger(MetricsListener.class);
    
    static final String CALLS = "circuitbreaker.calls";
    static final String TRANSITIONS = "circuitbreaker.state.transitions";
    static final String STATE = "circuitbreaker.state";
    
    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, AtomicInteger> states = new ConcurrentHashMap<>();
    
    public MetricsListener() {
        this(new SimpleMeterRegistry());
    }
    
    public MetricsListener(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        logger.info("Circuit breaker metrics listener initialized with {}", meterRegistry.getClass().getSimpleName());
    }
    
    @Override
    public void onRegistered(CircuitBreaker breaker) {
        CircuitState current = breaker.getCurrentState();
        stateGauge(breaker).set(current.ordinal());
    }
    
    @Override
    public void onSuccess(CircuitBreaker breaker) {
        callCounter(breaker, "success").increment();
    }
    
    @Override
    public void onFailure(CircuitBreaker breaker, Throwable error) {
        callCounter(breaker, "failure").increment();
    }
    
    @Override
    public void onStateChange(CircuitBreaker breaker, CircuitState from, CircuitState to) {
        Counter.builder(TRANSITIONS)
            .description("Circuit breaker state transitions")
            .tag("name", breaker.getName())
            .tag("from", from.getValue())
            .tag("to", to.getValue())
            .register(meterRegistry)
            .increment();
        stateGauge(breaker).set(to.ordinal());
    }
    
    /**
     * Last state reported for a breaker, or {@code null} if none was observed.
     */
    public CircuitState getRecordedState(String breakerName) {
        AtomicInteger value = states.get(breakerName);
        return value == null ? null : CircuitState.values()[value.get()];
    }
    
    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
    
    private Counter callCounter(CircuitBreaker breaker, String outcome) {
        return Counter.builder(CALLS)
            .description("Calls executed through the circuit breaker")
            .tag("name", breaker.getName())
            .tag("outcome", outcome)
            .register(meterRegistry);
    }
    
    private AtomicInteger stateGauge(CircuitBreaker breaker) {
        return states.computeIfAbsent(breaker.getName(), name -> {
            AtomicInteger value = new AtomicInteger(CircuitState.CLOSED.ordinal());
            Gauge.builder(STATE, value, AtomicInteger::doubleValue)
                .description("Circuit breaker state (0 closed, 1 open, 2 half-open)")
                .tag("name", name)
                .register(meterRegistry);
            return value;
        });
    }
}

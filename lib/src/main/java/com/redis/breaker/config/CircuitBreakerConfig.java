package com.redis.breaker.config;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Circuit breaker configuration: failure threshold, reset timeout and excluded exceptions.
 */
public class CircuitBreakerConfig {
    
    public static final int DEFAULT_FAIL_MAX = 5;
    public static final Duration DEFAULT_RESET_TIMEOUT = Duration.ofSeconds(60);
    public static final String DEFAULT_NAME = "default";
    
    private final int failMax;
    private final Duration resetTimeout;
    private final List<Class<? extends Throwable>> excludedExceptions;
    private final String name;
    private final boolean countRejectedCalls;
    private final Clock clock;
    
    private CircuitBreakerConfig(Builder builder) {
        this.failMax = builder.failMax;
        this.resetTimeout = builder.resetTimeout;
        this.excludedExceptions = List.copyOf(builder.excludedExceptions);
        this.name = builder.name;
        this.countRejectedCalls = builder.countRejectedCalls;
        this.clock = builder.clock;
    }
    
    /**
     * Number of consecutive qualifying failures that opens the circuit.
     */
    public int getFailMax() {
        return failMax;
    }
    
    /**
     * How long the circuit stays open before a trial call is allowed.
     */
    public Duration getResetTimeout() {
        return resetTimeout;
    }
    
    public List<Class<? extends Throwable>> getExcludedExceptions() {
        return excludedExceptions;
    }
    
    public String getName() {
        return name;
    }
    
    /**
     * Whether calls rejected while the circuit is open are added to the failure counter.
     * Off by default: the counter then only accumulates in the closed state.
     */
    public boolean isCountRejectedCalls() {
        return countRejectedCalls;
    }
    
    public Clock getClock() {
        return clock;
    }
    
    public Builder toBuilder() {
        Builder builder = new Builder()
            .failMax(failMax)
            .resetTimeout(resetTimeout)
            .name(name)
            .countRejectedCalls(countRejectedCalls)
            .clock(clock);
        builder.excludedExceptions.addAll(excludedExceptions);
        return builder;
    }
    
    public static CircuitBreakerConfig defaultConfig() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    @Override
    public String toString() {
        return "CircuitBreakerConfig{" +
            "name='" + name + '\'' +
            ", failMax=" + failMax +
            ", resetTimeout=" + resetTimeout +
            ", excludedExceptions=" + excludedExceptions +
            ", countRejectedCalls=" + countRejectedCalls +
            '}';
    }
    
    public static class Builder {
        private int failMax = DEFAULT_FAIL_MAX;
        private Duration resetTimeout = DEFAULT_RESET_TIMEOUT;
        private final List<Class<? extends Throwable>> excludedExceptions = new ArrayList<>();
        private String name = DEFAULT_NAME;
        private boolean countRejectedCalls = false;
        private Clock clock = Clock.systemUTC();
        
        public Builder failMax(int failMax) {
            this.failMax = failMax;
            return this;
        }
        
        public Builder resetTimeout(Duration resetTimeout) {
            this.resetTimeout = resetTimeout;
            return this;
        }
        
        public Builder exclude(Class<? extends Throwable> exception) {
            this.excludedExceptions.add(Objects.requireNonNull(exception, "exception"));
            return this;
        }
        
        public Builder exclude(Collection<? extends Class<? extends Throwable>> exceptions) {
            exceptions.forEach(this::exclude);
            return this;
        }
        
        public Builder name(String name) {
            this.name = name;
            return this;
        }
        
        public Builder countRejectedCalls(boolean countRejectedCalls) {
            this.countRejectedCalls = countRejectedCalls;
            return this;
        }
        
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }
        
        public CircuitBreakerConfig build() {
            if (failMax <= 0) {
                throw new IllegalArgumentException("failMax must be greater than 0, got " + failMax);
            }
            Objects.requireNonNull(resetTimeout, "resetTimeout");
            if (resetTimeout.isNegative() || resetTimeout.isZero()) {
                throw new IllegalArgumentException("resetTimeout must be positive, got " + resetTimeout);
            }
            Objects.requireNonNull(clock, "clock");
            if (name == null || name.isBlank()) {
                name = DEFAULT_NAME;
            }
            return new CircuitBreakerConfig(this);
        }
    }
}

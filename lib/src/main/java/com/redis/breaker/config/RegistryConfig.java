package com.redis.breaker.config;

import com.redis.breaker.model.CircuitBreakerListener;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Configuration shared by every breaker a registry creates.
 */
public class RegistryConfig {
    
    public static final String DEFAULT_ENVIRONMENT = "default";
    
    private final String environment;
    private final CircuitBreakerConfig breakerConfig;
    private final List<CircuitBreakerListener> listeners;
    
    private RegistryConfig(Builder builder) {
        this.environment = builder.environment;
        this.breakerConfig = builder.breakerConfig;
        this.listeners = List.copyOf(builder.listeners);
    }
    
    /**
     * Environment prefix used when deriving storage namespaces.
     */
    public String getEnvironment() {
        return environment;
    }
    
    /**
     * Template configuration; each breaker gets a copy named after its dependency.
     */
    public CircuitBreakerConfig getBreakerConfig() {
        return breakerConfig;
    }
    
    public List<CircuitBreakerListener> getListeners() {
        return listeners;
    }
    
    public static RegistryConfig defaultConfig() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private String environment = DEFAULT_ENVIRONMENT;
        private CircuitBreakerConfig breakerConfig = CircuitBreakerConfig.defaultConfig();
        private final List<CircuitBreakerListener> listeners = new ArrayList<>();
        
        public Builder environment(String environment) {
            this.environment = environment;
            return this;
        }
        
        public Builder breakerConfig(CircuitBreakerConfig breakerConfig) {
            this.breakerConfig = breakerConfig;
            return this;
        }
        
        public Builder listener(CircuitBreakerListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }
        
        public RegistryConfig build() {
            if (environment == null || environment.isBlank()) {
                throw new IllegalArgumentException("environment must not be blank");
            }
            Objects.requireNonNull(breakerConfig, "breakerConfig");
            return new RegistryConfig(this);
        }
    }
}

package com.redis.breaker.config;

import com.redis.breaker.model.CircuitState;

import java.util.Objects;

/**
 * Configuration for breaker state kept in a shared Redis instance.
 * Keys are laid out as {@code {baseNamespace}:{namespace}:{field}}.
 */
public class RedisStorageConfig {
    
    public static final String DEFAULT_BASE_NAMESPACE = "breaker";
    
    private final String baseNamespace;
    private final String namespace;
    private final CircuitState initialState;
    private final CircuitState fallbackState;
    
    private RedisStorageConfig(Builder builder) {
        this.baseNamespace = builder.baseNamespace;
        this.namespace = builder.namespace;
        this.initialState = builder.initialState;
        this.fallbackState = builder.fallbackState;
    }
    
    public String getBaseNamespace() {
        return baseNamespace;
    }
    
    /**
     * The per-breaker namespace, or {@code null} when keys sit directly under the base namespace.
     */
    public String getNamespace() {
        return namespace;
    }
    
    /**
     * State written when the shared breaker does not exist yet.
     */
    public CircuitState getInitialState() {
        return initialState;
    }
    
    /**
     * State reported while Redis cannot be read.
     */
    public CircuitState getFallbackState() {
        return fallbackState;
    }
    
    public Builder toBuilder() {
        return new Builder()
            .baseNamespace(baseNamespace)
            .namespace(namespace)
            .initialState(initialState)
            .fallbackState(fallbackState);
    }
    
    public static RedisStorageConfig defaultConfig() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private String baseNamespace = DEFAULT_BASE_NAMESPACE;
        private String namespace;
        private CircuitState initialState = CircuitState.CLOSED;
        private CircuitState fallbackState = CircuitState.CLOSED;
        
        public Builder baseNamespace(String baseNamespace) {
            this.baseNamespace = baseNamespace;
            return this;
        }
        
        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }
        
        public Builder initialState(CircuitState initialState) {
            this.initialState = initialState;
            return this;
        }
        
        public Builder fallbackState(CircuitState fallbackState) {
            this.fallbackState = fallbackState;
            return this;
        }
        
        public RedisStorageConfig build() {
            if (baseNamespace == null || baseNamespace.isBlank()) {
                throw new IllegalArgumentException("baseNamespace must not be blank");
            }
            Objects.requireNonNull(initialState, "initialState");
            Objects.requireNonNull(fallbackState, "fallbackState");
            return new RedisStorageConfig(this);
        }
    }
}

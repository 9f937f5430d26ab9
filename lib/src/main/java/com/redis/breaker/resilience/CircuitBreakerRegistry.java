package com.redis.breaker.resilience;

import com.redis.breaker.CircuitBreaker;
import com.redis.breaker.config.CircuitBreakerConfig;
import com.redis.breaker.config.RegistryConfig;
import com.redis.breaker.impl.DefaultCircuitBreaker;
import com.redis.breaker.model.CircuitState;
import com.redis.breaker.storage.CircuitBreakerStorage;
import com.redis.breaker.storage.StorageFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Owns one circuit breaker per protected dependency, created lazily on first use.
 * Each breaker is named after its dependency and stores its state under the namespace
 * given by the {@link NamespaceResolver}.
 */
public class CircuitBreakerRegistry implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreakerRegistry.class);
    
    private final RegistryConfig config;
    private final StorageFactory storageFactory;
    private final NamespaceResolver namespaceResolver;
    private final Map<String, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();
    private volatile boolean closed = false;
    
    public CircuitBreakerRegistry(RegistryConfig config, StorageFactory storageFactory) {
        this(config, storageFactory, NamespaceResolver.environmentScoped(config.getEnvironment()));
    }
    
    public CircuitBreakerRegistry(RegistryConfig config,
                                  StorageFactory storageFactory,
                                  NamespaceResolver namespaceResolver) {
        this.config = Objects.requireNonNull(config, "config");
        this.storageFactory = Objects.requireNonNull(storageFactory, "storageFactory");
        this.namespaceResolver = Objects.requireNonNull(namespaceResolver, "namespaceResolver");
        
        logger.info("CircuitBreakerRegistry initialized for environment {}", config.getEnvironment());
    }
    
    /**
     * Get or create the circuit breaker for a dependency.
     */
    public CircuitBreaker circuitBreaker(String dependency) {
        if (closed) {
            throw new IllegalStateException("CircuitBreakerRegistry is closed");
        }
        return circuitBreakers.computeIfAbsent(dependency, this::createCircuitBreaker);
    }
    
    /**
     * Get the circuit breaker for a dependency if it has been created.
     */
    public Optional<CircuitBreaker> find(String dependency) {
        return Optional.ofNullable(circuitBreakers.get(dependency));
    }
    
    public Collection<CircuitBreaker> getAll() {
        return List.copyOf(circuitBreakers.values());
    }
    
    /**
     * Current state of every breaker created so far, keyed by dependency.
     */
    public Map<String, CircuitState> getStates() {
        return circuitBreakers.entrySet().stream()
            .collect(Collectors.toMap(Map.Entry::getKey, entry -> entry.getValue().getCurrentState()));
    }
    
    public String namespaceOf(String dependency) {
        return namespaceResolver.resolve(dependency);
    }
    
    public RegistryConfig getConfig() {
        return config;
    }
    
    /**
     * Drop all breakers so the next lookup builds them from the current configuration.
     * State kept in shared storage is not touched.
     */
    public void reset() {
        int count = circuitBreakers.size();
        circuitBreakers.clear();
        logger.info("CircuitBreakerRegistry reset, {} circuit breakers dropped", count);
    }
    
    public boolean isClosed() {
        return closed;
    }
    
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        circuitBreakers.clear();
        logger.info("CircuitBreakerRegistry closed");
    }
    
    private CircuitBreaker createCircuitBreaker(String dependency) {
        String namespace = namespaceResolver.resolve(dependency);
        CircuitBreakerConfig breakerConfig = config.getBreakerConfig().toBuilder()
            .name(dependency)
            .build();
        CircuitBreakerStorage storage = storageFactory.create(namespace);
        
        logger.debug("Creating circuit breaker for {} with {} storage under namespace {}",
            dependency, storage.getName(), namespace);
        return new DefaultCircuitBreaker(breakerConfig, storage, config.getListeners());
    }
}

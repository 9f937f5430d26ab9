package com.redis.breaker.resilience;

/**
 * Maps a logical dependency name to the storage namespace of its breaker.
 */
@FunctionalInterface
public interface NamespaceResolver {
    
    /**
     * @param dependency the protected dependency, e.g. a service name
     * @return the namespace its breaker state is stored under
     */
    String resolve(String dependency);
    
    /**
     * Namespaces of the form {@code {environment}:{dependency}}, so breakers of
     * different environments can share one Redis.
     */
    static NamespaceResolver environmentScoped(String environment) {
        return dependency -> environment + ":" + dependency;
    }
}

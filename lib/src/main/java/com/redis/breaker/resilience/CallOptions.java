package com.redis.breaker.resilience;

/**
 * Per-call options for {@link GuardedCallExecutor}.
 */
public final class CallOptions {
    
    private static final CallOptions DEFAULTS = new CallOptions(false);
    private static final CallOptions SKIP_BREAKER = new CallOptions(true);
    
    private final boolean skipBreaker;
    
    private CallOptions(boolean skipBreaker) {
        this.skipBreaker = skipBreaker;
    }
    
    public static CallOptions defaults() {
        return DEFAULTS;
    }
    
    /**
     * Options that run the call directly, bypassing the breaker entirely.
     */
    public static CallOptions skipBreaker() {
        return SKIP_BREAKER;
    }
    
    public static CallOptions of(boolean skipBreaker) {
        return skipBreaker ? SKIP_BREAKER : DEFAULTS;
    }
    
    public boolean isSkipBreaker() {
        return skipBreaker;
    }
    
    @Override
    public String toString() {
        return "CallOptions{skipBreaker=" + skipBreaker + '}';
    }
}

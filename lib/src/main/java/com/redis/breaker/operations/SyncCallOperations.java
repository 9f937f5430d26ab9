package com.redis.breaker.operations;

import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Blocking calls through a circuit breaker. The protected operation runs on the caller's thread.
 * 
 * <p>Every method raises {@link com.redis.breaker.CircuitOpenException} when the call is
 * rejected, when it trips the breaker, or when it is a failed half-open trial. Any other
 * exception of the operation is re-thrown unchanged.</p>
 */
public interface SyncCallOperations {
    
    /**
     * Execute an operation according to the current state.
     * @param operation the protected operation
     * @return the operation's result
     * @throws Exception the operation's exception, possibly replaced by CircuitOpenException
     */
    <T> T call(Callable<T> operation) throws Exception;
    
    /**
     * Execute a function with one argument according to the current state.
     * @param function the protected function
     * @param argument the argument passed to the function
     * @return the function's result
     */
    <T, R> R call(Function<? super T, ? extends R> function, T argument);
    
    /**
     * Execute a runnable according to the current state.
     * @param operation the protected operation
     */
    void run(Runnable operation);
    
    /**
     * Wrap a callable so each invocation goes through the breaker.
     */
    <T> Callable<T> decorateCallable(Callable<T> operation);
    
    /**
     * Wrap a supplier so each invocation goes through the breaker.
     */
    <T> Supplier<T> decorateSupplier(Supplier<T> operation);
}

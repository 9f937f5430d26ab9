package com.redis.breaker.impl;

import com.redis.breaker.operations.SyncCallOperations;

import java.lang.reflect.UndeclaredThrowableException;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Blocking calling convention over the breaker's call engine.
 */
public class SyncCallOperationsImpl implements SyncCallOperations {
    
    private final DefaultCircuitBreaker breaker;
    
    public SyncCallOperationsImpl(DefaultCircuitBreaker breaker) {
        this.breaker = breaker;
    }
    
    @Override
    public <T> T call(Callable<T> operation) throws Exception {
        CallPermit permit = breaker.acquirePermission();
        T result;
        try {
            result = operation.call();
        } catch (Throwable error) {
            Throwable outcome = breaker.onError(permit, error);
            if (outcome instanceof Error) {
                throw (Error) outcome;
            }
            throw (Exception) outcome;
        }
        breaker.onSuccess(permit);
        return result;
    }
    
    @Override
    public <T, R> R call(Function<? super T, ? extends R> function, T argument) {
        return callUnchecked(() -> function.apply(argument));
    }
    
    @Override
    public void run(Runnable operation) {
        callUnchecked(() -> {
            operation.run();
            return null;
        });
    }
    
    @Override
    public <T> Callable<T> decorateCallable(Callable<T> operation) {
        return () -> call(operation);
    }
    
    @Override
    public <T> Supplier<T> decorateSupplier(Supplier<T> operation) {
        return () -> callUnchecked(operation::get);
    }
    
    private <T> T callUnchecked(Callable<T> operation) {
        try {
            return call(operation);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            // unchecked operations cannot raise checked exceptions
            throw new UndeclaredThrowableException(e);
        }
    }
}

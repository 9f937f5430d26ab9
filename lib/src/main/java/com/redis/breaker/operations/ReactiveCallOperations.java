package com.redis.breaker.operations;

import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Non-blocking calls through a circuit breaker using Project Reactor.
 * Storage access happens on a worker scheduler; the protected operation is subscribed
 * without blocking. Errors follow the same rules as {@link SyncCallOperations}.
 */
public interface ReactiveCallOperations {
    
    /**
     * Execute a lazily created Mono according to the current state.
     * The supplier is only invoked when the call is admitted.
     * @param operation supplier of the protected Mono
     * @return Mono emitting the operation's result
     */
    <T> Mono<T> call(Supplier<? extends Mono<T>> operation);
    
    /**
     * Execute a Mono according to the current state. The Mono is only subscribed when the call is admitted.
     * @param operation the protected Mono
     * @return Mono emitting the operation's result
     */
    <T> Mono<T> call(Mono<T> operation);
    
    /**
     * Operator for {@code Mono.transformDeferred}.
     */
    <T> Function<Mono<T>, Mono<T>> operator();
    
    /**
     * Execute a CompletionStage-returning operation according to the current state.
     * @param operation supplier of the protected future, invoked only when the call is admitted
     * @return CompletableFuture with the operation's result
     */
    <T> CompletableFuture<T> callAsync(Supplier<? extends CompletionStage<T>> operation);
}

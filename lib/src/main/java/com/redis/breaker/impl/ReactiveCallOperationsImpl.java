package com.redis.breaker.impl;

import com.redis.breaker.operations.ReactiveCallOperations;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Reactive calling convention over the breaker's call engine.
 * Storage access (permission, outcome book-keeping) runs on the given scheduler,
 * {@code boundedElastic} by default, so callers on event-loop threads are never blocked.
 */
public class ReactiveCallOperationsImpl implements ReactiveCallOperations {
    
    private final DefaultCircuitBreaker breaker;
    private final Scheduler scheduler;
    
    public ReactiveCallOperationsImpl(DefaultCircuitBreaker breaker) {
        this(breaker, Schedulers.boundedElastic());
    }
    
    public ReactiveCallOperationsImpl(DefaultCircuitBreaker breaker, Scheduler scheduler) {
        this.breaker = breaker;
        this.scheduler = scheduler;
    }
    
    @Override
    public <T> Mono<T> call(Supplier<? extends Mono<T>> operation) {
        return Mono.<CallPermit>create(sink -> {
                CallPermit permit = breaker.acquirePermission();
                // runs at once if the subscriber cancelled while the permit was being acquired
                sink.onCancel(() -> breaker.onCancel(permit));
                sink.success(permit);
            })
            .subscribeOn(scheduler)
            .flatMap(permit -> Mono.defer(operation)
                .materialize()
                .publishOn(scheduler)
                .flatMap(signal -> {
                    if (signal.isOnError()) {
                        return Mono.<T>error(breaker.onError(permit, signal.getThrowable()));
                    }
                    breaker.onSuccess(permit);
                    return signal.hasValue() ? Mono.just(signal.get()) : Mono.<T>empty();
                })
                .doOnCancel(() -> breaker.onCancel(permit)));
    }
    
    @Override
    public <T> Mono<T> call(Mono<T> operation) {
        return call(() -> operation);
    }
    
    @Override
    public <T> Function<Mono<T>, Mono<T>> operator() {
        return mono -> call(mono);
    }
    
    @Override
    public <T> CompletableFuture<T> callAsync(Supplier<? extends CompletionStage<T>> operation) {
        return call(() -> Mono.fromCompletionStage(operation)).toFuture();
    }
}

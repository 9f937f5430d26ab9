package com.redis.breaker.impl;

import com.redis.breaker.CircuitBreaker;
import com.redis.breaker.CircuitBreakerBuilder;
import com.redis.breaker.CircuitOpenException;
import com.redis.breaker.MutableClock;
import com.redis.breaker.RecordingListener;
import com.redis.breaker.config.CircuitBreakerConfig;
import com.redis.breaker.model.CircuitBreakerListener;
import com.redis.breaker.model.CircuitState;
import com.redis.breaker.storage.MemoryCircuitBreakerStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerConcurrencyTest {

    private final MutableClock clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(5);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
    }

    private void runConcurrently(int threads, Runnable task) throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                task.run();
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
    }

    @Test
    void testFailCounterStopsAtFailMax() throws Exception {
        CircuitBreaker breaker = CircuitBreakerBuilder.create(CircuitBreakerConfig.builder()
            .failMax(3000)
            .clock(clock)
            .build());

        runConcurrently(3, () -> {
            for (int i = 0; i < 2000; i++) {
                try {
                    breaker.sync().call(() -> {
                        throw new IOException("down");
                    });
                } catch (Exception expected) {
                    assertTrue(expected instanceof IOException || expected instanceof CircuitOpenException);
                }
            }
        });

        assertEquals(3000, breaker.getFailCounter());
        assertEquals(CircuitState.OPEN, breaker.getCurrentState());
    }

    @Test
    void testSingleHalfOpenTransitionAndTrial() throws Exception {
        RecordingListener listener = new RecordingListener();
        CircuitBreaker breaker = CircuitBreakerBuilder.create(CircuitBreakerConfig.builder()
            .failMax(1)
            .resetTimeout(Duration.ofSeconds(1))
            .clock(clock)
            .build(), new MemoryCircuitBreakerStorage(), listener);
        breaker.open();
        clock.advance(Duration.ofSeconds(1));
        AtomicInteger invocations = new AtomicInteger();
        List<Throwable> rejections = Collections.synchronizedList(new ArrayList<>());

        runConcurrently(5, () -> {
            try {
                breaker.sync().call(() -> {
                    invocations.incrementAndGet();
                    Thread.sleep(100);
                    throw new IOException("still down");
                });
            } catch (Exception e) {
                rejections.add(e);
            }
        });

        assertEquals(1, invocations.get());
        assertEquals(5, rejections.size());
        assertEquals(1, Collections.frequency(listener.transitions(), "open->half-open"));
        assertEquals(CircuitState.OPEN, breaker.getCurrentState());
    }

    @Test
    void testListenerCallsAreSerialized() throws Exception {
        int[] successes = new int[1];
        CircuitBreaker breaker = CircuitBreakerBuilder.create(CircuitBreakerConfig.defaultConfig(),
            new MemoryCircuitBreakerStorage(), new CircuitBreakerListener() {
                @Override
                public void onSuccess(CircuitBreaker cb) {
                    int current = successes[0];
                    Thread.yield();
                    successes[0] = current + 1;
                }
            });

        runConcurrently(3, () -> {
            for (int i = 0; i < 500; i++) {
                breaker.sync().run(() -> { });
            }
        });

        assertEquals(1500, successes[0]);
    }
}

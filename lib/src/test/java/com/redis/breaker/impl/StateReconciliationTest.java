package com.redis.breaker.impl;

import com.redis.breaker.CircuitBreaker;
import com.redis.breaker.CircuitBreakerBuilder;
import com.redis.breaker.CircuitOpenException;
import com.redis.breaker.MutableClock;
import com.redis.breaker.RecordingListener;
import com.redis.breaker.config.CircuitBreakerConfig;
import com.redis.breaker.model.CircuitState;
import com.redis.breaker.storage.MemoryCircuitBreakerStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Two breakers over one storage, standing in for two processes sharing Redis.
 */
class StateReconciliationTest {

    private MutableClock clock;
    private MemoryCircuitBreakerStorage sharedStorage;
    private RecordingListener firstListener;
    private RecordingListener secondListener;
    private CircuitBreaker first;
    private CircuitBreaker second;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        sharedStorage = new MemoryCircuitBreakerStorage();
        CircuitBreakerConfig config = CircuitBreakerConfig.builder()
            .name("billing")
            .failMax(2)
            .resetTimeout(Duration.ofSeconds(10))
            .clock(clock)
            .build();
        firstListener = new RecordingListener();
        secondListener = new RecordingListener();
        first = CircuitBreakerBuilder.create(config, sharedStorage, firstListener);
        second = CircuitBreakerBuilder.create(config, sharedStorage, secondListener);
    }

    @Test
    void testOpenCircuitIsObservedByOtherInstance() {
        assertThrows(IOException.class, () -> first.sync().call(() -> {
            throw new IOException("down");
        }));
        assertThrows(CircuitOpenException.class, () -> first.sync().call(() -> {
            throw new IOException("down");
        }));

        assertEquals(CircuitState.OPEN, second.getCurrentState());
        assertEquals(List.of("closed->open"), secondListener.transitions());

        AtomicInteger invocations = new AtomicInteger();
        assertThrows(CircuitOpenException.class, () -> second.sync().call(invocations::incrementAndGet));
        assertEquals(0, invocations.get());
    }

    @Test
    void testRecoveryIsObservedByOtherInstance() throws Exception {
        first.open();
        assertEquals(CircuitState.OPEN, second.getCurrentState());
        clock.advance(Duration.ofSeconds(10));

        assertEquals("ok", second.sync().call(() -> "ok"));

        assertEquals(CircuitState.CLOSED, first.getCurrentState());
        assertEquals(List.of("closed->open", "open->closed"), firstListener.transitions());
        assertEquals(List.of("closed->open", "open->half-open", "half-open->closed"), secondListener.transitions());
    }

    @Test
    void testFailuresAccumulateAcrossInstances() {
        assertThrows(IOException.class, () -> first.sync().call(() -> {
            throw new IOException("down");
        }));
        assertThrows(CircuitOpenException.class, () -> second.sync().call(() -> {
            throw new IOException("down");
        }));

        assertEquals(CircuitState.OPEN, first.getCurrentState());
        assertEquals(2, sharedStorage.getCounter());
    }

    @Test
    void testLateReconciliationRestartsOpenWindow() {
        first.open();
        clock.advance(Duration.ofSeconds(5));

        assertEquals(CircuitState.OPEN, second.getCurrentState());

        assertEquals(clock.instant(), sharedStorage.getOpenedAt().orElseThrow());
    }

    @Test
    void testSeparateStoragesStayIndependent() {
        CircuitBreakerConfig config = CircuitBreakerConfig.builder().failMax(1).clock(clock).build();
        MemoryCircuitBreakerStorage billingStorage = new MemoryCircuitBreakerStorage();
        MemoryCircuitBreakerStorage searchStorage = new MemoryCircuitBreakerStorage();
        CircuitBreaker billing = CircuitBreakerBuilder.create(config, billingStorage);
        CircuitBreaker search = CircuitBreakerBuilder.create(config, searchStorage);

        assertThrows(CircuitOpenException.class, () -> billing.sync().call(() -> {
            throw new IOException("down");
        }));

        assertEquals(CircuitState.OPEN, billing.getCurrentState());
        assertEquals(CircuitState.CLOSED, search.getCurrentState());
        assertEquals(0, search.getFailCounter());
        assertTrue(searchStorage.getOpenedAt().isEmpty());
    }

    @Test
    void testRebuildRunsEntrySideEffects() {
        sharedStorage.incrementCounter();
        sharedStorage.setState(CircuitState.HALF_OPEN);
        assertEquals(CircuitState.HALF_OPEN, first.getCurrentState());

        sharedStorage.setState(CircuitState.CLOSED);

        assertEquals(CircuitState.CLOSED, first.getCurrentState());
        assertEquals(0, sharedStorage.getCounter());
    }
}

package com.redis.breaker.observability;

import com.redis.breaker.CircuitBreaker;
import com.redis.breaker.CircuitBreakerBuilder;
import com.redis.breaker.CircuitOpenException;
import com.redis.breaker.config.CircuitBreakerConfig;
import com.redis.breaker.model.CircuitState;
import com.redis.breaker.storage.MemoryCircuitBreakerStorage;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class MetricsListenerTest {

    private MeterRegistry meterRegistry;
    private MetricsListener metricsListener;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metricsListener = new MetricsListener(meterRegistry);
        breaker = CircuitBreakerBuilder.create(CircuitBreakerConfig.builder().name("catalog").failMax(2).build(),
            new MemoryCircuitBreakerStorage(), metricsListener, new LoggingListener());
    }

    private double calls(String outcome) {
        return meterRegistry.get(MetricsListener.CALLS)
            .tag("name", "catalog")
            .tag("outcome", outcome)
            .counter()
            .count();
    }

    @Test
    void testConstructorWithDefaultRegistry() {
        MetricsListener defaultListener = new MetricsListener();

        assertTrue(defaultListener.getMeterRegistry() instanceof SimpleMeterRegistry);
    }

    @Test
    void testCallOutcomesAreCounted() throws Exception {
        breaker.sync().call(() -> "ok");
        breaker.sync().call(() -> "ok");
        assertThrows(IOException.class, () -> breaker.sync().call(() -> {
            throw new IOException("down");
        }));

        assertEquals(2.0, calls("success"));
        assertEquals(1.0, calls("failure"));
    }

    @Test
    void testTransitionsAndStateGauge() {
        assertEquals(CircuitState.CLOSED, metricsListener.getRecordedState("catalog"));

        assertThrows(IOException.class, () -> breaker.sync().call(() -> {
            throw new IOException("down");
        }));
        assertThrows(CircuitOpenException.class, () -> breaker.sync().call(() -> {
            throw new IOException("down");
        }));

        assertEquals(1.0, meterRegistry.get(MetricsListener.TRANSITIONS)
            .tag("name", "catalog")
            .tag("from", "closed")
            .tag("to", "open")
            .counter()
            .count());
        assertEquals(CircuitState.OPEN, metricsListener.getRecordedState("catalog"));
        assertEquals(1.0, meterRegistry.get(MetricsListener.STATE).tag("name", "catalog").gauge().value());

        breaker.halfOpen();
        assertEquals(2.0, meterRegistry.get(MetricsListener.STATE).tag("name", "catalog").gauge().value());

        breaker.close();
        assertEquals(CircuitState.CLOSED, metricsListener.getRecordedState("catalog"));
        assertEquals(0.0, meterRegistry.get(MetricsListener.STATE).tag("name", "catalog").gauge().value());
    }

    @Test
    void testStateGaugeIsSeededOnRegistration() {
        assertEquals(0.0, meterRegistry.get(MetricsListener.STATE).tag("name", "catalog").gauge().value());

        CircuitBreaker restored = CircuitBreakerBuilder.create(CircuitBreakerConfig.builder().name("orders").build(),
            new MemoryCircuitBreakerStorage(CircuitState.OPEN), metricsListener);

        assertEquals(CircuitState.OPEN, restored.getCurrentState());
        assertEquals(CircuitState.OPEN, metricsListener.getRecordedState("orders"));
        assertEquals(1.0, meterRegistry.get(MetricsListener.STATE).tag("name", "orders").gauge().value());
    }

    @Test
    void testStateGaugeIsSeededWhenListenerIsAddedLater() {
        MetricsListener late = new MetricsListener(new SimpleMeterRegistry());
        breaker.halfOpen();

        breaker.addListener(late);

        assertEquals(CircuitState.HALF_OPEN, late.getRecordedState("catalog"));
        assertNull(late.getRecordedState("orders"));
    }

    @Test
    void testSharedListenerTagsEachBreaker() throws Exception {
        CircuitBreaker other = CircuitBreakerBuilder.create(CircuitBreakerConfig.builder().name("reviews").build(),
            new MemoryCircuitBreakerStorage(), metricsListener);

        breaker.sync().call(() -> "ok");
        other.sync().call(() -> "ok");
        other.sync().call(() -> "ok");

        assertEquals(1.0, calls("success"));
        assertEquals(2.0, meterRegistry.get(MetricsListener.CALLS)
            .tag("name", "reviews")
            .tag("outcome", "success")
            .counter()
            .count());
    }
}

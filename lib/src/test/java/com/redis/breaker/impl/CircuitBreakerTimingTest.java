package com.redis.breaker.impl;

import com.redis.breaker.CircuitBreaker;
import com.redis.breaker.CircuitBreakerBuilder;
import com.redis.breaker.CircuitOpenException;
import com.redis.breaker.config.CircuitBreakerConfig;
import com.redis.breaker.model.CircuitState;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Reset timeout against the system clock.
 */
class CircuitBreakerTimingTest {

    @Test
    void testRecoveryAfterRealTimeout() throws Exception {
        CircuitBreaker breaker = CircuitBreakerBuilder.create(CircuitBreakerConfig.builder()
            .failMax(1)
            .resetTimeout(Duration.ofMillis(500))
            .build());

        assertThrows(CircuitOpenException.class, () -> breaker.sync().call(() -> {
            throw new IOException("down");
        }));
        assertThrows(CircuitOpenException.class, () -> breaker.sync().call(() -> "ok"));

        Thread.sleep(600);

        assertEquals("ok", breaker.sync().call(() -> "ok"));
        assertEquals(CircuitState.CLOSED, breaker.getCurrentState());
    }
}

package com.redis.breaker.impl;

import com.redis.breaker.CircuitBreaker;
import com.redis.breaker.config.CircuitBreakerConfig;
import com.redis.breaker.model.CircuitBreakerListener;
import com.redis.breaker.model.CircuitState;
import com.redis.breaker.operations.ReactiveCallOperations;
import com.redis.breaker.operations.SyncCallOperations;
import com.redis.breaker.storage.CircuitBreakerStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Default circuit breaker implementation.
 *
 * <p>The canonical state lives in the {@link CircuitBreakerStorage}. The breaker caches a
 * state handler and, on every state access, compares it with the stored state; on
 * mismatch the handler is rebuilt, running its entry side effects. This is how breakers
 * in separate processes sharing one storage converge.</p>
 *
 * <p>A reentrant lock serialises reconciliation, gating, outcome book-keeping and listener
 * dispatch within this instance. The protected operation runs outside the lock. There is
 * no cross-process lock: several processes may enter half-open for the same probation
 * window, and the shared counter may briefly exceed failMax.</p>
 */
public class DefaultCircuitBreaker implements CircuitBreaker {

    private static final Logger logger = LoggerFactory.getLogger(DefaultCircuitBreaker.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final CircuitBreakerStorage storage;
    private final String name;
    private final Clock clock;
    private final boolean countRejectedCalls;
    private final List<Class<? extends Throwable>> excludedExceptions;
    private final List<CircuitBreakerListener> listeners;
    private final SyncCallOperations syncOperations;
    private final ReactiveCallOperations reactiveOperations;

    private volatile int failMax;
    private volatile Duration resetTimeout;
    private volatile CircuitBreakerStateHandler handler;

    public DefaultCircuitBreaker(CircuitBreakerConfig config, CircuitBreakerStorage storage) {
        this(config, storage, List.of());
    }

    public DefaultCircuitBreaker(CircuitBreakerConfig config,
                                 CircuitBreakerStorage storage,
                                 List<CircuitBreakerListener> listeners) {
        Objects.requireNonNull(config, "config");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.name = config.getName();
        this.clock = config.getClock();
        this.countRejectedCalls = config.isCountRejectedCalls();
        this.failMax = config.getFailMax();
        this.resetTimeout = config.getResetTimeout();
        this.excludedExceptions = new CopyOnWriteArrayList<>(config.getExcludedExceptions());
        this.listeners = new CopyOnWriteArrayList<>(listeners);
        this.syncOperations = new SyncCallOperationsImpl(this);
        this.reactiveOperations = new ReactiveCallOperationsImpl(this);

        lock.lock();
        try {
            this.handler = createHandler(storage.getState());
        } finally {
            lock.unlock();
        }

        logger.info("Circuit breaker {} initialized in {} state with {} storage: {}",
            name, handler.getState(), storage.getName(), config);
        notifyListeners(listener -> listener.onRegistered(this));
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public SyncCallOperations sync() {
        return syncOperations;
    }

    @Override
    public ReactiveCallOperations reactive() {
        return reactiveOperations;
    }

    @Override
    public CircuitState getCurrentState() {
        lock.lock();
        try {
            return reconcileState().getState();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long getFailCounter() {
        return storage.getCounter();
    }

    @Override
    public void open() {
        forceTransition(CircuitState.OPEN);
        logger.warn("Circuit breaker {} forced to OPEN state", name);
    }

    @Override
    public void close() {
        forceTransition(CircuitState.CLOSED);
        logger.info("Circuit breaker {} forced to CLOSED state", name);
    }

    @Override
    public void halfOpen() {
        forceTransition(CircuitState.HALF_OPEN);
        logger.info("Circuit breaker {} forced to HALF_OPEN state", name);
    }

    @Override
    public int getFailMax() {
        return failMax;
    }

    @Override
    public void setFailMax(int failMax) {
        if (failMax <= 0) {
            throw new IllegalArgumentException("failMax must be greater than 0, got " + failMax);
        }
        this.failMax = failMax;
    }

    @Override
    public Duration getResetTimeout() {
        return resetTimeout;
    }

    @Override
    public void setResetTimeout(Duration resetTimeout) {
        Objects.requireNonNull(resetTimeout, "resetTimeout");
        if (resetTimeout.isNegative() || resetTimeout.isZero()) {
            throw new IllegalArgumentException("resetTimeout must be positive, got " + resetTimeout);
        }
        this.resetTimeout = resetTimeout;
    }

    @Override
    public List<Class<? extends Throwable>> getExcludedExceptions() {
        return List.copyOf(excludedExceptions);
    }

    @Override
    public void addExcludedException(Class<? extends Throwable> exception) {
        excludedExceptions.add(Objects.requireNonNull(exception, "exception"));
    }

    @Override
    public void addExcludedExceptions(Collection<? extends Class<? extends Throwable>> exceptions) {
        exceptions.forEach(this::addExcludedException);
    }

    @Override
    public boolean removeExcludedException(Class<? extends Throwable> exception) {
        return excludedExceptions.remove(exception);
    }

    @Override
    public boolean isSystemError(Throwable error) {
        for (Class<? extends Throwable> excluded : excludedExceptions) {
            if (excluded.isInstance(error)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public List<CircuitBreakerListener> getListeners() {
        return List.copyOf(listeners);
    }

    @Override
    public void addListener(CircuitBreakerListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
        try {
            listener.onRegistered(this);
        } catch (RuntimeException e) {
            logger.warn("Listener {} failed for circuit breaker {}", listener, name, e);
        }
    }

    @Override
    public void addListeners(CircuitBreakerListener... listeners) {
        for (CircuitBreakerListener listener : listeners) {
            addListener(listener);
        }
    }

    @Override
    public boolean removeListener(CircuitBreakerListener listener) {
        return listeners.remove(listener);
    }

    @Override
    public CircuitBreakerStorage getStorage() {
        return storage;
    }

    @Override
    public String toString() {
        return "CircuitBreaker{name='" + name + "', state=" + handler + ", storage=" + storage.getName() + '}';
    }

    // Call engine shared by the sync and reactive operations

    /**
     * Reconcile with storage and ask the current state whether the call may run.
     *
     * @return the permit to report the outcome against
     * @throws com.redis.breaker.CircuitOpenException if the call is rejected
     */
    CallPermit acquirePermission() {
        lock.lock();
        try {
            CallPermit permit = reconcileState().acquirePermission();
            notifyListeners(listener -> listener.beforeCall(this));
            return permit;
        } finally {
            lock.unlock();
        }
    }

    void onSuccess(CallPermit permit) {
        if (!permit.settle()) {
            return;
        }
        lock.lock();
        try {
            if (isCurrent(permit)) {
                permit.getHandler().onSuccess();
            }
            notifyListeners(listener -> listener.onSuccess(this));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Record a failed call.
     *
     * @return the exception to raise to the caller: the operation's own exception, or a
     *         CircuitOpenException when this failure opened the circuit
     */
    Throwable onError(CallPermit permit, Throwable error) {
        if (!permit.settle()) {
            return error;
        }
        lock.lock();
        try {
            if (!isSystemError(error)) {
                if (isCurrent(permit)) {
                    permit.getHandler().onExcludedError();
                }
                notifyListeners(listener -> listener.onSuccess(this));
                return error;
            }

            if (isCurrent(permit)) {
                permit.getHandler().recordFailure();
            }
            notifyListeners(listener -> listener.onFailure(this, error));
            if (isCurrent(permit)) {
                return permit.getHandler().onFailure(error);
            }
            logger.debug("Circuit breaker {} ignoring outcome of call admitted in previous {} state",
                name, permit.getHandler().getState());
            return error;
        } finally {
            lock.unlock();
        }
    }

    void onCancel(CallPermit permit) {
        if (!permit.settle()) {
            return;
        }
        lock.lock();
        try {
            if (isCurrent(permit)) {
                permit.getHandler().onCancel();
            }
            logger.debug("Circuit breaker {} call cancelled in {} state", name, permit.getHandler().getState());
        } finally {
            lock.unlock();
        }
    }

    // State handling, always under the lock

    /**
     * Compare the cached handler with the canonical stored state and rebuild it on mismatch.
     */
    CircuitBreakerStateHandler reconcileState() {
        CircuitState canonical = storage.getState();
        CircuitBreakerStateHandler current = handler;
        if (canonical != current.getState()) {
            logger.debug("Circuit breaker {} cached state {} differs from stored state {}, rebuilding",
                name, current.getState(), canonical);
            replaceHandler(current, canonical);
        }
        return handler;
    }

    /**
     * Write the new state to storage and enter it.
     */
    void transitionTo(CircuitState target) {
        storage.setState(target);
        replaceHandler(handler, target);
    }

    CircuitBreakerStateHandler currentHandler() {
        return handler;
    }

    Clock getClock() {
        return clock;
    }

    boolean isCountRejectedCalls() {
        return countRejectedCalls;
    }

    private void forceTransition(CircuitState target) {
        lock.lock();
        try {
            transitionTo(target);
        } finally {
            lock.unlock();
        }
    }

    private void replaceHandler(CircuitBreakerStateHandler previous, CircuitState target) {
        if (previous.getState() == target) {
            // same state: in-flight calls keep their handler, only the entry effects run again
            previous.onEnter();
            return;
        }
        handler = createHandler(target);
        logger.info("Circuit breaker {} state transition: {} -> {}", name, previous.getState(), target);
        notifyListeners(listener -> listener.onStateChange(this, previous.getState(), target));
    }

    private CircuitBreakerStateHandler createHandler(CircuitState state) {
        CircuitBreakerStateHandler created;
        switch (state) {
            case OPEN:
                created = new OpenStateHandler(this);
                break;
            case HALF_OPEN:
                created = new HalfOpenStateHandler(this);
                break;
            case CLOSED:
            default:
                created = new ClosedStateHandler(this);
                break;
        }
        created.onEnter();
        return created;
    }

    private boolean isCurrent(CallPermit permit) {
        return permit.getHandler() == handler;
    }

    private void notifyListeners(Consumer<CircuitBreakerListener> event) {
        for (CircuitBreakerListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                logger.warn("Listener {} failed for circuit breaker {}", listener, name, e);
            }
        }
    }
}

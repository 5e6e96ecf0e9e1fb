package io.workgate.resilience;

import io.workgate.spi.MetricsExporter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-local circuit breaker guarding one remote operation.
 *
 * <p>After {@code failureThreshold} consecutive failures the breaker opens and rejects
 * calls with {@link CircuitOpenException} without invoking them. Once {@code coolDown}
 * has elapsed, one probe call is let through; {@code successThreshold} successful probes
 * close the breaker again and any probe failure re-opens it.
 *
 * <p>Only exceptions matched by the failure predicate count as failures. Other exceptions
 * prove the remote side answered, so they are treated like a success for state purposes
 * and rethrown unchanged.
 *
 * <p>Instances are thread-safe. Create them through {@link CircuitBreakerRegistry} so each
 * operation name gets exactly one breaker.
 */
public final class CircuitBreaker {
    private static final Logger logger = Logger.getLogger(CircuitBreaker.class.getName());

    private final String operationName;
    private final int failureThreshold;
    private final int successThreshold;
    private final Duration coolDown;
    private final Clock clock;
    private final Predicate<Throwable> failurePredicate;
    private final MetricsExporter metrics;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private int halfOpenSuccesses;
    private boolean probeInFlight;
    private Instant openedAt;
    private long totalCalls;
    private long totalFailures;
    private long rejectedCalls;

    public CircuitBreaker(String operationName, int failureThreshold, Duration coolDown) {
        this(operationName, failureThreshold, 1, coolDown, Clock.systemUTC(), t -> true,
                MetricsExporter.NOOP);
    }

    public CircuitBreaker(String operationName, int failureThreshold, int successThreshold,
            Duration coolDown, Clock clock, Predicate<Throwable> failurePredicate,
            MetricsExporter metrics) {
        this.operationName = Objects.requireNonNull(operationName, "operationName");
        this.coolDown = Objects.requireNonNull(coolDown, "coolDown");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.failurePredicate = Objects.requireNonNull(failurePredicate, "failurePredicate");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got: " + failureThreshold);
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be >= 1, got: " + successThreshold);
        }
        if (coolDown.isNegative()) {
            throw new IllegalArgumentException("coolDown must be >= 0");
        }
        this.failureThreshold = failureThreshold;
        this.successThreshold = successThreshold;
    }

    public String operationName() {
        return operationName;
    }

    /**
     * Invokes {@code call} if the breaker admits it.
     *
     * @throws CircuitOpenException if the breaker is open, or half-open with a probe
     *     already in flight
     */
    public <T> T execute(Supplier<T> call) {
        acquirePermission();
        T result;
        try {
            result = call.get();
        } catch (Throwable t) {
            onError(t);
            throw t;
        }
        onSuccess();
        return result;
    }

    public void run(Runnable call) {
        execute(() -> {
            call.run();
            return null;
        });
    }

    /**
     * Returns the current state, moving OPEN to HALF_OPEN if the cool-down has elapsed.
     */
    public synchronized CircuitState state() {
        if (state == CircuitState.OPEN && coolDownElapsed()) {
            state = CircuitState.HALF_OPEN;
            halfOpenSuccesses = 0;
        }
        return state;
    }

    public synchronized CircuitSnapshot snapshot() {
        return new CircuitSnapshot(operationName, state(), consecutiveFailures, openedAt,
                totalCalls, totalFailures, rejectedCalls);
    }

    /**
     * Closes the breaker and clears its failure count.
     */
    public synchronized void reset() {
        state = CircuitState.CLOSED;
        consecutiveFailures = 0;
        halfOpenSuccesses = 0;
        probeInFlight = false;
        openedAt = null;
    }

    /**
     * Opens the breaker immediately, e.g. when an operator knows the dependency is down.
     */
    public synchronized void forceOpen() {
        transitionToOpen();
    }

    private synchronized void acquirePermission() {
        CircuitState current = state();
        if (current == CircuitState.OPEN
                || (current == CircuitState.HALF_OPEN && probeInFlight)) {
            rejectedCalls++;
            throw new CircuitOpenException(operationName, openedAt.plus(coolDown));
        }
        if (current == CircuitState.HALF_OPEN) {
            probeInFlight = true;
        }
        totalCalls++;
    }

    private void onError(Throwable t) {
        if (failurePredicate.test(t)) {
            onFailure(t);
        } else {
            onSuccess();
        }
    }

    private synchronized void onSuccess() {
        consecutiveFailures = 0;
        if (state == CircuitState.HALF_OPEN) {
            probeInFlight = false;
            halfOpenSuccesses++;
            if (halfOpenSuccesses >= successThreshold) {
                state = CircuitState.CLOSED;
                openedAt = null;
                logger.log(Level.INFO, "Circuit {0} closed after successful probe", operationName);
            }
        }
    }

    private synchronized void onFailure(Throwable e) {
        totalFailures++;
        consecutiveFailures++;
        if (state == CircuitState.HALF_OPEN) {
            probeInFlight = false;
            transitionToOpen();
            logger.log(Level.WARNING, "Circuit " + operationName + " re-opened: probe failed", e);
        } else if (state == CircuitState.CLOSED && consecutiveFailures >= failureThreshold) {
            transitionToOpen();
            logger.log(Level.WARNING, "Circuit " + operationName + " opened after "
                    + consecutiveFailures + " consecutive failures", e);
        }
    }

    private void transitionToOpen() {
        state = CircuitState.OPEN;
        openedAt = clock.instant();
        halfOpenSuccesses = 0;
        metrics.incrementCircuitOpened(operationName);
    }

    private boolean coolDownElapsed() {
        return openedAt != null && !clock.instant().isBefore(openedAt.plus(coolDown));
    }
}

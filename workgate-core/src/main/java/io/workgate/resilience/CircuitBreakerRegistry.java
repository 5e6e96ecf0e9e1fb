package io.workgate.resilience;

import io.workgate.spi.MetricsExporter;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Holds one {@link CircuitBreaker} per remote operation name.
 *
 * <p>Independent breakers keep one unhealthy endpoint from blocking unrelated calls.
 * A registry is constructed once at startup and passed to the components that need it;
 * there is no process-wide instance.
 */
public final class CircuitBreakerRegistry {
    private final int defaultFailureThreshold;
    private final Duration defaultCoolDown;
    private final int successThreshold;
    private final Clock clock;
    private final MetricsExporter metrics;
    private final Map<String, Settings> overrides = new ConcurrentHashMap<>();
    private final Map<String, Predicate<Throwable>> failurePredicates = new ConcurrentHashMap<>();
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry() {
        this(5, Duration.ofSeconds(60), 1, Clock.systemUTC(), MetricsExporter.NOOP);
    }

    public CircuitBreakerRegistry(int defaultFailureThreshold, Duration defaultCoolDown,
            int successThreshold, Clock clock, MetricsExporter metrics) {
        if (defaultFailureThreshold < 1) {
            throw new IllegalArgumentException("defaultFailureThreshold must be >= 1");
        }
        this.defaultFailureThreshold = defaultFailureThreshold;
        this.defaultCoolDown = Objects.requireNonNull(defaultCoolDown, "defaultCoolDown");
        this.successThreshold = successThreshold;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Overrides threshold and cool-down for one operation. Must be called before the
     * breaker is first used.
     */
    public CircuitBreakerRegistry configure(String operationName, int failureThreshold,
            Duration coolDown) {
        Objects.requireNonNull(operationName, "operationName");
        if (breakers.containsKey(operationName)) {
            throw new IllegalStateException("Circuit already created: " + operationName);
        }
        overrides.put(operationName, new Settings(failureThreshold, coolDown));
        return this;
    }

    /**
     * Restricts which exceptions count as failures for operations whose name starts with
     * {@code operationPrefix}.
     */
    public CircuitBreakerRegistry failureFilter(String operationPrefix, Predicate<Throwable> predicate) {
        failurePredicates.put(Objects.requireNonNull(operationPrefix, "operationPrefix"),
                Objects.requireNonNull(predicate, "predicate"));
        return this;
    }

    /**
     * Returns the breaker for {@code operationName}, creating it on first use.
     */
    public CircuitBreaker get(String operationName) {
        Objects.requireNonNull(operationName, "operationName");
        return breakers.computeIfAbsent(operationName, this::create);
    }

    public List<CircuitSnapshot> snapshots() {
        return breakers.values().stream()
                .map(CircuitBreaker::snapshot)
                .sorted((a, b) -> a.operationName().compareTo(b.operationName()))
                .toList();
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }

    private CircuitBreaker create(String operationName) {
        Settings settings = overrides.getOrDefault(operationName,
                new Settings(defaultFailureThreshold, defaultCoolDown));
        Predicate<Throwable> predicate = failurePredicates.entrySet().stream()
                .filter(e -> operationName.startsWith(e.getKey()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(t -> true);
        return new CircuitBreaker(operationName, settings.failureThreshold(), successThreshold,
                settings.coolDown(), clock, predicate, metrics);
    }

    private record Settings(int failureThreshold, Duration coolDown) {
    }
}

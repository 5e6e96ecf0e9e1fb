package io.workgate.resilience;

import io.workgate.MutableClock;
import io.workgate.spi.MetricsExporter;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerRegistryTest {

    private final MutableClock clock = new MutableClock();

    @Test
    void returnsSameBreakerPerOperation() {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry();

        assertSame(registry.get("a"), registry.get("a"));
        assertNotSame(registry.get("a"), registry.get("b"));
    }

    @Test
    void overridesApplyPerOperation() {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(5, Duration.ofSeconds(60), 1,
                clock, MetricsExporter.NOOP);
        registry.configure("fragile", 1, Duration.ofSeconds(1));

        assertThrows(RuntimeException.class,
                () -> registry.get("fragile").run(() -> { throw new RuntimeException("x"); }));
        assertThrows(RuntimeException.class,
                () -> registry.get("sturdy").run(() -> { throw new RuntimeException("x"); }));

        assertEquals(CircuitState.OPEN, registry.get("fragile").state());
        assertEquals(CircuitState.CLOSED, registry.get("sturdy").state());
    }

    @Test
    void configureAfterCreationFails() {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry();
        registry.get("op");

        assertThrows(IllegalStateException.class, () -> registry.configure("op", 1, Duration.ofSeconds(1)));
    }

    @Test
    void failureFilterAppliesByPrefix() {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(1, Duration.ofSeconds(60), 1,
                clock, MetricsExporter.NOOP);
        registry.failureFilter("remote.", t -> !(t instanceof IllegalArgumentException));

        assertThrows(IllegalArgumentException.class,
                () -> registry.get("remote.call").run(() -> { throw new IllegalArgumentException(); }));
        assertThrows(IllegalArgumentException.class,
                () -> registry.get("local.call").run(() -> { throw new IllegalArgumentException(); }));

        assertEquals(CircuitState.CLOSED, registry.get("remote.call").state());
        assertEquals(CircuitState.OPEN, registry.get("local.call").state());
    }

    @Test
    void snapshotsSortedAndResetAll() {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry();
        registry.get("b").forceOpen();
        registry.get("a");

        List<CircuitSnapshot> snapshots = registry.snapshots();
        assertEquals("a", snapshots.get(0).operationName());
        assertEquals(CircuitState.OPEN, snapshots.get(1).state());

        registry.resetAll();
        assertEquals(CircuitState.CLOSED, registry.get("b").state());
    }
}

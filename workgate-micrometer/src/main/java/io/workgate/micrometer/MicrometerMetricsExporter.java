package io.workgate.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.workgate.batch.OperationType;
import io.workgate.model.FailureType;
import io.workgate.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code workgate.discovery.runs}: discovery passes</li>
 *   <li>{@code workgate.discovery.matched}: items that passed the name pattern</li>
 *   <li>{@code workgate.discovery.selected}: items that survived filtering</li>
 *   <li>{@code workgate.discovery.all_filtered}: passes where every matched item was filtered out</li>
 *   <li>{@code workgate.lease.created} / {@code workgate.lease.errors} / {@code workgate.lease.released}</li>
 *   <li>{@code workgate.batch.operations}, tagged {@code type} and {@code result}</li>
 *   <li>{@code workgate.batch.flushes}, tagged {@code type} and {@code result}</li>
 *   <li>{@code workgate.task.succeeded} / {@code workgate.task.retried}</li>
 *   <li>{@code workgate.task.dead_lettered}, tagged {@code failure_type}</li>
 *   <li>{@code workgate.circuit.opened}, tagged {@code operation}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code workgate.discovery.last.selected}: survivors of the most recent pass</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final String prefix;
    private final Counter discoveryRuns;
    private final Counter discoveryMatched;
    private final Counter discoverySelected;
    private final Counter allFilteredOut;
    private final Counter leasesCreated;
    private final Counter leaseErrors;
    private final Counter leasesReleased;
    private final Counter tasksSucceeded;
    private final Counter tasksRetried;
    private final Gauge lastSelectedGauge;
    private final AtomicInteger lastSelected = new AtomicInteger();
    private final Map<String, Counter> taggedCounters = new ConcurrentHashMap<>();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "workgate"}.
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "workgate");
    }

    /**
     * @param namePrefix prefix for all meter names (e.g. {@code "ingest.workgate"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.prefix = namePrefix;
        this.discoveryRuns = Counter.builder(namePrefix + ".discovery.runs")
                .description("Discovery passes")
                .register(registry);
        this.discoveryMatched = Counter.builder(namePrefix + ".discovery.matched")
                .description("Items that passed the name pattern")
                .register(registry);
        this.discoverySelected = Counter.builder(namePrefix + ".discovery.selected")
                .description("Items that passed every filter")
                .register(registry);
        this.allFilteredOut = Counter.builder(namePrefix + ".discovery.all_filtered")
                .description("Discovery passes where every matched item was filtered out")
                .register(registry);
        this.leasesCreated = Counter.builder(namePrefix + ".lease.created")
                .description("Leases written")
                .register(registry);
        this.leaseErrors = Counter.builder(namePrefix + ".lease.errors")
                .description("Leases that could not be written")
                .register(registry);
        this.leasesReleased = Counter.builder(namePrefix + ".lease.released")
                .description("Leases removed after completion")
                .register(registry);
        this.tasksSucceeded = Counter.builder(namePrefix + ".task.succeeded")
                .description("Units confirmed successful")
                .register(registry);
        this.tasksRetried = Counter.builder(namePrefix + ".task.retried")
                .description("Unit attempts scheduled for retry")
                .register(registry);
        this.lastSelectedGauge = Gauge.builder(namePrefix + ".discovery.last.selected", lastSelected, AtomicInteger::get)
                .description("Survivors of the most recent discovery pass")
                .register(registry);
    }

    @Override
    public void recordDiscovery(int matched, int survivors) {
        if (closed) return;
        discoveryRuns.increment();
        discoveryMatched.increment(matched);
        discoverySelected.increment(survivors);
        lastSelected.set(survivors);
    }

    @Override
    public void incrementAllFilteredOut() {
        if (closed) return;
        allFilteredOut.increment();
    }

    @Override
    public void recordClaims(int created, int errors) {
        if (closed) return;
        leasesCreated.increment(created);
        leaseErrors.increment(errors);
    }

    @Override
    public void recordLeasesReleased(int released) {
        if (closed) return;
        leasesReleased.increment(released);
    }

    @Override
    public void recordBatchFlush(OperationType type, int size, boolean success) {
        if (closed) return;
        String typeTag = type.name().toLowerCase(Locale.ROOT);
        String result = success ? "success" : "failure";
        tagged(".batch.flushes", "Batched calls sent upstream", "type", typeTag, "result", result).increment();
        tagged(".batch.operations", "Operations carried by batched calls", "type", typeTag, "result", result)
                .increment(size);
    }

    @Override
    public void incrementTaskSucceeded() {
        if (closed) return;
        tasksSucceeded.increment();
    }

    @Override
    public void incrementTaskRetried() {
        if (closed) return;
        tasksRetried.increment();
    }

    @Override
    public void incrementDeadLettered(FailureType failureType) {
        if (closed) return;
        tagged(".task.dead_lettered", "Units moved to the dead-letter store",
                "failure_type", failureType.code()).increment();
    }

    @Override
    public void incrementCircuitOpened(String operationName) {
        if (closed) return;
        tagged(".circuit.opened", "Circuit breaker transitions to open", "operation", operationName).increment();
    }

    private Counter tagged(String suffix, String description, String... tags) {
        String key = suffix + "|" + String.join("|", tags);
        return taggedCounters.computeIfAbsent(key, k -> Counter.builder(prefix + suffix)
                .description(description)
                .tags(tags)
                .register(registry));
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     */
    @Override
    public void close() {
        closed = true;
        List<Meter> meters = new ArrayList<>(List.of(discoveryRuns, discoveryMatched, discoverySelected,
                allFilteredOut, leasesCreated, leaseErrors, leasesReleased, tasksSucceeded, tasksRetried,
                lastSelectedGauge));
        meters.addAll(taggedCounters.values());
        taggedCounters.clear();
        RuntimeException first = null;
        for (Meter meter : meters) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}

package io.workgate.dead;

import io.workgate.execution.RetryableUnit;
import io.workgate.execution.TaskExecutionEngine;
import io.workgate.execution.TaskOutcome;
import io.workgate.model.DeadLetterEntry;
import io.workgate.spi.DeadLetterStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Facade for inspecting, replaying and purging dead-lettered units.
 *
 * <p>Replays go through the same {@link TaskExecutionEngine} as first submissions, with
 * a fresh attempt budget.
 */
public final class DeadLetterManager {
    private static final Logger logger = Logger.getLogger(DeadLetterManager.class.getName());

    public static final Duration DEFAULT_MAX_AGE = Duration.ofHours(24);

    private final DeadLetterStore store;
    private final TaskExecutionEngine engine;
    private final Clock clock;

    public DeadLetterManager(DeadLetterStore store, TaskExecutionEngine engine) {
        this(store, engine, Clock.systemUTC());
    }

    public DeadLetterManager(DeadLetterStore store, TaskExecutionEngine engine, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @param operationName optional filter ({@code null} for all)
     * @param limit         maximum entries to return
     * @return entries, oldest first
     */
    public List<DeadLetterEntry> list(String operationName, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got: " + limit);
        }
        return store.query(operationName, limit);
    }

    public Optional<DeadLetterEntry> get(String id) {
        return store.find(id);
    }

    /**
     * @param operationName optional filter ({@code null} for all)
     */
    public int count(String operationName) {
        return store.count(operationName);
    }

    /**
     * Re-submits a dead-lettered unit. The entry is deleted once the replay succeeds.
     * If the replay is dead-lettered again, the new entry replaces the old one so each
     * unit appears once.
     *
     * If the new entry cannot be stored, the old one is kept.
     *
     * @return the replay outcome, or empty if no entry has this id
     */
    public Optional<CompletableFuture<TaskOutcome>> retry(String id) {
        Optional<DeadLetterEntry> found = store.find(id);
        if (found.isEmpty()) {
            logger.log(Level.INFO, "Dead letter {0} not found, nothing to retry", id);
            return Optional.empty();
        }
        DeadLetterEntry entry = found.get();
        RetryableUnit unit = RetryableUnit.of(entry.operationName(), entry.arguments());
        logger.log(Level.INFO, "Retrying dead letter {0} ({1}) as unit {2}",
                new Object[]{id, entry.operationName(), unit.unitId()});
        return Optional.of(engine.submit(unit).thenApply(outcome -> {
            if (outcome instanceof TaskOutcome.Succeeded || outcome instanceof TaskOutcome.DeadLettered) {
                store.delete(id);
            }
            return outcome;
        }));
    }

    /**
     * @return {@code true} if the entry existed
     */
    public boolean remove(String id) {
        return store.delete(id);
    }

    /**
     * Deletes entries older than {@code maxAge}.
     *
     * @return number of entries removed
     */
    public int purgeOlderThan(Duration maxAge) {
        Objects.requireNonNull(maxAge, "maxAge");
        Instant cutoff = clock.instant().minus(maxAge);
        int removed = store.purgeOlderThan(cutoff);
        if (removed > 0) {
            logger.log(Level.INFO, "Purged {0} dead letters older than {1}", new Object[]{removed, cutoff});
        }
        return removed;
    }
}

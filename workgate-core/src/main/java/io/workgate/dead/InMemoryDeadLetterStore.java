package io.workgate.dead;

import io.workgate.model.DeadLetterEntry;
import io.workgate.spi.DeadLetterStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Process-local {@link DeadLetterStore}. Entries are lost on restart; use the JDBC store
 * where they must survive.
 */
public final class InMemoryDeadLetterStore implements DeadLetterStore {
    private final Map<String, DeadLetterEntry> entries = new LinkedHashMap<>();

    @Override
    public synchronized void insert(DeadLetterEntry entry) {
        Objects.requireNonNull(entry, "entry");
        entries.put(entry.id(), entry);
    }

    @Override
    public synchronized Optional<DeadLetterEntry> find(String id) {
        return Optional.ofNullable(entries.get(id));
    }

    @Override
    public synchronized List<DeadLetterEntry> query(String operationName, int limit) {
        List<DeadLetterEntry> result = new ArrayList<>();
        for (DeadLetterEntry entry : entries.values()) {
            if (result.size() >= limit) {
                break;
            }
            if (operationName == null || operationName.equals(entry.operationName())) {
                result.add(entry);
            }
        }
        return result;
    }

    @Override
    public synchronized boolean delete(String id) {
        return entries.remove(id) != null;
    }

    @Override
    public synchronized int count(String operationName) {
        if (operationName == null) {
            return entries.size();
        }
        return (int) entries.values().stream()
                .filter(e -> operationName.equals(e.operationName()))
                .count();
    }

    @Override
    public synchronized int purgeOlderThan(Instant cutoff) {
        int before = entries.size();
        entries.values().removeIf(e -> e.createdAt().isBefore(cutoff));
        return before - entries.size();
    }
}

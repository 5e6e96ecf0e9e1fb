package io.workgate.spi;

import io.workgate.model.DeadLetterEntry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for dead-lettered units of work.
 *
 * @see io.workgate.dead.DeadLetterManager
 */
public interface DeadLetterStore {

    void insert(DeadLetterEntry entry);

    Optional<DeadLetterEntry> find(String id);

    /**
     * Lists entries oldest first.
     *
     * @param operationName optional filter ({@code null} for all)
     * @param limit         maximum entries to return
     */
    List<DeadLetterEntry> query(String operationName, int limit);

    /**
     * @return {@code true} if the entry existed
     */
    boolean delete(String id);

    /**
     * @param operationName optional filter ({@code null} for all)
     */
    int count(String operationName);

    /**
     * Deletes entries created before {@code cutoff}.
     *
     * @return number of entries removed
     */
    int purgeOlderThan(Instant cutoff);
}

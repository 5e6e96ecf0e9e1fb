package io.workgate.spi;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Shared key-value cache with per-key TTL.
 *
 * <p>The cache is the single source of truth for live leases across the worker fleet.
 * Writes are last-writer-wins. Implementations throw {@link CacheException} when the
 * backing service cannot be reached.
 */
public interface CacheClient {

    /**
     * @return the live value for {@code key}, or {@code null} if absent or expired
     */
    String get(String key);

    /**
     * Reads several keys in one round trip.
     *
     * @return live values by key; absent and expired keys are omitted
     */
    Map<String, String> getAll(Collection<String> keys);

    void set(String key, String value, Duration ttl);

    /**
     * Writes several entries in one round trip, all with the same TTL.
     */
    void setAll(Map<String, String> entries, Duration ttl);

    /**
     * @return {@code true} if a live entry was removed
     */
    boolean delete(String key);

    /**
     * @return number of live entries removed
     */
    int deleteAll(Collection<String> keys);

    /**
     * Enumerates live keys starting with {@code prefix}.
     */
    List<String> keysWithPrefix(String prefix);
}

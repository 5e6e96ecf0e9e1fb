package io.workgate.cache;

import io.workgate.spi.CacheClient;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-process {@link CacheClient} with per-key expiry. Suitable for tests and for
 * single-worker deployments; it does not coordinate across processes.
 */
public final class InMemoryCacheClient implements CacheClient {
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCacheClient() {
        this(Clock.systemUTC());
    }

    public InMemoryCacheClient(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.expiredAt(clock.instant())) {
            entries.remove(key, entry);
            return null;
        }
        return entry.value();
    }

    @Override
    public Map<String, String> getAll(Collection<String> keys) {
        Map<String, String> result = new LinkedHashMap<>();
        for (String key : keys) {
            String value = get(key);
            if (value != null) {
                result.put(key, value);
            }
        }
        return result;
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public void setAll(Map<String, String> values, Duration ttl) {
        values.forEach((key, value) -> set(key, value, ttl));
    }

    @Override
    public boolean delete(String key) {
        Entry removed = entries.remove(key);
        return removed != null && !removed.expiredAt(clock.instant());
    }

    @Override
    public int deleteAll(Collection<String> keys) {
        int deleted = 0;
        for (String key : keys) {
            if (delete(key)) {
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public List<String> keysWithPrefix(String prefix) {
        Instant now = clock.instant();
        List<String> keys = new ArrayList<>();
        entries.forEach((key, entry) -> {
            if (key.startsWith(prefix) && !entry.expiredAt(now)) {
                keys.add(key);
            }
        });
        keys.sort(null);
        return keys;
    }

    /**
     * Number of live entries.
     */
    public int size() {
        Instant now = clock.instant();
        entries.values().removeIf(e -> e.expiredAt(now));
        return entries.size();
    }

    private record Entry(String value, Instant expiresAt) {
        boolean expiredAt(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}

package io.workgate.cache;

import io.workgate.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCacheClientTest {

    private final MutableClock clock = new MutableClock();
    private final InMemoryCacheClient cache = new InMemoryCacheClient(clock);

    @Test
    void entriesExpireAfterTtl() {
        cache.set("k", "v", Duration.ofSeconds(10));
        assertEquals("v", cache.get("k"));

        clock.advance(Duration.ofSeconds(10));

        assertNull(cache.get("k"));
        assertEquals(0, cache.size());
    }

    @Test
    void getAllOmitsMissingAndExpired() {
        cache.setAll(Map.of("a", "1", "b", "2"), Duration.ofSeconds(5));
        cache.set("c", "3", Duration.ofSeconds(60));
        clock.advance(Duration.ofSeconds(30));

        assertEquals(Map.of("c", "3"), cache.getAll(List.of("a", "b", "c", "d")));
    }

    @Test
    void deleteCountsOnlyLiveEntries() {
        cache.set("live", "1", Duration.ofSeconds(60));
        cache.set("stale", "2", Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(2));

        assertEquals(1, cache.deleteAll(List.of("live", "stale", "missing")));
        assertFalse(cache.delete("live"));
    }

    @Test
    void keysWithPrefixIsSorted() {
        cache.set("file_active:wf:b", "x", Duration.ofSeconds(60));
        cache.set("file_active:wf:a", "x", Duration.ofSeconds(60));
        cache.set("other", "x", Duration.ofSeconds(60));

        assertEquals(List.of("file_active:wf:a", "file_active:wf:b"), cache.keysWithPrefix("file_active:"));
    }

    @Test
    void rejectsNonPositiveTtl() {
        assertThrows(IllegalArgumentException.class, () -> cache.set("k", "v", Duration.ZERO));
    }
}

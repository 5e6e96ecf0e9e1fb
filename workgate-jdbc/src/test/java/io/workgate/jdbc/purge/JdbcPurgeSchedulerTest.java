package io.workgate.jdbc.purge;

import io.workgate.jdbc.H2Tables;
import io.workgate.jdbc.TableNames;
import io.workgate.jdbc.cache.JdbcCacheClient;
import io.workgate.jdbc.dead.JdbcDeadLetterStore;
import io.workgate.jdbc.dialect.H2CacheDialect;
import io.workgate.model.DeadLetterEntry;
import io.workgate.model.FailureType;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcPurgeSchedulerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant NOW = T0.plus(Duration.ofDays(2));

    private JdbcDataSource dataSource;
    private JdbcDeadLetterStore deadLetters;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = H2Tables.create();
        deadLetters = JdbcDeadLetterStore.builder()
                .connectionProvider(dataSource::getConnection)
                .dialect(new H2CacheDialect())
                .build();
    }

    private JdbcCacheClient cacheAt(Instant now) {
        return JdbcCacheClient.builder()
                .connectionProvider(dataSource::getConnection)
                .dialect(new H2CacheDialect())
                .clock(Clock.fixed(now, ZoneOffset.UTC))
                .build();
    }

    private void insertDeadLetter(String id, Instant createdAt) {
        deadLetters.insert(new DeadLetterEntry(id, "process_file", Map.of(), "timeout",
                FailureType.TIMEOUT, 3, createdAt));
    }

    @Test
    void runOncePurgesExpiredLeasesAndOldDeadLetters() throws SQLException {
        cacheAt(T0).set("stale", "v", Duration.ofSeconds(60));
        cacheAt(NOW).set("live", "v", Duration.ofSeconds(60));
        insertDeadLetter("old", T0);
        insertDeadLetter("recent", NOW.minusSeconds(60));

        try (JdbcPurgeScheduler scheduler = JdbcPurgeScheduler.builder()
                .cacheClient(cacheAt(NOW))
                .deadLetterStore(deadLetters)
                .deadLetterRetention(Duration.ofHours(24))
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build()) {
            scheduler.runOnce();
        }

        assertEquals(1, H2Tables.rowCount(dataSource, TableNames.DEFAULT_CACHE_TABLE));
        assertEquals("v", cacheAt(NOW).get("live"));
        assertTrue(deadLetters.find("old").isEmpty());
        assertTrue(deadLetters.find("recent").isPresent());
    }

    @Test
    void runOnceDrainsBacklogAcrossBatches() throws SQLException {
        Map<String, String> entries = new HashMap<>();
        for (int i = 0; i < 25; i++) {
            entries.put("k" + i, "v");
        }
        cacheAt(T0).setAll(entries, Duration.ofSeconds(1));

        try (JdbcPurgeScheduler scheduler = JdbcPurgeScheduler.builder()
                .cacheClient(cacheAt(NOW))
                .batchSize(10)
                .build()) {
            scheduler.runOnce();
        }

        assertEquals(0, H2Tables.rowCount(dataSource, TableNames.DEFAULT_CACHE_TABLE));
    }

    @Test
    void failureInOneTargetDoesNotSkipTheOther() {
        insertDeadLetter("old", T0);
        JdbcCacheClient broken = JdbcCacheClient.builder()
                .connectionProvider(dataSource::getConnection)
                .dialect(new H2CacheDialect())
                .tableName("missing_table")
                .build();

        try (JdbcPurgeScheduler scheduler = JdbcPurgeScheduler.builder()
                .cacheClient(broken)
                .deadLetterStore(deadLetters)
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build()) {
            assertDoesNotThrow(scheduler::runOnce);
        }

        assertEquals(0, deadLetters.count(null));
    }

    @Test
    void runOnceAfterCloseIsNoOp() {
        insertDeadLetter("old", T0);
        JdbcPurgeScheduler scheduler = JdbcPurgeScheduler.builder()
                .deadLetterStore(deadLetters)
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build();
        scheduler.close();
        scheduler.runOnce();

        assertEquals(1, deadLetters.count(null));
        assertThrows(IllegalStateException.class, scheduler::start);
    }

    @Test
    void startIsIdempotent() {
        try (JdbcPurgeScheduler scheduler = JdbcPurgeScheduler.builder().deadLetterStore(deadLetters).build()) {
            scheduler.start();
            assertDoesNotThrow(scheduler::start);
        }
    }

    @Test
    void builderValidation() {
        assertThrows(IllegalArgumentException.class, () -> JdbcPurgeScheduler.builder().build());
        assertThrows(IllegalArgumentException.class, () -> JdbcPurgeScheduler.builder()
                .deadLetterStore(deadLetters).batchSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> JdbcPurgeScheduler.builder()
                .deadLetterStore(deadLetters).intervalSeconds(0).build());
        assertThrows(IllegalArgumentException.class, () -> JdbcPurgeScheduler.builder()
                .deadLetterStore(deadLetters).deadLetterRetention(Duration.ofSeconds(-1)).build());
    }
}

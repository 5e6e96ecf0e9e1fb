package io.workgate.jdbc.dead;

import io.workgate.jdbc.H2Tables;
import io.workgate.jdbc.WorkGateStoreException;
import io.workgate.jdbc.dialect.H2CacheDialect;
import io.workgate.model.DeadLetterEntry;
import io.workgate.model.FailureType;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcDeadLetterStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private JdbcDataSource dataSource;
    private JdbcDeadLetterStore store;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = H2Tables.create();
        store = JdbcDeadLetterStore.builder()
                .connectionProvider(dataSource::getConnection)
                .dialect(new H2CacheDialect())
                .build();
    }

    private static DeadLetterEntry entry(String id, String operation, Instant createdAt) {
        return new DeadLetterEntry(id, operation,
                Map.of("file_path", "/in/" + id + ".pdf", "workflow_id", "wf"),
                "task did not complete", FailureType.TIMEOUT, 3, createdAt);
    }

    @Test
    void insertAndFindRoundTripsAllColumns() {
        DeadLetterEntry original = entry("u-1", "process_file", T0);
        store.insert(original);

        DeadLetterEntry loaded = store.find("u-1").orElseThrow();
        assertEquals(original, loaded);
        assertTrue(store.find("u-2").isEmpty());
    }

    @Test
    void insertReplacesExistingId() {
        store.insert(entry("u-1", "process_file", T0));
        store.insert(new DeadLetterEntry("u-1", "process_file", Map.of(), "boom",
                FailureType.EXECUTION_ERROR, 1, T0.plusSeconds(5)));

        assertEquals(1, store.count(null));
        assertEquals(FailureType.EXECUTION_ERROR, store.find("u-1").orElseThrow().failureType());
    }

    @Test
    void queryIsOldestFirstWithOptionalFilterAndLimit() {
        store.insert(entry("c", "process_file", T0.plusSeconds(30)));
        store.insert(entry("a", "process_file", T0));
        store.insert(entry("b", "notify", T0.plusSeconds(10)));

        assertEquals(List.of("a", "b", "c"), store.query(null, 10).stream().map(DeadLetterEntry::id).toList());
        assertEquals(List.of("a", "c"), store.query("process_file", 10).stream().map(DeadLetterEntry::id).toList());
        assertEquals(List.of("a"), store.query(null, 1).stream().map(DeadLetterEntry::id).toList());
        assertThrows(IllegalArgumentException.class, () -> store.query(null, 0));
    }

    @Test
    void countAndDelete() {
        store.insert(entry("a", "process_file", T0));
        store.insert(entry("b", "notify", T0));

        assertEquals(2, store.count(null));
        assertEquals(1, store.count("notify"));
        assertTrue(store.delete("a"));
        assertFalse(store.delete("a"));
        assertEquals(1, store.count(null));
    }

    @Test
    void purgeOlderThanRemovesOnlyOldEntries() {
        for (int i = 0; i < 4; i++) {
            store.insert(entry("old-" + i, "process_file", T0.plusSeconds(i)));
        }
        store.insert(entry("new", "process_file", T0.plusSeconds(3600)));

        assertEquals(3, store.purgeOlderThan(T0.plusSeconds(60), 3));
        assertEquals(1, store.purgeOlderThan(T0.plusSeconds(60)));
        assertEquals(List.of("new"), store.query(null, 10).stream().map(DeadLetterEntry::id).toList());
    }

    @Test
    void longFailureReasonIsTruncated() {
        String reason = "x".repeat(5000);
        store.insert(new DeadLetterEntry("u-1", "process_file", Map.of(), reason, FailureType.TIMEOUT, 3, T0));

        assertEquals(4000, store.find("u-1").orElseThrow().failureReason().length());
    }

    @Test
    void sqlErrorsSurfaceAsStoreException() {
        JdbcDeadLetterStore broken = JdbcDeadLetterStore.builder()
                .connectionProvider(dataSource::getConnection)
                .dialect(new H2CacheDialect())
                .tableName("missing_table")
                .build();

        WorkGateStoreException ex = assertThrows(WorkGateStoreException.class, () -> broken.count(null));
        assertInstanceOf(SQLException.class, ex.getCause());
        assertThrows(WorkGateStoreException.class, () -> broken.insert(entry("a", "op", T0)));
    }
}

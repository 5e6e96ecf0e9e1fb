package io.workgate.jdbc.dead;

import io.workgate.jdbc.ConnectionProvider;
import io.workgate.jdbc.JdbcTemplate;
import io.workgate.jdbc.TableNames;
import io.workgate.jdbc.WorkGateStoreException;
import io.workgate.jdbc.spi.CacheDialect;
import io.workgate.model.DeadLetterEntry;
import io.workgate.model.FailureType;
import io.workgate.spi.DeadLetterStore;
import io.workgate.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link DeadLetterStore} that keeps entries in a database table so they survive restarts
 * and can be inspected by operators.
 *
 * <p>Expected table layout:
 * <pre>{@code
 * CREATE TABLE workgate_dead_letter (
 *   id             VARCHAR(128) PRIMARY KEY,
 *   operation_name VARCHAR(255) NOT NULL,
 *   arguments      CLOB NOT NULL,
 *   failure_reason CLOB,
 *   failure_type   VARCHAR(32) NOT NULL,
 *   attempts_made  INT NOT NULL,
 *   created_at     TIMESTAMP NOT NULL
 * )
 * }</pre>
 *
 * <p>Arguments are stored as a flat JSON object. Inserting an id that already exists
 * replaces the earlier entry.
 */
public final class JdbcDeadLetterStore implements DeadLetterStore {
    private static final int DEFAULT_PURGE_BATCH = 500;
    private static final int MAX_REASON_LENGTH = 4000;
    private static final String COLUMNS =
            "id, operation_name, arguments, failure_reason, failure_type, attempts_made, created_at";

    private final ConnectionProvider connectionProvider;
    private final CacheDialect dialect;
    private final String tableName;
    private final JsonCodec jsonCodec;
    private final JdbcTemplate.RowMapper<DeadLetterEntry> rowMapper;

    private JdbcDeadLetterStore(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.dialect = Objects.requireNonNull(builder.dialect, "dialect");
        this.tableName = TableNames.validate(builder.tableName);
        this.jsonCodec = Objects.requireNonNull(builder.jsonCodec, "jsonCodec");
        this.rowMapper = rs -> new DeadLetterEntry(
                rs.getString("id"),
                rs.getString("operation_name"),
                jsonCodec.parseObject(rs.getString("arguments")),
                rs.getString("failure_reason"),
                FailureType.fromCode(rs.getString("failure_type")),
                rs.getInt("attempts_made"),
                rs.getTimestamp("created_at").toInstant());
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void insert(DeadLetterEntry entry) {
        Objects.requireNonNull(entry, "entry");
        try (Connection conn = connectionProvider.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                JdbcTemplate.update(conn, "DELETE FROM " + tableName + " WHERE id=?", entry.id());
                JdbcTemplate.update(conn, "INSERT INTO " + tableName + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?)",
                        entry.id(),
                        entry.operationName(),
                        jsonCodec.toJson(entry.arguments()),
                        truncate(entry.failureReason()),
                        entry.failureType().code(),
                        entry.attemptsMade(),
                        Timestamp.from(entry.createdAt()));
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new WorkGateStoreException("Failed to insert dead letter " + entry.id(), e);
        }
    }

    @Override
    public Optional<DeadLetterEntry> find(String id) {
        Objects.requireNonNull(id, "id");
        String sql = "SELECT " + COLUMNS + " FROM " + tableName + " WHERE id=?";
        try (Connection conn = open()) {
            List<DeadLetterEntry> rows = JdbcTemplate.query(conn, sql, rowMapper, id);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (SQLException e) {
            throw new WorkGateStoreException("Failed to load dead letter " + id, e);
        }
    }

    @Override
    public List<DeadLetterEntry> query(String operationName, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        try (Connection conn = open()) {
            if (operationName == null) {
                String sql = "SELECT " + COLUMNS + " FROM " + tableName + " ORDER BY created_at, id LIMIT ?";
                return JdbcTemplate.query(conn, sql, rowMapper, limit);
            }
            String sql = "SELECT " + COLUMNS + " FROM " + tableName +
                    " WHERE operation_name=? ORDER BY created_at, id LIMIT ?";
            return JdbcTemplate.query(conn, sql, rowMapper, operationName, limit);
        } catch (SQLException e) {
            throw new WorkGateStoreException("Failed to query dead letters", e);
        }
    }

    @Override
    public boolean delete(String id) {
        Objects.requireNonNull(id, "id");
        try (Connection conn = open()) {
            return JdbcTemplate.update(conn, "DELETE FROM " + tableName + " WHERE id=?", id) > 0;
        } catch (SQLException e) {
            throw new WorkGateStoreException("Failed to delete dead letter " + id, e);
        }
    }

    @Override
    public int count(String operationName) {
        try (Connection conn = open()) {
            List<Integer> counts = operationName == null
                    ? JdbcTemplate.query(conn, "SELECT COUNT(*) FROM " + tableName, rs -> rs.getInt(1))
                    : JdbcTemplate.query(conn, "SELECT COUNT(*) FROM " + tableName + " WHERE operation_name=?",
                            rs -> rs.getInt(1), operationName);
            return counts.get(0);
        } catch (SQLException e) {
            throw new WorkGateStoreException("Failed to count dead letters", e);
        }
    }

    /**
     * Deletes every entry created before {@code cutoff}, in batches.
     */
    @Override
    public int purgeOlderThan(Instant cutoff) {
        int total = 0;
        int deleted;
        do {
            deleted = purgeOlderThan(cutoff, DEFAULT_PURGE_BATCH);
            total += deleted;
        } while (deleted >= DEFAULT_PURGE_BATCH);
        return total;
    }

    /**
     * Deletes up to {@code limit} entries created before {@code cutoff}, oldest first.
     *
     * @return number of entries removed
     */
    public int purgeOlderThan(Instant cutoff, int limit) {
        Objects.requireNonNull(cutoff, "cutoff");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        try (Connection conn = open()) {
            return JdbcTemplate.update(conn, dialect.purgeDeadLettersSql(tableName), Timestamp.from(cutoff), limit);
        } catch (SQLException e) {
            throw new WorkGateStoreException("Failed to purge dead letters", e);
        }
    }

    public String tableName() {
        return tableName;
    }

    private Connection open() throws SQLException {
        Connection conn = connectionProvider.getConnection();
        conn.setAutoCommit(true);
        return conn;
    }

    private static String truncate(String reason) {
        if (reason == null || reason.length() <= MAX_REASON_LENGTH) {
            return reason;
        }
        return reason.substring(0, MAX_REASON_LENGTH);
    }

    /** Builder for {@link JdbcDeadLetterStore}. */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private CacheDialect dialect;
        private String tableName = TableNames.DEFAULT_DEAD_LETTER_TABLE;
        private JsonCodec jsonCodec = JsonCodec.getDefault();

        private Builder() {
        }

        /**
         * <b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <b>Required.</b> Supplies the batch purge statement.
         */
        public Builder dialect(CacheDialect dialect) {
            this.dialect = dialect;
            return this;
        }

        /**
         * Optional. Defaults to {@value TableNames#DEFAULT_DEAD_LETTER_TABLE}.
         */
        public Builder tableName(String tableName) {
            this.tableName = tableName;
            return this;
        }

        /**
         * Optional. Defaults to {@link JsonCodec#getDefault()}.
         */
        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        public JdbcDeadLetterStore build() {
            return new JdbcDeadLetterStore(this);
        }
    }
}

package io.workgate.jdbc.cache;

import io.workgate.jdbc.ConnectionProvider;
import io.workgate.jdbc.JdbcTemplate;
import io.workgate.jdbc.TableNames;
import io.workgate.jdbc.spi.CacheDialect;
import io.workgate.spi.CacheClient;
import io.workgate.spi.CacheException;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link CacheClient} over a shared database table, so several worker processes see the
 * same leases without a dedicated cache service.
 *
 * <p>Expected table layout:
 * <pre>{@code
 * CREATE TABLE workgate_cache (
 *   cache_key   VARCHAR(512) PRIMARY KEY,
 *   cache_value VARCHAR(4000) NOT NULL,
 *   expires_at  TIMESTAMP NOT NULL
 * )
 * }</pre>
 *
 * <p>Expired rows are invisible to every read and are removed in batches by
 * {@link #purgeExpired(int)}. Every call uses its own auto-committed connection; any
 * {@link SQLException} surfaces as {@link CacheException}.
 */
public final class JdbcCacheClient implements CacheClient {
    private static final int MAX_IN_LIST = 500;
    private static final char LIKE_ESCAPE = '!';

    private final ConnectionProvider connectionProvider;
    private final CacheDialect dialect;
    private final String tableName;
    private final Clock clock;

    private JdbcCacheClient(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.dialect = Objects.requireNonNull(builder.dialect, "dialect");
        this.tableName = TableNames.validate(builder.tableName);
        this.clock = Objects.requireNonNull(builder.clock, "clock");
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String get(String key) {
        Objects.requireNonNull(key, "key");
        String sql = "SELECT cache_value FROM " + tableName + " WHERE cache_key=? AND expires_at > ?";
        try (Connection conn = open()) {
            List<String> values = JdbcTemplate.query(conn, sql, rs -> rs.getString(1), key, now());
            return values.isEmpty() ? null : values.get(0);
        } catch (SQLException e) {
            throw new CacheException("Failed to read cache key " + key, e);
        }
    }

    @Override
    public Map<String, String> getAll(Collection<String> keys) {
        Map<String, String> result = new LinkedHashMap<>();
        if (keys.isEmpty()) {
            return result;
        }
        Timestamp now = now();
        try (Connection conn = open()) {
            for (List<String> chunk : chunks(keys)) {
                String sql = "SELECT cache_key, cache_value FROM " + tableName +
                        " WHERE expires_at > ? AND cache_key IN (" + JdbcTemplate.placeholders(chunk.size()) + ")";
                Object[] params = new Object[chunk.size() + 1];
                params[0] = now;
                for (int i = 0; i < chunk.size(); i++) {
                    params[i + 1] = chunk.get(i);
                }
                JdbcTemplate.query(conn, sql, rs -> {
                    result.put(rs.getString(1), rs.getString(2));
                    return null;
                }, params);
            }
        } catch (SQLException e) {
            throw new CacheException("Failed to read " + keys.size() + " cache keys", e);
        }
        return result;
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        setAll(Map.of(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value")), ttl);
    }

    @Override
    public void setAll(Map<String, String> entries, Duration ttl) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
        if (entries.isEmpty()) {
            return;
        }
        Timestamp expiresAt = Timestamp.from(clock.instant().plus(ttl));
        String sql = dialect.upsertSql(tableName);
        try (Connection conn = open()) {
            for (Map.Entry<String, String> entry : entries.entrySet()) {
                JdbcTemplate.update(conn, sql, entry.getKey(), entry.getValue(), expiresAt);
            }
        } catch (SQLException e) {
            throw new CacheException("Failed to write " + entries.size() + " cache keys", e);
        }
    }

    @Override
    public boolean delete(String key) {
        return deleteAll(List.of(Objects.requireNonNull(key, "key"))) > 0;
    }

    @Override
    public int deleteAll(Collection<String> keys) {
        if (keys.isEmpty()) {
            return 0;
        }
        Timestamp now = now();
        int live = 0;
        try (Connection conn = open()) {
            for (List<String> chunk : chunks(keys)) {
                String in = " cache_key IN (" + JdbcTemplate.placeholders(chunk.size()) + ")";
                Object[] liveParams = new Object[chunk.size() + 1];
                liveParams[0] = now;
                for (int i = 0; i < chunk.size(); i++) {
                    liveParams[i + 1] = chunk.get(i);
                }
                live += JdbcTemplate.update(conn,
                        "DELETE FROM " + tableName + " WHERE expires_at > ? AND" + in, liveParams);
                // expired leftovers for the same keys
                JdbcTemplate.update(conn, "DELETE FROM " + tableName + " WHERE" + in, chunk.toArray());
            }
        } catch (SQLException e) {
            throw new CacheException("Failed to delete " + keys.size() + " cache keys", e);
        }
        return live;
    }

    @Override
    public List<String> keysWithPrefix(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        String sql = "SELECT cache_key FROM " + tableName +
                " WHERE cache_key LIKE ? ESCAPE '" + LIKE_ESCAPE + "' AND expires_at > ? ORDER BY cache_key";
        try (Connection conn = open()) {
            return JdbcTemplate.query(conn, sql, rs -> rs.getString(1), escapeLike(prefix) + "%", now());
        } catch (SQLException e) {
            throw new CacheException("Failed to list cache keys with prefix " + prefix, e);
        }
    }

    /**
     * Deletes up to {@code limit} expired rows.
     *
     * @return number of rows removed
     */
    public int purgeExpired(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        try (Connection conn = open()) {
            return JdbcTemplate.update(conn, dialect.purgeExpiredSql(tableName), now(), limit);
        } catch (SQLException e) {
            throw new CacheException("Failed to purge expired cache rows", e);
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

    private Timestamp now() {
        return Timestamp.from(clock.instant());
    }

    private static List<List<String>> chunks(Collection<String> keys) {
        List<String> all = new ArrayList<>(keys);
        List<List<String>> chunks = new ArrayList<>();
        for (int i = 0; i < all.size(); i += MAX_IN_LIST) {
            chunks.add(all.subList(i, Math.min(all.size(), i + MAX_IN_LIST)));
        }
        return chunks;
    }

    static String escapeLike(String prefix) {
        StringBuilder sb = new StringBuilder(prefix.length());
        for (char c : prefix.toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                sb.append(LIKE_ESCAPE);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /** Builder for {@link JdbcCacheClient}. */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private CacheDialect dialect;
        private String tableName = TableNames.DEFAULT_CACHE_TABLE;
        private Clock clock = Clock.systemUTC();

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
         * <b>Required.</b> See {@link io.workgate.jdbc.dialect.CacheDialects#detect}.
         */
        public Builder dialect(CacheDialect dialect) {
            this.dialect = dialect;
            return this;
        }

        /**
         * Optional. Defaults to {@value TableNames#DEFAULT_CACHE_TABLE}.
         */
        public Builder tableName(String tableName) {
            this.tableName = tableName;
            return this;
        }

        /**
         * Optional. Defaults to the UTC system clock. Expiry is computed and checked on
         * this clock rather than the database's.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @throws NullPointerException     if a required setting is missing
         * @throws IllegalArgumentException if the table name is not a plain identifier
         */
        public JdbcCacheClient build() {
            return new JdbcCacheClient(this);
        }
    }
}

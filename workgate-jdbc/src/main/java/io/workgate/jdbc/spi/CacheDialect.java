package io.workgate.jdbc.spi;

import java.util.List;

/**
 * SQL that differs between databases for the cache and dead-letter tables.
 *
 * <p>Register custom dialects via {@code META-INF/services/io.workgate.jdbc.spi.CacheDialect}.
 * Built-in dialects: H2, MySQL (+ TiDB), PostgreSQL.
 *
 * @see io.workgate.jdbc.dialect.CacheDialects
 */
public interface CacheDialect {

    /**
     * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
     */
    String name();

    /**
     * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
     */
    List<String> jdbcUrlPrefixes();

    /**
     * Inserts a cache row or overwrites the existing one.
     *
     * <p>Parameters: cache_key (String), cache_value (String), expires_at (Timestamp)
     */
    String upsertSql(String table);

    /**
     * Deletes up to {@code limit} cache rows that expired at or before a point in time.
     *
     * <p>Parameters: expires_at (Timestamp), limit (int)
     */
    String purgeExpiredSql(String table);

    /**
     * Deletes up to {@code limit} dead letters created before a point in time, oldest first.
     *
     * <p>Parameters: created_at (Timestamp), limit (int)
     */
    String purgeDeadLettersSql(String table);
}

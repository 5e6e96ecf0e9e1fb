package io.workgate.jdbc.dialect;

import java.util.List;

/**
 * MySQL dialect. Also compatible with TiDB.
 *
 * <p>MySQL rejects {@code LIMIT} inside an {@code IN} subquery, so the batch deletes use
 * {@code DELETE ... ORDER BY ... LIMIT} instead.
 */
public final class MySqlCacheDialect extends AbstractCacheDialect {

    @Override
    public String name() {
        return "mysql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:mysql:", "jdbc:tidb:");
    }

    @Override
    public String upsertSql(String table) {
        return "INSERT INTO " + table + " (cache_key, cache_value, expires_at) VALUES (?,?,?)" +
                " ON DUPLICATE KEY UPDATE cache_value=VALUES(cache_value), expires_at=VALUES(expires_at)";
    }

    @Override
    public String purgeExpiredSql(String table) {
        return "DELETE FROM " + table + " WHERE expires_at <= ? ORDER BY expires_at LIMIT ?";
    }

    @Override
    public String purgeDeadLettersSql(String table) {
        return "DELETE FROM " + table + " WHERE created_at < ? ORDER BY created_at LIMIT ?";
    }
}

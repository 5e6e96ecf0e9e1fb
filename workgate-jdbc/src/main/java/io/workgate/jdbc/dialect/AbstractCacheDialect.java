package io.workgate.jdbc.dialect;

import io.workgate.jdbc.spi.CacheDialect;

/**
 * Base dialect. The batch deletes use an {@code IN (SELECT ... LIMIT ?)} subquery, which
 * H2 and PostgreSQL accept.
 */
public abstract class AbstractCacheDialect implements CacheDialect {

    @Override
    public String purgeExpiredSql(String table) {
        return "DELETE FROM " + table + " WHERE cache_key IN (" +
                "SELECT cache_key FROM " + table +
                " WHERE expires_at <= ? ORDER BY expires_at LIMIT ?)";
    }

    @Override
    public String purgeDeadLettersSql(String table) {
        return "DELETE FROM " + table + " WHERE id IN (" +
                "SELECT id FROM " + table +
                " WHERE created_at < ? ORDER BY created_at LIMIT ?)";
    }
}

package io.workgate.jdbc.dialect;

import java.util.List;

/**
 * PostgreSQL dialect.
 */
public final class PostgresCacheDialect extends AbstractCacheDialect {

    @Override
    public String name() {
        return "postgresql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:postgresql:");
    }

    @Override
    public String upsertSql(String table) {
        return "INSERT INTO " + table + " (cache_key, cache_value, expires_at) VALUES (?,?,?)" +
                " ON CONFLICT (cache_key) DO UPDATE" +
                " SET cache_value=EXCLUDED.cache_value, expires_at=EXCLUDED.expires_at";
    }
}

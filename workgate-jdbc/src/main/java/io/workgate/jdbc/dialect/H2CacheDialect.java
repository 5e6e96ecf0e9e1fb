package io.workgate.jdbc.dialect;

import java.util.List;

/**
 * H2 dialect. Primarily for tests and single-node deployments.
 */
public final class H2CacheDialect extends AbstractCacheDialect {

    @Override
    public String name() {
        return "h2";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:h2:");
    }

    @Override
    public String upsertSql(String table) {
        return "MERGE INTO " + table + " (cache_key, cache_value, expires_at) KEY (cache_key) VALUES (?,?,?)";
    }
}

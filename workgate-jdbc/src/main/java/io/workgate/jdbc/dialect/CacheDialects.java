package io.workgate.jdbc.dialect;

import io.workgate.jdbc.spi.CacheDialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for cache dialects with auto-detection support.
 *
 * <p>Dialects are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.workgate.jdbc.spi.CacheDialect}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * CacheDialect dialect = CacheDialects.detect(dataSource);
 * CacheDialect dialect = CacheDialects.detect("jdbc:postgresql://localhost/workers");
 * CacheDialect dialect = CacheDialects.get("mysql");
 * }</pre>
 */
public final class CacheDialects {

    private static final List<CacheDialect> DIALECTS;
    private static final Map<String, CacheDialect> BY_NAME = new ConcurrentHashMap<>();

    static {
        DIALECTS = ServiceLoader.load(CacheDialect.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (CacheDialect dialect : DIALECTS) {
            BY_NAME.put(dialect.name().toLowerCase(), dialect);
        }
    }

    private CacheDialects() {
    }

    /**
     * Returns all registered dialects.
     */
    public static List<CacheDialect> all() {
        return DIALECTS;
    }

    /**
     * Gets a dialect by name.
     *
     * @param name dialect name (case-insensitive)
     * @throws IllegalArgumentException if no dialect has this name
     */
    public static CacheDialect get(String name) {
        Objects.requireNonNull(name, "name");
        CacheDialect dialect = BY_NAME.get(name.toLowerCase());
        if (dialect == null) {
            throw new IllegalArgumentException("Unknown cache dialect: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return dialect;
    }

    /**
     * Auto-detects the dialect from a DataSource's connection URL.
     *
     * @throws IllegalStateException if the URL cannot be read or matches no dialect
     */
    public static CacheDialect detect(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource");
        String url;
        try (Connection conn = dataSource.getConnection()) {
            url = conn.getMetaData().getURL();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect cache dialect from DataSource", e);
        }
        try {
            return detect(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    /**
     * Auto-detects the dialect from a JDBC URL.
     *
     * @throws IllegalArgumentException if no dialect handles this URL
     */
    public static CacheDialect detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }
        for (CacheDialect dialect : DIALECTS) {
            for (String prefix : dialect.jdbcUrlPrefixes()) {
                if (jdbcUrl.startsWith(prefix)) {
                    return dialect;
                }
            }
        }
        throw new IllegalArgumentException("No cache dialect found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + allPrefixes());
    }

    private static List<String> allPrefixes() {
        return DIALECTS.stream()
                .flatMap(d -> d.jdbcUrlPrefixes().stream())
                .toList();
    }
}

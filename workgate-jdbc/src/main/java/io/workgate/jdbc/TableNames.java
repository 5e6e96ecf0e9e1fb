package io.workgate.jdbc;

import java.util.Objects;

/**
 * Default table names and identifier validation for the JDBC components.
 */
public final class TableNames {
    public static final String DEFAULT_CACHE_TABLE = "workgate_cache";
    public static final String DEFAULT_DEAD_LETTER_TABLE = "workgate_dead_letter";
    private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

    private TableNames() {
    }

    public static String validate(String tableName) {
        Objects.requireNonNull(tableName, "tableName");
        if (!tableName.matches(TABLE_NAME_PATTERN)) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
        return tableName;
    }
}

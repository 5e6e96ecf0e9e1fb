package io.workgate.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Supplies JDBC connections to the cache client, dead-letter store and purge scheduler.
 * Callers close every connection they obtain.
 *
 * @see DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

    Connection getConnection() throws SQLException;
}

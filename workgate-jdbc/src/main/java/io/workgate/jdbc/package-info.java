/**
 * JDBC implementations of the shared lease cache and the dead-letter store.
 *
 * <ul>
 *   <li>{@link io.workgate.jdbc.cache.JdbcCacheClient}: lease cache over a table with
 *       per-row expiry.</li>
 *   <li>{@link io.workgate.jdbc.dead.JdbcDeadLetterStore}: durable dead letters.</li>
 *   <li>{@link io.workgate.jdbc.purge.JdbcPurgeScheduler}: batch removal of expired rows
 *       and old dead letters.</li>
 *   <li>{@link io.workgate.jdbc.dialect.CacheDialects}: H2, MySQL and PostgreSQL SQL
 *       variants, selected from the JDBC URL.</li>
 * </ul>
 */
package io.workgate.jdbc;

package io.workgate.jdbc;

/**
 * Unchecked exception wrapping JDBC errors raised by the dead-letter store and purge code.
 * The cache client reports the same failures as {@link io.workgate.spi.CacheException}.
 */
public final class WorkGateStoreException extends RuntimeException {

    public WorkGateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

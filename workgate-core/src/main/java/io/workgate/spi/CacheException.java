package io.workgate.spi;

/**
 * Thrown when the shared cache cannot serve a request.
 */
public class CacheException extends RuntimeException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.workgate.spi;

/**
 * Remote failure reported by a {@link ControlPlaneClient}.
 *
 * <p>Timeouts, 5xx responses and 429 are transient and may be retried. Any other status
 * is deterministic and is surfaced immediately.
 */
public class ControlPlaneException extends RuntimeException {

    /** Status code used when no HTTP response was received. */
    public static final int NO_RESPONSE = -1;

    private final int statusCode;
    private final boolean timeout;

    public ControlPlaneException(String message, int statusCode) {
        this(message, statusCode, false, null);
    }

    public ControlPlaneException(String message, int statusCode, boolean timeout, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.timeout = timeout;
    }

    public static ControlPlaneException timeout(String message, Throwable cause) {
        return new ControlPlaneException(message, NO_RESPONSE, true, cause);
    }

    public static ControlPlaneException unreachable(String message, Throwable cause) {
        return new ControlPlaneException(message, NO_RESPONSE, false, cause);
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean isTimeout() {
        return timeout;
    }

    public boolean isTransient() {
        return timeout || statusCode == NO_RESPONSE || statusCode == 429 || statusCode >= 500;
    }
}

package io.workgate.resilience;

import java.time.Instant;

/**
 * Point-in-time view of one circuit breaker.
 *
 * @param operationName       the remote operation the breaker guards
 * @param state               current state
 * @param consecutiveFailures failures since the last success
 * @param openedAt            when the breaker last opened, {@code null} if never
 * @param totalCalls          calls that reached the remote side
 * @param totalFailures       calls that failed
 * @param rejectedCalls       calls rejected while open
 */
public record CircuitSnapshot(
        String operationName,
        CircuitState state,
        int consecutiveFailures,
        Instant openedAt,
        long totalCalls,
        long totalFailures,
        long rejectedCalls) {
}

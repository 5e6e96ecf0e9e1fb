package io.workgate.resilience;

import io.workgate.batch.OperationOutcome;
import io.workgate.model.HistoryRecord;
import io.workgate.model.ItemKey;
import io.workgate.spi.ControlPlaneClient;
import io.workgate.spi.ControlPlaneException;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ControlPlaneClient} decorator that gives every remote method its own circuit
 * breaker and retries transient failures.
 *
 * <p>Breakers are named {@code control-plane.<method>} and count only transient
 * failures; a 4xx answer proves the endpoint is up. Deterministic failures are rethrown
 * on the first attempt. {@link CircuitOpenException} is never retried.
 */
public final class ResilientControlPlaneClient implements ControlPlaneClient {
    private static final Logger logger = Logger.getLogger(ResilientControlPlaneClient.class.getName());

    public static final String OPERATION_PREFIX = "control-plane.";

    private final ControlPlaneClient delegate;
    private final CircuitBreakerRegistry breakers;
    private final RetryPolicy retryPolicy;
    private final int maxAttempts;

    public ResilientControlPlaneClient(ControlPlaneClient delegate, CircuitBreakerRegistry breakers,
            RetryPolicy retryPolicy, int maxAttempts) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.breakers = Objects.requireNonNull(breakers, "breakers");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        breakers.failureFilter(OPERATION_PREFIX, ResilientControlPlaneClient::countsAsFailure);
    }

    @Override
    public Map<String, HistoryRecord> checkHistoryBatch(String workflowId, List<ItemKey> items,
            String organizationId) {
        return call("check-history-batch",
                () -> delegate.checkHistoryBatch(workflowId, items, organizationId));
    }

    @Override
    public Set<String> checkActiveProcessing(String workflowId, List<ItemKey> items,
            String currentExecutionId) {
        return call("check-active-processing",
                () -> delegate.checkActiveProcessing(workflowId, items, currentExecutionId));
    }

    @Override
    public List<OperationOutcome> batchUpdateExecutionStatus(List<Map<String, Object>> updates,
            String organizationId) {
        return call("batch-update-execution-status",
                () -> delegate.batchUpdateExecutionStatus(updates, organizationId));
    }

    @Override
    public List<OperationOutcome> batchUpdatePipelineStatus(List<Map<String, Object>> updates,
            String organizationId) {
        return call("batch-update-pipeline-status",
                () -> delegate.batchUpdatePipelineStatus(updates, organizationId));
    }

    @Override
    public List<OperationOutcome> batchUpdateFileExecutionStatus(String executionId,
            List<Map<String, Object>> updates, String organizationId) {
        return call("batch-update-file-execution-status",
                () -> delegate.batchUpdateFileExecutionStatus(executionId, updates, organizationId));
    }

    private <T> T call(String method, Supplier<T> call) {
        CircuitBreaker breaker = breakers.get(OPERATION_PREFIX + method);
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return breaker.execute(call);
            } catch (ControlPlaneException e) {
                if (!e.isTransient() || attempt >= maxAttempts) {
                    throw e;
                }
                long delayMs = retryPolicy.computeDelayMs(attempt);
                logger.log(Level.FINE, "Retrying {0} after transient failure (attempt {1}, delay {2}ms)",
                        new Object[]{method, attempt, delayMs});
                sleep(method, delayMs, e);
            }
        }
    }

    private static void sleep(String method, long delayMs, ControlPlaneException cause) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            ControlPlaneException interrupted = ControlPlaneException.unreachable(
                    "Interrupted while retrying " + method, ie);
            interrupted.addSuppressed(cause);
            throw interrupted;
        }
    }

    static boolean countsAsFailure(Throwable t) {
        return !(t instanceof ControlPlaneException cpe) || cpe.isTransient();
    }
}

package io.workgate.batch.handler;

import io.workgate.StubControlPlaneClient;
import io.workgate.batch.BatchOperation;
import io.workgate.batch.CompletionCallback;
import io.workgate.batch.OperationOutcome;
import io.workgate.batch.OperationType;
import io.workgate.cache.InMemoryCacheClient;
import io.workgate.spi.ControlPlaneException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BatchHandlersTest {

    private static BatchOperation op(OperationType type, String id, Map<String, Object> payload, String executionId) {
        return new BatchOperation(type, id, payload, "org", executionId, Instant.now(), CompletionCallback.NONE);
    }

    @Test
    void statusUpdateRejectsIncompleteOperationsLocally() {
        List<List<Map<String, Object>>> sent = new ArrayList<>();
        StatusUpdateHandler handler = new StatusUpdateHandler(new StubControlPlaneClient() {
            @Override
            public List<OperationOutcome> batchUpdateExecutionStatus(List<Map<String, Object>> updates, String org) {
                sent.add(updates);
                return allOk(updates);
            }
        });

        List<OperationOutcome> outcomes = handler.handle("org", List.of(
                op(OperationType.STATUS_UPDATE, "ok", Map.of("status", "COMPLETED"), "exec-1"),
                op(OperationType.STATUS_UPDATE, "no-status", Map.of(), "exec-1"),
                op(OperationType.STATUS_UPDATE, "payload-exec", Map.of("status", "ERROR", "execution_id", "exec-2"), null)));

        assertEquals(List.of(true, false, true), outcomes.stream().map(OperationOutcome::success).toList());
        assertEquals("no-status", outcomes.get(1).operationId());
        assertEquals(1, sent.size());
        assertEquals(2, sent.get(0).size());
        assertEquals("exec-1", sent.get(0).get(0).get("execution_id"));
    }

    @Test
    void shortUpstreamResponseCountsAsFailure() {
        StatusUpdateHandler handler = new StatusUpdateHandler(new StubControlPlaneClient() {
            @Override
            public List<OperationOutcome> batchUpdateExecutionStatus(List<Map<String, Object>> updates, String org) {
                return List.of(OperationOutcome.ok(null));
            }
        });

        List<OperationOutcome> outcomes = handler.handle("org", List.of(
                op(OperationType.STATUS_UPDATE, "a", Map.of("status", "X"), "e"),
                op(OperationType.STATUS_UPDATE, "b", Map.of("status", "X"), "e")));

        assertTrue(outcomes.get(0).success());
        assertEquals("a", outcomes.get(0).operationId());
        assertFalse(outcomes.get(1).success());
    }

    @Test
    void fileStatusUpdateCallsOncePerExecution() {
        List<String> executions = new ArrayList<>();
        FileStatusUpdateHandler handler = new FileStatusUpdateHandler(new StubControlPlaneClient() {
            @Override
            public List<OperationOutcome> batchUpdateFileExecutionStatus(String executionId,
                    List<Map<String, Object>> updates, String org) {
                executions.add(executionId + ":" + updates.size());
                if (executionId.equals("bad")) {
                    throw new ControlPlaneException("boom", 500);
                }
                return allOk(updates);
            }
        });

        List<OperationOutcome> outcomes = handler.handle("org", List.of(
                op(OperationType.FILE_STATUS_UPDATE, "1", Map.of("status", "COMPLETED"), "good"),
                op(OperationType.FILE_STATUS_UPDATE, "2", Map.of("status", "COMPLETED"), "bad"),
                op(OperationType.FILE_STATUS_UPDATE, "3", Map.of("status", "COMPLETED"), "good"),
                op(OperationType.FILE_STATUS_UPDATE, "4", Map.of("status", "COMPLETED"), null)));

        assertEquals(List.of("good:2", "bad:1"), executions);
        assertEquals(List.of(true, false, true, false), outcomes.stream().map(OperationOutcome::success).toList());
        assertEquals("boom", outcomes.get(1).error());
    }

    @Test
    void pipelineUpdateMapsPositionalResults() {
        PipelineUpdateHandler handler = new PipelineUpdateHandler(new StubControlPlaneClient());

        List<OperationOutcome> outcomes = handler.handle("org", List.of(
                op(OperationType.PIPELINE_UPDATE, "p1", Map.of("pipeline_id", "p1"), null),
                op(OperationType.PIPELINE_UPDATE, "p2", Map.of("pipeline_id", "p2"), null)));

        assertEquals(List.of("p1", "p2"), outcomes.stream().map(OperationOutcome::operationId).toList());
        assertTrue(outcomes.stream().allMatch(OperationOutcome::success));
    }

    @Test
    void cacheInvalidationByKeyAndPrefix() {
        InMemoryCacheClient cache = new InMemoryCacheClient();
        cache.set("single", "1", Duration.ofMinutes(1));
        cache.set("group:a", "1", Duration.ofMinutes(1));
        cache.set("group:b", "1", Duration.ofMinutes(1));
        cache.set("keep", "1", Duration.ofMinutes(1));
        CacheInvalidationHandler handler = new CacheInvalidationHandler(cache);

        List<OperationOutcome> outcomes = handler.handle("org", List.of(
                op(OperationType.CACHE_INVALIDATION, "k", Map.of("key", "single"), null),
                op(OperationType.CACHE_INVALIDATION, "p", Map.of("prefix", "group:"), null),
                op(OperationType.CACHE_INVALIDATION, "empty", Map.of(), null)));

        assertEquals(List.of(true, true, false), outcomes.stream().map(OperationOutcome::success).toList());
        assertEquals(1, cache.size());
        assertEquals("1", cache.get("keep"));
    }
}

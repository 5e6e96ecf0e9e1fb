package io.workgate;

import io.workgate.batch.BatchConfig;
import io.workgate.batch.OperationOutcome;
import io.workgate.cache.InMemoryCacheClient;
import io.workgate.discovery.DiscoveryRequest;
import io.workgate.execution.ExecutionConfig;
import io.workgate.lock.ClaimKeys;
import io.workgate.model.ExecutionStatus;
import io.workgate.model.HistoryRecord;
import io.workgate.model.ItemKey;
import io.workgate.source.LocalFileSystemSource;
import io.workgate.spi.TaskQueue.TaskStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WorkGateTest {

    @TempDir
    Path dir;

    private final InMemoryCacheClient cache = new InMemoryCacheClient();
    private final RecordingMetrics metrics = new RecordingMetrics();
    private final RecordingControlPlane controlPlane = new RecordingControlPlane();
    private WorkGate gate;

    @AfterEach
    void tearDown() {
        if (gate != null) {
            gate.close();
        }
    }

    /**
     * Knows b.pdf as completed and c.pdf as running elsewhere; records status writes.
     */
    private static final class RecordingControlPlane extends StubControlPlaneClient {
        final List<Map<String, Object>> executionUpdates = new CopyOnWriteArrayList<>();
        final List<Map<String, Object>> fileUpdates = new CopyOnWriteArrayList<>();

        @Override
        public Map<String, HistoryRecord> checkHistoryBatch(String workflowId, List<ItemKey> items,
                String organizationId) {
            Map<String, HistoryRecord> records = new HashMap<>();
            for (ItemKey key : items) {
                if (key.path().endsWith("b.pdf")) {
                    records.put(key.composite(), new HistoryRecord(key, true, ExecutionStatus.COMPLETED,
                            key.path(), 1, 3, null));
                }
            }
            return records;
        }

        @Override
        public Set<String> checkActiveProcessing(String workflowId, List<ItemKey> items,
                String currentExecutionId) {
            Set<String> active = new HashSet<>();
            for (ItemKey key : items) {
                if (key.path().endsWith("c.pdf")) {
                    active.add(key.composite());
                }
            }
            return active;
        }

        @Override
        public List<OperationOutcome> batchUpdateExecutionStatus(List<Map<String, Object>> updates,
                String organizationId) {
            executionUpdates.addAll(updates);
            return allOk(updates);
        }

        @Override
        public List<OperationOutcome> batchUpdateFileExecutionStatus(String executionId,
                List<Map<String, Object>> updates, String organizationId) {
            fileUpdates.addAll(updates);
            return allOk(updates);
        }
    }

    private WorkGate build(StubTaskQueue queue) {
        return WorkGate.builder()
                .itemSource(new LocalFileSystemSource())
                .cache(cache)
                .controlPlane(controlPlane)
                .taskQueue(queue)
                .metrics(metrics)
                .leaseTtl(Duration.ofSeconds(300))
                .batchConfig(new BatchConfig(100, Duration.ofMinutes(1), Duration.ofMinutes(1), false))
                .executionConfig(ExecutionConfig.builder()
                        .pollIntervalStart(Duration.ofMillis(5))
                        .pollIntervalMax(Duration.ofMillis(10))
                        .taskRetryAttempts(1)
                        .build())
                .build();
    }

    private ExecutionRequest request(int hardLimit) {
        return new ExecutionRequest("wf", "exec-1", "org", "process_file",
                new DiscoveryRequest(List.of(dir.toString()), List.of("*.pdf"), true, hardLimit, 100), true);
    }

    private void writeFiles() throws IOException {
        Files.writeString(dir.resolve("a.pdf"), "content A");
        Files.writeString(dir.resolve("b.pdf"), "content B");
        Files.writeString(dir.resolve("c.pdf"), "content C");
        Files.writeString(dir.resolve("notes.txt"), "ignored");
    }

    @Test
    void processesOnlyNewInactiveItems() throws Exception {
        writeFiles();
        StubTaskQueue queue = StubTaskQueue.succeeding();
        gate = build(queue);

        ExecutionReport report = gate.run(request(10)).get(10, TimeUnit.SECONDS);

        assertEquals(1, report.selected());
        assertEquals(1, report.claimed());
        assertEquals(1, report.succeeded());
        assertEquals(0, report.deadLettered());
        assertEquals(3, report.discovery().itemsMatched());
        assertEquals(1, queue.submissions.size());
        Map<String, String> args = queue.submissions.get(0);
        assertTrue(args.get("file_path").endsWith("a.pdf"));
        assertEquals("wf", args.get("workflow_id"));
        assertEquals("exec-1", args.get("execution_id"));
        assertEquals("org", args.get("organization_id"));
        assertEquals(64, args.get("provider_file_uuid").length());
        assertTrue(cache.keysWithPrefix(ClaimKeys.workflowPrefix("wf")).isEmpty());
        assertEquals(1, metrics.claimsCreated.get());
        assertEquals(1, metrics.leasesReleased.get());
    }

    @Test
    void statusWritesAreBatchedThroughAggregator() throws Exception {
        writeFiles();
        gate = build(StubTaskQueue.succeeding());
        gate.run(request(10)).get(10, TimeUnit.SECONDS);

        assertTrue(controlPlane.executionUpdates.isEmpty());
        gate.aggregator().flushAll();

        assertEquals(List.of("EXECUTING", "COMPLETED"),
                controlPlane.executionUpdates.stream().map(u -> u.get("status")).toList());
        assertEquals(1, controlPlane.fileUpdates.size());
        assertEquals("COMPLETED", controlPlane.fileUpdates.get(0).get("status"));
    }

    @Test
    void failedTaskIsDeadLetteredAndReported() throws Exception {
        writeFiles();
        gate = build(new StubTaskQueue(id -> TaskStatus.failed("ocr failed")));

        ExecutionReport report = gate.run(request(10)).get(10, TimeUnit.SECONDS);
        gate.aggregator().flushAll();

        assertEquals(1, report.deadLettered());
        assertEquals(1, gate.deadLetters().count("process_file"));
        assertEquals("ERROR", controlPlane.fileUpdates.get(0).get("status"));
        assertEquals("ocr failed", controlPlane.fileUpdates.get(0).get("error_message"));
        assertEquals("ERROR", controlPlane.executionUpdates.get(1).get("status"));
        assertTrue(cache.keysWithPrefix(ClaimKeys.PREFIX).isEmpty());
    }

    @Test
    void allFilteredOutSubmitsNothing() throws Exception {
        Files.writeString(dir.resolve("b.pdf"), "content B");
        Files.writeString(dir.resolve("c.pdf"), "content C");
        StubTaskQueue queue = StubTaskQueue.succeeding();
        gate = build(queue);

        ExecutionReport report = gate.run(request(10)).get(10, TimeUnit.SECONDS);

        assertTrue(report.allFilteredOut());
        assertEquals(0, report.selected());
        assertEquals(1, metrics.allFilteredOut.get());
        assertTrue(queue.submissions.isEmpty());
    }

    @Test
    void hardLimitBoundsTheBatch() throws Exception {
        for (int i = 0; i < 20; i++) {
            Files.writeString(dir.resolve("new-" + i + ".pdf"), "content " + i);
        }
        StubTaskQueue queue = StubTaskQueue.succeeding();
        gate = build(queue);

        ExecutionReport report = gate.run(request(5)).get(10, TimeUnit.SECONDS);

        assertEquals(5, report.selected());
        assertEquals(5, queue.submissions.size());
    }

    @Test
    void closeFlushesPendingStatus() throws Exception {
        writeFiles();
        gate = build(StubTaskQueue.succeeding());
        gate.run(request(10)).get(10, TimeUnit.SECONDS);

        gate.close();
        gate = null;

        assertEquals(2, controlPlane.executionUpdates.size());
        assertEquals(1, controlPlane.fileUpdates.size());
    }

    @Test
    void builderRequiresCollaborators() {
        assertThrows(NullPointerException.class, () -> WorkGate.builder().build());
        assertThrows(NullPointerException.class, () -> WorkGate.builder()
                .itemSource(new LocalFileSystemSource()).cache(cache).controlPlane(controlPlane).build());
    }
}

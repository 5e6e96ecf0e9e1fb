package io.workgate.spring.boot;

import io.workgate.batch.OperationOutcome;
import io.workgate.model.HistoryRecord;
import io.workgate.model.ItemKey;
import io.workgate.spi.ControlPlaneClient;
import io.workgate.spi.TaskQueue;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class StubBeans {

    private StubBeans() {
    }

    static final class OkControlPlane implements ControlPlaneClient {
        @Override
        public Map<String, HistoryRecord> checkHistoryBatch(String workflowId, List<ItemKey> items,
                String organizationId) {
            return Map.of();
        }

        @Override
        public Set<String> checkActiveProcessing(String workflowId, List<ItemKey> items,
                String currentExecutionId) {
            return Set.of();
        }

        @Override
        public List<OperationOutcome> batchUpdateExecutionStatus(List<Map<String, Object>> updates,
                String organizationId) {
            return allOk(updates.size());
        }

        @Override
        public List<OperationOutcome> batchUpdatePipelineStatus(List<Map<String, Object>> updates,
                String organizationId) {
            return allOk(updates.size());
        }

        @Override
        public List<OperationOutcome> batchUpdateFileExecutionStatus(String executionId,
                List<Map<String, Object>> updates, String organizationId) {
            return allOk(updates.size());
        }

        private static List<OperationOutcome> allOk(int n) {
            List<OperationOutcome> outcomes = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                outcomes.add(OperationOutcome.ok(null));
            }
            return outcomes;
        }
    }

    static final class SucceedingTaskQueue implements TaskQueue {
        @Override
        public String submit(String taskName, Map<String, String> arguments) {
            return taskName + "-1";
        }

        @Override
        public TaskStatus status(String trackingId) {
            return TaskStatus.of(TaskState.SUCCEEDED);
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class TaskQueueConfig {
        @Bean
        TaskQueue taskQueue() {
            return new SucceedingTaskQueue();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class ControlPlaneConfig {
        @Bean
        ControlPlaneClient controlPlaneClient() {
            return new OkControlPlane();
        }
    }
}

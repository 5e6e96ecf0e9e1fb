package io.workgate.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.workgate.batch.OperationOutcome;
import io.workgate.model.ExecutionStatus;
import io.workgate.model.HistoryRecord;
import io.workgate.model.ItemKey;
import io.workgate.spi.ControlPlaneClient;
import io.workgate.spi.ControlPlaneException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ControlPlaneClient} that posts JSON to the control-plane's internal API.
 *
 * <p>Every request carries {@code Authorization: Bearer <apiKey>} and, when known,
 * {@code X-Organization-ID}. Non-2xx responses become {@link ControlPlaneException} with
 * the response status; timeouts and I/O errors become exceptions without a status, which
 * {@link ControlPlaneException#isTransient()} treats as retryable.
 *
 * <p>This client does not retry. Wrap it in
 * {@link io.workgate.resilience.ResilientControlPlaneClient} for retries and circuit
 * breaking.
 */
public final class HttpControlPlaneClient implements ControlPlaneClient {
    private static final Logger logger = Logger.getLogger(HttpControlPlaneClient.class.getName());

    static final String HISTORY_PATH = "file-history/check-batch/";
    static final String ACTIVE_PATH = "check-active-processing/";
    static final String EXECUTION_STATUS_PATH = "workflow-execution/batch-status-update/";
    static final String PIPELINE_STATUS_PATH = "pipeline/batch-status-update/";
    static final String FILE_STATUS_PATH = "file-execution/batch-status-update/";

    private static final List<String> ACTIVE_STATUSES = List.of("PENDING", "EXECUTING");
    private static final int MAX_ERROR_BODY = 500;

    private final URI baseUri;
    private final String apiKey;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;

    private HttpControlPlaneClient(Builder builder) {
        Objects.requireNonNull(builder.baseUrl, "baseUrl");
        this.apiKey = Objects.requireNonNull(builder.apiKey, "apiKey");
        this.requestTimeout = Objects.requireNonNull(builder.requestTimeout, "requestTimeout");
        if (requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be > 0");
        }
        String base = builder.baseUrl.endsWith("/") ? builder.baseUrl : builder.baseUrl + "/";
        this.baseUri = URI.create(base);
        if (baseUri.getScheme() == null || !baseUri.getScheme().startsWith("http")) {
            throw new IllegalArgumentException("baseUrl must be an http(s) URL: " + builder.baseUrl);
        }
        this.httpClient = builder.httpClient != null ? builder.httpClient : HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(requestTimeout)
                .build();
        this.mapper = builder.mapper != null ? builder.mapper : Jsons.mapper();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Map<String, HistoryRecord> checkHistoryBatch(String workflowId, List<ItemKey> items,
            String organizationId) {
        Map<String, HistoryRecord> records = new LinkedHashMap<>();
        if (items.isEmpty()) {
            return records;
        }
        Map<String, ItemKey> byComposite = new LinkedHashMap<>();
        List<Map<String, Object>> files = new ArrayList<>();
        for (ItemKey key : items) {
            byComposite.put(key.composite(), key);
            Map<String, Object> file = new LinkedHashMap<>();
            file.put("provider_file_uuid", key.providerIdentity());
            file.put("file_path", key.path());
            file.put("identifier", key.composite());
            files.add(file);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("workflow_id", workflowId);
        body.put("organization_id", organizationId);
        body.put("files", files);

        JsonNode response = post(HISTORY_PATH, body, organizationId);
        JsonNode histories = response.has("file_histories") ? response.get("file_histories") : response;
        for (Map.Entry<String, ItemKey> entry : byComposite.entrySet()) {
            JsonNode node = histories.get(entry.getKey());
            if (node != null && node.isObject()) {
                records.put(entry.getKey(), toHistoryRecord(entry.getValue(), node));
            }
        }
        return records;
    }

    static HistoryRecord toHistoryRecord(ItemKey key, JsonNode node) {
        if (!node.path("found").asBoolean(false)) {
            return HistoryRecord.notFound(key);
        }
        JsonNode history = node.path("file_history");
        ExecutionStatus status = ExecutionStatus.parse(textOrNull(history.get("status")));
        if (status == null && node.path("is_completed").asBoolean(false)) {
            status = ExecutionStatus.COMPLETED;
        }
        JsonNode exceeded = history.get("has_exceeded_limit");
        return new HistoryRecord(
                key,
                true,
                status,
                textOrNull(history.get("file_path")),
                history.path("execution_count").asInt(0),
                history.path("max_execution_count").asInt(HistoryRecord.DEFAULT_MAX_EXECUTION_COUNT),
                exceeded == null || exceeded.isNull() ? null : exceeded.asBoolean());
    }

    @Override
    public Set<String> checkActiveProcessing(String workflowId, List<ItemKey> items,
            String currentExecutionId) {
        Set<String> active = new HashSet<>();
        if (items.isEmpty()) {
            return active;
        }
        List<Map<String, Object>> files = new ArrayList<>();
        for (ItemKey key : items) {
            Map<String, Object> file = new LinkedHashMap<>();
            file.put("uuid", key.providerIdentity());
            file.put("path", key.path());
            files.add(file);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("workflow_id", workflowId);
        body.put("files", files);
        body.put("statuses", ACTIVE_STATUSES);
        body.put("exclude_execution_id", currentExecutionId);

        JsonNode response = post(ACTIVE_PATH, body, null);
        JsonNode identifiers = response.path("active_identifiers");
        if (identifiers.isArray() && identifiers.size() > 0) {
            Set<String> requested = new HashSet<>();
            for (ItemKey key : items) {
                requested.add(key.composite());
            }
            for (JsonNode id : identifiers) {
                if (requested.contains(id.asText())) {
                    active.add(id.asText());
                }
            }
            return active;
        }
        // older control planes only report provider identities
        Set<String> uuids = new HashSet<>();
        for (JsonNode uuid : response.path("active_uuids")) {
            uuids.add(uuid.asText());
        }
        for (ItemKey key : items) {
            if (key.hasProviderIdentity() && uuids.contains(key.providerIdentity())) {
                active.add(key.composite());
            }
        }
        return active;
    }

    @Override
    public List<OperationOutcome> batchUpdateExecutionStatus(List<Map<String, Object>> updates,
            String organizationId) {
        return batchUpdate(EXECUTION_STATUS_PATH, "status_update", null, updates, organizationId);
    }

    @Override
    public List<OperationOutcome> batchUpdatePipelineStatus(List<Map<String, Object>> updates,
            String organizationId) {
        return batchUpdate(PIPELINE_STATUS_PATH, "pipeline_update", null, updates, organizationId);
    }

    @Override
    public List<OperationOutcome> batchUpdateFileExecutionStatus(String executionId,
            List<Map<String, Object>> updates, String organizationId) {
        return batchUpdate(FILE_STATUS_PATH, "file_status_update", executionId, updates, organizationId);
    }

    private List<OperationOutcome> batchUpdate(String path, String operationType, String executionId,
            List<Map<String, Object>> updates, String organizationId) {
        if (updates.isEmpty()) {
            return List.of();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("operation_type", operationType);
        if (executionId != null) {
            body.put("execution_id", executionId);
        }
        body.put("organization_id", organizationId);
        body.put("items", updates);
        return toOutcomes(post(path, body, organizationId), updates.size());
    }

    /**
     * Maps a batch response to one outcome per submitted update. Per-item results are
     * used when present; otherwise the summary counters decide for the whole batch.
     */
    static List<OperationOutcome> toOutcomes(JsonNode response, int submitted) {
        List<OperationOutcome> outcomes = new ArrayList<>(submitted);
        JsonNode results = response.path("results");
        if (results.isArray() && results.size() > 0) {
            for (int i = 0; i < submitted; i++) {
                JsonNode result = results.get(i);
                if (result == null) {
                    outcomes.add(OperationOutcome.failed(null, "No result returned for update"));
                } else if (result.path("success").asBoolean(!result.has("error"))) {
                    outcomes.add(OperationOutcome.ok(null));
                } else {
                    outcomes.add(OperationOutcome.failed(null, result.path("error").asText("Update rejected")));
                }
            }
            return outcomes;
        }
        int failed = response.path("failed_items").asInt(0);
        String error = null;
        if (failed > 0) {
            List<String> errors = new ArrayList<>();
            for (JsonNode e : response.path("errors")) {
                errors.add(e.isTextual() ? e.asText() : e.toString());
            }
            error = errors.isEmpty() ? failed + " of " + submitted + " updates failed" : String.join("; ", errors);
        }
        for (int i = 0; i < submitted; i++) {
            outcomes.add(error == null ? OperationOutcome.ok(null) : OperationOutcome.failed(null, error));
        }
        return outcomes;
    }

    private JsonNode post(String path, Object body, String organizationId) {
        URI uri = baseUri.resolve(path);
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize request for " + path, e);
        }
        HttpRequest.Builder request = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(json));
        if (organizationId != null && !organizationId.isEmpty()) {
            request.header("X-Organization-ID", organizationId);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw ControlPlaneException.timeout("Request to " + uri + " timed out", e);
        } catch (IOException e) {
            throw ControlPlaneException.unreachable("Request to " + uri + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ControlPlaneException.unreachable("Interrupted calling " + uri, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            logger.log(Level.FINE, "{0} returned {1}", new Object[]{uri, status});
            throw new ControlPlaneException("Control plane returned " + status + " for " + path + ": "
                    + abbreviate(response.body()), status);
        }
        String responseBody = response.body();
        if (responseBody == null || responseBody.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new ControlPlaneException("Malformed response from " + path + ": " + e.getOriginalMessage(),
                    status, false, e);
        }
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_ERROR_BODY ? body : body.substring(0, MAX_ERROR_BODY) + "...";
    }

    /** Builder for {@link HttpControlPlaneClient}. */
    public static final class Builder {
        private String baseUrl;
        private String apiKey;
        private Duration requestTimeout = Duration.ofSeconds(30);
        private HttpClient httpClient;
        private ObjectMapper mapper;

        private Builder() {
        }

        /**
         * Root of the internal API, e.g. {@code http://backend:8000/internal/v1/}.
         *
         * <p><b>Required.</b>
         */
        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        /**
         * Bearer token for the internal API.
         *
         * <p><b>Required.</b>
         */
        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        /**
         * Optional. Defaults to {@code 30 seconds}. Also used as the connect timeout
         * of the default HTTP client.
         */
        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        /**
         * Optional. Defaults to an HTTP/1.1 client.
         */
        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        /**
         * Optional. Defaults to {@link Jsons#mapper()}.
         */
        public Builder objectMapper(ObjectMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        public HttpControlPlaneClient build() {
            return new HttpControlPlaneClient(this);
        }
    }
}

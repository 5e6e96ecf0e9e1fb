package io.workgate.lock;

import io.workgate.model.ActiveClaim;
import io.workgate.model.ItemKey;
import io.workgate.util.JsonCodec;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lease value format stored in the shared cache.
 */
final class LeaseCodec {
    static final String STATUS_EXECUTING = "EXECUTING";

    private final JsonCodec json;

    LeaseCodec(JsonCodec json) {
        this.json = json;
    }

    String encode(ActiveClaim claim) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("execution_id", claim.executionId());
        fields.put("workflow_id", claim.workflowId());
        fields.put("provider_file_uuid", claim.itemKey().providerIdentity());
        fields.put("file_path", claim.itemKey().path());
        fields.put("status", STATUS_EXECUTING);
        fields.put("created_at", claim.claimedAt().toString());
        fields.put("ttl_seconds", Long.toString(claim.ttl().toSeconds()));
        return json.toJson(fields);
    }

    /**
     * @throws IllegalArgumentException if the value is not a lease written by {@link #encode}
     */
    ActiveClaim decode(String value) {
        Map<String, String> fields = json.parseObject(value);
        String executionId = fields.get("execution_id");
        String workflowId = fields.get("workflow_id");
        String path = fields.get("file_path");
        if (executionId == null || workflowId == null || path == null) {
            throw new IllegalArgumentException("Lease value lacks execution_id, workflow_id or file_path");
        }
        Instant createdAt = fields.containsKey("created_at")
                ? Instant.parse(fields.get("created_at")) : Instant.EPOCH;
        Duration ttl = fields.containsKey("ttl_seconds")
                ? Duration.ofSeconds(Long.parseLong(fields.get("ttl_seconds"))) : Duration.ZERO;
        return new ActiveClaim(workflowId, new ItemKey(fields.get("provider_file_uuid"), path),
                executionId, createdAt, ttl);
    }
}

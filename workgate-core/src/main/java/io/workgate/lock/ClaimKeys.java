package io.workgate.lock;

import io.workgate.model.ItemKey;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Cache key layout for leases: {@code file_active:<workflow>:<identity>:<pathHash12>}.
 *
 * <p>The path hash keeps identical content at different paths on different keys while
 * the identity segment allows prefix deletion of every lease for one identity.
 */
public final class ClaimKeys {
    public static final String PREFIX = "file_active:";
    static final String UNKNOWN_IDENTITY = "unknown";
    private static final int PATH_HASH_LENGTH = 12;

    private ClaimKeys() {
    }

    public static String forItem(String workflowId, ItemKey key) {
        return identityPrefix(workflowId, key.hasProviderIdentity() ? key.providerIdentity() : UNKNOWN_IDENTITY)
                + pathHash(key.path());
    }

    public static String identityPrefix(String workflowId, String providerIdentity) {
        return workflowPrefix(workflowId) + providerIdentity + ":";
    }

    public static String workflowPrefix(String workflowId) {
        return PREFIX + workflowId + ":";
    }

    /**
     * First 12 hex characters of the SHA-256 of the normalized path.
     */
    static String pathHash(String path) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(normalize(path).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, PATH_HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String normalize(String path) {
        String normalized = path.replace('\\', '/').replaceAll("/{2,}", "/");
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}

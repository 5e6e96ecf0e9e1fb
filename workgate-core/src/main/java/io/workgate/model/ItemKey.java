package io.workgate.model;

import java.util.Objects;

/**
 * Identity of a work item: the provider-assigned identity paired with the source path.
 *
 * <p>The same content at two paths yields two distinct keys; the same path seen twice
 * yields equal keys. The provider identity may be {@code null} when the source could not
 * assign one.
 *
 * @param providerIdentity content hash or provider-assigned id, may be {@code null}
 * @param path             source path
 */
public record ItemKey(String providerIdentity, String path) {

    public ItemKey {
        Objects.requireNonNull(path, "path");
    }

    /**
     * Returns {@code identity:path}, the composite form used by the control plane.
     */
    public String composite() {
        return providerIdentity + ":" + path;
    }

    public boolean hasProviderIdentity() {
        return providerIdentity != null && !providerIdentity.isEmpty();
    }
}

package io.workgate.lock;

import io.workgate.model.ItemKey;

import java.util.Set;

/**
 * Result of a read-only active-item check.
 *
 * @param activeKeys        items currently held by a different execution
 * @param cacheHits         active items found through the cache
 * @param controlPlaneHits  active items found through the control plane
 * @param degraded          whether a lookup failed and items were let through unchecked
 */
public record ActiveCheck(Set<ItemKey> activeKeys, int cacheHits, int controlPlaneHits,
        boolean degraded) {

    public ActiveCheck {
        activeKeys = Set.copyOf(activeKeys);
    }

    public boolean isActive(ItemKey key) {
        return activeKeys.contains(key);
    }
}

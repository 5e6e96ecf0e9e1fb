package io.workgate.lock;

import io.workgate.model.ActiveClaim;
import io.workgate.model.ItemKey;
import io.workgate.model.WorkItem;
import io.workgate.spi.CacheClient;
import io.workgate.spi.ControlPlaneClient;
import io.workgate.spi.MetricsExporter;
import io.workgate.util.JsonCodec;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fleet-wide active-item leases kept in the shared cache.
 *
 * <p>Locking is two-phase. Filtering calls {@link #checkActive}, which only reads. Once
 * downstream limits have fixed the final batch, {@link #claim} writes one lease per item,
 * so items that were discovered but later dropped never hold a lease. Leases expire after
 * their TTL, which recovers items held by a crashed worker without any heartbeat.
 * Contention is last-writer-wins.
 *
 * <p>Executions that started before leases existed are only visible in the control
 * plane's durable records, so {@link #checkActive} consults the control plane for every
 * item the cache could not resolve.
 */
public final class ActiveItemLockManager {
    private static final Logger logger = Logger.getLogger(ActiveItemLockManager.class.getName());

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(300);
    public static final Duration MIN_ENV_TTL = Duration.ofSeconds(60);
    public static final Duration MAX_TTL = Duration.ofSeconds(3600);
    public static final String TTL_ENV_VARIABLE = "WORKGATE_ACTIVE_LEASE_TTL_SECONDS";
    static final int DELETE_CHUNK_SIZE = 100;

    private final CacheClient cache;
    private final ControlPlaneClient controlPlane;
    private final Duration ttl;
    private final LeaseCodec codec;
    private final MetricsExporter metrics;
    private final Clock clock;

    private ActiveItemLockManager(Builder builder) {
        this.cache = Objects.requireNonNull(builder.cache, "cache");
        this.controlPlane = builder.controlPlane;
        this.ttl = builder.ttl != null ? builder.ttl : ttlFromEnvironment(System.getenv(TTL_ENV_VARIABLE));
        if (ttl.isZero() || ttl.isNegative() || ttl.compareTo(MAX_TTL) > 0) {
            throw new IllegalArgumentException("ttl must be in (0, " + MAX_TTL + "], got: " + ttl);
        }
        this.codec = new LeaseCodec(builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault());
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves the lease TTL from an environment value: unset or unparsable means the
     * default, anything else is clamped to [60s, 3600s].
     */
    static Duration ttlFromEnvironment(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_TTL;
        }
        try {
            long seconds = Long.parseLong(raw.trim());
            long clamped = Math.max(MIN_ENV_TTL.toSeconds(), Math.min(MAX_TTL.toSeconds(), seconds));
            return Duration.ofSeconds(clamped);
        } catch (NumberFormatException e) {
            logger.log(Level.WARNING, "Ignoring invalid {0}={1}, using {2}s",
                    new Object[]{TTL_ENV_VARIABLE, raw, DEFAULT_TTL.toSeconds()});
            return DEFAULT_TTL;
        }
    }

    public Duration ttl() {
        return ttl;
    }

    /**
     * Finds items held by an execution other than {@code executionId}. Reads the cache
     * for every item first, then asks the control plane only about items without a
     * lease. Lookup failures let the affected items through.
     */
    public ActiveCheck checkActive(List<WorkItem> items, String workflowId, String executionId) {
        Map<String, ItemKey> byCacheKey = new LinkedHashMap<>();
        for (WorkItem item : items) {
            byCacheKey.put(ClaimKeys.forItem(workflowId, item.key()), item.key());
        }
        Set<ItemKey> active = new HashSet<>();
        List<ItemKey> unresolved = new ArrayList<>();
        boolean degraded = false;

        Map<String, String> leases;
        try {
            leases = cache.getAll(byCacheKey.keySet());
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Lease lookup failed for " + byCacheKey.size()
                    + " items, falling back to control plane", e);
            leases = Map.of();
            degraded = true;
        }
        for (Map.Entry<String, ItemKey> entry : byCacheKey.entrySet()) {
            String value = leases.get(entry.getKey());
            if (value == null) {
                unresolved.add(entry.getValue());
                continue;
            }
            try {
                if (!codec.decode(value).isHeldBy(executionId)) {
                    active.add(entry.getValue());
                }
            } catch (RuntimeException e) {
                logger.log(Level.FINE, "Unreadable lease at {0}: {1}", new Object[]{entry.getKey(), e.getMessage()});
                unresolved.add(entry.getValue());
            }
        }
        int cacheHits = active.size();

        int controlPlaneHits = 0;
        if (controlPlane != null && !unresolved.isEmpty()) {
            try {
                Set<String> remoteActive = controlPlane.checkActiveProcessing(workflowId, unresolved, executionId);
                for (ItemKey key : unresolved) {
                    if (remoteActive.contains(key.composite())) {
                        active.add(key);
                        controlPlaneHits++;
                    }
                }
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Active-processing check failed for " + unresolved.size()
                        + " items, treating them as free", e);
                degraded = true;
            }
        }
        if (!active.isEmpty()) {
            logger.log(Level.FINE, "{0} of {1} items active elsewhere (cache {2}, control plane {3})",
                    new Object[]{active.size(), items.size(), cacheHits, controlPlaneHits});
        }
        return new ActiveCheck(active, cacheHits, controlPlaneHits, degraded);
    }

    /**
     * Writes one lease per item of the final batch. Tries a single batched write and
     * falls back to per-item writes if that fails. Never throws on cache errors.
     */
    public ClaimResult claim(List<WorkItem> items, String workflowId, String executionId) {
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(executionId, "executionId");
        Instant now = clock.instant();
        Map<String, WorkItem> byCacheKey = new LinkedHashMap<>();
        Map<String, String> values = new LinkedHashMap<>();
        for (WorkItem item : items) {
            String key = ClaimKeys.forItem(workflowId, item.key());
            if (byCacheKey.putIfAbsent(key, item) == null) {
                values.put(key, codec.encode(new ActiveClaim(workflowId, item.key(), executionId, now, ttl)));
            }
        }
        if (values.isEmpty()) {
            return new ClaimResult(List.of(), List.of(), new ClaimResult.ClaimStats(0, 0, 0));
        }

        List<WorkItem> claimed = new ArrayList<>();
        List<WorkItem> unleased = new ArrayList<>();
        try {
            cache.setAll(values, ttl);
            claimed.addAll(byCacheKey.values());
        } catch (RuntimeException batchError) {
            logger.log(Level.WARNING, "Batched lease write failed, writing " + values.size()
                    + " leases individually", batchError);
            for (Map.Entry<String, String> entry : values.entrySet()) {
                WorkItem item = byCacheKey.get(entry.getKey());
                try {
                    cache.set(entry.getKey(), entry.getValue(), ttl);
                    claimed.add(item);
                } catch (RuntimeException e) {
                    logger.log(Level.WARNING, "Lease write failed for " + item.sourcePath(), e);
                    unleased.add(item);
                }
            }
        }
        metrics.recordClaims(claimed.size(), unleased.size());
        logger.log(Level.FINE, "Claimed {0}/{1} items for execution {2}",
                new Object[]{claimed.size(), values.size(), executionId});
        return new ClaimResult(claimed, unleased,
                new ClaimResult.ClaimStats(values.size(), claimed.size(), unleased.size()));
    }

    /**
     * Deletes every lease of the given provider identities in a workflow by prefix.
     * Best effort: failures are logged and TTL expiry remains the safety net.
     *
     * @return number of leases deleted
     */
    public int release(Collection<String> providerIdentities, String workflowId) {
        int released = 0;
        for (String identity : providerIdentities) {
            String prefix = ClaimKeys.identityPrefix(workflowId,
                    identity == null || identity.isEmpty() ? ClaimKeys.UNKNOWN_IDENTITY : identity);
            try {
                released += deleteInChunks(cache.keysWithPrefix(prefix));
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Lease release failed for prefix " + prefix, e);
            }
        }
        metrics.recordLeasesReleased(released);
        return released;
    }

    /**
     * Deletes the leases of specific items. Best effort, like {@link #release}.
     *
     * @return number of leases deleted
     */
    public int releaseItems(Collection<WorkItem> items, String workflowId) {
        List<String> keys = new ArrayList<>(items.size());
        for (WorkItem item : items) {
            keys.add(ClaimKeys.forItem(workflowId, item.key()));
        }
        int released = 0;
        try {
            released = deleteInChunks(keys);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Lease release failed for " + keys.size() + " items", e);
        }
        metrics.recordLeasesReleased(released);
        return released;
    }

    /**
     * Reads the live lease on an item, if any.
     */
    public Optional<ActiveClaim> currentClaim(WorkItem item, String workflowId) {
        String value = cache.get(ClaimKeys.forItem(workflowId, item.key()));
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(codec.decode(value));
        } catch (RuntimeException e) {
            logger.log(Level.FINE, "Unreadable lease for {0}", item.sourcePath());
            return Optional.empty();
        }
    }

    private int deleteInChunks(List<String> keys) {
        int deleted = 0;
        for (int from = 0; from < keys.size(); from += DELETE_CHUNK_SIZE) {
            deleted += cache.deleteAll(keys.subList(from, Math.min(keys.size(), from + DELETE_CHUNK_SIZE)));
        }
        return deleted;
    }

    /** Builder for {@link ActiveItemLockManager}. */
    public static final class Builder {
        private CacheClient cache;
        private ControlPlaneClient controlPlane;
        private Duration ttl;
        private JsonCodec jsonCodec;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        /**
         * Shared cache holding the leases. <b>Required.</b>
         */
        public Builder cache(CacheClient cache) {
            this.cache = cache;
            return this;
        }

        /**
         * Control plane consulted for items without a lease. Optional; without it only
         * the cache is checked.
         */
        public Builder controlPlane(ControlPlaneClient controlPlane) {
            this.controlPlane = controlPlane;
            return this;
        }

        /**
         * Lease TTL. Optional; defaults to {@code WORKGATE_ACTIVE_LEASE_TTL_SECONDS}
         * clamped to [60s, 3600s], or 300s when unset.
         */
        public Builder ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ActiveItemLockManager build() {
            return new ActiveItemLockManager(this);
        }
    }
}

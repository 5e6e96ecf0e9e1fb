package io.workgate.discovery;

import io.workgate.filter.FilterContext;
import io.workgate.filter.FilterPipeline;
import io.workgate.model.WorkItem;
import io.workgate.spi.ItemSource;
import io.workgate.spi.MetricsExporter;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Walks an {@link ItemSource} incrementally and filters as it goes.
 *
 * <p>Directories are listed breadth-first, one listing at a time. Entries whose base name
 * matches are buffered into micro-batches; every full micro-batch is run through the
 * {@link FilterPipeline} and its survivors appended to the result. The walk stops, even
 * in the middle of a directory, as soon as {@code hardLimit} survivors exist, so huge
 * trees are never enumerated or filtered exhaustively. Overshoot from the last
 * micro-batch is cut by discovery order.
 *
 * <p>A directory that cannot be listed is logged and skipped. Any other failure ends the
 * walk and returns what was collected so far.
 */
public final class StreamingDiscovery {
    private static final Logger logger = Logger.getLogger(StreamingDiscovery.class.getName());

    private final ItemSource source;
    private final MetricsExporter metrics;

    public StreamingDiscovery(ItemSource source) {
        this(source, MetricsExporter.NOOP);
    }

    public StreamingDiscovery(ItemSource source, MetricsExporter metrics) {
        this.source = Objects.requireNonNull(source, "source");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public DiscoveryResult discover(DiscoveryRequest request, FilterPipeline pipeline, FilterContext context) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(pipeline, "pipeline");
        Objects.requireNonNull(context, "context");
        Walk walk = new Walk(request, pipeline, context);
        Throwable error = null;
        try {
            walk.run();
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Discovery aborted after " + walk.survivors.size()
                    + " survivors, returning partial results", e);
            error = e;
        }
        List<WorkItem> items = walk.survivors.size() > request.hardLimit()
                ? walk.survivors.subList(0, request.hardLimit())
                : walk.survivors;
        DiscoveryStats stats = walk.stats();
        metrics.recordDiscovery(stats.itemsMatched(), items.size());
        logger.log(Level.FINE, "Discovery finished: {0}", stats);
        return new DiscoveryResult(items, stats, error);
    }

    private final class Walk {
        private final DiscoveryRequest request;
        private final FilterPipeline pipeline;
        private final FilterContext context;
        private final NamePattern pattern;
        private final List<WorkItem> buffer = new ArrayList<>();
        private final List<WorkItem> survivors = new ArrayList<>();

        private long sequence;
        private int directoriesListed;
        private int directoriesFailed;
        private int itemsDiscovered;
        private int itemsMatched;
        private int batchesFiltered;
        private int itemsFilteredOut;

        Walk(DiscoveryRequest request, FilterPipeline pipeline, FilterContext context) {
            this.request = request;
            this.pipeline = pipeline;
            this.context = context;
            this.pattern = NamePattern.of(request.patterns());
        }

        void run() {
            for (String root : request.roots()) {
                if (limitReached() || walkRoot(root)) {
                    return;
                }
            }
            flushBuffer();
        }

        /**
         * @return {@code true} if the limit was reached inside this root
         */
        private boolean walkRoot(String root) {
            Deque<String> pending = new ArrayDeque<>();
            pending.add(root);
            while (!pending.isEmpty()) {
                String dir = pending.poll();
                List<ItemSource.SourceEntry> entries;
                try {
                    entries = source.listDirectory(dir);
                    directoriesListed++;
                } catch (IOException | RuntimeException e) {
                    directoriesFailed++;
                    logger.log(Level.WARNING, "Skipping unreadable directory " + dir, e);
                    continue;
                }
                for (ItemSource.SourceEntry entry : entries) {
                    if (entry.directory()) {
                        if (request.recursive()) {
                            pending.add(entry.path());
                        }
                        continue;
                    }
                    itemsDiscovered++;
                    if (!pattern.matches(entry.name())) {
                        continue;
                    }
                    itemsMatched++;
                    buffer.add(new WorkItem(entry.path(), entry.providerIdentity(), entry.size(),
                            entry.mimeType(), sequence++, null));
                    if (buffer.size() >= request.microBatchSize() && flushBuffer()) {
                        return true;
                    }
                }
            }
            return false;
        }

        /**
         * Filters the buffered micro-batch.
         *
         * @return {@code true} if the limit is now reached
         */
        private boolean flushBuffer() {
            if (buffer.isEmpty()) {
                return limitReached();
            }
            List<WorkItem> batch = List.copyOf(buffer);
            buffer.clear();
            batchesFiltered++;
            List<WorkItem> passed = pipeline.apply(batch, context);
            itemsFilteredOut += batch.size() - passed.size();
            survivors.addAll(passed);
            return limitReached();
        }

        private boolean limitReached() {
            return survivors.size() >= request.hardLimit();
        }

        DiscoveryStats stats() {
            return new DiscoveryStats(directoriesListed, directoriesFailed, itemsDiscovered, itemsMatched,
                    batchesFiltered, itemsFilteredOut, limitReached());
        }
    }
}

package org.unicitylabs.hydrator.hydration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.unicitylabs.hydrator.config.ConfigurationException;
import org.unicitylabs.hydrator.projection.EventProjector;
import org.unicitylabs.hydrator.projection.InvalidEventException;
import org.unicitylabs.hydrator.projection.ProjectionResult;
import org.unicitylabs.hydrator.projection.RecordMappers;
import org.unicitylabs.hydrator.protocol.Event;
import org.unicitylabs.hydrator.protocol.Filter;
import org.unicitylabs.hydrator.query.FanOutQuery;
import org.unicitylabs.hydrator.query.QueryResult;
import org.unicitylabs.hydrator.store.RecordStore;

import java.util.List;

/**
 * One-shot hydration: fan-out query, then project every event, flushing the store in
 * fixed-size batches.
 */
public class BackfillJob {

    private static final Logger logger = LoggerFactory.getLogger(BackfillJob.class);

    private final FanOutQuery query;
    private final RecordStore store;
    private final RecordMappers mappers;

    private long perRelayTimeoutMs = FanOutQuery.DEFAULT_PER_RELAY_TIMEOUT_MS;
    private long overallTimeoutMs = FanOutQuery.DEFAULT_OVERALL_TIMEOUT_MS;
    private int batchSize = 50;

    public BackfillJob(FanOutQuery query, RecordStore store) {
        this(query, store, RecordMappers.defaults());
    }

    public BackfillJob(FanOutQuery query, RecordStore store, RecordMappers mappers) {
        this.query = query;
        this.store = store;
        this.mappers = mappers;
    }

    public void setPerRelayTimeoutMs(long perRelayTimeoutMs) {
        this.perRelayTimeoutMs = perRelayTimeoutMs;
    }

    public void setOverallTimeoutMs(long overallTimeoutMs) {
        this.overallTimeoutMs = overallTimeoutMs;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    /**
     * Hydrate events matching the filter from the given relays.
     *
     * @throws ConfigurationException if no relay is given
     */
    public HydrationSummary run(List<String> relays, Filter filter) {
        if (relays == null || relays.isEmpty()) {
            throw new ConfigurationException("No relay configured for backfill");
        }
        long start = System.currentTimeMillis();
        logger.info("Backfilling from {} relay(s) with filter {}", relays.size(), filter);

        QueryResult result = query.execute(relays, filter, perRelayTimeoutMs, overallTimeoutMs);

        EventProjector projector = new EventProjector(store, mappers);
        projector.setAutoFlush(false);
        if (filter.getKinds() != null) {
            projector.setAllowedKinds(filter.getKinds());
        }

        int staged = 0;
        int saved = 0;
        int skipped = 0;
        int errors = 0;

        for (Event event : result.getEvents()) {
            try {
                ProjectionResult projection = projector.projectWithResult(event, result.getSourceRelay(event.getId()));
                if (projection.isCreated()) {
                    staged++;
                } else {
                    skipped++;
                }
            } catch (InvalidEventException e) {
                errors++;
                logger.warn("Could not project event {}: {}", event.getShortId(), e.getMessage());
            } catch (RuntimeException e) {
                errors++;
                logger.error("Failed to project event {}", event.getShortId(), e);
            }

            if (staged >= batchSize) {
                int[] counts = flush(staged);
                saved += counts[0];
                skipped += counts[1];
                errors += counts[2];
                staged = 0;
            }
        }
        if (staged > 0) {
            int[] counts = flush(staged);
            saved += counts[0];
            skipped += counts[1];
            errors += counts[2];
        }

        HydrationSummary summary = new HydrationSummary(result.getLegOutcomes().size(),
                result.getReachableRelayCount(), result.getEvents().size(), saved, skipped, errors,
                result.getRejectedCount(), System.currentTimeMillis() - start);
        logger.info("Backfill complete: {}", summary);
        return summary;
    }

    /**
     * @return {saved, skipped, errors}
     */
    private int[] flush(int staged) {
        long failedBefore = store.failedCount();
        try {
            int inserted = store.flush();
            int failed = (int) (store.failedCount() - failedBefore);
            logger.info("Persisted batch of {} record(s), {} refused", inserted, failed);
            return new int[] {inserted, staged - inserted - failed, failed};
        } catch (RuntimeException e) {
            logger.error("Failed to flush batch of {} record(s)", staged, e);
            return new int[] {0, 0, staged};
        }
    }
}

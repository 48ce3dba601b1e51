package org.unicitylabs.hydrator.projection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.unicitylabs.hydrator.projection.record.DomainRecord;
import org.unicitylabs.hydrator.protocol.Event;
import org.unicitylabs.hydrator.protocol.EventKinds;
import org.unicitylabs.hydrator.protocol.EventVerifier;
import org.unicitylabs.hydrator.store.RecordStore;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns raw events into stored records. The only writer of records.
 *
 * Projection is idempotent on event id: an id that is already stored (or staged in the
 * current batch) returns the existing record and writes nothing. Batching is the caller's
 * choice: with auto-flush off, call {@link RecordStore#flush()} every N events.
 */
public class EventProjector {

    private static final Logger logger = LoggerFactory.getLogger(EventProjector.class);

    private final RecordStore store;
    private final RecordMappers mappers;
    private volatile Set<Integer> allowedKinds = Collections.emptySet();
    private volatile boolean autoFlush = true;

    private final AtomicLong createdCount = new AtomicLong();
    private final AtomicLong duplicateCount = new AtomicLong();
    private final AtomicLong invalidCount = new AtomicLong();

    public EventProjector(RecordStore store) {
        this(store, RecordMappers.defaults());
    }

    public EventProjector(RecordStore store, RecordMappers mappers) {
        this.store = store;
        this.mappers = mappers;
    }

    /**
     * Restrict projection to these kinds. An empty collection accepts every kind.
     */
    public void setAllowedKinds(Collection<Integer> kinds) {
        this.allowedKinds = kinds == null ? Collections.emptySet() : Collections.unmodifiableSet(new HashSet<>(kinds));
    }

    /**
     * Flush the store after every new record (default: true).
     */
    public void setAutoFlush(boolean autoFlush) {
        this.autoFlush = autoFlush;
    }

    /**
     * Project one event.
     *
     * @param event Raw event as received
     * @param sourceRelayUrl Relay it came from, may be null
     * @return the stored record, new or pre-existing
     * @throws InvalidEventException if a required field is missing or the kind is not accepted
     * @throws EventVerificationException if the id or signature does not match
     */
    public DomainRecord project(Event event, String sourceRelayUrl) {
        return projectWithResult(event, sourceRelayUrl).getRecord();
    }

    /**
     * Project one event and report whether a new record was created.
     */
    public ProjectionResult projectWithResult(Event event, String sourceRelayUrl) {
        validate(event);

        EventVerifier.Outcome outcome = EventVerifier.check(event);
        if (!outcome.isValid()) {
            invalidCount.incrementAndGet();
            throw new EventVerificationException(event.getId(), outcome);
        }

        DomainRecord existing = store.findById(event.getId());
        if (existing != null) {
            duplicateCount.incrementAndGet();
            logger.debug("Event {} already projected, skipping", event.getShortId());
            return new ProjectionResult(existing, false);
        }

        DomainRecord record;
        try {
            record = mappers.map(event, sourceRelayUrl);
        } catch (InvalidEventException e) {
            invalidCount.incrementAndGet();
            throw e;
        }

        if (!store.save(record)) {
            // Another thread staged the same id first
            duplicateCount.incrementAndGet();
            return new ProjectionResult(store.findById(event.getId()), false);
        }

        long failedBefore = store.failedCount();
        if (autoFlush && store.flush() == 0) {
            // Lost an insert race to another projector; the stored row wins
            DomainRecord stored = store.findById(event.getId());
            if (stored != null) {
                duplicateCount.incrementAndGet();
                return new ProjectionResult(stored, false);
            }
            if (store.failedCount() > failedBefore) {
                throw new IllegalStateException("Store refused event " + event.getShortId());
            }
        }

        createdCount.incrementAndGet();
        logger.debug("Projected {} {} from {}", EventKinds.getName(event.getKind()), event.getShortId(),
                sourceRelayUrl != null ? sourceRelayUrl : "unknown relay");
        return new ProjectionResult(record, true);
    }

    private void validate(Event event) {
        if (event == null) {
            throw new InvalidEventException(null, "Event is null");
        }
        if (event.getId() == null || event.getId().isEmpty()) {
            invalidCount.incrementAndGet();
            throw new InvalidEventException(null, "Event has no id");
        }
        if (event.getPubkey() == null || event.getPubkey().isEmpty()) {
            invalidCount.incrementAndGet();
            throw new InvalidEventException(event.getId(), "Event has no pubkey");
        }
        if (!event.hasKind()) {
            invalidCount.incrementAndGet();
            throw new InvalidEventException(event.getId(), "Event has no kind");
        }
        Set<Integer> allowed = allowedKinds;
        if (!allowed.isEmpty() && !allowed.contains(event.getKind())) {
            invalidCount.incrementAndGet();
            throw new InvalidEventException(event.getId(), "Kind " + event.getKind() + " is not accepted");
        }
    }

    public long getCreatedCount() { return createdCount.get(); }
    public long getDuplicateCount() { return duplicateCount.get(); }
    public long getInvalidCount() { return invalidCount.get(); }
}

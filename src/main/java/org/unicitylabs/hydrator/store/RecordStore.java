package org.unicitylabs.hydrator.store;

import org.unicitylabs.hydrator.projection.record.DomainRecord;

/**
 * Persistence for projected records, keyed by event id.
 *
 * Writes are staged with {@link #save} and written by {@link #flush}. The backing
 * store's uniqueness on event id is the final arbiter: a flush silently skips ids that
 * are already stored.
 */
public interface RecordStore {

    /**
     * Find a stored or staged record.
     *
     * @return the record, or null if unknown
     */
    DomainRecord findById(String eventId);

    /**
     * Stage a record for the next flush.
     *
     * @return false if a record with the same id is already staged
     */
    boolean save(DomainRecord record);

    /**
     * Write staged records. A record the backing store refuses is logged and counted in
     * {@link #failedCount()}; the rest of the batch is still written.
     *
     * @return number of records actually inserted
     */
    int flush();

    /**
     * Records that could not be written by any flush so far.
     */
    long failedCount();

    /**
     * Records staged and not yet flushed.
     */
    int pendingCount();

    /**
     * Number of stored records.
     */
    long count();
}

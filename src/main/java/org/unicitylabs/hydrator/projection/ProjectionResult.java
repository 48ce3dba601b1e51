package org.unicitylabs.hydrator.projection;

import org.unicitylabs.hydrator.projection.record.DomainRecord;

/**
 * A projected record and whether this call created it.
 */
public class ProjectionResult {

    private final DomainRecord record;
    private final boolean created;

    public ProjectionResult(DomainRecord record, boolean created) {
        this.record = record;
        this.created = created;
    }

    public DomainRecord getRecord() { return record; }

    /** False when the id was already stored or staged and the existing record was returned. */
    public boolean isCreated() { return created; }
}

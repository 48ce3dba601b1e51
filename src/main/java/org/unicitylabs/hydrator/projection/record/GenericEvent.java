package org.unicitylabs.hydrator.projection.record;

import org.unicitylabs.hydrator.projection.tag.Tags;
import org.unicitylabs.hydrator.protocol.Event;

/**
 * Any kind without a dedicated mapping, zap receipts included.
 */
public class GenericEvent extends DomainRecord {

    private final Tags tags;

    public GenericEvent(Event event, String sourceRelayUrl, Tags tags) {
        super(event, sourceRelayUrl);
        this.tags = tags;
    }

    @Override
    public RecordType getType() {
        return RecordType.GENERIC;
    }

    public Tags getTags() {
        return tags;
    }

    /** Value of the "d" tag for addressable kinds, else null. */
    @Override
    public String getSlug() {
        return tags.value("d");
    }
}

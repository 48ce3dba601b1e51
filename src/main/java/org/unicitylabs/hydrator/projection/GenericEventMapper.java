package org.unicitylabs.hydrator.projection;

import org.unicitylabs.hydrator.projection.record.DomainRecord;
import org.unicitylabs.hydrator.projection.record.GenericEvent;
import org.unicitylabs.hydrator.projection.tag.Tags;
import org.unicitylabs.hydrator.protocol.Event;

/**
 * Fallback for every kind without a dedicated mapper.
 */
public class GenericEventMapper implements RecordMapper {

    @Override
    public DomainRecord map(Event event, Tags tags, String sourceRelayUrl) {
        return new GenericEvent(event, sourceRelayUrl, tags);
    }
}

package org.unicitylabs.hydrator.projection;

import org.unicitylabs.hydrator.projection.record.DomainRecord;
import org.unicitylabs.hydrator.projection.tag.Tags;
import org.unicitylabs.hydrator.protocol.Event;

/**
 * Pure mapping from an event's tags and content to a typed record. Mappers never touch
 * persistence and never verify; the projector does both.
 */
public interface RecordMapper {

    /**
     * @param event Verified event
     * @param tags The event's tags, parsed
     * @param sourceRelayUrl Relay the event came from, may be null
     * @throws InvalidEventException if the event lacks a tag its kind requires
     */
    DomainRecord map(Event event, Tags tags, String sourceRelayUrl);
}

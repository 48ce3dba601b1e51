package org.unicitylabs.hydrator.projection;

import org.unicitylabs.hydrator.projection.record.DomainRecord;
import org.unicitylabs.hydrator.projection.record.Highlight;
import org.unicitylabs.hydrator.projection.tag.Tags;
import org.unicitylabs.hydrator.protocol.Event;

/**
 * Kind 9802.
 */
public class HighlightMapper implements RecordMapper {

    @Override
    public DomainRecord map(Event event, Tags tags, String sourceRelayUrl) {
        return new Highlight(event, sourceRelayUrl,
                tags.value("a"),
                tags.value("e"),
                tags.value("r"),
                tags.value("context"));
    }
}

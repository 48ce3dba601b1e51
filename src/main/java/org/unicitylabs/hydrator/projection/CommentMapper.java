package org.unicitylabs.hydrator.projection;

import org.unicitylabs.hydrator.projection.record.Comment;
import org.unicitylabs.hydrator.projection.record.DomainRecord;
import org.unicitylabs.hydrator.projection.tag.Tags;
import org.unicitylabs.hydrator.protocol.Event;

/**
 * Kind 1111. Root scope comes from E/A/I, K and P; parent scope from e/a/i, k and p.
 * An addressable reference wins over an event id when both are present.
 */
public class CommentMapper implements RecordMapper {

    @Override
    public DomainRecord map(Event event, Tags tags, String sourceRelayUrl) {
        String root = reference(tags, "A", "E", "I");
        String parent = reference(tags, "a", "e", "i");
        if (root == null && parent == null) {
            throw new InvalidEventException(event.getId(), "Comment has no root or parent reference");
        }
        return new Comment(event, sourceRelayUrl,
                root, tags.value("K"), tags.value("P"),
                parent, tags.value("k"), tags.value("p"));
    }

    private static String reference(Tags tags, String... names) {
        for (String name : names) {
            String value = tags.value(name);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}

package org.unicitylabs.hydrator.projection.tag;

import java.util.List;

/**
 * "e" / "E": ["e", event-id, relay-hint, marker-or-pubkey].
 */
public final class EventReferenceTag extends ReferenceTag {

    EventReferenceTag(List<String> raw) {
        super(raw);
    }

    public String getEventId() {
        return getValue();
    }

    /** Fourth element: a NIP-10 marker or, in NIP-22 comments, the author pubkey. */
    public String getMarkerOrPubkey() {
        return element(3);
    }
}

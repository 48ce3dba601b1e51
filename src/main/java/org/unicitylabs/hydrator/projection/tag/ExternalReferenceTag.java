package org.unicitylabs.hydrator.projection.tag;

import java.util.List;

/**
 * "i" / "I": external content id such as a URL or ISBN.
 */
public final class ExternalReferenceTag extends ReferenceTag {

    ExternalReferenceTag(List<String> raw) {
        super(raw);
    }

    public String getExternalId() {
        return getValue();
    }
}

package org.unicitylabs.hydrator.projection.tag;

import java.util.List;

/**
 * "p" / "P": a referenced author.
 */
public final class PubkeyReferenceTag extends ReferenceTag {

    PubkeyReferenceTag(List<String> raw) {
        super(raw);
    }

    public String getPubkey() {
        return getValue();
    }
}

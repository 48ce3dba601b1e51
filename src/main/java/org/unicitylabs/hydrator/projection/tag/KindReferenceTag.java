package org.unicitylabs.hydrator.projection.tag;

import java.util.List;

/**
 * "k" / "K": kind of the referenced parent or root. External roots use a string such as "web".
 */
public final class KindReferenceTag extends ReferenceTag {

    KindReferenceTag(List<String> raw) {
        super(raw);
    }

    public String getReferencedKind() {
        return getValue();
    }
}

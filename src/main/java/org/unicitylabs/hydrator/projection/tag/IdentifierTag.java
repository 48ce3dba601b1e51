package org.unicitylabs.hydrator.projection.tag;

import java.util.List;

/**
 * The "d" tag identifying a parameterized replaceable event (the article slug).
 */
public final class IdentifierTag extends Tag {

    IdentifierTag(List<String> raw) {
        super(raw);
    }

    /** Identifier, "" when the tag carries no value. */
    public String getIdentifier() {
        String value = getValue();
        return value != null ? value : "";
    }
}

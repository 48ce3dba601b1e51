package org.unicitylabs.hydrator.projection.tag;

import java.util.List;

/**
 * NIP-32 "L" label namespace.
 */
public final class LabelNamespaceTag extends Tag {

    LabelNamespaceTag(List<String> raw) {
        super(raw);
    }

    public String getNamespace() {
        return getValue();
    }
}

package org.unicitylabs.hydrator.projection.tag;

import java.util.List;

/**
 * NIP-36 "content-warning", with an optional reason.
 */
public final class ContentWarningTag extends Tag {

    ContentWarningTag(List<String> raw) {
        super(raw);
    }

    public String getReason() {
        return getValue();
    }
}

package org.unicitylabs.hydrator.projection.tag;

import java.util.List;

/**
 * Single-valued metadata tag such as title, summary, image, url, m or published_at.
 */
public final class ValueTag extends Tag {

    ValueTag(List<String> raw) {
        super(raw);
    }
}

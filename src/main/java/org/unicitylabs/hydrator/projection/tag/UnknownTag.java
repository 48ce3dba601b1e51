package org.unicitylabs.hydrator.projection.tag;

import java.util.List;

/**
 * Any tag without a typed variant. Carried through opaquely.
 */
public final class UnknownTag extends Tag {

    UnknownTag(List<String> raw) {
        super(raw);
    }
}

package org.unicitylabs.hydrator.projection.tag;

import java.util.List;

/**
 * A reference to another event, address, external id or author.
 * Uppercase names (E, A, I, K, P) point at the root of a thread; lowercase at the parent.
 */
public abstract class ReferenceTag extends Tag {

    protected ReferenceTag(List<String> raw) {
        super(raw);
    }

    public boolean isRootScope() {
        return Character.isUpperCase(getName().charAt(0));
    }

    /** Relay hint, third array element. */
    public String getRelayHint() {
        return element(2);
    }
}

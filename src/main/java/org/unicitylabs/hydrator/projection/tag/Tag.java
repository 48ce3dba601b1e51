package org.unicitylabs.hydrator.projection.tag;

import java.util.Collections;
import java.util.List;

/**
 * One event tag, parsed into a typed variant by {@link TagParser}.
 * The raw string array is always kept so unknown or partially understood tags survive
 * a round trip unchanged.
 */
public abstract class Tag {

    protected final List<String> raw;

    protected Tag(List<String> raw) {
        this.raw = Collections.unmodifiableList(raw);
    }

    /** Tag name, the first array element. */
    public String getName() {
        return raw.get(0);
    }

    /** Second array element, or null if absent. */
    public String getValue() {
        return element(1);
    }

    public List<String> getRaw() {
        return raw;
    }

    protected String element(int index) {
        if (index >= raw.size()) {
            return null;
        }
        String value = raw.get(index);
        return value == null || value.isEmpty() ? null : value;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + raw;
    }
}

package org.unicitylabs.hydrator.projection.tag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, typed view over an event's tags.
 */
public final class Tags {

    private final List<Tag> tags;

    Tags(List<Tag> tags) {
        this.tags = Collections.unmodifiableList(tags);
    }

    public List<Tag> all() {
        return tags;
    }

    /**
     * First tag with this exact name, or null.
     */
    public Tag first(String name) {
        for (Tag tag : tags) {
            if (tag.getName().equals(name)) {
                return tag;
            }
        }
        return null;
    }

    /**
     * First tag with this exact name and variant, or null.
     */
    public <T extends Tag> T first(String name, Class<T> type) {
        for (Tag tag : tags) {
            if (tag.getName().equals(name) && type.isInstance(tag)) {
                return type.cast(tag);
            }
        }
        return null;
    }

    /**
     * Value of the first tag with this name, or null when absent or empty.
     */
    public String value(String name) {
        Tag tag = first(name);
        return tag != null ? tag.getValue() : null;
    }

    public <T extends Tag> List<T> ofType(Class<T> type) {
        List<T> matches = new ArrayList<>();
        for (Tag tag : tags) {
            if (type.isInstance(tag)) {
                matches.add(type.cast(tag));
            }
        }
        return matches;
    }

    public boolean has(String name) {
        return first(name) != null;
    }

    public int size() {
        return tags.size();
    }
}

package org.unicitylabs.hydrator.projection.tag;

import java.util.List;
import java.util.Locale;

/**
 * A "t" hashtag.
 */
public final class TopicTag extends Tag {

    TopicTag(List<String> raw) {
        super(raw);
    }

    /** Lowercased topic without a leading '#'. */
    public String getTopic() {
        String value = getValue();
        if (value == null) {
            return null;
        }
        String topic = value.startsWith("#") ? value.substring(1) : value;
        return topic.trim().toLowerCase(Locale.ROOT);
    }
}

package org.unicitylabs.hydrator.projection;

import org.unicitylabs.hydrator.projection.record.Article;
import org.unicitylabs.hydrator.projection.record.DomainRecord;
import org.unicitylabs.hydrator.projection.tag.IdentifierTag;
import org.unicitylabs.hydrator.projection.tag.Tags;
import org.unicitylabs.hydrator.projection.tag.TopicTag;
import org.unicitylabs.hydrator.protocol.Event;

import java.util.ArrayList;
import java.util.List;

/**
 * Kinds 30023 and 30024.
 */
public class ArticleMapper implements RecordMapper {

    @Override
    public DomainRecord map(Event event, Tags tags, String sourceRelayUrl) {
        IdentifierTag identifier = tags.first("d", IdentifierTag.class);
        String slug = identifier != null ? identifier.getIdentifier() : "";

        List<String> topics = new ArrayList<>();
        for (TopicTag topic : tags.ofType(TopicTag.class)) {
            String value = topic.getTopic();
            if (value != null && !value.isEmpty() && !topics.contains(value)) {
                topics.add(value);
            }
        }

        return new Article(event, sourceRelayUrl, slug,
                tags.value("title"),
                tags.value("summary"),
                tags.value("image"),
                parseTimestamp(tags.value("published_at")),
                topics);
    }

    static Long parseTimestamp(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

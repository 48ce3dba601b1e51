package org.unicitylabs.hydrator.projection.record;

import org.unicitylabs.hydrator.protocol.Event;
import org.unicitylabs.hydrator.protocol.EventKinds;

import java.util.Collections;
import java.util.List;

/**
 * Long-form article (kind 30023) or draft (kind 30024).
 */
public class Article extends DomainRecord {

    private final String slug;
    private final String title;
    private final String summary;
    private final String image;
    private final Long publishedAt;
    private final List<String> topics;

    public Article(Event event, String sourceRelayUrl, String slug, String title, String summary,
                   String image, Long publishedAt, List<String> topics) {
        super(event, sourceRelayUrl);
        this.slug = slug;
        this.title = title;
        this.summary = summary;
        this.image = image;
        this.publishedAt = publishedAt;
        this.topics = Collections.unmodifiableList(topics);
    }

    @Override
    public RecordType getType() {
        return RecordType.ARTICLE;
    }

    @Override
    public String getSlug() { return slug; }
    public String getTitle() { return title; }
    public String getSummary() { return summary; }
    public String getImage() { return image; }
    /** Unix seconds from the published_at tag, null if absent or unparseable. */
    public Long getPublishedAt() { return publishedAt; }
    public List<String> getTopics() { return topics; }

    public boolean isDraft() {
        return getKind() == EventKinds.LONG_FORM_DRAFT;
    }

    /**
     * "kind:pubkey:slug", the address replaceable versions share.
     */
    @Override
    public String getCoordinate() {
        return getKind() + ":" + getPubkey() + ":" + slug;
    }
}

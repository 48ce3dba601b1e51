package org.unicitylabs.hydrator.projection.record;

import org.unicitylabs.hydrator.protocol.Event;

/**
 * NIP-84 highlight (kind 9802). The highlighted text is the event content.
 */
public class Highlight extends DomainRecord {

    private final String articleCoordinate;
    private final String highlightedEventId;
    private final String sourceUrl;
    private final String context;

    public Highlight(Event event, String sourceRelayUrl, String articleCoordinate,
                     String highlightedEventId, String sourceUrl, String context) {
        super(event, sourceRelayUrl);
        this.articleCoordinate = articleCoordinate;
        this.highlightedEventId = highlightedEventId;
        this.sourceUrl = sourceUrl;
        this.context = context;
    }

    @Override
    public RecordType getType() {
        return RecordType.HIGHLIGHT;
    }

    public String getArticleCoordinate() { return articleCoordinate; }
    public String getHighlightedEventId() { return highlightedEventId; }
    public String getSourceUrl() { return sourceUrl; }
    public String getContext() { return context; }

    @Override
    public String getCoordinate() {
        return articleCoordinate;
    }

    @Override
    public String getParentReference() {
        if (articleCoordinate != null) {
            return articleCoordinate;
        }
        return highlightedEventId != null ? highlightedEventId : sourceUrl;
    }
}

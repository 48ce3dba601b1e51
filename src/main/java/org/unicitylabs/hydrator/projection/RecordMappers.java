package org.unicitylabs.hydrator.projection;

import org.unicitylabs.hydrator.projection.record.DomainRecord;
import org.unicitylabs.hydrator.projection.tag.TagParser;
import org.unicitylabs.hydrator.protocol.Event;
import org.unicitylabs.hydrator.protocol.EventKinds;

import java.util.HashMap;
import java.util.Map;

/**
 * Kind to mapper registry. Kinds without an entry map to {@link GenericEventMapper}.
 */
public class RecordMappers {

    private final Map<Integer, RecordMapper> mappers = new HashMap<>();
    private final RecordMapper fallback = new GenericEventMapper();

    /**
     * Registry with the built-in article, comment, highlight and media mappings.
     */
    public static RecordMappers defaults() {
        RecordMappers registry = new RecordMappers();
        ArticleMapper articles = new ArticleMapper();
        registry.register(EventKinds.LONG_FORM, articles);
        registry.register(EventKinds.LONG_FORM_DRAFT, articles);
        registry.register(EventKinds.COMMENT, new CommentMapper());
        registry.register(EventKinds.HIGHLIGHT, new HighlightMapper());
        MediaMapper media = new MediaMapper();
        registry.register(EventKinds.PICTURE, media);
        registry.register(EventKinds.VIDEO, media);
        registry.register(EventKinds.SHORT_VIDEO, media);
        return registry;
    }

    public RecordMappers register(int kind, RecordMapper mapper) {
        mappers.put(kind, mapper);
        return this;
    }

    public RecordMapper forKind(int kind) {
        return mappers.getOrDefault(kind, fallback);
    }

    /**
     * Map a verified event with the mapper registered for its kind.
     */
    public DomainRecord map(Event event, String sourceRelayUrl) {
        return forKind(event.getKind()).map(event, TagParser.parseAll(event.getTags()), sourceRelayUrl);
    }
}

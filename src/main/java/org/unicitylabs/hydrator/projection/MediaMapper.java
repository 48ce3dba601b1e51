package org.unicitylabs.hydrator.projection;

import org.unicitylabs.hydrator.projection.record.DomainRecord;
import org.unicitylabs.hydrator.projection.record.Media;
import org.unicitylabs.hydrator.projection.tag.ImetaTag;
import org.unicitylabs.hydrator.projection.tag.LabelNamespaceTag;
import org.unicitylabs.hydrator.projection.tag.Tags;
import org.unicitylabs.hydrator.projection.tag.TopicTag;
import org.unicitylabs.hydrator.protocol.Event;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Kinds 20, 21 and 22.
 */
public class MediaMapper implements RecordMapper {

    private static final Set<String> NSFW_HASHTAGS = new HashSet<>(Arrays.asList(
        "nsfw", "adult", "explicit", "18+", "nsfl"
    ));

    @Override
    public DomainRecord map(Event event, Tags tags, String sourceRelayUrl) {
        List<String> hashtags = new ArrayList<>();
        for (TopicTag topic : tags.ofType(TopicTag.class)) {
            String value = topic.getTopic();
            if (value != null && !value.isEmpty() && !hashtags.contains(value)) {
                hashtags.add(value);
            }
        }

        String mimeType = tags.value("m");
        ImetaTag imeta = tags.first("imeta", ImetaTag.class);
        if (mimeType == null && imeta != null) {
            mimeType = imeta.getMimeType();
        }

        return new Media(event, sourceRelayUrl,
                mediaUrl(event, tags, imeta),
                mimeType,
                tags.value("title"),
                hashtags,
                isNsfw(tags, hashtags));
    }

    /**
     * url tag, then image tag, then the first imeta url, then the content if it is a bare URL.
     */
    static String mediaUrl(Event event, Tags tags, ImetaTag imeta) {
        String url = tags.value("url");
        if (url == null) {
            url = tags.value("image");
        }
        if (url == null && imeta != null) {
            url = imeta.getUrl();
        }
        if (url == null && event.getContent() != null) {
            String content = event.getContent().trim();
            if ((content.startsWith("http://") || content.startsWith("https://")) && !content.contains(" ")) {
                url = content;
            }
        }
        return url;
    }

    static boolean isNsfw(Tags tags, List<String> hashtags) {
        if (tags.has("content-warning")) {
            return true;
        }
        for (LabelNamespaceTag label : tags.ofType(LabelNamespaceTag.class)) {
            if ("nsfw".equalsIgnoreCase(label.getNamespace())) {
                return true;
            }
        }
        for (String hashtag : hashtags) {
            if (NSFW_HASHTAGS.contains(hashtag)) {
                return true;
            }
        }
        return false;
    }
}

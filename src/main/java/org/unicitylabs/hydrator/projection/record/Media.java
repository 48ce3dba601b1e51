package org.unicitylabs.hydrator.projection.record;

import org.unicitylabs.hydrator.protocol.Event;

import java.util.Collections;
import java.util.List;

/**
 * NIP-68 picture (20) or NIP-71 video (21, 22) post.
 */
public class Media extends DomainRecord {

    private final String mediaUrl;
    private final String mimeType;
    private final String title;
    private final List<String> hashtags;
    private final boolean nsfw;

    public Media(Event event, String sourceRelayUrl, String mediaUrl, String mimeType,
                 String title, List<String> hashtags, boolean nsfw) {
        super(event, sourceRelayUrl);
        this.mediaUrl = mediaUrl;
        this.mimeType = mimeType;
        this.title = title;
        this.hashtags = Collections.unmodifiableList(hashtags);
        this.nsfw = nsfw;
    }

    @Override
    public RecordType getType() {
        return RecordType.MEDIA;
    }

    /** Null when the event carries no usable URL. */
    public String getMediaUrl() { return mediaUrl; }
    public String getMimeType() { return mimeType; }
    public String getTitle() { return title; }
    public List<String> getHashtags() { return hashtags; }
    public boolean isNsfw() { return nsfw; }
}

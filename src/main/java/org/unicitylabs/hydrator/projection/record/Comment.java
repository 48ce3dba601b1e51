package org.unicitylabs.hydrator.projection.record;

import org.unicitylabs.hydrator.protocol.Event;

/**
 * NIP-22 comment (kind 1111). Uppercase tags describe the thread root, lowercase tags
 * the direct parent.
 */
public class Comment extends DomainRecord {

    private final String rootReference;
    private final String rootKind;
    private final String rootAuthor;
    private final String parentReference;
    private final String parentKind;
    private final String parentAuthor;

    public Comment(Event event, String sourceRelayUrl,
                   String rootReference, String rootKind, String rootAuthor,
                   String parentReference, String parentKind, String parentAuthor) {
        super(event, sourceRelayUrl);
        this.rootReference = rootReference;
        this.rootKind = rootKind;
        this.rootAuthor = rootAuthor;
        this.parentReference = parentReference;
        this.parentKind = parentKind;
        this.parentAuthor = parentAuthor;
    }

    @Override
    public RecordType getType() {
        return RecordType.COMMENT;
    }

    @Override
    public String getRootReference() { return rootReference; }
    public String getRootKind() { return rootKind; }
    public String getRootAuthor() { return rootAuthor; }
    @Override
    public String getParentReference() { return parentReference; }
    public String getParentKind() { return parentKind; }
    public String getParentAuthor() { return parentAuthor; }

    /**
     * Root coordinate when the thread root is an addressable event such as an article.
     */
    @Override
    public String getCoordinate() {
        return rootReference != null && rootReference.indexOf(':') > 0 && !rootReference.contains("://")
                ? rootReference : null;
    }

    public boolean isTopLevel() {
        return rootReference != null && rootReference.equals(parentReference);
    }
}

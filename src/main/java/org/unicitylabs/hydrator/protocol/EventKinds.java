package org.unicitylabs.hydrator.protocol;

/**
 * Event kinds the hydrator knows how to project.
 * See: https://github.com/nostr-protocol/nips
 */
public final class EventKinds {

    /** NIP-01: Metadata (profile information) */
    public static final int PROFILE = 0;

    /** NIP-01: Text note */
    public static final int TEXT_NOTE = 1;

    /** NIP-68: Picture */
    public static final int PICTURE = 20;

    /** NIP-68: Video (horizontal) */
    public static final int VIDEO = 21;

    /** NIP-68: Short video (vertical) */
    public static final int SHORT_VIDEO = 22;

    /** NIP-22: Comment */
    public static final int COMMENT = 1111;

    /** NIP-57: Zap receipt */
    public static final int ZAP_RECEIPT = 9735;

    /** NIP-84: Highlight */
    public static final int HIGHLIGHT = 9802;

    /** NIP-42: Client authentication */
    public static final int CLIENT_AUTH = 22242;

    /** NIP-23: Long-form content */
    public static final int LONG_FORM = 30023;

    /** NIP-23: Long-form draft */
    public static final int LONG_FORM_DRAFT = 30024;

    /** NIP-51: Curation set (articles) */
    public static final int CURATION_SET = 30004;

    /**
     * Get human-readable name for event kind.
     */
    public static String getName(int kind) {
        switch (kind) {
            case PROFILE: return "Profile";
            case TEXT_NOTE: return "Text Note";
            case PICTURE: return "Picture";
            case VIDEO: return "Video";
            case SHORT_VIDEO: return "Short Video";
            case COMMENT: return "Comment";
            case ZAP_RECEIPT: return "Zap Receipt";
            case HIGHLIGHT: return "Highlight";
            case CLIENT_AUTH: return "Client Auth";
            case LONG_FORM: return "Long-form Article";
            case LONG_FORM_DRAFT: return "Long-form Draft";
            case CURATION_SET: return "Curation Set";
            default: return "Unknown (" + kind + ")";
        }
    }

    private EventKinds() {
        // Utility class, no instantiation
    }
}

package org.unicitylabs.hydrator.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Nostr event structure as defined in NIP-01.
 * Events are immutable once signed: the id is the SHA-256 of the canonical serialization
 * and the signature covers the id. Nothing here is trusted until {@link EventVerifier} says so.
 */
public class Event {

    /** Marker for an event whose "kind" field was absent on the wire. */
    public static final int KIND_UNSET = -1;

    /** Event ID (32-byte SHA-256 hash of serialized event data) */
    @JsonProperty("id")
    private String id;

    /** Public key of event creator (32-byte hex string) */
    @JsonProperty("pubkey")
    private String pubkey;

    /** Unix timestamp in seconds */
    @JsonProperty("created_at")
    private long createdAt;

    /** Event kind (determines event type and handling) */
    @JsonProperty("kind")
    private int kind;

    /** Event tags (list of tag arrays, first element is the tag name) */
    @JsonProperty("tags")
    private List<List<String>> tags;

    /** Event content (arbitrary string, often markdown or JSON) */
    @JsonProperty("content")
    private String content;

    /** Schnorr signature (64-byte hex string) */
    @JsonProperty("sig")
    private String sig;

    /**
     * Default constructor for Jackson deserialization.
     */
    public Event() {
        this.kind = KIND_UNSET;
        this.tags = new ArrayList<>();
        this.content = "";
    }

    /**
     * Full constructor for events received from relays or built locally.
     */
    public Event(String id, String pubkey, long createdAt, int kind,
                 List<List<String>> tags, String content, String sig) {
        this.id = id;
        this.pubkey = pubkey;
        this.createdAt = createdAt;
        this.kind = kind;
        this.tags = copyTags(tags);
        this.content = content != null ? content : "";
        this.sig = sig;
    }

    /**
     * Copy of this event with a different signature. Used to build tampered fixtures and
     * to attach a signature after the id has been computed.
     */
    public Event withSig(String newSig) {
        return new Event(id, pubkey, createdAt, kind, tags, content, newSig);
    }

    /**
     * Copy of this event with different content but the same id and signature.
     */
    public Event withContent(String newContent) {
        return new Event(id, pubkey, createdAt, kind, tags, newContent, sig);
    }

    // Getters
    public String getId() { return id; }
    public String getPubkey() { return pubkey; }
    public long getCreatedAt() { return createdAt; }
    public int getKind() { return kind; }
    public List<List<String>> getTags() { return tags; }
    public String getContent() { return content; }
    public String getSig() { return sig; }

    // Setters
    public void setId(String id) { this.id = id; }
    public void setPubkey(String pubkey) { this.pubkey = pubkey; }
    public void setCreatedAt(long createdAt) { this.createdAt = createdAt; }
    public void setKind(int kind) { this.kind = kind; }
    public void setTags(List<List<String>> tags) { this.tags = copyTags(tags); }
    public void setContent(String content) {
        this.content = content != null ? content : "";
    }
    public void setSig(String sig) { this.sig = sig; }

    /**
     * Whether the wire message carried a kind.
     */
    @JsonIgnore
    public boolean hasKind() {
        return kind >= 0;
    }

    /**
     * Short id for log lines.
     */
    @JsonIgnore
    public String getShortId() {
        return abbreviate(id);
    }

    /**
     * Truncates a hex identifier to 16 characters for logging.
     */
    public static String abbreviate(String hex) {
        if (hex == null) {
            return "unknown";
        }
        return hex.length() > 16 ? hex.substring(0, 16) + "..." : hex;
    }

    private static List<List<String>> copyTags(List<List<String>> tags) {
        List<List<String>> copy = new ArrayList<>();
        if (tags != null) {
            for (List<String> tag : tags) {
                if (tag == null) {
                    throw new IllegalArgumentException("Tag list contains a null tag");
                }
                copy.add(new ArrayList<>(tag));
            }
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Event event = (Event) o;
        return Objects.equals(id, event.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Event{" +
                "id='" + abbreviate(id) + "'" +
                ", pubkey='" + abbreviate(pubkey) + "'" +
                ", kind=" + kind +
                ", createdAt=" + createdAt +
                ", tags=" + tags.size() +
                ", content=" + content.length() + " chars" +
                '}';
    }
}

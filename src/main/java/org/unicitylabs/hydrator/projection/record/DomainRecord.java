package org.unicitylabs.hydrator.projection.record;

import org.unicitylabs.hydrator.protocol.Event;

import java.util.Objects;

/**
 * A verified event projected into a typed record. The event id is the record's identity;
 * there is at most one record per id.
 */
public abstract class DomainRecord {

    private final Event event;
    private final String sourceRelayUrl;

    protected DomainRecord(Event event, String sourceRelayUrl) {
        this.event = Objects.requireNonNull(event, "event");
        this.sourceRelayUrl = sourceRelayUrl;
    }

    public abstract RecordType getType();

    public String getEventId() { return event.getId(); }
    public String getPubkey() { return event.getPubkey(); }
    public int getKind() { return event.getKind(); }
    public long getCreatedAt() { return event.getCreatedAt(); }
    public String getContent() { return event.getContent(); }

    /** The signed event this record was projected from. */
    public Event getEvent() { return event; }

    /** Relay the event was first received from, may be null. */
    public String getSourceRelayUrl() { return sourceRelayUrl; }

    /** Lookup column: article slug. */
    public String getSlug() { return null; }

    /** Lookup column: addressable coordinate this record has or points at. */
    public String getCoordinate() { return null; }

    /** Lookup column: thread root this record replies to. */
    public String getRootReference() { return null; }

    /** Lookup column: direct parent this record replies to or quotes. */
    public String getParentReference() { return null; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return getEventId().equals(((DomainRecord) o).getEventId());
    }

    @Override
    public int hashCode() {
        return getEventId().hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + event.getShortId() + ", kind=" + getKind() + '}';
    }
}

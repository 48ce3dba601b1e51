package org.unicitylabs.hydrator.query;

/**
 * How one relay leg of a fan-out query ended.
 */
public class RelayLegOutcome {

    public enum Status {
        /** Relay signalled end of stored events. */
        EOSE,
        /** Relay refused or ended the subscription with a CLOSED frame. */
        CLOSED,
        /** Per-relay timeout reached before EOSE. */
        TIMEOUT,
        /** Connection could not be opened; the leg was skipped. */
        CONNECT_FAILED,
        /** Connection dropped mid-read; events read so far are kept. */
        CONNECTION_LOST,
        /** Overall timeout reached while the leg was still running. */
        ABANDONED
    }

    private final String relayUrl;
    private final Status status;
    private final int eventCount;
    private final int rejectedCount;
    private final long elapsedMs;
    private final String message;

    public RelayLegOutcome(String relayUrl, Status status, int eventCount, int rejectedCount,
                           long elapsedMs, String message) {
        this.relayUrl = relayUrl;
        this.status = status;
        this.eventCount = eventCount;
        this.rejectedCount = rejectedCount;
        this.elapsedMs = elapsedMs;
        this.message = message;
    }

    public String getRelayUrl() { return relayUrl; }
    public Status getStatus() { return status; }
    /** Verified events buffered by this leg, duplicates included. */
    public int getEventCount() { return eventCount; }
    public int getRejectedCount() { return rejectedCount; }
    public long getElapsedMs() { return elapsedMs; }
    public String getMessage() { return message; }

    /**
     * Whether the relay was reached at all.
     */
    public boolean isReachable() {
        return status != Status.CONNECT_FAILED;
    }

    @Override
    public String toString() {
        return "RelayLegOutcome{" + relayUrl + ' ' + status +
                ", events=" + eventCount +
                ", rejected=" + rejectedCount +
                ", elapsedMs=" + elapsedMs +
                (message != null ? ", message=" + message : "") +
                '}';
    }
}

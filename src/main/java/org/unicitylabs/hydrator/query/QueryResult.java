package org.unicitylabs.hydrator.query;

import org.unicitylabs.hydrator.protocol.Event;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Merged result of a fan-out query.
 */
public class QueryResult {

    private final List<Event> events;
    private final int rejectedCount;
    private final int duplicateCount;
    private final List<RelayLegOutcome> legOutcomes;
    private final Map<String, String> sourceRelays;

    public QueryResult(List<Event> events, int rejectedCount, int duplicateCount,
                       List<RelayLegOutcome> legOutcomes, Map<String, String> sourceRelays) {
        this.events = Collections.unmodifiableList(events);
        this.sourceRelays = Collections.unmodifiableMap(sourceRelays);
        this.rejectedCount = rejectedCount;
        this.duplicateCount = duplicateCount;
        this.legOutcomes = Collections.unmodifiableList(legOutcomes);
    }

    /** Verified events, one per id, in first-seen order. */
    public List<Event> getEvents() { return events; }
    /** Events dropped because verification failed. */
    public int getRejectedCount() { return rejectedCount; }
    /** Verified events dropped because another relay already supplied the id. */
    public int getDuplicateCount() { return duplicateCount; }
    public List<RelayLegOutcome> getLegOutcomes() { return legOutcomes; }

    /**
     * Relay whose copy of the event was kept, or null for an unknown id.
     */
    public String getSourceRelay(String eventId) {
        return sourceRelays.get(eventId);
    }

    public int getReachableRelayCount() {
        int reachable = 0;
        for (RelayLegOutcome outcome : legOutcomes) {
            if (outcome.isReachable()) {
                reachable++;
            }
        }
        return reachable;
    }

    @Override
    public String toString() {
        return "QueryResult{events=" + events.size() +
                ", rejected=" + rejectedCount +
                ", duplicates=" + duplicateCount +
                ", legs=" + legOutcomes +
                '}';
    }
}

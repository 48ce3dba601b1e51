package org.unicitylabs.hydrator.projection;

import org.unicitylabs.hydrator.protocol.EventVerifier;

/**
 * The event's id or signature does not match its content.
 */
public class EventVerificationException extends InvalidEventException {

    private final EventVerifier.Outcome outcome;

    public EventVerificationException(String eventId, EventVerifier.Outcome outcome) {
        super(eventId, "Event failed verification: " + outcome);
        this.outcome = outcome;
    }

    public EventVerifier.Outcome getOutcome() {
        return outcome;
    }
}

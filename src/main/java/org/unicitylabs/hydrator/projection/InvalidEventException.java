package org.unicitylabs.hydrator.projection;

import org.unicitylabs.hydrator.protocol.Event;

/**
 * An event that cannot be projected: a required field is missing, the kind is not
 * accepted, or the kind's mapping finds no usable tags.
 */
public class InvalidEventException extends RuntimeException {

    private final String eventId;

    public InvalidEventException(String eventId, String message) {
        super(message + " (event " + Event.abbreviate(eventId) + ")");
        this.eventId = eventId;
    }

    public String getEventId() {
        return eventId;
    }
}

package org.unicitylabs.hydrator.protocol;

/**
 * Relay-to-client frame, as defined in NIP-01 (EVENT, EOSE, OK, NOTICE, CLOSED) and
 * NIP-42 (AUTH). Control frames of the WebSocket itself (ping/pong) never become a
 * RelayMessage.
 */
public abstract class RelayMessage {

    /**
     * Frame discriminator (first element of the JSON array).
     */
    public enum Type {
        EVENT,
        EOSE,
        OK,
        NOTICE,
        CLOSED,
        AUTH
    }

    private final Type type;

    protected RelayMessage(Type type) {
        this.type = type;
    }

    public Type getType() {
        return type;
    }

    /**
     * Subscription this frame belongs to, or null for connection-level frames.
     */
    public String getSubscriptionId() {
        return null;
    }

    /**
     * ["EVENT", subscription_id, event]
     */
    public static final class EventMessage extends RelayMessage {
        private final String subscriptionId;
        private final Event event;

        public EventMessage(String subscriptionId, Event event) {
            super(Type.EVENT);
            this.subscriptionId = subscriptionId;
            this.event = event;
        }

        @Override
        public String getSubscriptionId() { return subscriptionId; }
        public Event getEvent() { return event; }

        @Override
        public String toString() {
            return "EVENT[" + subscriptionId + ", " + event + "]";
        }
    }

    /**
     * ["EOSE", subscription_id]
     */
    public static final class EoseMessage extends RelayMessage {
        private final String subscriptionId;

        public EoseMessage(String subscriptionId) {
            super(Type.EOSE);
            this.subscriptionId = subscriptionId;
        }

        @Override
        public String getSubscriptionId() { return subscriptionId; }

        @Override
        public String toString() {
            return "EOSE[" + subscriptionId + "]";
        }
    }

    /**
     * ["CLOSED", subscription_id, message]: the relay ended the subscription.
     */
    public static final class ClosedMessage extends RelayMessage {
        private final String subscriptionId;
        private final String message;

        public ClosedMessage(String subscriptionId, String message) {
            super(Type.CLOSED);
            this.subscriptionId = subscriptionId;
            this.message = message;
        }

        @Override
        public String getSubscriptionId() { return subscriptionId; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return "CLOSED[" + subscriptionId + ", " + message + "]";
        }
    }

    /**
     * ["OK", event_id, accepted, message]
     */
    public static final class OkMessage extends RelayMessage {
        private final String eventId;
        private final boolean accepted;
        private final String message;

        public OkMessage(String eventId, boolean accepted, String message) {
            super(Type.OK);
            this.eventId = eventId;
            this.accepted = accepted;
            this.message = message;
        }

        public String getEventId() { return eventId; }
        public boolean isAccepted() { return accepted; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return "OK[" + Event.abbreviate(eventId) + ", " + accepted + ", " + message + "]";
        }
    }

    /**
     * ["NOTICE", message]
     */
    public static final class NoticeMessage extends RelayMessage {
        private final String message;

        public NoticeMessage(String message) {
            super(Type.NOTICE);
            this.message = message;
        }

        public String getMessage() { return message; }

        /** Relays prefix machine-readable failures with "ERROR:" */
        public boolean isError() {
            return message != null && message.startsWith("ERROR:");
        }

        @Override
        public String toString() {
            return "NOTICE[" + message + "]";
        }
    }

    /**
     * ["AUTH", challenge]: never answered automatically.
     */
    public static final class AuthMessage extends RelayMessage {
        private final String challenge;

        public AuthMessage(String challenge) {
            super(Type.AUTH);
            this.challenge = challenge;
        }

        public String getChallenge() { return challenge; }

        @Override
        public String toString() {
            return "AUTH[" + challenge + "]";
        }
    }
}

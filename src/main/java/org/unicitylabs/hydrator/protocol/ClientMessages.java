package org.unicitylabs.hydrator.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * Builds client-to-relay frames: REQ, CLOSE, EVENT and AUTH.
 */
public final class ClientMessages {

    /**
     * Fresh random subscription id. Relays cap the length at 64 chars; 16 is plenty.
     */
    public static String newSubscriptionId(String prefix) {
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        return prefix == null || prefix.isEmpty() ? random : prefix + "-" + random;
    }

    /**
     * ["REQ", subscription_id, filter...]
     */
    public static String req(String subscriptionId, List<Filter> filters) {
        List<Object> reqMessage = new ArrayList<>();
        reqMessage.add("REQ");
        reqMessage.add(subscriptionId);
        reqMessage.addAll(filters);
        return write(reqMessage);
    }

    /**
     * ["CLOSE", subscription_id]
     */
    public static String close(String subscriptionId) {
        return write(Arrays.asList("CLOSE", subscriptionId));
    }

    /**
     * ["EVENT", event]
     */
    public static String event(Event event) {
        return write(Arrays.asList("EVENT", event));
    }

    /**
     * ["AUTH", signed kind-22242 event]
     */
    public static String auth(Event authEvent) {
        return write(Arrays.asList("AUTH", authEvent));
    }

    private static String write(List<Object> frame) {
        try {
            return CanonicalJson.mapper().writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize client frame", e);
        }
    }

    private ClientMessages() {
        // Utility class
    }
}

package org.unicitylabs.hydrator.relay;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Relay URL normalization and relay list ordering.
 */
public final class RelayUrls {

    /** Fallback relays used when neither a local relay nor defaults are configured. */
    public static final List<String> PUBLIC_RELAYS = List.of(
        "wss://theforest.nostr1.com",
        "wss://nostr.land",
        "wss://relay.primal.net"
    );

    /**
     * Trim whitespace and trailing slashes so "wss://a/" and "wss://a" share a connection.
     */
    public static String normalize(String url) {
        if (url == null) {
            throw new IllegalArgumentException("Relay URL is null");
        }
        String normalized = url.trim();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Relay URL is blank");
        }
        return normalized;
    }

    /**
     * Normalize and de-duplicate, keeping first-seen order.
     */
    public static List<String> normalizeAll(Collection<String> urls) {
        Set<String> unique = new LinkedHashSet<>();
        for (String url : urls) {
            if (url != null && !url.isBlank()) {
                unique.add(normalize(url));
            }
        }
        return new ArrayList<>(unique);
    }

    /**
     * The local relay (if any) first, then the requested relays without duplicates.
     */
    public static List<String> withLocalFirst(String localRelay, Collection<String> urls) {
        List<String> ordered = new ArrayList<>();
        if (localRelay != null && !localRelay.isBlank()) {
            ordered.add(localRelay);
        }
        ordered.addAll(urls);
        return normalizeAll(ordered);
    }

    /**
     * Relay set to hydrate from: local relay first, then configured defaults, falling back
     * to {@link #PUBLIC_RELAYS} when no defaults are configured.
     */
    public static List<String> resolve(String localRelay, Collection<String> defaults) {
        Collection<String> others = defaults == null || defaults.isEmpty() ? PUBLIC_RELAYS : defaults;
        return withLocalFirst(localRelay, others);
    }

    public static List<String> of(String... urls) {
        return normalizeAll(Arrays.asList(urls));
    }

    private RelayUrls() {
        // Utility class
    }
}

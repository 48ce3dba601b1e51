package org.unicitylabs.hydrator.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.apache.commons.codec.binary.Hex;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.List;

/**
 * NIP-01 event id computation.
 * The id is hex(sha256(utf8(json([0, pubkey, created_at, kind, tags, content])))) with
 * compact JSON and the escaping rules of {@link CanonicalJson}.
 */
public final class EventIds {

    /**
     * Canonical serialization of the signed fields.
     */
    public static String serialize(String pubkey, long createdAt, int kind,
                                   List<List<String>> tags, String content) {
        List<Object> eventData = Arrays.asList(
            0,
            pubkey,
            createdAt,
            kind,
            tags != null ? tags : List.of(),
            content != null ? content : ""
        );
        try {
            return CanonicalJson.mapper().writeValueAsString(eventData);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize event fields", e);
        }
    }

    /**
     * Compute the lowercase hex event id for the given fields.
     */
    public static String computeId(String pubkey, long createdAt, int kind,
                                   List<List<String>> tags, String content) {
        byte[] canonical = serialize(pubkey, createdAt, kind, tags, content).getBytes(StandardCharsets.UTF_8);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return Hex.encodeHexString(digest.digest(canonical));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Compute the id an event should carry given its other fields.
     */
    public static String computeId(Event event) {
        return computeId(event.getPubkey(), event.getCreatedAt(), event.getKind(),
            event.getTags(), event.getContent());
    }

    private EventIds() {
        // Utility class
    }
}

package org.unicitylabs.hydrator.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes relay-to-client text frames.
 *
 * Shapes are strict: tags are arrays of strings and numbers stay numbers, since the
 * canonical id is recomputed from the parsed values. Missing event fields are left unset
 * for {@link EventVerifier} to reject.
 */
public final class RelayMessageParser {

    /**
     * Parse one text frame.
     *
     * @param text Raw frame text
     * @return Parsed message
     * @throws ProtocolException if the frame is not a well-formed relay message
     */
    public static RelayMessage parse(String text) throws ProtocolException {
        JsonNode root;
        try {
            root = CanonicalJson.mapper().readTree(text);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Frame is not valid JSON", e);
        }
        if (root == null || !root.isArray() || root.size() == 0 || !root.get(0).isTextual()) {
            throw new ProtocolException("Frame is not a JSON array with a type label");
        }

        String type = root.get(0).asText();
        switch (type) {
            case "EVENT":
                requireSize(root, 3, type);
                return new RelayMessage.EventMessage(text(root, 1, type), parseEvent(root.get(2)));
            case "EOSE":
                requireSize(root, 2, type);
                return new RelayMessage.EoseMessage(text(root, 1, type));
            case "CLOSED":
                requireSize(root, 2, type);
                return new RelayMessage.ClosedMessage(text(root, 1, type), optionalText(root, 2));
            case "OK":
                requireSize(root, 3, type);
                if (!root.get(2).isBoolean()) {
                    throw new ProtocolException("OK frame without boolean acceptance flag");
                }
                return new RelayMessage.OkMessage(text(root, 1, type), root.get(2).asBoolean(), optionalText(root, 3));
            case "NOTICE":
                requireSize(root, 2, type);
                return new RelayMessage.NoticeMessage(text(root, 1, type));
            case "AUTH":
                requireSize(root, 2, type);
                return new RelayMessage.AuthMessage(text(root, 1, type));
            default:
                throw new ProtocolException("Unsupported message type: " + type);
        }
    }

    /**
     * Decode an event object. Unknown properties are ignored.
     */
    public static Event parseEvent(JsonNode node) throws ProtocolException {
        if (node == null || !node.isObject()) {
            throw new ProtocolException("Event payload is not a JSON object");
        }
        Event event = new Event();
        event.setId(optionalString(node, "id"));
        event.setPubkey(optionalString(node, "pubkey"));
        event.setSig(optionalString(node, "sig"));

        JsonNode createdAt = node.get("created_at");
        if (createdAt != null && !createdAt.isNull()) {
            if (!createdAt.isIntegralNumber() || !createdAt.canConvertToLong()) {
                throw new ProtocolException("created_at is not an integer");
            }
            event.setCreatedAt(createdAt.asLong());
        }

        JsonNode kind = node.get("kind");
        if (kind != null && !kind.isNull()) {
            if (!kind.isIntegralNumber() || !kind.canConvertToInt() || kind.asInt() < 0) {
                throw new ProtocolException("kind is not a non-negative integer");
            }
            event.setKind(kind.asInt());
        }

        JsonNode content = node.get("content");
        if (content != null && !content.isNull()) {
            if (!content.isTextual()) {
                throw new ProtocolException("content is not a string");
            }
            event.setContent(content.asText());
        }

        JsonNode tags = node.get("tags");
        if (tags != null && !tags.isNull()) {
            event.setTags(parseTags(tags));
        }
        return event;
    }

    private static List<List<String>> parseTags(JsonNode tags) throws ProtocolException {
        if (!tags.isArray()) {
            throw new ProtocolException("tags is not an array");
        }
        List<List<String>> out = new ArrayList<>(tags.size());
        for (JsonNode tag : tags) {
            if (!tag.isArray() || tag.size() == 0) {
                throw new ProtocolException("tag is not a non-empty array");
            }
            List<String> values = new ArrayList<>(tag.size());
            for (JsonNode value : tag) {
                if (!value.isTextual()) {
                    throw new ProtocolException("tag element is not a string");
                }
                values.add(value.asText());
            }
            out.add(values);
        }
        return out;
    }

    private static void requireSize(JsonNode root, int min, String type) throws ProtocolException {
        if (root.size() < min) {
            throw new ProtocolException(type + " frame has " + root.size() + " elements, expected " + min);
        }
    }

    private static String text(JsonNode root, int index, String type) throws ProtocolException {
        JsonNode node = root.get(index);
        if (node == null || !node.isTextual()) {
            throw new ProtocolException(type + " frame element " + index + " is not a string");
        }
        return node.asText();
    }

    private static String optionalText(JsonNode root, int index) {
        JsonNode node = root.get(index);
        return node != null && node.isTextual() ? node.asText() : "";
    }

    private static String optionalString(JsonNode node, String field) throws ProtocolException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new ProtocolException(field + " is not a string");
        }
        return value.asText();
    }

    private RelayMessageParser() {
        // Utility class
    }
}

package org.unicitylabs.hydrator.projection.tag;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps raw string arrays to tag variants by tag name.
 */
public final class TagParser {

    private static final Set<String> VALUE_TAGS = new HashSet<>(Arrays.asList(
        "title", "summary", "image", "thumb", "published_at", "url", "m", "context", "r", "alt"
    ));

    public static Tag parse(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("Tag must have a name");
        }
        List<String> copy = new ArrayList<>(raw);
        String name = copy.get(0);

        if (VALUE_TAGS.contains(name)) {
            return new ValueTag(copy);
        }
        switch (name) {
            case "d":
                return new IdentifierTag(copy);
            case "t":
                return new TopicTag(copy);
            case "e":
            case "E":
                return new EventReferenceTag(copy);
            case "a":
            case "A":
                return new AddressReferenceTag(copy);
            case "i":
            case "I":
                return new ExternalReferenceTag(copy);
            case "p":
            case "P":
                return new PubkeyReferenceTag(copy);
            case "k":
            case "K":
                return new KindReferenceTag(copy);
            case "content-warning":
                return new ContentWarningTag(copy);
            case "L":
                return new LabelNamespaceTag(copy);
            case "imeta":
                return new ImetaTag(copy);
            default:
                return new UnknownTag(copy);
        }
    }

    public static Tags parseAll(List<List<String>> rawTags) {
        List<Tag> tags = new ArrayList<>();
        if (rawTags != null) {
            for (List<String> raw : rawTags) {
                if (raw != null && !raw.isEmpty()) {
                    tags.add(parse(raw));
                }
            }
        }
        return new Tags(tags);
    }

    private TagParser() {
        // Utility class
    }
}

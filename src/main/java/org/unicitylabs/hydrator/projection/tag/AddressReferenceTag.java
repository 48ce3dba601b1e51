package org.unicitylabs.hydrator.projection.tag;

import java.util.List;

/**
 * "a" / "A": ["a", "kind:pubkey:identifier", relay-hint].
 */
public final class AddressReferenceTag extends ReferenceTag {

    AddressReferenceTag(List<String> raw) {
        super(raw);
    }

    public String getCoordinate() {
        return getValue();
    }

    /** Kind part of the coordinate, -1 if the coordinate is malformed. */
    public int getReferencedKind() {
        String[] parts = split();
        if (parts == null) {
            return -1;
        }
        try {
            return Integer.parseInt(parts[0]);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    public String getReferencedPubkey() {
        String[] parts = split();
        return parts != null ? parts[1] : null;
    }

    public String getReferencedIdentifier() {
        String[] parts = split();
        return parts != null ? parts[2] : null;
    }

    private String[] split() {
        String coordinate = getCoordinate();
        if (coordinate == null) {
            return null;
        }
        // The identifier may itself contain ':'
        String[] parts = coordinate.split(":", 3);
        return parts.length == 3 ? parts : null;
    }
}

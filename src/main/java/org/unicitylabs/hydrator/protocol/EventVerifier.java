package org.unicitylabs.hydrator.protocol;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.unicitylabs.hydrator.crypto.SchnorrSigner;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Pure, side-effect-free integrity check for events received from untrusted relays.
 * An event is trusted only when its id matches the canonical hash of its fields and its
 * signature verifies against that id and its pubkey.
 */
public final class EventVerifier {

    private static final Pattern HEX_64 = Pattern.compile("[0-9a-f]{64}");
    private static final Pattern HEX_128 = Pattern.compile("[0-9a-f]{128}");

    /**
     * Why an event passed or failed verification.
     */
    public enum Outcome {
        VALID,
        MISSING_FIELD,
        MALFORMED_FIELD,
        ID_MISMATCH,
        BAD_SIGNATURE;

        public boolean isValid() {
            return this == VALID;
        }
    }

    /**
     * @return true only if both id and signature check out
     */
    public static boolean verify(Event event) {
        return check(event).isValid();
    }

    /**
     * Verify and report the first failing check.
     */
    public static Outcome check(Event event) {
        if (event == null || event.getId() == null || event.getPubkey() == null
                || event.getSig() == null || !event.hasKind()) {
            return Outcome.MISSING_FIELD;
        }
        if (!HEX_64.matcher(event.getId()).matches()
                || !HEX_64.matcher(event.getPubkey()).matches()
                || !HEX_128.matcher(event.getSig()).matches()) {
            return Outcome.MALFORMED_FIELD;
        }
        for (List<String> tag : event.getTags()) {
            if (tag == null || tag.isEmpty() || tag.contains(null)) {
                return Outcome.MALFORMED_FIELD;
            }
        }

        String expectedId = EventIds.computeId(event);
        if (!expectedId.equals(event.getId())) {
            return Outcome.ID_MISMATCH;
        }

        try {
            byte[] signature = Hex.decodeHex(event.getSig());
            byte[] message = Hex.decodeHex(event.getId());
            byte[] publicKey = Hex.decodeHex(event.getPubkey());
            return SchnorrSigner.verify(signature, message, publicKey) ? Outcome.VALID : Outcome.BAD_SIGNATURE;
        } catch (DecoderException e) {
            return Outcome.MALFORMED_FIELD;
        }
    }

    private EventVerifier() {
        // Utility class
    }
}

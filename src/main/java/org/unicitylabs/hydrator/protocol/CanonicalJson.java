package org.unicitylabs.hydrator.protocol;

import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared Jackson configuration for the wire format.
 *
 * NIP-01 serializes with the JSON.stringify escaping rules: the two-character escapes for
 * quote, backslash, \b \t \n \f \r, lowercase \\u00xx for every other control character and
 * nothing else escaped. Jackson's defaults differ only in the hex case, fixed here.
 */
public final class CanonicalJson {

    private static final ObjectMapper MAPPER = create();

    /**
     * Mapper used for both inbound frames and id serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    private static ObjectMapper create() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.getFactory().setCharacterEscapes(new Nip01Escapes());
        return mapper;
    }

    private static final class Nip01Escapes extends CharacterEscapes {

        private static final char[] HEX = "0123456789abcdef".toCharArray();

        private final int[] asciiEscapes;

        Nip01Escapes() {
            asciiEscapes = CharacterEscapes.standardAsciiEscapesForJSON();
            for (int ch = 0; ch < 0x20; ch++) {
                if (asciiEscapes[ch] == CharacterEscapes.ESCAPE_STANDARD) {
                    asciiEscapes[ch] = CharacterEscapes.ESCAPE_CUSTOM;
                }
            }
        }

        @Override
        public int[] getEscapeCodesForAscii() {
            return asciiEscapes;
        }

        @Override
        public SerializableString getEscapeSequence(int ch) {
            // Jackson also asks about every non-ASCII char; those stay verbatim
            if (ch >= 0x20) {
                return null;
            }
            return new SerializedString("\\u00" + HEX[(ch >> 4) & 0xF] + HEX[ch & 0xF]);
        }
    }

    private CanonicalJson() {
        // Utility class
    }
}

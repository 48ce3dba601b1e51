package org.unicitylabs.hydrator.protocol;

import org.junit.Test;

import java.util.ArrayList;

import static org.junit.Assert.*;
import static org.unicitylabs.hydrator.protocol.TestEvents.tag;
import static org.unicitylabs.hydrator.protocol.TestEvents.tags;

/**
 * Canonical serialization and id computation.
 */
public class EventIdsTest {

    private static final String PUBKEY = "f9308a019258c31049344f85f89d5229b531c845836f99b08601f113bce036f9";

    @Test
    public void testSerializeIsCompactFixedOrderArray() {
        String serialized = EventIds.serialize(PUBKEY, 1700000000L, 1,
                tags(tag("t", "nostr")), "hello \"world\"\n");

        assertEquals("[0,\"" + PUBKEY + "\",1700000000,1,[[\"t\",\"nostr\"]],\"hello \\\"world\\\"\\n\"]",
                serialized);
    }

    @Test
    public void testComputeIdKnownVector() {
        String id = EventIds.computeId(PUBKEY, 1700000000L, 1, tags(tag("t", "nostr")), "hello \"world\"\n");
        assertEquals("eadd14a6aa9c1e3ec30177341d4b963eb5283df67a751978fd0e5c7f5c01889c", id);
    }

    @Test
    public void testControlCharactersUseLowercaseUnicodeEscapes() {
        String content = "caf\u00e9 \t \u0001 </tag>";
        String serialized = EventIds.serialize(PUBKEY, 1700000000L, 1,
                tags(tag("e", "abc", "wss://r"), tag("p", PUBKEY)), content);

        assertTrue(serialized.contains("\"caf\u00e9 \\t \\u0001 </tag>\""));
        assertEquals("98df0dfbbac9f9472d178c75213b7b517337eb35f66e8a583cabd41635dea4e5",
                EventIds.computeId(PUBKEY, 1700000000L, 1,
                        tags(tag("e", "abc", "wss://r"), tag("p", PUBKEY)), content));
    }

    @Test
    public void testComputeIdIsDeterministic() {
        String first = EventIds.computeId(PUBKEY, 42L, 30023, tags(tag("d", "slug")), "body");
        String second = EventIds.computeId(PUBKEY, 42L, 30023, tags(tag("d", "slug")), "body");
        assertEquals(first, second);
        assertEquals(64, first.length());
    }

    @Test
    public void testEveryFieldChangesTheId() {
        String base = EventIds.computeId(PUBKEY, 42L, 1, tags(tag("t", "a")), "x");

        assertNotEquals(base, EventIds.computeId(PUBKEY, 43L, 1, tags(tag("t", "a")), "x"));
        assertNotEquals(base, EventIds.computeId(PUBKEY, 42L, 2, tags(tag("t", "a")), "x"));
        assertNotEquals(base, EventIds.computeId(PUBKEY, 42L, 1, tags(tag("t", "b")), "x"));
        assertNotEquals(base, EventIds.computeId(PUBKEY, 42L, 1, tags(tag("t", "a")), "y"));
    }

    @Test
    public void testNullTagsAndContentSerializeAsEmpty() {
        assertEquals(EventIds.computeId(PUBKEY, 1L, 1, new ArrayList<>(), ""),
                EventIds.computeId(PUBKEY, 1L, 1, null, null));
    }
}

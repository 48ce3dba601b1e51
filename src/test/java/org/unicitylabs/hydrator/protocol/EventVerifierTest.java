package org.unicitylabs.hydrator.protocol;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;
import static org.unicitylabs.hydrator.protocol.TestEvents.tag;
import static org.unicitylabs.hydrator.protocol.TestEvents.tags;

public class EventVerifierTest {

    private static final String ZERO_SIG = repeat('0', 128);

    @Test
    public void testSignedEventVerifies() {
        Event event = TestEvents.signed(EventKinds.LONG_FORM, tags(tag("d", "hello"), tag("title", "Hello")), "# Hello");
        assertTrue(EventVerifier.verify(event));
        assertEquals(EventVerifier.Outcome.VALID, EventVerifier.check(event));
    }

    @Test
    public void testTamperedContentFails() {
        Event event = TestEvents.note("original");
        Event tampered = event.withContent("changed");

        assertEquals(event.getId(), tampered.getId());
        assertFalse(EventVerifier.verify(tampered));
        assertEquals(EventVerifier.Outcome.ID_MISMATCH, EventVerifier.check(tampered));
    }

    @Test
    public void testTamperedTagsFail() {
        Event event = TestEvents.signed(EventKinds.TEXT_NOTE, tags(tag("t", "nostr")), "tagged");
        List<List<String>> tags = new ArrayList<>(event.getTags());
        tags.add(tag("t", "injected"));
        Event tampered = new Event(event.getId(), event.getPubkey(), event.getCreatedAt(), event.getKind(),
                tags, event.getContent(), event.getSig());

        assertFalse(EventVerifier.verify(tampered));
    }

    @Test
    public void testTamperedCreatedAtFails() {
        Event event = TestEvents.note("timestamped");
        Event tampered = new Event(event.getId(), event.getPubkey(), event.getCreatedAt() + 1, event.getKind(),
                event.getTags(), event.getContent(), event.getSig());

        assertFalse(EventVerifier.verify(tampered));
    }

    @Test
    public void testZeroSignatureFails() {
        Event event = TestEvents.note("zero sig").withSig(ZERO_SIG);

        assertFalse(EventVerifier.verify(event));
        assertEquals(EventVerifier.Outcome.BAD_SIGNATURE, EventVerifier.check(event));
    }

    @Test
    public void testSignatureOfAnotherEventFails() {
        Event event = TestEvents.withForeignSignature(TestEvents.note("mine"));
        assertEquals(EventVerifier.Outcome.BAD_SIGNATURE, EventVerifier.check(event));
    }

    @Test
    public void testMissingFields() {
        Event event = TestEvents.note("complete");

        Event noSig = event.withSig(null);
        assertEquals(EventVerifier.Outcome.MISSING_FIELD, EventVerifier.check(noSig));

        Event noKind = new Event();
        noKind.setId(event.getId());
        noKind.setPubkey(event.getPubkey());
        noKind.setSig(event.getSig());
        assertEquals(EventVerifier.Outcome.MISSING_FIELD, EventVerifier.check(noKind));

        assertEquals(EventVerifier.Outcome.MISSING_FIELD, EventVerifier.check(null));
    }

    @Test
    public void testUppercaseHexIsMalformed() {
        Event event = TestEvents.note("case");
        Event upper = new Event(event.getId().toUpperCase(), event.getPubkey(), event.getCreatedAt(),
                event.getKind(), event.getTags(), event.getContent(), event.getSig());

        assertEquals(EventVerifier.Outcome.MALFORMED_FIELD, EventVerifier.check(upper));
    }

    @Test
    public void testShortSignatureIsMalformed() {
        Event event = TestEvents.note("short").withSig("abcd");
        assertEquals(EventVerifier.Outcome.MALFORMED_FIELD, EventVerifier.check(event));
    }

    @Test
    public void testEventParsedFromWireVerifies() throws Exception {
        Event event = TestEvents.signed(EventKinds.COMMENT,
                tags(tag("E", "abc"), tag("K", "30023")), "unicode ☃ and \"quotes\"\tand tabs");
        String json = CanonicalJson.mapper().writeValueAsString(event);

        Event parsed = RelayMessageParser.parseEvent(CanonicalJson.mapper().readTree(json));
        assertTrue(EventVerifier.verify(parsed));
    }

    private static String repeat(char c, int count) {
        StringBuilder sb = new StringBuilder(count);
        for (int i = 0; i < count; i++) {
            sb.append(c);
        }
        return sb.toString();
    }
}

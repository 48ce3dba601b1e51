package org.unicitylabs.hydrator.projection;

import org.junit.Before;
import org.junit.Test;
import org.unicitylabs.hydrator.projection.record.Article;
import org.unicitylabs.hydrator.projection.record.DomainRecord;
import org.unicitylabs.hydrator.projection.record.RecordType;
import org.unicitylabs.hydrator.protocol.Event;
import org.unicitylabs.hydrator.protocol.EventKinds;
import org.unicitylabs.hydrator.protocol.EventVerifier;
import org.unicitylabs.hydrator.protocol.TestEvents;
import org.unicitylabs.hydrator.store.InMemoryRecordStore;

import java.util.Arrays;

import static org.junit.Assert.*;
import static org.unicitylabs.hydrator.protocol.TestEvents.tag;
import static org.unicitylabs.hydrator.protocol.TestEvents.tags;

public class EventProjectorTest {

    private static final String RELAY = "wss://relay.example.com";

    private InMemoryRecordStore store;
    private EventProjector projector;

    @Before
    public void setUp() {
        store = new InMemoryRecordStore();
        projector = new EventProjector(store);
    }

    @Test
    public void testProjectsArticle() {
        Event event = TestEvents.signed(EventKinds.LONG_FORM,
                tags(tag("d", "my-slug"), tag("title", "Hello")), "# Body");

        ProjectionResult result = projector.projectWithResult(event, RELAY);

        assertTrue(result.isCreated());
        assertEquals(RecordType.ARTICLE, result.getRecord().getType());
        Article article = (Article) result.getRecord();
        assertEquals("my-slug", article.getSlug());
        assertEquals("Hello", article.getTitle());
        assertEquals(RELAY, article.getSourceRelayUrl());
        assertEquals(1, store.count());
        assertEquals(0, store.pendingCount());
    }

    @Test
    public void testProjectionIsIdempotent() {
        Event event = TestEvents.note("only once");

        DomainRecord first = projector.project(event, RELAY);
        long countAfterFirst = store.count();
        ProjectionResult second = projector.projectWithResult(event, "wss://other");

        assertFalse(second.isCreated());
        assertSame(first, second.getRecord());
        assertEquals(RELAY, second.getRecord().getSourceRelayUrl());
        assertEquals(countAfterFirst, store.count());
        assertEquals(1, projector.getCreatedCount());
        assertEquals(1, projector.getDuplicateCount());
    }

    @Test
    public void testDuplicateWithinUnflushedBatch() {
        projector.setAutoFlush(false);
        Event event = TestEvents.note("staged");

        assertTrue(projector.projectWithResult(event, RELAY).isCreated());
        assertFalse(projector.projectWithResult(event, RELAY).isCreated());

        assertEquals(1, store.pendingCount());
        assertEquals(0, store.count());
        assertEquals(1, store.flush());
        assertEquals(1, store.count());
    }

    @Test
    public void testNullEventIsInvalid() {
        try {
            projector.project(null, RELAY);
            fail("Expected InvalidEventException");
        } catch (InvalidEventException e) {
            assertNull(e.getEventId());
        }
    }

    @Test
    public void testMissingFieldsAreInvalid() {
        Event valid = TestEvents.note("fields");
        Event[] broken = {
            new Event(null, valid.getPubkey(), valid.getCreatedAt(), valid.getKind(),
                    valid.getTags(), valid.getContent(), valid.getSig()),
            new Event(valid.getId(), "", valid.getCreatedAt(), valid.getKind(),
                    valid.getTags(), valid.getContent(), valid.getSig()),
            new Event(valid.getId(), valid.getPubkey(), valid.getCreatedAt(), Event.KIND_UNSET,
                    valid.getTags(), valid.getContent(), valid.getSig())
        };

        for (Event event : broken) {
            try {
                projector.project(event, RELAY);
                fail("Expected InvalidEventException for " + event);
            } catch (EventVerificationException e) {
                fail("Field validation must run before verification");
            } catch (InvalidEventException expected) {
                // rejected
            }
        }
        assertEquals(3, projector.getInvalidCount());
        assertEquals(0, store.count());
    }

    @Test
    public void testTamperedEventFailsVerification() {
        Event tampered = TestEvents.note("original").withContent("edited");

        try {
            projector.project(tampered, RELAY);
            fail("Expected EventVerificationException");
        } catch (EventVerificationException e) {
            assertEquals(EventVerifier.Outcome.ID_MISMATCH, e.getOutcome());
            assertEquals(tampered.getId(), e.getEventId());
        }
        assertNull(store.findById(tampered.getId()));
    }

    @Test
    public void testForeignSignatureFailsVerification() {
        Event forged = TestEvents.withForeignSignature(TestEvents.note("forged"));

        try {
            projector.project(forged, RELAY);
            fail("Expected EventVerificationException");
        } catch (EventVerificationException e) {
            assertEquals(EventVerifier.Outcome.BAD_SIGNATURE, e.getOutcome());
        }
        assertEquals(0, store.count());
    }

    @Test
    public void testKindOutsideAllowListIsRejected() {
        projector.setAllowedKinds(Arrays.asList(EventKinds.LONG_FORM, EventKinds.COMMENT));

        try {
            projector.project(TestEvents.note("not wanted"), RELAY);
            fail("Expected InvalidEventException");
        } catch (InvalidEventException e) {
            assertTrue(e.getMessage().contains("Kind 1 is not accepted"));
        }
        assertEquals(1, projector.getInvalidCount());
    }

    @Test
    public void testCommentWithoutReferencesIsInvalid() {
        Event orphan = TestEvents.signed(EventKinds.COMMENT, tags(tag("p", "abc")), "orphan reply");

        try {
            projector.project(orphan, RELAY);
            fail("Expected InvalidEventException");
        } catch (InvalidEventException e) {
            assertEquals(orphan.getId(), e.getEventId());
        }
        assertEquals(0, store.count());
        assertEquals(0, store.pendingCount());
    }

    @Test
    public void testUnmappedKindBecomesGenericRecord() {
        Event zap = TestEvents.signed(EventKinds.ZAP_RECEIPT,
                tags(tag("p", "recipient"), tag("bolt11", "lnbc10u1...")), "");

        DomainRecord record = projector.project(zap, RELAY);

        assertEquals(RecordType.GENERIC, record.getType());
        assertEquals(EventKinds.ZAP_RECEIPT, record.getKind());
    }
}

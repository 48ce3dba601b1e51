package org.unicitylabs.hydrator.store;

import com.zaxxer.hikari.HikariDataSource;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.unicitylabs.hydrator.projection.EventProjector;
import org.unicitylabs.hydrator.projection.RecordMappers;
import org.unicitylabs.hydrator.projection.record.Article;
import org.unicitylabs.hydrator.projection.record.Comment;
import org.unicitylabs.hydrator.projection.record.DomainRecord;
import org.unicitylabs.hydrator.protocol.Event;
import org.unicitylabs.hydrator.protocol.EventKinds;
import org.unicitylabs.hydrator.protocol.EventVerifier;
import org.unicitylabs.hydrator.protocol.TestEvents;

import java.util.Arrays;
import java.util.Map;
import java.util.UUID;

import static org.junit.Assert.*;
import static org.unicitylabs.hydrator.protocol.TestEvents.tag;
import static org.unicitylabs.hydrator.protocol.TestEvents.tags;

public class JdbcRecordStoreTest {

    private static final String RELAY = "wss://relay.example.com";

    private final RecordMappers mappers = RecordMappers.defaults();
    private HikariDataSource dataSource;
    private JdbcRecordStore store;

    @Before
    public void setUp() {
        dataSource = StoreDataSources.create("jdbc:hsqldb:mem:store-" + UUID.randomUUID(), null, null);
        StoreDataSources.migrate(dataSource);
        store = new JdbcRecordStore(dataSource);
    }

    @After
    public void tearDown() {
        dataSource.close();
    }

    @Test
    public void testStagedRecordsAreVisibleBeforeFlush() {
        DomainRecord record = mappers.map(TestEvents.note("staged"), RELAY);

        assertTrue(store.save(record));
        assertFalse(store.save(record));

        assertSame(record, store.findById(record.getEventId()));
        assertEquals(1, store.pendingCount());
        assertEquals(0, store.count());

        assertEquals(1, store.flush());
        assertEquals(0, store.pendingCount());
        assertEquals(1, store.count());
        assertEquals(0, store.flush());
    }

    @Test
    public void testArticleIsRebuiltFromRow() {
        Event event = TestEvents.signed(EventKinds.LONG_FORM, tags(
                tag("d", "my-slug"),
                tag("title", "Grüße"),
                tag("t", "nostr")), "Line one\nLine two ⚡");
        store.save(mappers.map(event, RELAY));
        store.flush();

        DomainRecord loaded = new JdbcRecordStore(dataSource).findById(event.getId());

        assertTrue(loaded instanceof Article);
        Article article = (Article) loaded;
        assertEquals("my-slug", article.getSlug());
        assertEquals("Grüße", article.getTitle());
        assertEquals(Arrays.asList("nostr"), article.getTopics());
        assertEquals(RELAY, article.getSourceRelayUrl());
        assertEquals(event.getContent(), article.getContent());
        assertTrue("stored event must still verify", EventVerifier.verify(article.getEvent()));
    }

    @Test
    public void testUnknownIdReturnsNull() {
        assertNull(store.findById("0".repeat(64)));
    }

    @Test
    public void testAlreadyStoredIdIsSkippedOnFlush() {
        Event event = TestEvents.note("twice");
        store.save(mappers.map(event, RELAY));
        assertEquals(1, store.flush());

        JdbcRecordStore other = new JdbcRecordStore(dataSource);
        other.save(mappers.map(event, "wss://other"));

        assertEquals(0, other.flush());
        assertEquals(1, store.count());
        assertEquals(RELAY, store.findById(event.getId()).getSourceRelayUrl());
    }

    @Test
    public void testBatchWithDuplicateStillStoresNewRecords() {
        Event existing = TestEvents.note("existing");
        store.save(mappers.map(existing, RELAY));
        store.flush();

        JdbcRecordStore other = new JdbcRecordStore(dataSource);
        Event before = TestEvents.note("before");
        Event after = TestEvents.note("after");
        other.save(mappers.map(before, RELAY));
        other.save(mappers.map(existing, RELAY));
        other.save(mappers.map(after, RELAY));

        assertEquals(2, other.flush());
        assertEquals(3, store.count());
        assertNotNull(store.findById(before.getId()));
        assertNotNull(store.findById(after.getId()));
    }

    @Test
    public void testLongTagValuesAreStored() {
        String slug = "x".repeat(600);
        String longRoot = "30023:" + TestEvents.KEYS.getPublicKeyHex() + ":" + "y".repeat(2000);
        Event article = TestEvents.signed(EventKinds.LONG_FORM, tags(tag("d", slug)), "long slug");
        Event comment = TestEvents.signed(EventKinds.COMMENT, tags(tag("A", longRoot), tag("a", longRoot)), "reply");
        Event note = TestEvents.note("fine");
        store.save(mappers.map(note, RELAY));
        store.save(mappers.map(article, RELAY + "/" + "z".repeat(700)));
        store.save(mappers.map(comment, RELAY));

        assertEquals(3, store.flush());
        assertEquals(0, store.failedCount());

        Article loaded = (Article) new JdbcRecordStore(dataSource).findById(article.getId());
        assertEquals(slug, loaded.getSlug());
        assertEquals(longRoot, ((Comment) store.findById(comment.getId())).getRootReference());
        assertNotNull(store.findById(note.getId()));
    }

    @Test
    public void testRefusedRowDoesNotLoseRestOfBatch() {
        Event before = TestEvents.note("before");
        Event oversizedSig = TestEvents.note("bad row");
        oversizedSig = oversizedSig.withSig(oversizedSig.getSig() + oversizedSig.getSig());
        Event after = TestEvents.note("after");
        store.save(mappers.map(before, RELAY));
        store.save(mappers.map(oversizedSig, RELAY));
        store.save(mappers.map(after, RELAY));

        assertEquals(2, store.flush());

        assertEquals(1, store.failedCount());
        assertEquals(0, store.pendingCount());
        assertEquals(2, store.count());
        assertNotNull(store.findById(before.getId()));
        assertNotNull(store.findById(after.getId()));
        assertNull(store.findById(oversizedSig.getId()));
    }

    @Test
    public void testCountByType() {
        Event article = TestEvents.signed(EventKinds.LONG_FORM, tags(tag("d", "a")), "body");
        Event comment = TestEvents.signed(EventKinds.COMMENT, tags(
                tag("A", "30023:" + article.getPubkey() + ":a"),
                tag("a", "30023:" + article.getPubkey() + ":a")), "nice");
        store.save(mappers.map(article, RELAY));
        store.save(mappers.map(comment, RELAY));
        store.save(mappers.map(TestEvents.note("generic"), RELAY));
        store.flush();

        Map<String, Long> counts = store.countByType();

        assertEquals(Long.valueOf(1), counts.get("ARTICLE"));
        assertEquals(Long.valueOf(1), counts.get("COMMENT"));
        assertEquals(Long.valueOf(1), counts.get("GENERIC"));
        assertTrue(store.findById(comment.getId()) instanceof Comment);
    }

    @Test
    public void testProjectorOverJdbcIsIdempotent() {
        EventProjector projector = new EventProjector(store);
        Event event = TestEvents.note("project me");

        assertTrue(projector.projectWithResult(event, RELAY).isCreated());
        assertFalse(projector.projectWithResult(event, RELAY).isCreated());

        EventProjector second = new EventProjector(new JdbcRecordStore(dataSource));
        assertFalse(second.projectWithResult(event, RELAY).isCreated());
        assertEquals(1, store.count());
    }

    @Test
    public void testMigrationIsRepeatable() {
        StoreDataSources.migrate(dataSource);

        assertEquals(0, store.count());
    }
}

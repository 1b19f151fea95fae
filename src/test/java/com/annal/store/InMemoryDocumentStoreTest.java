package com.annal.store;

import com.annal.query.Filter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryDocumentStoreTest {
    @Test
    public void testCrud() {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        String id = store.insertOne("people", new Document(Map.of("name", "Alice", "age", 30))).insertedId();
        store.insertOne("people", new Document(Map.of("_id", "bob", "name", "Bob", "age", 25)));

        assertNotNull(id);
        assertEquals("Alice", store.findOne("people", Filter.byId(id)).orElseThrow().get("name"));
        assertEquals(1, store.find("people", Filter.field("age", Filter.Operator.GT, 26)).size());
        assertThrows(DuplicateKeyException.class,
                () -> store.insertOne("people", new Document(Map.of("_id", "bob"))));

        UpdateResult replaced = store.replaceOne("people", Filter.byId("bob"), new Document(Map.of("name", "Robert")));
        assertEquals(1, replaced.matchedCount());
        Document bob = store.findOne("people", Filter.byId("bob")).orElseThrow();
        assertEquals("Robert", bob.get("name"));
        assertNull(bob.get("age"));
        assertEquals(UpdateResult.NONE, store.replaceOne("people", Filter.byId("nobody"), new Document(Map.of())));

        UpdateResult updated = store.updateMany("people", Filter.all(), Map.of("meta.checked", true));
        assertEquals(2, updated.modifiedCount());
        assertEquals(true, store.findOne("people", Filter.byId("bob")).orElseThrow().getPath("meta.checked"));
        assertEquals(0, store.updateMany("people", Filter.all(), Map.of("meta.checked", true)).modifiedCount());

        assertEquals(1, store.deleteMany("people", Filter.eq("name", "Alice")).deletedCount());
        assertEquals(1, store.count("people"));
    }

    @Test
    public void testFailedCallbackLeavesNothingBehind() {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        assertThrows(IllegalStateException.class, () -> store.runInTransaction(session -> {
            session.insertOne("a", new Document(Map.of("x", 1)));
            session.insertOne("b", new Document(Map.of("y", 2)));
            throw new IllegalStateException("boom");
        }, TransactionOptions.defaults()));
        assertEquals(0, store.count("a"));
        assertEquals(0, store.count("b"));
    }

    @Test
    public void testSessionSeesItsOwnWrites() {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        long seen = store.runInTransaction(session -> {
            session.insertOne("a", new Document(Map.of("_id", "1", "x", 1)));
            session.deleteMany("a", Filter.byId("1"));
            session.insertOne("a", new Document(Map.of("_id", "2", "x", 2)));
            return (long) session.find("a", Filter.all()).size();
        }, TransactionOptions.defaults());
        assertEquals(1, seen);
        assertTrue(store.findOne("a", Filter.byId("2")).isPresent());
    }

    @Test
    public void testConflictingCommitIsRetried() {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        store.insertOne("counters", new Document(Map.of("_id", "c", "value", 0)));
        AtomicInteger attempts = new AtomicInteger();

        store.runInTransaction(session -> {
            long value = ((Number) session.findOne("counters", Filter.byId("c")).orElseThrow().get("value")).longValue();
            if (attempts.incrementAndGet() == 1) {
                // a competing writer commits between our read and our commit
                store.updateMany("counters", Filter.byId("c"), Map.of("value", 10));
            }
            session.updateMany("counters", Filter.byId("c"), Map.of("value", value + 1));
            return null;
        }, TransactionOptions.defaults());

        assertEquals(2, attempts.get());
        assertEquals(11L, ((Number) store.findOne("counters", Filter.byId("c")).orElseThrow().get("value")).longValue());
    }

    @Test
    public void testSnapshotReadConcernIsRejected() {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        TransactionOptions snapshot = new TransactionOptions(TransactionOptions.ReadConcern.SNAPSHOT,
                TransactionOptions.WriteConcern.majority(Duration.ofSeconds(1)), 1);
        AtomicInteger calls = new AtomicInteger();

        assertThrows(IllegalArgumentException.class, () -> store.runInTransaction(session -> {
            calls.incrementAndGet();
            return session.insertOne("a", new Document(Map.of("x", 1)));
        }, snapshot));
        assertEquals(0, calls.get());
        assertEquals(0, store.count("a"));

        TransactionOptions majorityReads = new TransactionOptions(TransactionOptions.ReadConcern.MAJORITY,
                TransactionOptions.WriteConcern.majority(Duration.ofSeconds(1)), 1);
        store.runInTransaction(session -> session.insertOne("a", new Document(Map.of("x", 1))), majorityReads);
        assertEquals(1, store.count("a"));
    }

    @Test
    public void testRetriesAreBounded() {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        AtomicInteger attempts = new AtomicInteger();
        TransactionException e = assertThrows(TransactionException.class, () -> store.runInTransaction(session -> {
            attempts.incrementAndGet();
            session.find("a", Filter.all());
            store.insertOne("a", new Document(Map.of("n", attempts.get())));
            session.insertOne("a", new Document(Map.of("mine", true)));
            return null;
        }, TransactionOptions.defaults().withMaxAttempts(3)));

        assertFalse(e instanceof TransientTransactionException);
        assertInstanceOf(TransientTransactionException.class, e.getCause());
        assertEquals(3, attempts.get());
        assertTrue(store.find("a", Filter.eq("mine", true)).isEmpty());
    }

    @Test
    public void testReloadReplaysLogAndSnapshot(@TempDir Path tempDir) {
        InMemoryDocumentStore store = new InMemoryDocumentStore(tempDir);
        Instant when = Instant.parse("2024-03-01T12:00:00Z");
        store.insertOne("people", new Document(Map.of("_id", "1", "name", "Alice", "at", when)));
        store.insertOne("people", new Document(Map.of("_id", "2", "name", "Bob")));
        store.saveSnapshot();
        store.deleteMany("people", Filter.byId("2"));
        store.updateMany("people", Filter.byId("1"), Map.of("age", 31));

        InMemoryDocumentStore reloaded = new InMemoryDocumentStore(tempDir);
        assertEquals(1, reloaded.count("people"));
        Document alice = reloaded.findOne("people", Filter.byId("1")).orElseThrow();
        assertEquals(when, alice.get("at"));
        assertEquals(31L, alice.get("age"));
    }

    @Test
    public void testTornLogLineIsSkipped(@TempDir Path tempDir) throws IOException {
        InMemoryDocumentStore store = new InMemoryDocumentStore(tempDir);
        store.insertOne("people", new Document(Map.of("_id", "1", "name", "Alice")));
        Files.writeString(tempDir.resolve("wal.log"), "{\"timestamp\": 1, \"chan", StandardCharsets.UTF_8,
                StandardOpenOption.APPEND);

        InMemoryDocumentStore reloaded = new InMemoryDocumentStore(tempDir);
        assertEquals(List.of("people"), List.copyOf(reloaded.collectionNames()));
        assertEquals(1, reloaded.count("people"));
    }
}

package com.annal.store;

import com.annal.persistence.PersistenceManager;
import com.annal.query.Filter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory store of named document collections with atomic multi-document
 * transactions and optional on-disk persistence.
 * <p>
 * Transactions stage their writes privately and remember the commit counter
 * of every collection they touch. At commit the counters are re-checked under
 * the commit lock; if another commit moved one of them the attempt fails with
 * {@link TransientTransactionException} and {@link #runInTransaction} runs the
 * callback again. Reads see the latest committed data plus the transaction's
 * own staged writes.
 * <p>
 * On a single node {@code LOCAL} and {@code MAJORITY} reads are the same, and
 * every commit satisfies its write acknowledgment once applied; only the
 * write-concern timeout is used, as the commit lock wait. {@code SNAPSHOT}
 * reads are rejected.
 */
public class InMemoryDocumentStore implements DocumentStore {
    private static final Logger LOGGER = Logger.getLogger(InMemoryDocumentStore.class.getName());

    private final Map<String, Map<String, Document>> collections = new HashMap<>();
    private final Map<String, Long> commitCounters = new HashMap<>();
    private final ReentrantLock commitLock = new ReentrantLock();
    private final PersistenceManager persistence;
    private final TransactionOptions autoCommitOptions;

    public InMemoryDocumentStore() {
        this.persistence = null;
        this.autoCommitOptions = TransactionOptions.defaults();
    }

    /**
     * Opens a store persisted under the given directory, replaying any
     * snapshot and log found there.
     */
    public InMemoryDocumentStore(Path baseDirectory) {
        this.persistence = new PersistenceManager(baseDirectory);
        this.autoCommitOptions = TransactionOptions.defaults();
        PersistenceManager.LoadedState state = persistence.load();
        for (var entry : state.collections().entrySet()) {
            collections.put(entry.getKey(), new LinkedHashMap<>(entry.getValue()));
        }
        LOGGER.fine(() -> "Opened store at " + baseDirectory + " after replaying " + state.replayedCommits() + " commits");
    }

    @Override
    public <T> T runInTransaction(TransactionCallback<T> callback, TransactionOptions options) {
        if (callback == null || options == null) {
            LOGGER.severe("runInTransaction called with null callback or options");
            throw new IllegalArgumentException("callback and options must be non-null");
        }
        if (options.readConcern() == TransactionOptions.ReadConcern.SNAPSHOT) {
            LOGGER.severe("runInTransaction called with unsupported read concern " + options.readConcern());
            throw new IllegalArgumentException("snapshot reads are not supported by the in-memory store");
        }
        TransientTransactionException last = null;
        for (int attempt = 1; attempt <= options.maxAttempts(); attempt++) {
            Session session = new Session(options);
            try {
                T result = callback.execute(session);
                session.commit();
                return result;
            } catch (TransientTransactionException e) {
                last = e;
                LOGGER.log(Level.FINE, "Transaction attempt " + attempt + " conflicted: " + e.getMessage());
                backoff(attempt);
            } finally {
                session.close();
            }
        }
        throw new TransactionException("transaction aborted after " + options.maxAttempts() + " attempts", last);
    }

    @Override
    public Optional<Document> findOne(String collection, Filter filter) {
        return runInTransaction(s -> s.findOne(collection, filter), autoCommitOptions);
    }

    @Override
    public List<Document> find(String collection, Filter filter) {
        return runInTransaction(s -> s.find(collection, filter), autoCommitOptions);
    }

    @Override
    public InsertResult insertOne(String collection, Document document) {
        return runInTransaction(s -> s.insertOne(collection, document), autoCommitOptions);
    }

    @Override
    public UpdateResult replaceOne(String collection, Filter filter, Document replacement) {
        return runInTransaction(s -> s.replaceOne(collection, filter, replacement), autoCommitOptions);
    }

    @Override
    public UpdateResult updateMany(String collection, Filter filter, Map<String, ?> setFields) {
        return runInTransaction(s -> s.updateMany(collection, filter, setFields), autoCommitOptions);
    }

    @Override
    public DeleteResult deleteMany(String collection, Filter filter) {
        return runInTransaction(s -> s.deleteMany(collection, filter), autoCommitOptions);
    }

    public Set<String> collectionNames() {
        commitLock.lock();
        try {
            return new TreeSet<>(collections.keySet());
        } finally {
            commitLock.unlock();
        }
    }

    public long count(String collection) {
        commitLock.lock();
        try {
            return collections.getOrDefault(collection, Collections.emptyMap()).size();
        } finally {
            commitLock.unlock();
        }
    }

    /**
     * Writes all collections to the snapshot file and truncates the log.
     */
    public void saveSnapshot() {
        if (persistence == null) {
            LOGGER.warning("saveSnapshot called on a store without persistence");
            return;
        }
        commitLock.lock();
        try {
            Map<String, List<Document>> copy = new LinkedHashMap<>();
            collections.forEach((name, docs) -> copy.put(name, new ArrayList<>(docs.values())));
            persistence.saveSnapshot(copy);
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Failed to save snapshot", e);
            throw new RuntimeException("unable to save snapshot", e);
        } finally {
            commitLock.unlock();
        }
    }

    private static void backoff(int attempt) {
        try {
            Thread.sleep(Math.min(50, attempt * 5L));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransactionException("interrupted while retrying transaction", e);
        }
    }

    private Map<String, Document> committedView(String collection) {
        commitLock.lock();
        try {
            return new LinkedHashMap<>(collections.getOrDefault(collection, Collections.emptyMap()));
        } finally {
            commitLock.unlock();
        }
    }

    private long counter(String collection) {
        commitLock.lock();
        try {
            return commitCounters.getOrDefault(collection, 0L);
        } finally {
            commitLock.unlock();
        }
    }

    /**
     * Operations of one transaction attempt.
     */
    private final class Session implements DocumentOperations {
        private final TransactionOptions options;
        private final Map<String, Long> observed = new HashMap<>();
        // document == null marks a removal
        private final Map<String, Map<String, Document>> staged = new LinkedHashMap<>();
        private boolean closed;

        Session(TransactionOptions options) {
            this.options = options;
        }

        @Override
        public Optional<Document> findOne(String collection, Filter filter) {
            requireArgs(collection, filter);
            for (Document doc : view(collection).values()) {
                if (filter.matches(doc)) {
                    return Optional.of(doc);
                }
            }
            return Optional.empty();
        }

        @Override
        public List<Document> find(String collection, Filter filter) {
            requireArgs(collection, filter);
            List<Document> result = new ArrayList<>();
            for (Document doc : view(collection).values()) {
                if (filter.matches(doc)) {
                    result.add(doc);
                }
            }
            return result;
        }

        @Override
        public InsertResult insertOne(String collection, Document document) {
            if (collection == null || document == null) {
                throw new IllegalArgumentException("collection and document must be non-null");
            }
            String id = document.getId() == null ? UUID.randomUUID().toString() : document.getId();
            if (view(collection).containsKey(id)) {
                throw new DuplicateKeyException(collection, id);
            }
            stage(collection, id, document.getId() == null ? document.withId(id) : document);
            return new InsertResult(id);
        }

        @Override
        public UpdateResult replaceOne(String collection, Filter filter, Document replacement) {
            requireArgs(collection, filter);
            if (replacement == null) {
                throw new IllegalArgumentException("replacement must be non-null");
            }
            Optional<Document> match = findOne(collection, filter);
            if (match.isEmpty()) {
                return UpdateResult.NONE;
            }
            Document existing = match.get();
            Document next = replacement.withId(existing.getId());
            stage(collection, existing.getId(), next);
            return new UpdateResult(1, existing.equals(next) ? 0 : 1);
        }

        @Override
        public UpdateResult updateMany(String collection, Filter filter, Map<String, ?> setFields) {
            requireArgs(collection, filter);
            if (setFields == null) {
                throw new IllegalArgumentException("setFields must be non-null");
            }
            long matched = 0;
            long modified = 0;
            for (Document doc : find(collection, filter)) {
                matched++;
                Map<String, Object> fields = doc.toMutableMap();
                boolean changed = false;
                for (var entry : setFields.entrySet()) {
                    if (Document.ID_FIELD.equals(entry.getKey())) {
                        throw new IllegalArgumentException("_id cannot be updated");
                    }
                    if (!Documents.valuesEqual(Documents.getPath(fields, entry.getKey()), entry.getValue())) {
                        Documents.setPath(fields, entry.getKey(), entry.getValue());
                        changed = true;
                    }
                }
                if (changed) {
                    stage(collection, doc.getId(), new Document(fields));
                    modified++;
                }
            }
            return new UpdateResult(matched, modified);
        }

        @Override
        public DeleteResult deleteMany(String collection, Filter filter) {
            requireArgs(collection, filter);
            long deleted = 0;
            for (Document doc : find(collection, filter)) {
                stage(collection, doc.getId(), null);
                deleted++;
            }
            return new DeleteResult(deleted);
        }

        void commit() {
            ensureOpen();
            if (staged.isEmpty()) {
                return;
            }
            boolean locked;
            try {
                locked = commitLock.tryLock(options.writeConcern().timeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransactionException("interrupted while waiting to commit", e);
            }
            if (!locked) {
                throw new TransientTransactionException("commit not acknowledged within " + options.writeConcern().timeout());
            }
            try {
                for (var entry : observed.entrySet()) {
                    long current = commitCounters.getOrDefault(entry.getKey(), 0L);
                    if (current != entry.getValue()) {
                        throw new TransientTransactionException("collection '" + entry.getKey() + "' changed during the transaction");
                    }
                }
                List<PersistenceManager.Change> changes = new ArrayList<>();
                staged.forEach((collection, docs) ->
                        docs.forEach((id, doc) -> changes.add(new PersistenceManager.Change(collection, id, doc))));
                if (persistence != null) {
                    try {
                        persistence.appendCommit(changes);
                    } catch (IOException e) {
                        LOGGER.log(Level.SEVERE, "Failed to append commit to log", e);
                        throw new TransactionException("unable to make commit durable", e);
                    }
                }
                for (PersistenceManager.Change change : changes) {
                    Map<String, Document> docs = collections.computeIfAbsent(change.collection(), k -> new LinkedHashMap<>());
                    if (change.document() == null) {
                        docs.remove(change.id());
                    } else {
                        docs.put(change.id(), change.document());
                    }
                }
                for (String collection : staged.keySet()) {
                    commitCounters.merge(collection, 1L, Long::sum);
                }
            } finally {
                commitLock.unlock();
            }
        }

        void close() {
            closed = true;
        }

        private Map<String, Document> view(String collection) {
            ensureOpen();
            touch(collection);
            Map<String, Document> view = committedView(collection);
            Map<String, Document> pending = staged.get(collection);
            if (pending != null) {
                pending.forEach((id, doc) -> {
                    if (doc == null) {
                        view.remove(id);
                    } else {
                        view.put(id, doc);
                    }
                });
            }
            return view;
        }

        private void stage(String collection, String id, Document document) {
            touch(collection);
            staged.computeIfAbsent(collection, k -> new LinkedHashMap<>()).put(id, document);
        }

        private void touch(String collection) {
            observed.computeIfAbsent(collection, InMemoryDocumentStore.this::counter);
        }

        private void ensureOpen() {
            if (closed) {
                throw new IllegalStateException("transaction session is no longer usable");
            }
        }

        private void requireArgs(String collection, Filter filter) {
            if (collection == null || filter == null) {
                throw new IllegalArgumentException("collection and filter must be non-null");
            }
        }
    }
}
